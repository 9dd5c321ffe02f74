package tsp;

import java.util.Map;
import java.util.Optional;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

import tsp.processor.ASTChild;
import tsp.processor.ASTNode;

/**
 * A node of the command tree: an entity, macro, option, statement, assignment, link or run of text.
 *
 * <p>Nodes are immutable. The parser assembles them with a {@link Builder} and hands the builder
 * to the {@link Verifier} before building, so that no node enters the tree unchecked. The owning
 * entity is held by id, never by reference.
 */
@ASTNode
public final class Command implements Command_ASTNode {
  private final String uid;
  private final CommandType type;
  private final String tag;
  private final Tokenizer.Pos pos;
  private final Optional<String> parentEntity;
  private final Optional<String> id;
  private final Optional<String> displayName;
  private final Optional<ImmutableMap<String, String>> attrs;
  private final Optional<ImmutableMap<String, Object>> flags;
  private final Optional<ImmutableMap<String, Object>> states;
  private final Optional<ImmutableMap<String, Object>> parameters;
  private final Optional<Object> value;
  private final Optional<String> inlineText;
  private final Optional<ImmutableList<Condition>> cond;
  private final Optional<String> op;
  private final Optional<String> rval;
  private final Optional<ImmutableMap<String, Object>> settings;
  private final Optional<ImmutableMap<String, Object>> cmdState;
  private final boolean flowController;
  private final Optional<ImmutableList<Command>> leadin;
  private final Optional<ImmutableList<Command>> body;
  private final Optional<String> text;

  private Command(Builder builder) {
    this.uid = builder.uid;
    this.type = builder.type;
    this.tag = builder.tag;
    this.pos = builder.pos;
    this.parentEntity = builder.parentEntity;
    this.id = builder.id;
    this.displayName = builder.displayName;
    this.attrs = builder.attrs;
    this.flags = builder.flags;
    this.states = builder.states;
    this.parameters = builder.parameters;
    this.value = builder.value;
    this.inlineText = builder.inlineText;
    this.cond = builder.cond;
    this.op = builder.op;
    this.rval = builder.rval;
    this.settings = builder.settings;
    this.cmdState = builder.cmdState;
    this.flowController = builder.flowController;
    this.leadin = builder.leadin;
    this.body = builder.body;
    this.text = builder.text;
  }

  public static Builder builder(String uid, CommandType type, String tag, Tokenizer.Pos pos) {
    return new Builder(uid, type, tag, pos);
  }

  public static Command text(String uid, String text, Tokenizer.Pos pos) {
    return builder(uid, CommandType.TEXT, "text", pos).setText(text).build();
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public String uid() {
    return uid;
  }

  public CommandType type() {
    return type;
  }

  public String tag() {
    return tag;
  }

  public Tokenizer.Pos pos() {
    return pos;
  }

  public Optional<String> parentEntity() {
    return parentEntity;
  }

  public Optional<String> id() {
    return id;
  }

  public Optional<String> displayName() {
    return displayName;
  }

  public Optional<ImmutableMap<String, String>> attrs() {
    return attrs;
  }

  public Optional<ImmutableMap<String, Object>> flags() {
    return flags;
  }

  public Optional<ImmutableMap<String, Object>> states() {
    return states;
  }

  public Optional<ImmutableMap<String, Object>> parameters() {
    return parameters;
  }

  public Optional<Object> value() {
    return value;
  }

  public Optional<String> inlineText() {
    return inlineText;
  }

  public Optional<String> op() {
    return op;
  }

  public Optional<String> rval() {
    return rval;
  }

  public Optional<ImmutableMap<String, Object>> settings() {
    return settings;
  }

  public Optional<ImmutableMap<String, Object>> cmdState() {
    return cmdState;
  }

  public boolean flowController() {
    return flowController;
  }

  // The body of a leaf text node.
  public Optional<String> text() {
    return text;
  }

  public boolean hasLeadin() {
    return leadin.isPresent();
  }

  public boolean hasBody() {
    return body.isPresent();
  }

  public boolean has(Property property) {
    return Builder.has(this.toBuilder(), property);
  }

  public Optional<EntityType> entityType() {
    return type.isEntity() ? EntityType.forTag(tag) : Optional.empty();
  }

  public boolean isText() {
    return type == CommandType.TEXT && text.isPresent();
  }

  @ASTChild
  @Override
  public ImmutableList<Condition> conditions() {
    return cond.orElse(ImmutableList.of());
  }

  @ASTChild
  @Override
  public ImmutableList<Command> leadin() {
    return leadin.orElse(ImmutableList.of());
  }

  @ASTChild
  @Override
  public ImmutableList<Command> body() {
    return body.orElse(ImmutableList.of());
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Command)) return false;

    Command that = (Command) o;
    return uid.equals(that.uid)
        && type == that.type
        && tag.equals(that.tag)
        && pos.equals(that.pos)
        && parentEntity.equals(that.parentEntity)
        && id.equals(that.id)
        && displayName.equals(that.displayName)
        && attrs.equals(that.attrs)
        && flags.equals(that.flags)
        && states.equals(that.states)
        && parameters.equals(that.parameters)
        && value.equals(that.value)
        && inlineText.equals(that.inlineText)
        && cond.equals(that.cond)
        && op.equals(that.op)
        && rval.equals(that.rval)
        && settings.equals(that.settings)
        && cmdState.equals(that.cmdState)
        && flowController == that.flowController
        && leadin.equals(that.leadin)
        && body.equals(that.body)
        && text.equals(that.text);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(uid, tag, pos, id, leadin, body, text);
  }

  @Override
  public String toString() {
    return String.format("[%s%s] %s", tag, id.map(i -> " " + i).orElse(""), uid);
  }

  @CanIgnoreReturnValue
  public static final class Builder {
    private final String uid;
    private final CommandType type;
    private final String tag;
    private final Tokenizer.Pos pos;
    private Optional<String> parentEntity = Optional.empty();
    private Optional<String> id = Optional.empty();
    private Optional<String> displayName = Optional.empty();
    private Optional<ImmutableMap<String, String>> attrs = Optional.empty();
    private Optional<ImmutableMap<String, Object>> flags = Optional.empty();
    private Optional<ImmutableMap<String, Object>> states = Optional.empty();
    private Optional<ImmutableMap<String, Object>> parameters = Optional.empty();
    private Optional<Object> value = Optional.empty();
    private Optional<String> inlineText = Optional.empty();
    private Optional<ImmutableList<Condition>> cond = Optional.empty();
    private Optional<String> op = Optional.empty();
    private Optional<String> rval = Optional.empty();
    private Optional<ImmutableMap<String, Object>> settings = Optional.empty();
    private Optional<ImmutableMap<String, Object>> cmdState = Optional.empty();
    private boolean flowController = false;
    private Optional<ImmutableList<Command>> leadin = Optional.empty();
    private Optional<ImmutableList<Command>> body = Optional.empty();
    private Optional<String> text = Optional.empty();

    private Builder(String uid, CommandType type, String tag, Tokenizer.Pos pos) {
      this.uid = Preconditions.checkNotNull(uid);
      this.type = Preconditions.checkNotNull(type);
      this.tag = Preconditions.checkNotNull(tag);
      this.pos = Preconditions.checkNotNull(pos);
    }

    private Builder(Command command) {
      this(command.uid, command.type, command.tag, command.pos);
      this.parentEntity = command.parentEntity;
      this.id = command.id;
      this.displayName = command.displayName;
      this.attrs = command.attrs;
      this.flags = command.flags;
      this.states = command.states;
      this.parameters = command.parameters;
      this.value = command.value;
      this.inlineText = command.inlineText;
      this.cond = command.cond;
      this.op = command.op;
      this.rval = command.rval;
      this.settings = command.settings;
      this.cmdState = command.cmdState;
      this.flowController = command.flowController;
      this.leadin = command.leadin;
      this.body = command.body;
      this.text = command.text;
    }

    public String uid() {
      return uid;
    }

    public CommandType type() {
      return type;
    }

    public String tag() {
      return tag;
    }

    public Tokenizer.Pos pos() {
      return pos;
    }

    public Optional<String> parentEntity() {
      return parentEntity;
    }

    public Optional<String> id() {
      return id;
    }

    public Optional<ImmutableMap<String, Object>> flags() {
      return flags;
    }

    public Optional<ImmutableMap<String, Object>> parameters() {
      return parameters;
    }

    public Optional<String> inlineText() {
      return inlineText;
    }

    public Optional<ImmutableList<Condition>> cond() {
      return cond;
    }

    public Optional<String> rval() {
      return rval;
    }

    public Optional<ImmutableMap<String, Object>> settings() {
      return settings;
    }

    public Optional<ImmutableList<Command>> body() {
      return body;
    }

    public Optional<ImmutableList<Command>> leadin() {
      return leadin;
    }

    public Optional<String> text() {
      return text;
    }

    public Optional<EntityType> entityType() {
      return type.isEntity() ? EntityType.forTag(tag) : Optional.empty();
    }

    public Builder setParentEntity(String parentEntity) {
      this.parentEntity = Optional.of(parentEntity);
      return this;
    }

    public Builder setId(String id) {
      this.id = Optional.of(id);
      return this;
    }

    public Builder setDisplayName(String displayName) {
      this.displayName = Optional.of(displayName);
      return this;
    }

    public Builder setAttrs(Map<String, String> attrs) {
      this.attrs = Optional.of(ImmutableMap.copyOf(attrs));
      return this;
    }

    public Builder setFlags(Map<String, Object> flags) {
      this.flags = Optional.of(ImmutableMap.copyOf(flags));
      return this;
    }

    public Builder setStates(Map<String, Object> states) {
      this.states = Optional.of(ImmutableMap.copyOf(states));
      return this;
    }

    public Builder setParameters(Map<String, Object> parameters) {
      this.parameters = Optional.of(ImmutableMap.copyOf(parameters));
      return this;
    }

    public Builder setValue(Object value) {
      this.value = Optional.of(value);
      return this;
    }

    public Builder setInlineText(String inlineText) {
      this.inlineText = Optional.of(inlineText);
      return this;
    }

    public Builder setCond(Iterable<Condition> cond) {
      this.cond = Optional.of(ImmutableList.copyOf(cond));
      return this;
    }

    public Builder setOp(String op) {
      this.op = Optional.of(op);
      return this;
    }

    public Builder setRval(String rval) {
      this.rval = Optional.of(rval);
      return this;
    }

    public Builder setSettings(Map<String, Object> settings) {
      this.settings = Optional.of(ImmutableMap.copyOf(settings));
      return this;
    }

    public Builder setCmdState(Map<String, Object> cmdState) {
      this.cmdState = Optional.of(ImmutableMap.copyOf(cmdState));
      return this;
    }

    public Builder setFlowController(boolean flowController) {
      this.flowController = flowController;
      return this;
    }

    public Builder setLeadin(Iterable<Command> leadin) {
      this.leadin = Optional.of(ImmutableList.copyOf(leadin));
      return this;
    }

    public Builder setBody(Iterable<Command> body) {
      Preconditions.checkState(!text.isPresent(), "%s already has a text body", tag);
      this.body = Optional.of(ImmutableList.copyOf(body));
      return this;
    }

    public Builder setText(String text) {
      Preconditions.checkState(!body.isPresent(), "%s already has a command body", tag);
      this.text = Optional.of(text);
      return this;
    }

    public boolean has(Property property) {
      return has(this, property);
    }

    private static boolean has(Builder b, Property property) {
      switch (property) {
        case ID:
          return b.id.isPresent();
        case ATTRS:
          return b.attrs.isPresent();
        case FLAGS:
          return b.flags.isPresent();
        case INLINE_TEXT:
          return b.inlineText.isPresent();
        case COND:
          return b.cond.isPresent();
        case OP:
          return b.op.isPresent();
        case RVAL:
          return b.rval.isPresent();
        case VALUE:
          return b.value.isPresent();
        case SETTINGS:
          return b.settings.isPresent();
        case PARAMETERS:
          return b.parameters.isPresent();
        case BODY:
          return b.body.isPresent() || b.text.isPresent();
      }
      throw new AssertionError(property);
    }

    public Builder clear(Property property) {
      switch (property) {
        case ID:
          id = Optional.empty();
          break;
        case ATTRS:
          attrs = Optional.empty();
          break;
        case FLAGS:
          flags = Optional.empty();
          break;
        case INLINE_TEXT:
          inlineText = Optional.empty();
          break;
        case COND:
          cond = Optional.empty();
          break;
        case OP:
          op = Optional.empty();
          break;
        case RVAL:
          rval = Optional.empty();
          break;
        case VALUE:
          value = Optional.empty();
          break;
        case SETTINGS:
          settings = Optional.empty();
          break;
        case PARAMETERS:
          parameters = Optional.empty();
          break;
        case BODY:
          body = Optional.empty();
          text = Optional.empty();
          break;
      }
      return this;
    }

    public Command build() {
      return new Command(this);
    }
  }
}
