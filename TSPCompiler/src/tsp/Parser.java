package tsp;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Parses one tokenized source unit in two passes.
 *
 * <p>{@link #buildReferences()} reads only the entity headers, so that bodies may refer to entities
 * declared further down the unit (or in earlier units, once the caller has merged the references
 * into the {@link CompilationContext}). {@link #parse(Map)} then parses every body and builds each
 * node through the {@link Verifier}.
 */
public class Parser {
  private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

  private final CompilationContext context;
  private final Verifier verifier;
  private final TokenCursor cursor;
  private final String file;
  private final LinkTables links = new LinkTables();

  // Header of the entity whose body is being parsed.
  private Command entity;
  // Tags of the commands enclosing the current position, innermost first.
  private final Deque<String> containers = new ArrayDeque<>();

  public Parser(CompilationContext context, String file, List<Token> tokens) {
    this.context = context;
    this.verifier = new Verifier(context);
    this.cursor = new TokenCursor(tokens);
    this.file = file;
  }

  public ImmutableMap<String, Command> buildReferences() throws CompilerException {
    LOG.debug("Building entity references for {}", file);
    cursor.reset();

    Map<String, Command> references = new LinkedHashMap<>();
    while (!cursor.isAtEnd()) {
      if (cursor.match(Token.Kind.NEWLINES, Token.Kind.WHITESPACE)) continue;

      Command reference = parseEntityReference();
      String id = reference.id().get();
      Command original = references.get(id);
      if (original != null) {
        throw CompilationContext.duplicateEntity(id, original, reference);
      }
      references.put(id, reference);

      while (!cursor.check(Token.Kind.ENTITY_START) && !cursor.isAtEnd()) {
        cursor.advance();
      }
    }
    return ImmutableMap.copyOf(references);
  }

  private Command parseEntityReference() throws CompilerException {
    Token start = cursor.consume("entity declaration '::'", Token.Kind.ENTITY_START);
    Token idToken = cursor.consume("entity id", Token.Kind.PHRASE);
    cursor.consume("entity type '--'", Token.Kind.ENTITY_TYPE);
    Token typeToken = cursor.consume("entity type", Token.Kind.WORD);

    String tag = typeToken.value();
    Optional<Shape> shape = Grammar.shapeOf(tag).filter(s -> s.type().isEntity());
    Optional<EntityType> type = EntityType.forTag(tag);
    if (!shape.isPresent() || !type.isPresent()) {
      throw new CompilerException(
          typeToken.pos(), String.format("Invalid entity type '%s'", typeToken.text()));
    }

    String id = idToken.value();
    Command.Builder reference =
        Command.builder(context.nextUid(), shape.get().type(), tag, start.pos())
            .setId(id)
            .setDisplayName(idToken.text());
    LOG.debug("{}: entity '{}' --{}", start.pos(), id, tag);

    Map<String, String> attrs = new LinkedHashMap<>();
    if (cursor.match(Token.Kind.SET_OPEN)) {
      if (shape.get().presence(Property.ATTRS).equals(Optional.of(Presence.PARAMETER))) {
        reference.setParameters(parseStateList());
        cursor.consume("parameter list close ')'", Token.Kind.SET_CLOSE);
      } else {
        Map<String, Object> flags = new LinkedHashMap<>();
        parseAttributes(type.get(), id, attrs, flags);
        if (type.get() == EntityType.VARIABLE) {
          if (attrs.containsKey("value")) {
            reference.setValue(Values.parsePrimitive(attrs.get("value")));
          }
        } else {
          reference.setAttrs(attrs).setFlags(flags);
        }
      }
    }
    type.get().initialStates(attrs).ifPresent(reference::setStates);

    cursor.consume("end of entity declaration", Token.Kind.ENTITY_END);
    return reference.build();
  }

  private void parseAttributes(
      EntityType type, String id, Map<String, String> attrs, Map<String, Object> flags)
      throws CompilerException {
    while (!cursor.match(Token.Kind.SET_CLOSE)) {
      if (cursor.match(Token.Kind.ENTITY_PARAM_DELIM)) continue;

      Token key = cursor.consume("attribute key", Token.Kind.PHRASE);
      verifier.verifyEntityAttribute(type, id, key.value(), key.pos());
      cursor.match(Token.Kind.ENTITY_PARAM_ASSIGN);

      if (key.value().equals("flags")) {
        flags.putAll(parseStateList());
      } else if (cursor.check(Token.Kind.INLINE_DELIM)) {
        attrs.put(key.value(), consumeInline());
      } else {
        attrs.put(key.value(), cursor.consume("attribute value", Token.Kind.PHRASE).value());
      }
    }
  }

  // a, b = 3: names without a value default to false.
  private ImmutableMap<String, Object> parseStateList() throws CompilerException {
    Map<String, Object> states = new LinkedHashMap<>();
    while (!cursor.check(Token.Kind.SET_CLOSE, Token.Kind.ENTITY_PARAM_DELIM)) {
      Token key = cursor.consume("flag id", Token.Kind.PHRASE);
      if (states.containsKey(key.value())) {
        context
            .diagnostics()
            .warning(
                key.pos(),
                String.format(
                    "Duplicate flag name '%s' found. The value will be overwritten.",
                    key.value()));
      }
      Object value = false;
      if (cursor.match(Token.Kind.ENTITY_STATE_ASSIGN)) {
        value = Values.parsePrimitive(cursor.consume("flag value", Token.Kind.PHRASE).value());
      }
      states.put(key.value(), value);
      cursor.match(Token.Kind.ENTITY_STATE_DELIM);
    }
    return ImmutableMap.copyOf(states);
  }

  /** Parses the body of every entity in {@code references}, which must come from this parser. */
  public ImmutableMap<String, Command> parse(Map<String, Command> references)
      throws CompilerException {
    cursor.reset();

    ImmutableMap.Builder<String, Command> entities = ImmutableMap.builder();
    for (Command reference : references.values()) {
      String id = reference.id().get();
      entity = reference;
      links.clear();
      containers.clear();

      cursor.seek(String.format("Seeking the body of entity '%s'", id), Token.Kind.ENTITY_END);
      containers.push(reference.tag());
      ImmutableList<Command> body = parseEntityBody();
      containers.pop();

      Command.Builder builder = reference.toBuilder();
      if (reference.type() != CommandType.VARIABLE) {
        builder.setBody(verifier.pruneSingular(body));
      }
      entities.put(
          id,
          verifier.construct(
              builder, Optional.empty(), Optional.empty(), Optional.empty(), links));
    }
    return entities.build();
  }

  private ImmutableList<Command> parseEntityBody() throws CompilerException {
    List<Command> body = new ArrayList<>();
    while (!cursor.check(Token.Kind.ENTITY_START) && !cursor.isAtEnd()) {
      Token token = cursor.peek();
      if (token.is(Token.Kind.WHITESPACE)) {
        cursor.advance();
        body.add(text("text", "", token.pos()));
      } else if (token.is(Token.Kind.MACRO_END)) {
        skipStrayEndMacro();
      } else {
        Optional<Command> content = parseContent();
        if (!content.isPresent()) {
          throw cursor.error(
              String.format("Invalid body content for entity %s", entity.id().get()));
        }
        body.add(content.get());
      }
    }
    return ImmutableList.copyOf(body);
  }

  private void skipStrayEndMacro() {
    Token start = cursor.advance();
    context
        .diagnostics()
        .error(
            start.pos(),
            String.format(
                "Malformed simple macro: '[/%s]' does not require a closing macro",
                cursor.peek().value()));
    cursor.match(Token.Kind.WORD);
    cursor.match(Token.Kind.MACRO_CLOSE);
  }

  // Content allowed in any body; empty when the next token starts none.
  private Optional<Command> parseContent() throws CompilerException {
    Token token = cursor.peek();
    switch (token.kind()) {
      case MACRO_OPEN:
        return Optional.of(parseMacro());
      case HOTLINK_OPEN:
        return Optional.of(
            parseLink(CommandType.HOTLINK, Token.Kind.HOTLINK_OPEN, Token.Kind.HOTLINK_CLOSE));
      case ITEM_OPEN:
        return Optional.of(parseLink(itemLinkType(), Token.Kind.ITEM_OPEN, Token.Kind.ITEM_CLOSE));
      case SCENERY_DELIMITER:
        return Optional.of(
            parseLink(
                CommandType.SCENERYLINK,
                Token.Kind.SCENERY_DELIMITER,
                Token.Kind.SCENERY_DELIMITER));
      case ENTITY_REF_DELIMITER:
        return Optional.of(
            parseLink(
                CommandType.NPCLINK,
                Token.Kind.ENTITY_REF_DELIMITER,
                Token.Kind.ENTITY_REF_DELIMITER));
      case TO_STRING:
        {
          cursor.advance();
          Command.Builder toString =
              Command.builder(context.nextUid(), CommandType.TOSTRING, "tostring", token.pos())
                  .setId(token.value());
          return Optional.of(construct(toString, Optional.empty()));
        }
      case NEWLINES:
        cursor.advance();
        return Optional.of(text("newline", token.text(), token.pos()));
      case PARAGRAPH:
        cursor.advance();
        return Optional.of(text("text", token.text(), token.pos()));
      default:
        return Optional.empty();
    }
  }

  private Command text(String tag, String text, Tokenizer.Pos pos) throws CompilerException {
    return construct(
        Command.builder(context.nextUid(), CommandType.TEXT, tag, pos).setText(text),
        Optional.empty());
  }

  private Command construct(Command.Builder node, Optional<Shape> parent)
      throws CompilerException {
    return verifier.construct(
        node, Optional.of(entity), parent, Optional.ofNullable(containers.peek()), links);
  }

  private CommandType itemLinkType() {
    Token id = cursor.lookAhead(1);
    boolean fixed =
        id.is(Token.Kind.KEYWORD)
            && context
                .reference(id.value())
                .flatMap(Command::entityType)
                .filter(t -> t == EntityType.FIXED)
                .isPresent();
    return fixed ? CommandType.FIXEDLINK : CommandType.ITEMLINK;
  }

  private Command parseLink(CommandType type, Token.Kind open, Token.Kind close)
      throws CompilerException {
    String what = type.jsonName();
    Token start = cursor.consume(what + " open", open);
    Token id = cursor.consume(what + " id", Token.Kind.KEYWORD);

    Command.Builder link =
        Command.builder(context.nextUid(), type, type.jsonName(), start.pos())
            .setParentEntity(entity.id().get())
            .setId(id.value());
    if (cursor.check(Token.Kind.INLINE_DELIM)) {
      link.setInlineText(consumeInline());
    }
    cursor.consume(what + " close", close);

    Command built = construct(link, Optional.empty());
    if (type == CommandType.SCENERYLINK || type == CommandType.NPCLINK) {
      links.register(built);
    }
    return built;
  }

  private String consumeInline() throws CompilerException {
    cursor.consume("inline delimiter '`'", Token.Kind.INLINE_DELIM);
    if (!cursor.check(Token.Kind.PARAGRAPH)) {
      throw cursor.error("Inline body must not be empty");
    }
    String text = cursor.advance().text();
    cursor.consume("closing inline delimiter '`'", Token.Kind.INLINE_DELIM);
    return text;
  }

  private Command parseMacro() throws CompilerException {
    Token open = cursor.consume("macro open '['", Token.Kind.MACRO_OPEN);
    Token tagToken = cursor.consume("macro tag", Token.Kind.WORD);
    String tag = tagToken.value();
    Shape shape = Grammar.requireShape(tag, tagToken.pos());
    if (shape.type().isEntity() || shape.type() == CommandType.TEXT) {
      throw new CompilerException(
          tagToken.pos(), String.format("Undefined command definition: [%s]", tag));
    }
    LOG.debug("{}: [{}] macro start", tagToken.pos(), tag);

    Command.Builder macro =
        Command.builder(context.nextUid(entity.uid()), shape.type(), tag, open.pos())
            .setParentEntity(entity.id().get())
            .setFlowController(shape.flowController());
    if (!shape.cmdState().isEmpty()) {
      macro.setCmdState(shape.cmdState());
    }

    if (shape.type() == CommandType.ASSIGNMENT) {
      macro.setId(cursor.consume("assignment target", Token.Kind.PHRASE).value());
      macro.setOp(
          cursor.consume("assignment operator 'to' or 'to not'", Token.Kind.ASSIGNOP).value());
      macro.setRval(
          cursor.check(Token.Kind.INLINE_DELIM)
              ? consumeInline()
              : cursor.consume("assignment value", Token.Kind.PHRASE).value());
      cursor.consume("macro close ']'", Token.Kind.MACRO_CLOSE);
    } else {
      if (cursor.check(Token.Kind.PHRASE)) {
        macro.setId(cursor.advance().value());
      }
      parseHeader(macro, shape, Token.Kind.MACRO_CLOSE);
    }

    if (shape.type() == CommandType.MACRO) {
      containers.push(tag);
      if (shape.isStructured()) {
        parseStructuredBody(macro, shape);
      } else {
        macro.setBody(parseMacroBody(tag));
      }
      containers.pop();
      parseEndMacro(tag);
    }
    LOG.debug("{}: [{}] macro end", cursor.pos(), tag);
    return construct(macro, Optional.empty());
  }

  // Inline text, conditions and settings, in any order, up to the closing bracket.
  private void parseHeader(Command.Builder node, Shape shape, Token.Kind close)
      throws CompilerException {
    while (!cursor.match(close)) {
      if (cursor.check(Token.Kind.INLINE_DELIM)) {
        node.setInlineText(consumeInline());
      } else if (cursor.check(Token.Kind.SET_OPEN)) {
        node.setCond(parseConditions());
      } else if (cursor.check(Token.Kind.MACRO_SETTING)) {
        node.setSettings(parseSettings(shape));
      } else {
        throw cursor.error(
            String.format(
                "Expecting inline text, conditional expression or settings, but found %s",
                TokenCursor.describe(cursor.peek())));
      }
    }
  }

  private ImmutableList<Condition> parseConditions() throws CompilerException {
    cursor.consume("condition open '('", Token.Kind.SET_OPEN);
    List<Condition> conditions = new ArrayList<>();
    while (!cursor.match(Token.Kind.SET_CLOSE)) {
      Token lval = cursor.consume("condition lval", Token.Kind.PHRASE);
      Token op = cursor.consume("relational operator", Token.Kind.RELOP);
      String rval =
          cursor.check(Token.Kind.INLINE_DELIM)
              ? consumeInline()
              : cursor.consume("condition rval", Token.Kind.PHRASE).value();
      Optional<String> lop =
          cursor.check(Token.Kind.LOGOP) ? Optional.of(cursor.advance().value()) : Optional.empty();
      conditions.add(Condition.create(lval.value(), op.value(), rval, lop, lval.pos()));
    }
    return ImmutableList.copyOf(conditions);
  }

  private ImmutableMap<String, Object> parseSettings(Shape shape) throws CompilerException {
    Token open = cursor.consume("settings ':'", Token.Kind.MACRO_SETTING);
    Map<String, Object> settings = new LinkedHashMap<>();
    while (!cursor.check(Token.Kind.MACRO_SETTING_END)) {
      String key = cursor.consume("setting key", Token.Kind.PHRASE).value();
      // A bare key switches a setting on.
      Object value = true;
      if (cursor.match(Token.Kind.MACRO_SETTING_ASSIGN)) {
        Token token =
            cursor.consume(
                "setting value of string, number or boolean",
                Token.Kind.NUMBER,
                Token.Kind.BOOLEAN,
                Token.Kind.PHRASE);
        Optional<Object> declared =
            shape.settings().flatMap(defaults -> Optional.ofNullable(defaults.get(key)));
        value = Values.coerceSetting(declared, token.value());
      }
      settings.put(key, value);
      if (!cursor.match(Token.Kind.MACRO_SETTING_DELIM)) break;
    }
    cursor.consume("end of settings", Token.Kind.MACRO_SETTING_END);
    verifier.verifySettings(shape, open.pos(), settings);
    return ImmutableMap.copyOf(settings);
  }

  private ImmutableList<Command> parseMacroBody(String tag) throws CompilerException {
    List<Command> body = new ArrayList<>();
    while (!cursor.check(Token.Kind.MACRO_END)) {
      if (cursor.match(Token.Kind.WHITESPACE)) continue;

      if (cursor.check(Token.Kind.ENTITY_START)) {
        throw cursor.error(
            String.format(
                "Unexpected Entity declaration for \"%s\". (No closing tag for [%s]?)",
                cursor.lookAhead(1).value(), tag));
      }
      if (cursor.isAtEnd()) {
        throw cursor.error(
            String.format("Unexpected end of %s. (No closing tag for [%s]?)", file, tag));
      }
      Optional<Command> content = parseContent();
      if (!content.isPresent()) {
        throw cursor.error(String.format("Invalid body content for block macro %s", tag));
      }
      body.add(content.get());
    }
    return ImmutableList.copyOf(body);
  }

  private void parseStructuredBody(Command.Builder macro, Shape shape) throws CompilerException {
    String tag = shape.tag();
    skipAllWhitespace();

    if (shape.leadin() && !isOptionAhead(Optional.of(tag))) {
      macro.setLeadin(parseOptionBody(tag, Optional.empty()));
      if (isMacroEnd(tag)) {
        macro.setBody(ImmutableList.of());
        return;
      }
    }

    skipAllWhitespace();
    List<Command> options = new ArrayList<>();
    while (isOptionAhead(Optional.of(tag))) {
      options.add(parseOption(shape));
      skipAllWhitespace();
    }
    macro.setBody(options);
  }

  private Command parseOption(Shape parent) throws CompilerException {
    Token open = cursor.consume("option open '<'", Token.Kind.OPTION_OPEN);
    Token tagToken = cursor.consume("option tag", Token.Kind.WORD);
    String tag = tagToken.value();
    Shape shape =
        Grammar.optionShapeOf(parent.tag(), tag)
            .orElseThrow(
                () ->
                    new CompilerException(
                        tagToken.pos(),
                        String.format(
                            "Invalid option tag <%s> in structured macro [%s]. Valid tags: <%s>",
                            tag,
                            parent.tag(),
                            Joiner.on(">, <").join(Grammar.validOptionTags(parent.tag())))));
    LOG.debug("{}: <{}> option of [{}]", tagToken.pos(), tag, parent.tag());

    Command.Builder option =
        Command.builder(context.nextUid(entity.uid()), CommandType.OPTION, tag, open.pos())
            .setParentEntity(entity.id().get());
    if (cursor.check(Token.Kind.PHRASE)) {
      option.setId(cursor.advance().value());
    }
    parseHeader(option, shape, Token.Kind.OPTION_CLOSE);

    if (shape.declaresBody()) {
      containers.push(tag);
      option.setBody(parseOptionBody(tag, Optional.of(parent.tag())));
      containers.pop();
      // An option may be closed explicitly, as long as the end tag is not its parent's.
      if (cursor.check(Token.Kind.MACRO_END) && !isMacroEnd(parent.tag())) {
        parseEndMacro(tag);
      }
    }
    return construct(option, Optional.of(parent));
  }

  // Runs until the next option of the parent, the end tag of ownTag, or content no body allows.
  private ImmutableList<Command> parseOptionBody(String ownTag, Optional<String> parentTag)
      throws CompilerException {
    List<Command> body = new ArrayList<>();
    while (!isOptionAhead(parentTag) && !isMacroEnd(ownTag)) {
      if (cursor.match(Token.Kind.WHITESPACE)) continue;

      Optional<Command> content = parseContent();
      if (!content.isPresent()) break;
      body.add(content.get());
    }
    return ImmutableList.copyOf(body);
  }

  // An option tag the parent does not accept is fatal.
  private boolean isOptionAhead(Optional<String> parentTag) throws CompilerException {
    if (!parentTag.isPresent() || !cursor.check(Token.Kind.OPTION_OPEN)) return false;

    Token tag = cursor.lookAhead(1);
    if (!tag.is(Token.Kind.WORD)) return false;
    if (Grammar.optionShapeOf(parentTag.get(), tag.value()).isPresent()) return true;

    throw new CompilerException(
        tag.pos(),
        String.format(
            "Invalid option macro <%s> in structured macro [%s]. Valid tags: <%s>",
            tag.value(),
            parentTag.get(),
            Joiner.on(">, <").join(Grammar.validOptionTags(parentTag.get()))));
  }

  private boolean isMacroEnd(String tag) {
    if (!cursor.check(Token.Kind.MACRO_END)) return false;
    Token found = cursor.lookAhead(1);
    return found.is(Token.Kind.WORD) && found.value().equals(tag);
  }

  private void parseEndMacro(String tag) throws CompilerException {
    skipAllWhitespace();
    cursor.consume(String.format("closing tag [/%s]", tag), Token.Kind.MACRO_END);
    Token found = cursor.peek();
    if (!found.is(Token.Kind.WORD) || !found.value().equals(tag)) {
      throw cursor.error(
          String.format(
              "Mismatched end macro tag: [/%s] does not match opening tag [%s]",
              found.value(), tag));
    }
    cursor.advance();
    cursor.consume(String.format("']' closing [/%s", tag), Token.Kind.MACRO_CLOSE);
  }

  private void skipAllWhitespace() {
    while (cursor.check(Token.Kind.WHITESPACE, Token.Kind.NEWLINES)) {
      cursor.advance();
    }
  }
}
