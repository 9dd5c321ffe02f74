package tsp;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;

/** The grammar entry of a command or option tag. */
@AutoValue
public abstract class Shape {
  public abstract String tag();

  public abstract CommandType type();

  abstract ImmutableMap<Property, Presence> presences();

  public abstract Optional<String> assignmentOperator();

  // Default values; keys outside this map are rejected.
  public abstract Optional<ImmutableMap<String, Object>> settings();

  public abstract ImmutableMap<String, Object> cmdState();

  public abstract Optional<Flow> flow();

  public abstract boolean flowController();

  // At most one per entity.
  public abstract boolean singular();

  public abstract Optional<EntityType> entityContainer();

  // Settings are passed through unchecked, as call arguments.
  public abstract boolean acceptsArguments();

  public abstract boolean leadin();

  public abstract Optional<ImmutableMap<String, Shape>> options();

  public abstract Optional<Placement> placement();

  public abstract Optional<Presence> optionPresence();

  // Options that declare, as a block, a link made inline earlier in the same entity.
  public abstract Optional<CommandType> declaresLink();

  public Optional<Presence> presence(Property property) {
    return Optional.ofNullable(presences().get(property));
  }

  public boolean requires(Property property) {
    return presence(property).filter(p -> p == Presence.REQUIRED).isPresent();
  }

  public boolean declares(Property property) {
    switch (property) {
      case OP:
        return assignmentOperator().isPresent();
      case SETTINGS:
        return settings().isPresent() || acceptsArguments();
      default:
        return presences().containsKey(property);
    }
  }

  public boolean isStructured() {
    return options().isPresent();
  }

  public boolean isRequiredOption() {
    return optionPresence().filter(p -> p == Presence.REQUIRED).isPresent();
  }

  // Options only have a body when they declare one.
  public boolean declaresBody() {
    return presence(Property.BODY).filter(p -> p != Presence.ABSENT).isPresent();
  }

  public Flow flowOrDefault() {
    return flow().orElse(Flow.INLINE);
  }

  static Builder builder(String tag, CommandType type) {
    return new AutoValue_Shape.Builder()
        .setTag(tag)
        .setType(type)
        .setCmdState(ImmutableMap.of())
        .setFlowController(false)
        .setSingular(false)
        .setAcceptsArguments(false)
        .setLeadin(false);
  }

  @AutoValue.Builder
  abstract static class Builder {
    abstract Builder setTag(String tag);

    abstract Builder setType(CommandType type);

    abstract ImmutableMap.Builder<Property, Presence> presencesBuilder();

    abstract Builder setAssignmentOperator(String op);

    abstract Builder setSettings(ImmutableMap<String, Object> settings);

    abstract Builder setCmdState(ImmutableMap<String, Object> cmdState);

    abstract Builder setFlow(Flow flow);

    abstract Builder setFlowController(boolean flowController);

    abstract Builder setSingular(boolean singular);

    abstract Builder setEntityContainer(EntityType container);

    abstract Builder setAcceptsArguments(boolean acceptsArguments);

    abstract Builder setLeadin(boolean leadin);

    abstract Builder setOptions(ImmutableMap<String, Shape> options);

    abstract Builder setPlacement(Placement placement);

    abstract Builder setOptionPresence(Presence presence);

    abstract Builder setDeclaresLink(CommandType link);

    abstract Shape build();

    Builder with(Property property, Presence presence) {
      presencesBuilder().put(property, presence);
      return this;
    }

    Builder id(Presence presence) {
      return with(Property.ID, presence);
    }

    Builder attrs(Presence presence) {
      return with(Property.ATTRS, presence);
    }

    Builder flags(Presence presence) {
      return with(Property.FLAGS, presence);
    }

    Builder inlineText(Presence presence) {
      return with(Property.INLINE_TEXT, presence);
    }

    Builder cond(Presence presence) {
      return with(Property.COND, presence);
    }

    Builder rval(Presence presence) {
      return with(Property.RVAL, presence);
    }

    Builder value(Presence presence) {
      return with(Property.VALUE, presence);
    }

    Builder body(Presence presence) {
      return with(Property.BODY, presence);
    }

    Builder parameters(Presence presence) {
      return with(Property.PARAMETERS, presence);
    }
  }
}
