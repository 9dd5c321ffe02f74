package tsp;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

/**
 * Checks every node as it is constructed. Fatal problems throw {@link CompilerException};
 * everything else is reported to the {@link Diagnostics} of the compilation and healed where
 * possible.
 */
public class Verifier {
  private static final Logger LOG = LoggerFactory.getLogger(Verifier.class);

  // Functions the runtime provides, usable wherever an entity id is.
  public static final ImmutableSet<String> GLOBAL_FUNCTIONS =
      ImmutableSet.of(
          "visited",
          "entries",
          "present",
          "encountered",
          "carried",
          "handled",
          "met",
          "position",
          "here",
          "presentitems",
          "visibleitems",
          "this");

  public static final ImmutableSet<String> BUILT_IN_ENTITIES =
      ImmutableSet.of("player", "offstage");

  // Never stripped from a node, whatever its shape declares.
  private static final ImmutableSet<Property> CHECKED_PROPERTIES =
      ImmutableSet.of(
          Property.ID,
          Property.INLINE_TEXT,
          Property.COND,
          Property.OP,
          Property.RVAL,
          Property.VALUE,
          Property.SETTINGS,
          Property.PARAMETERS);

  private static final String INLINE_LINK_HOSTS = "'location', 'item', 'fixed', or 'npc'";

  private final CompilationContext context;
  private final Diagnostics diagnostics;

  public Verifier(CompilationContext context) {
    this.context = context;
    this.diagnostics = context.diagnostics();
  }

  /**
   * Verifies and builds a node.
   *
   * @param entity the header of the entity being parsed, absent for entities themselves
   * @param parent the structured macro an option belongs to
   * @param container the tag of the command whose body holds the node
   */
  Command construct(
      Command.Builder node,
      Optional<Command> entity,
      Optional<Shape> parent,
      Optional<String> container,
      LinkTables links)
      throws CompilerException {
    Shape shape = shapeOf(node, parent);

    verifyComposition(node, shape);
    if (shape.isStructured()) {
      verifyOptions(node, shape);
    }
    if (entity.isPresent() && container.isPresent()) {
      verifyContainer(node, shape, entity.get(), container.get());
    }

    if (node.type() == CommandType.SCENERYLINK || shape.declaresLink().isPresent()) {
      verifySceneryLink(node, shape, entity, links);
    } else if (node.type() == CommandType.NPCLINK) {
      verifyNpcLink(node, entity);
    } else {
      verifyReferences(node, shape, entity);
    }
    return node.build();
  }

  static Shape shapeOf(Command.Builder node, Optional<Shape> parent) throws CompilerException {
    if (parent.isPresent()) {
      Optional<Shape> option = Grammar.optionShapeOf(parent.get().tag(), node.tag());
      if (option.isPresent()) {
        return option.get();
      }
    }
    return Grammar.requireShape(node.tag(), node.pos());
  }

  private void verifyComposition(Command.Builder node, Shape shape) {
    for (Map.Entry<Property, Presence> presence : shape.presences().entrySet()) {
      if (presence.getValue() == Presence.REQUIRED && !node.has(presence.getKey())) {
        diagnostics.error(
            node.pos(),
            String.format(
                "Missing required property: \"%s\" for %s",
                presence.getKey().jsonName(),
                node.tag()));
      }
    }

    for (Property property : CHECKED_PROPERTIES) {
      if (node.has(property) && !shape.declares(property)) {
        diagnostics.warning(
            node.pos(),
            String.format(
                "Invalid property: '%s' for [%s] (Auto-removing it - Update your source file)",
                property.jsonName(),
                node.tag()));
        node.clear(property);
      }
    }
  }

  private void verifyOptions(Command.Builder node, Shape shape) {
    ImmutableMap<String, Shape> options = shape.options().get();
    ImmutableList<Command> body = node.body().orElse(ImmutableList.of());

    for (Shape option : options.values()) {
      if (option.isRequiredOption() && body.stream().noneMatch(c -> c.tag().equals(option.tag()))) {
        diagnostics.error(
            node.pos(),
            String.format("Missing required option: %s for [%s]", option.tag(), node.tag()));
      }
    }

    for (int i = 0; i < body.size(); i++) {
      Command child = body.get(i);
      Shape option = options.get(child.tag());
      if (option == null) {
        diagnostics.error(
            child.pos(), String.format("Invalid option: %s for [%s]", child.tag(), node.tag()));
        continue;
      }
      Optional<Placement> placement = option.placement();
      if (placement.equals(Optional.of(Placement.FIRST)) && i != 0) {
        diagnostics.error(
            child.pos(),
            String.format(
                "Option [%s] for [%s] may only be the first option", child.tag(), node.tag()));
      }
      if (placement.equals(Optional.of(Placement.LAST)) && i != body.size() - 1) {
        diagnostics.error(
            child.pos(),
            String.format(
                "Option [%s] for [%s] may only be the last option", child.tag(), node.tag()));
      }
    }
  }

  // The command directly holding the node must be an entity of the required type.
  private void verifyContainer(
      Command.Builder node, Shape shape, Command entity, String container) {
    if (!shape.entityContainer().isPresent()) return;

    String required = shape.entityContainer().get().tag();
    if (container.equals(required)) return;

    String entityId = entity.id().orElse(entity.tag());
    if (container.equals(entity.tag())) {
      diagnostics.error(
          node.pos(), String.format("Invalid macro [%s] in entity '%s'", node.tag(), entityId));
    } else {
      diagnostics.error(
          node.pos(),
          String.format(
              "Invalid macro [%s] inside [%s] in entity '%s'", node.tag(), container, entityId));
    }
    diagnostics.error(
        node.pos(),
        String.format("\t[%s] is only valid in entities of type '%s'", node.tag(), required));
  }

  private void verifySceneryLink(
      Command.Builder node, Shape shape, Optional<Command> entity, LinkTables links)
      throws CompilerException {
    if (!entity.isPresent()) {
      throw new CompilerException(node.pos(), "Scenery reference occurs outside of an entity");
    }
    String entityId = entity.get().id().orElse(entity.get().tag());

    if (node.type() == CommandType.SCENERYLINK) {
      verifyInlineLinkHost(node, entity.get(), "Scenery");
    }

    Optional<CommandType> declared = shape.declaresLink();
    if (declared.isPresent() && node.id().isPresent()) {
      String id = node.id().get();
      if (!links.inlineLink(declared.get(), id).isPresent()) {
        diagnostics.warning(
            node.pos(),
            String.format(
                "Invalid scenery reference ^%s^ in entity '%s' (will be safely ignored)",
                id, entityId));
      }
    }
  }

  private void verifyNpcLink(Command.Builder node, Optional<Command> entity)
      throws CompilerException {
    if (node.id().isPresent()) {
      String id = node.id().get();
      boolean isNpc =
          context
              .reference(id)
              .flatMap(Command::entityType)
              .filter(t -> t == EntityType.NPC)
              .isPresent();
      if (!isNpc) {
        diagnostics.error(
            node.pos(),
            String.format("Invalid NPC reference ~%s~ - no NPC entity with this ID found", id));
      }
    }

    if (!entity.isPresent()) {
      throw new CompilerException(node.pos(), "NPC reference occurs outside of an entity");
    }
    verifyInlineLinkHost(node, entity.get(), "NPC");
  }

  private void verifyInlineLinkHost(Command.Builder node, Command entity, String kind) {
    boolean hosts = entity.entityType().filter(EntityType::hostsInlineLinks).isPresent();
    if (!hosts) {
      diagnostics.error(
          node.pos(),
          String.format(
              "%s reference occurs in invalid entity '%s'", kind, entity.id().orElse("")));
      diagnostics.error(
          node.pos(),
          String.format(
              "\t%s references are only valid in entities of type %s", kind, INLINE_LINK_HOSTS));
    }
  }

  private void verifyReferences(Command.Builder node, Shape shape, Optional<Command> entity) {
    Optional<Presence> idPresence = shape.presence(Property.ID);
    if (node.id().isPresent()) {
      if (idPresence.equals(Optional.of(Presence.REQUIRED))) {
        ensureValidLval(node.id().get(), node.pos(), entity);
      } else if (!idPresence.filter(Presence::permitsValue).isPresent()) {
        diagnostics.error(node.pos(), String.format("Forbidden id in [%s]", node.tag()));
      }
    }

    Optional<Presence> rvalPresence = shape.presence(Property.RVAL);
    if (node.rval().isPresent()) {
      String rval = node.rval().get();
      if (!rvalPresence.filter(Presence::permitsValue).isPresent()) {
        diagnostics.error(
            node.pos(),
            String.format("Forbidden rval in %s entity '%s'", node.tag(), node.id().orElse("")));
      } else if (!isValidRval(rval, node.id())) {
        diagnostics.error(
            node.pos(),
            String.format(
                "Invalid rval reference: %s in %s entity '%s'",
                rval, node.tag(), node.id().orElse("")));
      }
    }
  }

  // Unknown ids become global variables, resolved once the whole program is known.
  private void ensureValidLval(String id, Tokenizer.Pos pos, Optional<Command> entity) {
    if (context.reference(id).isPresent()) return;

    LOG.debug("Recording global variable '{}' at {}", id, pos);
    context.recordGlobal(id, pos, entity.flatMap(Command::id));
  }

  boolean isValidRval(String rval, Optional<String> lval) {
    if (context.reference(rval).isPresent()) return true;
    if (Values.isBooleanLiteral(rval)) return true;
    if (Values.isNumeric(rval)) return true;
    boolean isFlag =
        lval.flatMap(context::reference)
            .flatMap(Command::flags)
            .filter(flags -> flags.containsKey(rval))
            .isPresent();
    if (isFlag) return true;
    return GLOBAL_FUNCTIONS.contains(rval) || BUILT_IN_ENTITIES.contains(rval);
  }

  boolean isValidLval(String lval) {
    return context.reference(lval).isPresent()
        || BUILT_IN_ENTITIES.contains(lval)
        || context.isGlobal(lval)
        || GLOBAL_FUNCTIONS.contains(lval);
  }

  /** Checks parsed settings keys against the defaults the shape declares. */
  public void verifySettings(Shape shape, Tokenizer.Pos pos, Map<String, Object> settings) {
    if (shape.settings().isPresent()) {
      for (String key : settings.keySet()) {
        if (!shape.settings().get().containsKey(key)) {
          diagnostics.error(
              pos, String.format("Invalid settings property: '%s' for [%s]", key, shape.tag()));
        }
      }
    } else if (!shape.acceptsArguments() && !settings.isEmpty()) {
      diagnostics.error(
          pos, String.format("Invalid settings: [%s] does not accept settings", shape.tag()));
    }
  }

  /** Checks an entity header attribute against the keys its type accepts. */
  public void verifyEntityAttribute(
      EntityType type, String entityId, String key, Tokenizer.Pos pos) {
    if (type.attributeKeys().contains(key)) return;

    diagnostics.error(
        pos,
        String.format(
            "Entity '%s': Invalid parameter key '%s' for type '%s'", entityId, key, type.tag()));
    diagnostics.error(
        pos,
        String.format(
            "\tTypes permitted: %s",
            type.attributeKeys().isEmpty() ? "none" : Joiner.on(", ").join(type.attributeKeys())));
  }

  /**
   * Removes all but the last of each singular command directly in an entity body, warning once per
   * removed duplicate.
   */
  public ImmutableList<Command> pruneSingular(List<Command> body) {
    Set<String> seen = new HashSet<>();
    List<Command> kept = new ArrayList<>();
    for (Command command : Lists.reverse(body)) {
      boolean singular = Grammar.shapeOf(command.tag()).filter(Shape::singular).isPresent();
      if (singular && !seen.add(command.tag())) {
        diagnostics.warning(
            command.pos(),
            String.format(
                "Duplicate command: [%s] may only appear once in an entity.  Only the last"
                    + " definition will be used. (Auto-removing the duplicate - Update your source"
                    + " file to merge the two.)",
                command.tag()));
        continue;
      }
      kept.add(command);
    }
    return ImmutableList.copyOf(Lists.reverse(kept));
  }
}
