package tsp;

import static tsp.Presence.ABSENT;
import static tsp.Presence.IDORCHILD;
import static tsp.Presence.OPTIONAL;
import static tsp.Presence.PARAMETER;
import static tsp.Presence.REQUIRED;

import java.util.Map;
import java.util.Optional;

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableTable;

/** The closed table of every command and option tag the language knows. */
public final class Grammar {
  private static final String LIST_STYLE = "liststyle";
  private static final String SYNDECTIC = "syndectic";

  private static final ImmutableMap<String, Shape> SHAPES = buildShapes();

  // (parent tag, option tag) -> option shape
  private static final ImmutableTable<String, String, Shape> OPTIONS = flattenOptions(SHAPES);

  public static Optional<Shape> shapeOf(String tag) {
    return Optional.ofNullable(SHAPES.get(tag));
  }

  public static Shape requireShape(String tag, Tokenizer.Pos pos) throws CompilerException {
    Shape shape = SHAPES.get(tag);
    if (shape == null) {
      throw new CompilerException(pos, String.format("Undefined command definition: [%s]", tag));
    }
    return shape;
  }

  public static Optional<Shape> optionShapeOf(String parentTag, String optionTag) {
    return Optional.ofNullable(OPTIONS.get(parentTag, optionTag));
  }

  // The shape of a node, as an option of its parent when it is one.
  public static Optional<Shape> shapeOf(String tag, Optional<String> parentTag) {
    if (parentTag.isPresent()) {
      Optional<Shape> option = optionShapeOf(parentTag.get(), tag);
      if (option.isPresent()) {
        return option;
      }
    }
    return shapeOf(tag);
  }

  public static ImmutableList<String> validOptionTags(String parentTag) {
    return shapeOf(parentTag)
        .flatMap(Shape::options)
        .map(options -> options.keySet().asList())
        .orElse(ImmutableList.of());
  }

  public static boolean isOptionTag(String tag) {
    return OPTIONS.containsColumn(tag);
  }

  public static ImmutableSet<String> commandTags() {
    return SHAPES.keySet();
  }

  public static ImmutableSet<String> optionTags() {
    return OPTIONS.columnKeySet();
  }

  private static ImmutableTable<String, String, Shape> flattenOptions(
      ImmutableMap<String, Shape> shapes) {
    ImmutableTable.Builder<String, String, Shape> table = ImmutableTable.builder();
    for (Shape shape : shapes.values()) {
      if (!shape.options().isPresent()) continue;
      for (Map.Entry<String, Shape> option : shape.options().get().entrySet()) {
        Verify.verify(
            !shapes.containsKey(option.getKey()), "Duplicate key found: %s", option.getKey());
        table.put(shape.tag(), option.getKey(), option.getValue());
      }
    }
    return table.build();
  }

  private static Shape.Builder entity(String tag, CommandType type) {
    return Shape.builder(tag, type).id(REQUIRED);
  }

  private static Shape.Builder statement(String tag) {
    return Shape.builder(tag, CommandType.STATEMENT);
  }

  private static Shape.Builder idStatement(String tag) {
    return statement(tag).id(REQUIRED).cond(OPTIONAL);
  }

  private static Shape.Builder link(String tag, CommandType type) {
    return Shape.builder(tag, type).id(REQUIRED).inlineText(OPTIONAL).setFlow(Flow.INLINE);
  }

  private static Shape.Builder macro(String tag) {
    return Shape.builder(tag, CommandType.MACRO);
  }

  private static Shape.Builder assignment(String tag) {
    return Shape.builder(tag, CommandType.ASSIGNMENT)
        .id(REQUIRED)
        .setAssignmentOperator("to")
        .rval(REQUIRED);
  }

  private static Shape.Builder option(
      String tag, Optional<Placement> placement, Presence presence) {
    Shape.Builder option = Shape.builder(tag, CommandType.OPTION).setOptionPresence(presence);
    placement.ifPresent(option::setPlacement);
    return option;
  }

  private static Shape.Builder option(String tag, Placement placement, Presence presence) {
    return option(tag, Optional.of(placement), presence);
  }

  private static Shape.Builder settingsOption(String tag) {
    return option(tag, Optional.empty(), OPTIONAL);
  }

  private static ImmutableMap<String, Shape> options(Shape.Builder... builders) {
    ImmutableMap.Builder<String, Shape> options = ImmutableMap.builder();
    for (Shape.Builder builder : builders) {
      Shape option = builder.build();
      options.put(option.tag(), option);
    }
    return options.build();
  }

  private static ImmutableMap<String, Shape> buildShapes() {
    ImmutableList<Shape.Builder> builders =
        ImmutableList.of(
            // Entities
            entity("audio", CommandType.ENTITY).attrs(OPTIONAL).flags(OPTIONAL),
            entity("function", CommandType.ENTITY)
                .attrs(PARAMETER)
                .flags(ABSENT)
                .parameters(OPTIONAL)
                .body(REQUIRED),
            entity("item", CommandType.ENTITY).attrs(OPTIONAL).flags(OPTIONAL).body(REQUIRED),
            entity("fixed", CommandType.ENTITY).attrs(OPTIONAL).flags(OPTIONAL).body(REQUIRED),
            entity("itemdefaults", CommandType.ENTITY)
                .attrs(PARAMETER)
                .flags(ABSENT)
                .parameters(REQUIRED)
                .body(REQUIRED),
            entity("location", CommandType.LOCATION)
                .attrs(OPTIONAL)
                .body(REQUIRED)
                .setFlow(Flow.LOCATION),
            entity("npc", CommandType.ENTITY).attrs(OPTIONAL).flags(OPTIONAL).body(REQUIRED),
            entity("system", CommandType.ENTITY).attrs(OPTIONAL).flags(OPTIONAL).body(REQUIRED),
            entity("variable", CommandType.VARIABLE).value(REQUIRED),

            // Text
            Shape.builder("newline", CommandType.TEXT),
            Shape.builder("text", CommandType.TEXT).setFlow(Flow.INLINE),
            Shape.builder("tostring", CommandType.TOSTRING).id(REQUIRED).setFlow(Flow.INLINE),

            // Inline links
            link("hotlink", CommandType.HOTLINK),
            link("itemlink", CommandType.ITEMLINK),
            link("fixedlink", CommandType.FIXEDLINK),
            link("npclink", CommandType.NPCLINK),
            macro("link").inlineText(REQUIRED).cond(OPTIONAL).setFlow(Flow.STRUCTURED),
            link("scenerylink", CommandType.SCENERYLINK),
            Shape.builder("entityref", CommandType.ENTITY_REF).id(REQUIRED).setFlow(Flow.INLINE),

            // Statements
            statement("visibleitems")
                .cond(OPTIONAL)
                .inlineText(OPTIONAL)
                .setSettings(ImmutableMap.of(LIST_STYLE, SYNDECTIC))
                .setFlow(Flow.INLINE),
            idStatement("call").setAcceptsArguments(true),
            idStatement("clearevent"),
            statement("break").cond(OPTIONAL),
            statement("inventory")
                .inlineText(OPTIONAL)
                .setSettings(ImmutableMap.of(LIST_STYLE, SYNDECTIC))
                .cond(OPTIONAL),
            idStatement("dismiss"),
            idStatement("dropitem"),
            idStatement("goto"),
            idStatement("hide"),
            statement("look"),
            idStatement("play")
                .setSettings(ImmutableMap.of("loop", false, "fade", 0L, "volume", 1L)),
            idStatement("resume").setSettings(ImmutableMap.of("fade", 500L)),
            idStatement("stop").setSettings(ImmutableMap.of("fade", 500L)),
            idStatement("takeitem"),
            idStatement("talk").inlineText(REQUIRED),
            idStatement("topics").setFlow(Flow.INLINE),
            idStatement("triggerevent"),
            statement("presentitemselect").inlineText(REQUIRED),

            // Assignments
            assignment("move"),
            assignment("set"),

            // Macros
            macro("description").cond(OPTIONAL).setFlow(Flow.BLOCK),
            macro("gate").id(REQUIRED).body(REQUIRED).cond(REQUIRED).setFlow(Flow.INLINE),
            macro("i").body(REQUIRED).cond(OPTIONAL).setFlow(Flow.INLINE),
            macro("initial").cond(OPTIONAL).body(REQUIRED),
            macro("once")
                .body(REQUIRED)
                .cond(OPTIONAL)
                .setCmdState(ImmutableMap.of("count", 0L))
                .inlineText(OPTIONAL)
                .setFlow(Flow.INLINE),
            macro("exiting").body(REQUIRED).cond(OPTIONAL),
            macro("present").body(REQUIRED).cond(OPTIONAL).setFlow(Flow.BLOCK),

            // Structured macros
            macro("actions")
                .body(REQUIRED)
                .setFlow(Flow.STRUCTURED)
                .setSettings(ImmutableMap.of("exclude defaults", false))
                .setOptions(
                    options(
                        option("action", Placement.REPEATABLE, REQUIRED)
                            .inlineText(REQUIRED)
                            .body(REQUIRED)
                            .cond(OPTIONAL)
                            .setFlow(Flow.BLOCK))),
            macro("chain")
                .body(REQUIRED)
                .cond(OPTIONAL)
                .inlineText(OPTIONAL)
                .setFlow(Flow.BLOCK)
                .setSettings(ImmutableMap.of("hidelinks", false))
                .setCmdState(ImmutableMap.of("count", 0L))
                .setOptions(
                    options(
                        option("intro", Placement.FIRST, OPTIONAL)
                            .cond(OPTIONAL)
                            .body(REQUIRED)
                            .setFlow(Flow.BLOCK),
                        option("clink", Placement.REPEATABLE, REQUIRED)
                            .cond(OPTIONAL)
                            .inlineText(OPTIONAL)
                            .body(REQUIRED)
                            .setFlow(Flow.BLOCK))),
            macro("each")
                .body(REQUIRED)
                .cond(OPTIONAL)
                .setCmdState(ImmutableMap.of("count", 0L))
                .setFlow(Flow.STRUCTURED)
                .setOptions(
                    options(
                        option("step", Placement.REPEATABLE, OPTIONAL)
                            .body(REQUIRED)
                            .setFlow(Flow.INLINE),
                        option("loop", Placement.LAST, OPTIONAL)
                            .body(REQUIRED)
                            .setFlow(Flow.INLINE),
                        option("hold", Placement.LAST, OPTIONAL)
                            .body(REQUIRED)
                            .setFlow(Flow.INLINE))),
            macro("if")
                .cond(REQUIRED)
                .body(REQUIRED)
                .setFlow(Flow.STRUCTURED)
                .setFlowController(true)
                .setLeadin(true)
                .setOptions(
                    options(
                        option("elseif", Placement.REPEATABLE, OPTIONAL)
                            .body(REQUIRED)
                            .cond(REQUIRED),
                        option("else", Placement.LAST, OPTIONAL).body(REQUIRED))),
            macro("interface")
                .cond(OPTIONAL)
                .body(REQUIRED)
                .setFlow(Flow.STRUCTURED)
                .setSingular(true)
                .setOptions(
                    options(
                        option("option", Optional.empty(), REQUIRED)
                            .inlineText(REQUIRED)
                            .cond(OPTIONAL)
                            .setFlow(Flow.INLINE))),
            macro("interact")
                .id(REQUIRED)
                .body(REQUIRED)
                .setFlow(Flow.STRUCTURED)
                .setEntityContainer(EntityType.NPC)
                .setSingular(true)
                .setOptions(
                    options(
                        option("greeting", Placement.FIRST, OPTIONAL)
                            .cond(OPTIONAL)
                            .body(REQUIRED)
                            .setFlow(Flow.INLINE),
                        option("topic", Placement.REPEATABLE, REQUIRED)
                            .cond(OPTIONAL)
                            .inlineText(REQUIRED)
                            .body(REQUIRED)
                            .setFlow(Flow.INLINE))),
            macro("itemui")
                .id(IDORCHILD)
                .body(REQUIRED)
                .setFlow(Flow.STRUCTURED)
                .setEntityContainer(EntityType.ITEM)
                .setSingular(true)
                .setLeadin(true)
                .setOptions(ImmutableMap.of()),
            macro("itemselect")
                .id(REQUIRED)
                .inlineText(REQUIRED)
                .cond(OPTIONAL)
                .body(REQUIRED)
                .setFlow(Flow.STRUCTURED)
                .setEntityContainer(EntityType.ITEM)
                .setSingular(true)
                .setOptions(
                    options(
                        option("intro", Placement.FIRST, REQUIRED)
                            .body(REQUIRED)
                            .setFlow(Flow.BLOCK),
                        option("choice", Placement.REPEATABLE, REQUIRED)
                            .id(REQUIRED)
                            .body(REQUIRED)
                            .setFlow(Flow.BLOCK),
                        option("default", Placement.LAST, OPTIONAL)
                            .body(REQUIRED)
                            .setFlow(Flow.BLOCK))),
            macro("scenery")
                .body(REQUIRED)
                .setFlow(Flow.STRUCTURED)
                .setSingular(true)
                .setOptions(
                    options(
                        option("prop", Placement.REPEATABLE, REQUIRED)
                            .id(REQUIRED)
                            .body(REQUIRED)
                            .cond(OPTIONAL)
                            .setFlow(Flow.BLOCK)
                            .setDeclaresLink(CommandType.SCENERYLINK))),
            macro("settings")
                .body(REQUIRED)
                .setSingular(true)
                .setOptions(
                    options(
                        settingsOption("start").id(REQUIRED).body(ABSENT),
                        settingsOption("ifid").body(ABSENT).inlineText(REQUIRED),
                        settingsOption("tsp_version").body(ABSENT).inlineText(REQUIRED),
                        settingsOption("app_version").body(ABSENT).inlineText(REQUIRED),
                        settingsOption("author").body(ABSENT).inlineText(REQUIRED),
                        settingsOption("title").body(REQUIRED),
                        settingsOption("subtitle").body(REQUIRED),
                        settingsOption("summary").body(REQUIRED),
                        settingsOption("copyright").body(REQUIRED))));

    ImmutableMap.Builder<String, Shape> shapes = ImmutableMap.builder();
    for (Shape.Builder builder : builders) {
      Shape shape = builder.build();
      shapes.put(shape.tag(), shape);
    }
    return shapes.build();
  }

  private Grammar() {}
}
