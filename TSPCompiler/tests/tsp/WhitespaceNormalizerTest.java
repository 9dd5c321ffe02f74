package tsp;

import static com.google.common.truth.Truth.assertThat;
import static tsp.SourceFixtures.entity;
import static tsp.SourceFixtures.flatten;
import static tsp.SourceFixtures.lines;
import static tsp.SourceFixtures.macro;
import static tsp.SourceFixtures.render;
import static tsp.SourceFixtures.text;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

public class WhitespaceNormalizerTest {
  private CompilationContext context;
  private WhitespaceNormalizer normalizer;

  @BeforeEach
  public void setUp() {
    context = new CompilationContext();
    normalizer = new WhitespaceNormalizer(context);
  }

  private static ImmutableList<String> texts(Command node) {
    return node.body().stream()
        .map(child -> child.text().orElse("<" + child.tag() + ">"))
        .collect(ImmutableList.toImmutableList());
  }

  @Test
  public void blocksAreSeparatedFromInlineSiblings() {
    Command item =
        entity(
            CommandType.ENTITY,
            "item",
            "lamp",
            macro("description", text("  Alpha  ")),
            text(" beta "),
            macro("present", text("\nGamma\n")));

    Command normalized = normalizer.normalizeEntity(item);

    assertThat(flatten(normalized)).isEqualTo("Alpha\n\n beta \n\nGamma");
    assertThat(texts(normalized.body().get(0))).containsExactly("Alpha", "\n\n").inOrder();
    assertThat(texts(normalized.body().get(2))).containsExactly("\n\n", "Gamma").inOrder();
  }

  @Test
  public void blockBetweenBlocksIsSeparatedOnBothSides() {
    Command item =
        entity(
            CommandType.ENTITY,
            "item",
            "lamp",
            macro("description", text("A")),
            macro("description", text("B")),
            macro("description", text("C")));

    assertThat(flatten(normalizer.normalizeEntity(item))).isEqualTo("A\n\n\n\nB\n\n\n\nC");
  }

  @Test
  public void whitespaceSiblingsDoNotMakeABlockInner() {
    Command item =
        entity(
            CommandType.ENTITY,
            "item",
            "lamp",
            text("\n"),
            macro("description", text(" Only. ")),
            text("\n\n"));

    Command normalized = normalizer.normalizeEntity(item);

    assertThat(texts(normalized.body().get(1))).containsExactly("Only.");
  }

  @Test
  public void blockDropsTextEmptiedByTrimming() {
    Command item =
        entity(
            CommandType.ENTITY,
            "item",
            "lamp",
            macro("description", text("\n"), text("Lit."), text("  ")));

    assertThat(texts(normalizer.normalizeEntity(item).body().get(0))).containsExactly("Lit.");
  }

  @Test
  public void locationTrimsOnlyItsBoundaries() {
    Command hall =
        entity(
            CommandType.LOCATION,
            "location",
            "hall",
            text("  \n  "),
            text("Hello,  world. "),
            macro("i", text(" inner ")),
            text(" then "),
            text("\n\t"));

    Command normalized = normalizer.normalizeEntity(hall);

    assertThat(texts(normalized))
        .containsExactly("", "Hello,  world. ", "<i>", " then", "")
        .inOrder();
    assertThat(texts(normalized.body().get(2))).containsExactly(" inner ");
  }

  @Test
  public void locationTrimsPastEmptiedBoundaryText() {
    Command hall =
        entity(
            CommandType.LOCATION,
            "location",
            "hall",
            text("\n"),
            text("  Hello.  "),
            text("  Bye.  "),
            text("\n\n"));

    assertThat(texts(normalizer.normalizeEntity(hall)))
        .containsExactly("", "Hello.  ", "  Bye.", "")
        .inOrder();
  }

  @Test
  public void locationTrimsIntoLeadingAndTrailingCommands() {
    Command hall =
        entity(
            CommandType.LOCATION,
            "location",
            "hall",
            macro("i", text("  Start")),
            text(" middle "),
            macro("i", text("End  ")));

    assertThat(flatten(normalizer.normalizeEntity(hall))).isEqualTo("Start middle End");
  }

  @Test
  public void structuredDropsWhitespaceText() {
    Command option =
        Command.builder("o1", CommandType.OPTION, "option", SourceFixtures.POS)
            .setInlineText("Look")
            .build();
    Command hall =
        entity(
            CommandType.LOCATION,
            "location",
            "hall",
            macro("interface", text("\n  "), option, text("\n")));

    Command normalized = normalizer.normalizeEntity(hall);

    assertThat(SourceFixtures.tags(normalized.body().get(0).body())).containsExactly("option");
  }

  @Test
  public void normalizingTwiceChangesNothing() {
    Command item =
        entity(
            CommandType.ENTITY,
            "item",
            "lamp",
            text("\n"),
            macro("description", text(" A ")),
            text(" b "),
            macro("present", text("C"), macro("description", text("D"))),
            text("\n"));

    Command once = normalizer.normalizeEntity(item);
    Command twice = normalizer.normalizeEntity(once);

    assertThat(render(twice)).isEqualTo(render(once));
    assertThat(twice).isEqualTo(once);
  }

  @Test
  public void separatorsKeepTheirUidsWhenNormalizedAgain() {
    Command item =
        entity(
            CommandType.ENTITY,
            "item",
            "lamp",
            macro("description", text("A")),
            text(" beta "),
            macro("present", text("B")));

    Command once = normalizer.normalizeEntity(item);
    Command twice = normalizer.normalizeEntity(once);

    assertThat(twice).isEqualTo(once);
    assertThat(twice.body().get(0).body().get(1).uid())
        .isEqualTo(once.body().get(0).body().get(1).uid());
    GameFileWriter writer = new GameFileWriter(false);
    assertThat(writer.toJson(ImmutableMap.of("lamp", twice)))
        .isEqualTo(writer.toJson(ImmutableMap.of("lamp", once)));
  }

  @Test
  public void whitespaceAtABlockBoundaryBecomesItsSeparator() {
    Command leading = text("\n");
    Command item =
        entity(
            CommandType.ENTITY,
            "item",
            "lamp",
            text("Before."),
            macro("description", leading, text("Inside.")));

    Command description = normalizer.normalizeEntity(item).body().get(1);

    assertThat(texts(description)).containsExactly("\n\n", "Inside.").inOrder();
    assertThat(description.body().get(0).uid()).isEqualTo(leading.uid());
  }

  @Test
  public void normalizingParsedSourceTwiceChangesNothing() throws CompilerException {
    ImmutableMap<String, Command> parsed =
        SourceFixtures.parse(
            context,
            lines(
                ":: hall --location",
                "  A long hall.  ",
                "[description]",
                "  Dust everywhere.",
                "[/description]",
                "[if (hall is visited)]",
                "  Again.",
                "<else>",
                "  First time.",
                "[/if]",
                "[chain]",
                "<intro>Hello.",
                "<clink `Go`>Onwards.",
                "[/chain]",
                "Done.   "));

    ImmutableMap<String, Command> once = normalizer.normalize(parsed);
    ImmutableMap<String, Command> twice = normalizer.normalize(once);

    assertThat(twice).isEqualTo(once);
    assertThat(flatten(once.get("hall"))).startsWith("A long hall.");
    assertThat(flatten(once.get("hall"))).endsWith("Done.");
  }

  @Test
  public void emptyBodyStaysEmpty() {
    Command hall = entity(CommandType.LOCATION, "location", "hall");

    assertThat(normalizer.normalizeEntity(hall).body()).isEmpty();
  }
}
