package tsp;

import static com.google.common.truth.Truth.assertThat;
import static tsp.SourceFixtures.find;
import static tsp.SourceFixtures.flatten;
import static tsp.SourceFixtures.lines;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Resources;
import com.typesafe.config.ConfigFactory;

public class CompilationTest {
  private Compilation compilation;

  @BeforeEach
  public void setUp() {
    compilation = new Compilation(CompilerOptions.load());
  }

  private static String unit(String name) throws IOException {
    return Resources.toString(Resources.getResource("units/" + name), StandardCharsets.UTF_8);
  }

  private List<String> errors() {
    return compilation.diagnostics().sorted().stream()
        .filter(d -> d.severity() == Diagnostic.Severity.ERROR)
        .map(Diagnostic::message)
        .collect(Collectors.toList());
  }

  @Test
  public void reportsEachUsageOfAnUndeclaredGlobal() {
    compilation.addUnit("a.tsp", lines(":: hall --location", "[set score to 5]"));
    compilation.addUnit("b.tsp", lines(":: yard --location", "[set score to 6]"));
    compilation.finish();

    assertThat(errors())
        .containsExactly(
            "Global Variable \"score\" is not declared anywhere",
            "Global Variable \"score\" is not declared anywhere");
    List<String> files =
        compilation.diagnostics().sorted().stream()
            .map(d -> d.pos().file())
            .collect(Collectors.toList());
    assertThat(files).containsExactly("a.tsp", "b.tsp").inOrder();
  }

  @Test
  public void diagnosticsFollowTheOrderUnitsWereAdded() {
    compilation.addUnit("b.tsp", lines(":: yard --location", "[set score to 6]"));
    compilation.addUnit("a.tsp", lines(":: hall --location", "[set score to 5]"));
    compilation.finish();

    List<String> files =
        compilation.diagnostics().sorted().stream()
            .map(d -> d.pos().file())
            .collect(Collectors.toList());
    assertThat(files).containsExactly("b.tsp", "a.tsp").inOrder();
  }

  @Test
  public void globalDeclaredInLaterUnitResolves() {
    compilation.addUnit("a.tsp", lines(":: hall --location", "[set score to 5]"));
    compilation.addUnit("b.tsp", lines(":: score --variable (value: 0)"));
    compilation.finish();

    assertThat(errors()).isEmpty();
    assertThat(compilation.succeeded()).isTrue();
  }

  @Test
  public void functionParametersAreNotGlobals() {
    compilation.addUnit(
        "a.tsp", lines(":: greet --function (name)", "[set name to 1]", "[call greet]"));
    compilation.finish();

    assertThat(errors()).isEmpty();
  }

  @Test
  public void fatalErrorAbortsOnlyItsUnit() {
    ImmutableList<Diagnostic> broken =
        compilation.addUnit("a.tsp", lines(":: hall --location", "[bogus]"));
    compilation.addUnit("b.tsp", lines(":: yard --location", "Grass."));
    compilation.finish();

    assertThat(broken).hasSize(1);
    assertThat(broken.get(0).message()).isEqualTo("Undefined command definition: [bogus]");
    assertThat(compilation.failedUnits()).containsExactly("a.tsp");
    assertThat(compilation.entities().keySet()).containsExactly("yard");
    assertThat(compilation.succeeded()).isFalse();
  }

  @Test
  public void duplicateIdsAcrossUnitsAbortTheLaterUnit() {
    compilation.addUnit("a.tsp", lines(":: hall --location", "One."));
    ImmutableList<Diagnostic> duplicate =
        compilation.addUnit("b.tsp", lines(":: hall --location", "Two."));
    compilation.finish();

    assertThat(duplicate.get(0).message())
        .isEqualTo(
            "Duplicate key \"hall\" encountered. Original located at a.tsp:1. Decide which to"
                + " keep or change.");
    assertThat(flatten(compilation.entities().get("hall"))).isEqualTo("One.");
  }

  @Test
  public void onlyOneSystemEntity() {
    compilation.addUnit("a.tsp", lines(":: core --system", "One."));
    compilation.addUnit("b.tsp", lines(":: extra --system", "Two."));
    compilation.finish();

    assertThat(errors())
        .containsExactly(
            "There may only be one entity of type 'system': \"extra\" is redundant");
  }

  @Test
  public void settingsProvideTheGameTitle() {
    compilation.addUnit(
        "a.tsp",
        lines(
            ":: config --system",
            "[settings]",
            "<title>The Cave",
            "<author `Ann`>",
            "<start hall>",
            "[/settings]",
            ":: hall --location",
            "Dark."));
    compilation.finish();

    assertThat(compilation.gameTitle()).isEqualTo("The Cave");
    assertThat(errors()).isEmpty();
  }

  @Test
  public void gameTitleDefaults() {
    compilation.addUnit("a.tsp", lines(":: hall --location", "Dark."));
    compilation.finish();

    assertThat(compilation.gameTitle()).isEqualTo("Game");
  }

  @Test
  public void repeatedSettingIsAnError() {
    compilation.addUnit(
        "a.tsp", lines(":: config --system", "[settings]", "<title>A", "<title>B", "[/settings]"));
    compilation.finish();

    assertThat(errors())
        .containsExactly("Duplicate setting \"title\": only one setting of each type permitted");
  }

  @Test
  public void conditionsAreCheckedAgainstTheWholeProgram() {
    compilation.addUnit(
        "a.tsp",
        lines(
            ":: hall --location",
            "[if (ghost is visited)]Boo.[/if]",
            "[if (lamp is lit)]Bright.[/if]"));
    compilation.addUnit("b.tsp", lines(":: lamp --item (flags: lit)", "A lamp."));
    compilation.finish();

    assertThat(errors())
        .containsExactly("Invalid lval reference 'ghost' in conditional expression for macro [if]");
  }

  @Test
  public void sentenceSpacingIsCorrected() {
    compilation.addUnit("a.tsp", lines(":: hall --location", "Stop.  Go."));
    compilation.finish();

    assertThat(flatten(compilation.entities().get("hall"))).isEqualTo("Stop.&ensp;Go.");
  }

  @Test
  public void sentenceSpacingCanBeDisabled() {
    compilation =
        new Compilation(
            CompilerOptions.from(
                ConfigFactory.parseString("tsp.compiler.correct-sentence-spacing = false")
                    .withFallback(ConfigFactory.load())));
    compilation.addUnit("a.tsp", lines(":: hall --location", "Stop.  Go."));
    compilation.finish();

    assertThat(flatten(compilation.entities().get("hall"))).isEqualTo("Stop.  Go.");
  }

  @Test
  public void blocksAreNormalizedEndToEnd() {
    compilation.addUnit(
        "a.tsp",
        lines(
            ":: lamp --item",
            "[description]  A brass lamp.  [/description]",
            "It hums.",
            "[present]  It sits here.  [/present]"));
    compilation.finish();

    Command lamp = compilation.entities().get("lamp");
    assertThat(flatten(find(lamp, "description").get())).isEqualTo("A brass lamp.\n\n");
    assertThat(flatten(find(lamp, "present").get())).isEqualTo("\n\nIt sits here.");
    assertThat(compilation.succeeded()).isTrue();
  }

  @Test
  public void newlineEndingACommandLineIsDropped() {
    compilation.addUnit(
        "a.tsp",
        lines(
            ":: score --variable (value: 0)",
            ":: hall --location",
            "Dusty hall.",
            "[set score to 1]",
            "[description]",
            "Old.",
            "[/description]"));
    compilation.finish();

    assertThat(flatten(compilation.entities().get("hall"))).isEqualTo("Dusty hall.\n\n\nOld.");
  }

  @Test
  public void compilesAGameSplitAcrossUnits() throws IOException {
    compilation.addUnit("cave.tsp", unit("cave.tsp"));
    compilation.addUnit("system.tsp", unit("system.tsp"));
    compilation.finish();

    assertThat(compilation.diagnostics().sorted()).isEmpty();
    assertThat(compilation.succeeded()).isTrue();
    assertThat(compilation.gameTitle()).isEqualTo("The Cave");
    assertThat(compilation.entities().keySet())
        .containsExactly("entrance", "hall", "lamp", "config", "score")
        .inOrder();

    Command entrance = compilation.entities().get("entrance");
    assertThat(entrance.displayName()).hasValue("Entrance");
    assertThat(flatten(entrance))
        .startsWith("You stand at the mouth of a cave.&ensp;A cold wind blows.");
    assertThat(find(entrance, "goto").get().id()).hasValue("hall");
    assertThat(find(compilation.entities().get("hall"), "itemlink").get().id()).hasValue("lamp");
  }
}
