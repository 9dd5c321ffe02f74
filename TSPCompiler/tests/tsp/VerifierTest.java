package tsp;

import static com.google.common.truth.Truth.assertThat;
import static tsp.SourceFixtures.POS;
import static tsp.SourceFixtures.lines;
import static tsp.SourceFixtures.macro;
import static tsp.SourceFixtures.text;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

public class VerifierTest {
  private CompilationContext context;
  private Verifier verifier;

  @BeforeEach
  public void setUp() throws CompilerException {
    context = new CompilationContext();
    verifier = new Verifier(context);
    SourceFixtures.parse(
        context, lines(":: lamp --item (flags: lit)", "A lamp.", ":: hall --location", "Hall."));
  }

  private List<String> messages() {
    return context.diagnostics().sorted().stream()
        .map(Diagnostic::message)
        .collect(Collectors.toList());
  }

  @Test
  public void pruneSingularKeepsTheLastDefinition() {
    Command first = macro("interface", text("a"));
    Command prose = text("between");
    Command last = macro("interface", text("b"));

    ImmutableList<Command> kept = verifier.pruneSingular(ImmutableList.of(first, prose, last));

    assertThat(kept).containsExactly(prose, last).inOrder();
    assertThat(context.diagnostics().count(Diagnostic.Severity.WARNING)).isEqualTo(1);
  }

  @Test
  public void pruneSingularLeavesRepeatableCommands() {
    ImmutableList<Command> body =
        ImmutableList.of(macro("description", text("a")), macro("description", text("b")));

    assertThat(verifier.pruneSingular(body)).isEqualTo(body);
    assertThat(context.diagnostics().count(Diagnostic.Severity.WARNING)).isEqualTo(0);
  }

  @Test
  public void rvals() {
    assertThat(verifier.isValidRval("hall", Optional.empty())).isTrue();
    assertThat(verifier.isValidRval("lit", Optional.of("lamp"))).isTrue();
    assertThat(verifier.isValidRval("dim", Optional.of("lamp"))).isFalse();
    assertThat(verifier.isValidRval("-3.5", Optional.empty())).isTrue();
    assertThat(verifier.isValidRval("off", Optional.empty())).isTrue();
    assertThat(verifier.isValidRval("visited", Optional.empty())).isTrue();
    assertThat(verifier.isValidRval("offstage", Optional.empty())).isTrue();
    assertThat(verifier.isValidRval("anywhere", Optional.empty())).isFalse();
  }

  @Test
  public void lvals() {
    assertThat(verifier.isValidLval("lamp")).isTrue();
    assertThat(verifier.isValidLval("player")).isTrue();
    assertThat(verifier.isValidLval("ghost")).isFalse();

    context.recordGlobal("ghost", POS, Optional.of("hall"));

    assertThat(verifier.isValidLval("ghost")).isTrue();
  }

  @Test
  public void settingsMustBeDeclared() {
    verifier.verifySettings(Grammar.shapeOf("play").get(), POS, ImmutableMap.of("loop", true));
    assertThat(messages()).isEmpty();

    verifier.verifySettings(Grammar.shapeOf("play").get(), POS, ImmutableMap.of("speed", 3L));
    verifier.verifySettings(Grammar.shapeOf("goto").get(), POS, ImmutableMap.of("fast", true));

    assertThat(messages())
        .containsExactly(
            "Invalid settings property: 'speed' for [play]",
            "Invalid settings: [goto] does not accept settings")
        .inOrder();
  }

  @Test
  public void entityAttributesMustBelongToTheType() {
    verifier.verifyEntityAttribute(EntityType.ITEM, "lamp", "flags", POS);
    assertThat(messages()).isEmpty();

    verifier.verifyEntityAttribute(EntityType.FUNCTION, "greet", "location", POS);

    assertThat(messages())
        .containsExactly(
            "Entity 'greet': Invalid parameter key 'location' for type 'function'",
            "\tTypes permitted: none")
        .inOrder();
  }
}
