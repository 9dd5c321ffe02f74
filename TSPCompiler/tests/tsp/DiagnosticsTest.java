package tsp;

import static com.google.common.truth.Truth.assertThat;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class DiagnosticsTest {
  private static final Tokenizer.Pos A_LATE = new Tokenizer.Pos("a.tsp", 5, 2);
  private static final Tokenizer.Pos A_EARLY = new Tokenizer.Pos("a.tsp", 1, 0);
  private static final Tokenizer.Pos B = new Tokenizer.Pos("b.tsp", 0, 0);

  private Diagnostics diagnostics;

  @BeforeEach
  public void setUp() {
    diagnostics = new Diagnostics();
  }

  private static List<String> messages(List<Diagnostic> diagnostics) {
    return diagnostics.stream().map(Diagnostic::message).collect(Collectors.toList());
  }

  @Test
  public void sortsByPositionThenSeverity() {
    diagnostics.error(B, "b");
    diagnostics.warning(A_LATE, "late warning");
    diagnostics.error(A_LATE, "late error");
    diagnostics.info(A_EARLY, "early");

    assertThat(messages(diagnostics.sorted()))
        .containsExactly("early", "late error", "late warning", "b")
        .inOrder();
  }

  @Test
  public void unitsSortInTheOrderTheyWereAdded() {
    diagnostics.addUnit("b.tsp");
    diagnostics.addUnit("a.tsp");
    diagnostics.error(new Tokenizer.Pos("other.tsp", 0, 0), "other");
    diagnostics.error(A_EARLY, "a");
    diagnostics.error(B, "b");

    assertThat(messages(diagnostics.sorted())).containsExactly("b", "a", "other").inOrder();
  }

  @Test
  public void sortIsStable() {
    diagnostics.error(A_EARLY, "first");
    diagnostics.error(A_EARLY, "second");
    diagnostics.error(A_EARLY, "third");

    assertThat(messages(diagnostics.sorted()))
        .containsExactly("first", "second", "third")
        .inOrder();
  }

  @Test
  public void reportIsCapped() {
    diagnostics.error(A_LATE, "one");
    diagnostics.warning(A_LATE, "two");
    diagnostics.info(B, "three");

    assertThat(diagnostics.report(2))
        .containsExactly("ERROR: a.tsp@6:3 one", "WARNING: a.tsp@6:3 two", "... 1 more")
        .inOrder();
    assertThat(diagnostics.report(3)).hasSize(3);
  }

  @Test
  public void sinceAndCounts() {
    diagnostics.warning(A_EARLY, "old");
    int mark = diagnostics.size();
    diagnostics.info(B, "new");

    assertThat(messages(diagnostics.since(mark))).containsExactly("new");
    assertThat(diagnostics.count(Diagnostic.Severity.WARNING)).isEqualTo(1);
    assertThat(diagnostics.hasErrors()).isFalse();

    diagnostics.error(B, "bad");

    assertThat(diagnostics.hasErrors()).isTrue();
  }

  @Test
  public void fatalErrorsBecomeDiagnostics() {
    CompilerException ex = new CompilerException(A_EARLY, "Broken");

    Diagnostic diagnostic = ex.toDiagnostic();

    assertThat(diagnostic.severity()).isEqualTo(Diagnostic.Severity.ERROR);
    assertThat(diagnostic.format()).isEqualTo("ERROR: a.tsp@2:1 Broken");
  }
}
