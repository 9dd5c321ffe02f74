package tsp;

import java.util.Comparator;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class Diagnostic implements Comparable<Diagnostic> {
  public enum Severity {
    ERROR,
    WARNING,
    INFO
  }

  private static final Comparator<Diagnostic> ORDER =
      Comparator.comparing(Diagnostic::pos).thenComparing(Diagnostic::severity);

  public abstract Tokenizer.Pos pos();

  public abstract Severity severity();

  public abstract String message();

  public static Diagnostic create(Tokenizer.Pos pos, Severity severity, String message) {
    return new AutoValue_Diagnostic(pos, severity, message);
  }

  public String format() {
    return String.format(
        "%s: %s@%d:%d %s",
        severity(), pos().file(), pos().lineNumber() + 1, pos().column() + 1, message());
  }

  @Override
  public int compareTo(Diagnostic other) {
    return ORDER.compare(this, other);
  }
}
