package tsp;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;

/** Append-only sink for non-fatal errors, warnings and notes. */
public class Diagnostics {
  private final List<Diagnostic> diagnostics = new ArrayList<>();
  private final List<String> units = new ArrayList<>();

  // Diagnostics of registered units sort in registration order, ahead of any other file.
  public void addUnit(String file) {
    if (!units.contains(file)) {
      units.add(file);
    }
  }

  public void error(Tokenizer.Pos pos, String msg) {
    add(Diagnostic.create(pos, Diagnostic.Severity.ERROR, msg));
  }

  public void warning(Tokenizer.Pos pos, String msg) {
    add(Diagnostic.create(pos, Diagnostic.Severity.WARNING, msg));
  }

  public void info(Tokenizer.Pos pos, String msg) {
    add(Diagnostic.create(pos, Diagnostic.Severity.INFO, msg));
  }

  public void add(Diagnostic diagnostic) {
    diagnostics.add(diagnostic);
  }

  public void addAll(Iterable<Diagnostic> other) {
    other.forEach(this::add);
  }

  public int size() {
    return diagnostics.size();
  }

  // Stable: diagnostics at the same position keep the order they were reported in.
  public ImmutableList<Diagnostic> sorted() {
    Comparator<Diagnostic> order =
        Comparator.comparingInt((Diagnostic d) -> unitIndex(d.pos().file()))
            .thenComparing(Ordering.natural());
    return ImmutableList.sortedCopyOf(order, diagnostics);
  }

  private int unitIndex(String file) {
    int index = units.indexOf(file);
    return index < 0 ? Integer.MAX_VALUE : index;
  }

  public ImmutableList<Diagnostic> since(int mark) {
    return ImmutableList.copyOf(diagnostics.subList(mark, diagnostics.size()));
  }

  public long count(Diagnostic.Severity severity) {
    return diagnostics.stream().filter(d -> d.severity() == severity).count();
  }

  public boolean hasErrors() {
    return count(Diagnostic.Severity.ERROR) > 0;
  }

  public ImmutableList<String> report(int max) {
    ImmutableList<Diagnostic> sorted = sorted();
    ImmutableList.Builder<String> lines = ImmutableList.builder();
    sorted.stream().limit(max).map(Diagnostic::format).forEach(lines::add);
    if (sorted.size() > max) {
      lines.add(String.format("... %d more", sorted.size() - max));
    }
    return lines.build();
  }

  public void print(int max) {
    report(max).forEach(System.out::println);
  }
}
