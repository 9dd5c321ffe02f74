package tsp;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

abstract class ErrorCollectingValidator extends VoidDefaultASTVisitor {
  private final List<Diagnostic> errors = new ArrayList<>();

  protected ImmutableList<Diagnostic> errors() {
    return ImmutableList.copyOf(errors);
  }

  protected void logError(Tokenizer.Pos pos, String msg) {
    errors.add(Diagnostic.create(pos, Diagnostic.Severity.ERROR, msg));
  }

  protected void logError(CompilerException ex) {
    errors.add(ex.toDiagnostic());
  }

  protected void takeErrors(ErrorCollectingValidator other) {
    errors.addAll(other.errors);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }
}
