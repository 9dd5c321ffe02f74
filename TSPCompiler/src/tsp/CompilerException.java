package tsp;

/** A fatal error: aborts the source unit being compiled. */
public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Tokenizer.Pos pos;
  private final String errorMsg;

  public CompilerException(Tokenizer.Pos pos, String errorMsg) {
    super(errorMsg);
    this.pos = pos;
    this.errorMsg = errorMsg;
  }

  public Tokenizer.Pos pos() {
    return pos;
  }

  public String errorMsg() {
    return errorMsg;
  }

  public Diagnostic toDiagnostic() {
    return Diagnostic.create(pos, Diagnostic.Severity.ERROR, errorMsg);
  }
}
