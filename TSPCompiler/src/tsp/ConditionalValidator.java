package tsp;

import java.util.Optional;

/** Checks both sides of every conditional expression once the whole program is known. */
class ConditionalValidator extends ErrorCollectingValidator {

  private final Verifier verifier;

  public ConditionalValidator(Verifier verifier) {
    this.verifier = verifier;
  }

  @Override
  public void visitImpl(Command command) {
    for (Condition condition : command.conditions()) {
      if (!verifier.isValidLval(condition.lval())) {
        logError(
            condition.pos(),
            String.format(
                "Invalid lval reference '%s' in conditional expression for macro [%s]",
                condition.lval(), command.tag()));
      }
      if (!verifier.isValidRval(condition.rval(), Optional.of(condition.lval()))) {
        logError(
            condition.pos(),
            String.format(
                "Invalid rval reference '%s' in conditional expression for macro [%s]",
                condition.rval(), command.tag()));
      }
    }
    super.visitImpl(command);
  }
}
