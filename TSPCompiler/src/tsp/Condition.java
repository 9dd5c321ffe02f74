package tsp;

import java.util.Optional;

import com.google.auto.value.AutoValue;

import tsp.processor.ASTNode;

/**
 * One comparison of a conditional expression chain. Chains have no precedence: each comparison is
 * joined to the next by its logical operator, left to right.
 */
@ASTNode
@AutoValue
public abstract class Condition implements Condition_ASTNode {
  public abstract String lval();

  public abstract String op();

  public abstract String rval();

  // Joins this comparison to the next one in the chain.
  public abstract Optional<String> lop();

  public abstract Tokenizer.Pos pos();

  public static Condition create(
      String lval, String op, String rval, Optional<String> lop, Tokenizer.Pos pos) {
    return new AutoValue_Condition(lval, op, rval, lop, pos);
  }
}
