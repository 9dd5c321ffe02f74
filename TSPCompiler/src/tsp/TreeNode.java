package tsp;

/** A node of the command tree that the generated visitors can walk. */
public interface TreeNode {
  <V> V accept(ASTVisitor<V> visitor, V value);

  // Children in the order their accessors are declared.
  <V> V visitChildren(ASTVisitor<V> visitor, V value);
}
