package tsp;

/** Dispatch helpers called from the generated {@code *_ASTNode} interfaces. */
public final class TreeNodes {
  public static <V> V accept(TreeNode node, ASTVisitor<V> visitor, V value) {
    return node.accept(visitor, value);
  }

  // Threads the value through every node in order.
  public static <V> V accept(Iterable<? extends TreeNode> nodes, ASTVisitor<V> visitor, V value) {
    for (TreeNode node : nodes) {
      value = accept(node, visitor, value);
    }
    return value;
  }

  private TreeNodes() {}
}
