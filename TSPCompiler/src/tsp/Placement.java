package tsp;

public enum Placement {
  REPEATABLE,
  FIRST,
  LAST
}
