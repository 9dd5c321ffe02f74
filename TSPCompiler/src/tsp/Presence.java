package tsp;

public enum Presence {
  ABSENT,
  REQUIRED,
  OPTIONAL,
  // An id naming another entity; without one the command applies to its own entity.
  IDORCHILD,
  // Entity attributes that are a parameter list rather than key/value pairs.
  PARAMETER;

  public boolean permitsValue() {
    return this == REQUIRED || this == OPTIONAL || this == IDORCHILD;
  }
}
