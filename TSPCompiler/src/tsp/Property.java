package tsp;

/** Command properties whose presence a {@link Shape} constrains. */
public enum Property {
  ID("id"),
  ATTRS("attrs"),
  FLAGS("flags"),
  INLINE_TEXT("inlineText"),
  COND("cond"),
  OP("op"),
  RVAL("rval"),
  VALUE("value"),
  SETTINGS("settings"),
  PARAMETERS("parameters"),
  BODY("body");

  private final String jsonName;

  Property(String jsonName) {
    this.jsonName = jsonName;
  }

  public String jsonName() {
    return jsonName;
  }
}
