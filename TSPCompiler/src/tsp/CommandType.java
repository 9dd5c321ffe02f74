package tsp;

/** The runtime kind of a command, as named in the emitted game file. */
public enum CommandType {
  ASSIGNMENT("assignment"),
  ENTITY("entity"),
  ENTITY_REF("entityRef"),
  HOTLINK("hotlink"),
  ITEMLINK("itemlink"),
  FIXEDLINK("fixedlink"),
  NPCLINK("npclink"),
  LOCATION("location"),
  MACRO("macro"),
  OPTION("option"),
  REFERENCE("reference"),
  SCENERYLINK("scenerylink"),
  STATEMENT("statement"),
  TOSTRING("tostring"),
  SYSTEM("system"),
  TEXT("text"),
  VARIABLE("variable");

  private final String jsonName;

  CommandType(String jsonName) {
    this.jsonName = jsonName;
  }

  public String jsonName() {
    return jsonName;
  }

  // Commands declared at the root of a source unit.
  public boolean isEntity() {
    return this == ENTITY || this == LOCATION || this == VARIABLE;
  }
}
