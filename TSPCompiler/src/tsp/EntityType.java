package tsp;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/** Root-level entity kinds, with the attribute keys each accepts and its runtime states. */
public enum EntityType {
  AUDIO("audio", "file", "volume", "loop", "fade"),
  FIXED("fixed", "location", "flags", "defaultactions"),
  FUNCTION("function"),
  ITEM("item", "location", "flags", "defaultactions"),
  ITEMDEFAULTS("itemdefaults"),
  LOCATION("location", "audio", "flags"),
  NPC("npc", "location", "name", "gender", "flags"),
  SYSTEM("system", "flags"),
  VARIABLE("variable", "value");

  private final String tag;
  private final ImmutableSet<String> attributeKeys;

  EntityType(String tag, String... attributeKeys) {
    this.tag = tag;
    this.attributeKeys = ImmutableSet.copyOf(attributeKeys);
  }

  public static Optional<EntityType> forTag(String tag) {
    return Arrays.stream(values()).filter(t -> t.tag.equals(tag)).findFirst();
  }

  public String tag() {
    return tag;
  }

  public ImmutableSet<String> attributeKeys() {
    return attributeKeys;
  }

  // Entity kinds whose prose may carry scenery and npc links.
  public boolean hostsInlineLinks() {
    return this == LOCATION || this == ITEM || this == FIXED || this == NPC;
  }

  public Optional<ImmutableMap<String, Object>> initialStates(Map<String, String> attrs) {
    String position = attrs.getOrDefault("location", "");
    switch (this) {
      case LOCATION:
        return Optional.of(ImmutableMap.of("visited", false, "entries", 0));
      case ITEM:
        return Optional.of(
            ImmutableMap.of("handled", false, "encountered", false, "position", position));
      case NPC:
        return Optional.of(
            ImmutableMap.of("met", false, "encountered", false, "position", position));
      case FIXED:
        return Optional.of(ImmutableMap.of("encountered", false));
      default:
        return Optional.empty();
    }
  }
}
