package tsp;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/** Inline scenery and npc links seen so far in the entity being parsed. */
class LinkTables {
  private final Map<String, Command> scenery = new HashMap<>();
  private final Map<String, Command> npcs = new HashMap<>();

  void clear() {
    scenery.clear();
    npcs.clear();
  }

  void register(Command link) {
    String id =
        link.id().orElseThrow(() -> new IllegalArgumentException("Link without id: " + link));
    if (link.type() == CommandType.SCENERYLINK) {
      scenery.put(id, link);
    } else if (link.type() == CommandType.NPCLINK) {
      npcs.put(id, link);
    }
  }

  Optional<Command> inlineLink(CommandType type, String id) {
    switch (type) {
      case SCENERYLINK:
        return Optional.ofNullable(scenery.get(id));
      case NPCLINK:
        return Optional.ofNullable(npcs.get(id));
      default:
        return Optional.empty();
    }
  }
}
