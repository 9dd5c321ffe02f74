package tsp;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.Iterables;
import com.google.common.io.Files;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * Emits compiled entities as the game file read by the runtime.
 *
 * <p>The document has two members: {@code entities}, keyed by entity id, and {@code commands},
 * every command and option tag the grammar knows. Source positions and owning-entity links are
 * compile-time only and are not written.
 */
public class GameFileWriter {
  private final Gson gson;

  public GameFileWriter(boolean prettyPrint) {
    GsonBuilder builder = new GsonBuilder().disableHtmlEscaping();
    if (prettyPrint) {
      builder.setPrettyPrinting();
    }
    this.gson = builder.create();
  }

  // The game file name for a title: "The Cave" becomes "the_cave.tsp.json".
  public static String fileNameFor(String gameTitle) {
    return gameTitle.replaceAll("[^A-Za-z0-9]", "_").toLowerCase(Locale.ROOT) + ".tsp.json";
  }

  public void write(Map<String, Command> entities, File file) throws IOException {
    Files.asCharSink(file, StandardCharsets.UTF_8).write(toJson(entities));
  }

  public String toJson(Map<String, Command> entities) {
    return gson.toJson(toJsonTree(entities));
  }

  public JsonObject toJsonTree(Map<String, Command> entities) {
    JsonObject entitiesJson = new JsonObject();
    entities.forEach((id, entity) -> entitiesJson.add(id, toJson(entity)));

    JsonArray commands = new JsonArray();
    for (String tag : Iterables.concat(Grammar.commandTags(), Grammar.optionTags())) {
      commands.add(tag);
    }

    JsonObject document = new JsonObject();
    document.add("entities", entitiesJson);
    document.add("commands", commands);
    return document;
  }

  JsonObject toJson(Command node) {
    JsonObject json = new JsonObject();
    json.addProperty("type", node.type().isEntity() ? node.tag() : node.type().jsonName());
    json.addProperty("uid", node.uid());
    json.addProperty("tag", node.tag());
    addString(json, "id", node.id());
    addString(json, "displayName", node.displayName());
    node.attrs().ifPresent(attrs -> json.add("attrs", gson.toJsonTree(attrs)));
    addMap(json, "flags", node.flags());
    addMap(json, "states", node.states());
    addMap(json, "parameters", node.parameters());
    node.value().ifPresent(value -> json.add("value", toJsonValue(value)));
    addString(json, "inlineText", node.inlineText());
    addString(json, "op", node.op());
    addString(json, "rval", node.rval());
    addMap(json, "settings", node.settings());
    addMap(json, "cmdState", node.cmdState());
    if (node.flowController()) {
      json.addProperty("flowController", true);
    }
    if (!node.conditions().isEmpty()) {
      JsonArray cond = new JsonArray();
      for (Condition condition : node.conditions()) {
        JsonObject c = new JsonObject();
        c.addProperty("lval", condition.lval());
        c.addProperty("op", condition.op());
        c.addProperty("rval", condition.rval());
        condition.lop().ifPresent(lop -> c.addProperty("lop", lop));
        cond.add(c);
      }
      json.add("cond", cond);
    }
    if (node.hasLeadin()) {
      json.add("leadin", toJsonArray(node.leadin()));
    }
    if (node.text().isPresent()) {
      json.addProperty("body", node.text().get());
    } else if (node.hasBody()) {
      json.add("body", toJsonArray(node.body()));
    }
    return json;
  }

  private JsonArray toJsonArray(List<Command> nodes) {
    JsonArray array = new JsonArray();
    nodes.forEach(node -> array.add(toJson(node)));
    return array;
  }

  private static void addString(JsonObject json, String key, Optional<String> value) {
    value.ifPresent(v -> json.addProperty(key, v));
  }

  private void addMap(JsonObject json, String key, Optional<? extends Map<String, Object>> map) {
    if (!map.isPresent()) {
      return;
    }
    JsonObject object = new JsonObject();
    map.get().forEach((k, v) -> object.add(k, toJsonValue(v)));
    json.add(key, object);
  }

  // Numbers and booleans stay native; nested maps and lists go through Gson.
  private JsonElement toJsonValue(Object value) {
    if (value instanceof Boolean) {
      return new JsonPrimitive((Boolean) value);
    }
    if (value instanceof Number) {
      return new JsonPrimitive((Number) value);
    }
    if (value instanceof String) {
      return new JsonPrimitive((String) value);
    }
    return gson.toJsonTree(value);
  }
}
