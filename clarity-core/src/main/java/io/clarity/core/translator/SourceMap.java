package io.clarity.core.translator;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import io.clarity.core.lexer.Position;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bidirectional index between surface source positions and knowledge document paths such as
 * {@code structured_knowledge.components[0].structured_knowledge.parameters[1]}. Each position
 * and each path is mapped at most once.
 */
public final class SourceMap {

  private final Map<Position, String> toDocument = new LinkedHashMap<>();
  private final Map<String, Position> toSource = new LinkedHashMap<>();

  /**
   * Records a mapping.
   *
   * @throws IllegalArgumentException if the position or the path is already mapped
   */
  public void add(Position position, String path) {
    if (toDocument.containsKey(position)) {
      throw new IllegalArgumentException(
          "Position " + position + " already mapped to " + toDocument.get(position));
    }
    if (toSource.containsKey(path)) {
      throw new IllegalArgumentException(
          "Path " + path + " already mapped to " + toSource.get(path));
    }
    toDocument.put(position, path);
    toSource.put(path, position);
  }

  public Optional<String> pathAt(int line, int column) {
    return Optional.ofNullable(toDocument.get(new Position(line, column)));
  }

  public Optional<Position> positionOf(String path) {
    return Optional.ofNullable(toSource.get(path));
  }

  public int size() {
    return toDocument.size();
  }

  public boolean isEmpty() {
    return toDocument.isEmpty();
  }

  /** Mappings in insertion order. */
  public Map<Position, String> entries() {
    return Collections.unmodifiableMap(toDocument);
  }

  /** {@code {"line:column": path}} in insertion order. */
  public JsonObject toJson() {
    JsonObject o = new JsonObject();
    toDocument.forEach((pos, path) -> o.addProperty(pos.toString(), path));
    return o;
  }

  /**
   * Reads a map written by {@link #toJson()}.
   *
   * @throws IllegalArgumentException on a malformed key or a duplicate mapping
   */
  public static SourceMap fromJson(JsonObject o) {
    SourceMap map = new SourceMap();
    for (Map.Entry<String, JsonElement> e : o.entrySet()) {
      String[] parts = e.getKey().split(":");
      if (parts.length != 2) {
        throw new IllegalArgumentException("Malformed source position: " + e.getKey());
      }
      try {
        map.add(
            new Position(Integer.parseInt(parts[0]), Integer.parseInt(parts[1])),
            e.getValue().getAsString());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("Malformed source position: " + e.getKey(), ex);
      }
    }
    return map;
  }
}
