package io.clarity.core.translator;

import static org.junit.jupiter.api.Assertions.*;

import com.google.gson.JsonObject;
import io.clarity.core.lexer.Position;
import org.junit.jupiter.api.Test;

class SourceMapTest {

  @Test
  void mapsBothWays() {
    SourceMap map = new SourceMap();
    map.add(new Position(1, 0), "structured_knowledge.components[0]");
    map.add(new Position(3, 4), "structured_knowledge.components[1]");

    assertEquals("structured_knowledge.components[1]", map.pathAt(3, 4).orElseThrow());
    assertEquals(new Position(1, 0), map.positionOf("structured_knowledge.components[0]").get());
    assertTrue(map.positionOf("structured_knowledge.components[9]").isEmpty());
    assertEquals(2, map.size());
    assertFalse(map.isEmpty());
  }

  @Test
  void rejectsDuplicatePositionsAndPaths() {
    SourceMap map = new SourceMap();
    map.add(new Position(1, 0), "a");

    assertThrows(IllegalArgumentException.class, () -> map.add(new Position(1, 0), "b"));
    assertThrows(IllegalArgumentException.class, () -> map.add(new Position(2, 0), "a"));
    assertEquals(1, map.size());
  }

  @Test
  void jsonFormUsesLineColonColumnKeys() {
    SourceMap map = new SourceMap();
    map.add(new Position(2, 5), "p");

    JsonObject json = map.toJson();
    assertEquals("p", json.get("2:5").getAsString());

    SourceMap read = SourceMap.fromJson(json);
    assertEquals(map.entries(), read.entries());
  }

  @Test
  void malformedKeysAreRejected() {
    JsonObject json = new JsonObject();
    json.addProperty("line-two", "p");
    assertThrows(IllegalArgumentException.class, () -> SourceMap.fromJson(json));

    JsonObject notNumbers = new JsonObject();
    notNumbers.addProperty("a:b", "p");
    assertThrows(IllegalArgumentException.class, () -> SourceMap.fromJson(notNumbers));
  }

  @Test
  void entriesAreReadOnly() {
    SourceMap map = new SourceMap();
    assertTrue(map.isEmpty());
    assertThrows(UnsupportedOperationException.class, () -> map.entries().clear());
  }
}
