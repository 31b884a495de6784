package io.clarity.core.translator;

import static org.junit.jupiter.api.Assertions.*;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import io.clarity.core.config.TranslatorConfig;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;

class TranslationProofPropertiesTest {

  private static final TranslationResult RESULT =
      new ClarityToKnowledgeTranslator(
              TranslatorConfig.builder()
                  .clock(Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC))
                  .build())
          .translate(TranslatorTest.PROGRAM);

  /** Setters for every primitive leaf of {@code element}, in document order. */
  private static void leaves(JsonElement element, List<Consumer<JsonElement>> out) {
    if (element.isJsonObject()) {
      JsonObject object = element.getAsJsonObject();
      for (Map.Entry<String, JsonElement> e : object.entrySet()) {
        if (e.getValue().isJsonPrimitive() || e.getValue().isJsonNull()) {
          String key = e.getKey();
          out.add(v -> object.add(key, v));
        } else {
          leaves(e.getValue(), out);
        }
      }
    } else if (element.isJsonArray()) {
      JsonArray array = element.getAsJsonArray();
      for (int i = 0; i < array.size(); i++) {
        if (array.get(i).isJsonPrimitive() || array.get(i).isJsonNull()) {
          int index = i;
          out.add(v -> array.set(index, v));
        } else {
          leaves(array.get(i), out);
        }
      }
    }
  }

  @Property(tries = 200)
  void anySingleFieldMutationFailsVerification(@ForAll @IntRange(min = 0) int pick) {
    JsonObject mutated = RESULT.document().deepCopy();
    List<Consumer<JsonElement>> setters = new ArrayList<>();
    leaves(mutated, setters);

    setters.get(pick % setters.size()).accept(new JsonPrimitive("mutated-value"));

    assertFalse(RESULT.proof().verify(TranslatorTest.PROGRAM, mutated));
  }

  @Property
  void anyOtherSourceTextFailsVerification(@ForAll String otherSource) {
    if (otherSource.equals(TranslatorTest.PROGRAM)) {
      return;
    }
    assertFalse(RESULT.proof().verify(otherSource, RESULT.document()));
  }
}
