package io.clarity.core.knowledge;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import io.clarity.core.ast.SourceRenderer;
import io.clarity.core.knowledge.BocAst.*;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Renders knowledge-dialect text, either from a parsed {@link BocAst.Program} (canonical form)
 * or from a translator-produced knowledge document.
 *
 * <p>A document has no block syntax for nested objects, so nested objects are flattened into
 * {@code outer_inner} keys and arrays of objects into {@code outer_<index>_inner} keys. The
 * output always re-parses with {@link KnowledgeParser}.
 */
public final class KnowledgeWriter {

  private static final String INDENT = "    ";
  private static final Pattern PLAIN_NUMBER = Pattern.compile("\\d+(\\.\\d+)?");

  private KnowledgeWriter() {}

  // === Parsed programs ===

  /** Canonical text of a parsed program: one statement per line, four-space block bodies. */
  public static String write(Program program) {
    StringBuilder sb = new StringBuilder();
    for (Statement statement : program.statements()) {
      if (statement instanceof Block block) {
        writeBlock(sb, block);
      } else if (statement instanceof Assignment assignment) {
        sb.append(assignment.name()).append(" = ").append(render(assignment.value()));
      }
      sb.append('\n');
    }
    return sb.toString();
  }

  private static void writeBlock(StringBuilder sb, Block block) {
    sb.append(block.kind().keyword());
    if (block.confidence() != null) {
      sb.append(" confidence=").append(render(block.confidence()));
    }
    if (block.action() != null) {
      sb.append(" to_perform: ").append(render(block.action()));
    }
    for (Map.Entry<String, Expr> attribute : block.attributes().entrySet()) {
      sb.append(" @").append(attribute.getKey());
      if (!isTrue(attribute.getValue())) {
        sb.append('(').append(render(attribute.getValue())).append(')');
      }
    }
    if (block.content().isEmpty()) {
      sb.append(" {}");
      return;
    }
    sb.append(" {\n");
    for (Entry entry : block.content()) {
      sb.append(INDENT);
      if (entry.isKeyValue()) {
        sb.append(entry.key()).append(": ");
      }
      sb.append(render(entry.value())).append('\n');
    }
    sb.append('}');
  }

  /** Dialect text of a single expression. */
  public static String render(Expr expr) {
    if (expr instanceof Literal literal) {
      return literal.kind() == LiteralKind.STRING ? quote(literal.text()) : literal.text();
    }
    if (expr instanceof Ref ref) {
      return ref.name();
    }
    ArrayExpr array = (ArrayExpr) expr;
    StringBuilder sb = new StringBuilder("[");
    for (int i = 0; i < array.items().size(); i++) {
      if (i > 0) sb.append(", ");
      sb.append(render(array.items().get(i)));
    }
    return sb.append(']').toString();
  }

  private static boolean isTrue(Expr expr) {
    return expr instanceof Literal l
        && l.kind() == LiteralKind.BOOLEAN
        && l.text().equalsIgnoreCase("true");
  }

  // === Knowledge documents ===

  /**
   * Dialect text of a translator knowledge document: a {@code structured_knowledge @program}
   * header, one block per component, the program intent and a {@code shared_state
   * @versioning_info} block.
   */
  public static String write(JsonObject document) {
    StringBuilder sb = new StringBuilder();

    JsonObject root = objectOrEmpty(document, "structured_knowledge");
    JsonObject header = new JsonObject();
    for (Map.Entry<String, JsonElement> e : root.entrySet()) {
      if (!e.getKey().equals("components")) {
        header.add(e.getKey(), e.getValue());
      }
    }
    sb.append("structured_knowledge @program");
    writeBody(sb, header);

    JsonArray components =
        root.has("components") && root.get("components").isJsonArray()
            ? root.getAsJsonArray("components")
            : new JsonArray();
    for (int i = 0; i < components.size(); i++) {
      JsonElement component = components.get(i);
      if (component.isJsonObject()) {
        writeComponent(sb, component.getAsJsonObject(), i);
      }
    }

    if (document.has("intent") && document.get("intent").isJsonObject()) {
      writeIntent(sb, document.getAsJsonObject("intent"), "");
    }
    if (document.has("versioning_info") && document.get("versioning_info").isJsonObject()) {
      sb.append("shared_state @versioning_info");
      writeBody(sb, document.getAsJsonObject("versioning_info"));
    }
    return sb.toString();
  }

  private static void writeComponent(StringBuilder sb, JsonObject component, int index) {
    String attr = " @component(" + index + ")";
    if (component.has("structured_knowledge")) {
      JsonObject body =
          merged(
              component, "structured_knowledge", objectOrEmpty(component, "structured_knowledge"));
      sb.append("structured_knowledge").append(attr);
      writeBody(sb, body);
    } else if (component.has("belief")) {
      JsonObject belief = objectOrEmpty(component, "belief").deepCopy();
      JsonElement confidence = belief.remove("confidence");
      JsonObject body = merged(component, "belief", belief);
      sb.append("belief");
      if (confidence != null) {
        sb.append(" confidence=").append(scalar(confidence));
      }
      sb.append(attr);
      writeBody(sb, body);
    } else if (component.has("reasoning_context")) {
      JsonObject body =
          merged(component, "reasoning_context", objectOrEmpty(component, "reasoning_context"));
      sb.append("reasoning_context").append(attr);
      writeBody(sb, body);
    } else {
      writeIntent(sb, component, attr);
    }
  }

  private static void writeIntent(StringBuilder sb, JsonObject intent, String attr) {
    JsonObject body = intent.deepCopy();
    JsonElement action = body.remove("to_perform");
    sb.append("intent");
    if (action != null) {
      sb.append(" to_perform: ").append(scalar(action));
    }
    sb.append(attr);
    writeBody(sb, body);
  }

  /** Members of {@code main}, then the component's other members under their own keys. */
  private static JsonObject merged(JsonObject component, String primary, JsonObject main) {
    JsonObject body = new JsonObject();
    for (Map.Entry<String, JsonElement> e : main.entrySet()) {
      body.add(e.getKey(), e.getValue());
    }
    for (Map.Entry<String, JsonElement> e : component.entrySet()) {
      if (!e.getKey().equals(primary)) {
        body.add(e.getKey(), e.getValue());
      }
    }
    return body;
  }

  private static void writeBody(StringBuilder sb, JsonObject body) {
    if (body.size() == 0) {
      sb.append(" {}\n");
      return;
    }
    sb.append(" {\n");
    for (Map.Entry<String, JsonElement> e : body.entrySet()) {
      flatten(sb, e.getKey(), e.getValue());
    }
    sb.append("}\n");
  }

  private static void flatten(StringBuilder sb, String key, JsonElement value) {
    if (value.isJsonObject()) {
      JsonObject object = value.getAsJsonObject();
      if (object.size() == 0) {
        sb.append(INDENT).append(key).append(": []\n");
      }
      for (Map.Entry<String, JsonElement> e : object.entrySet()) {
        flatten(sb, key + "_" + e.getKey(), e.getValue());
      }
    } else if (value.isJsonArray() && containsObject(value.getAsJsonArray())) {
      JsonArray array = value.getAsJsonArray();
      for (int i = 0; i < array.size(); i++) {
        flatten(sb, key + "_" + i, array.get(i));
      }
    } else {
      sb.append(INDENT).append(key).append(": ").append(scalar(value)).append('\n');
    }
  }

  private static boolean containsObject(JsonArray array) {
    for (JsonElement e : array) {
      if (e.isJsonObject() || (e.isJsonArray() && containsObject(e.getAsJsonArray()))) {
        return true;
      }
    }
    return false;
  }

  private static String scalar(JsonElement value) {
    if (value.isJsonNull()) {
      return "null";
    }
    if (value.isJsonArray()) {
      StringBuilder sb = new StringBuilder("[");
      JsonArray array = value.getAsJsonArray();
      for (int i = 0; i < array.size(); i++) {
        if (i > 0) sb.append(", ");
        sb.append(scalar(array.get(i)));
      }
      return sb.append(']').toString();
    }
    if (value.isJsonObject()) {
      return quote(value.toString());
    }
    JsonPrimitive primitive = value.getAsJsonPrimitive();
    if (primitive.isBoolean()) {
      return String.valueOf(primitive.getAsBoolean());
    }
    if (primitive.isNumber()) {
      String text = primitive.getAsNumber().toString();
      // the dialect has no sign or exponent syntax
      return PLAIN_NUMBER.matcher(text).matches() ? text : quote(text);
    }
    return quote(primitive.getAsString());
  }

  private static JsonObject objectOrEmpty(JsonObject parent, String key) {
    JsonElement e = parent.get(key);
    return e != null && e.isJsonObject() ? e.getAsJsonObject() : new JsonObject();
  }

  static String quote(String text) {
    return SourceRenderer.quote(text);
  }
}
