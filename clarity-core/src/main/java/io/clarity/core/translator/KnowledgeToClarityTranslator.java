package io.clarity.core.translator;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import io.clarity.core.ast.ClarityAst.FunctionDef;
import io.clarity.core.ast.ClarityAst.IfExpr;
import io.clarity.core.ast.ClarityAst.Node;
import io.clarity.core.ast.ClarityAst.Program;
import io.clarity.core.config.TranslatorConfig;
import io.clarity.core.error.ClarityException;
import io.clarity.core.error.ProofVerificationException;
import io.clarity.core.parser.ClarityParser;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reconstructs surface-shaped text from a knowledge document and, given a proof, verifies the
 * document against it.
 *
 * <p>Reconstruction is lossy: functions come back as signatures with an empty body, variable
 * beliefs and conditionals as comments (conditionals with an {@code if true} skeleton). The
 * reconstructed text parses as a surface program as long as the document's names and types are
 * identifiers.
 *
 * <p>Verification recomputes the document hash and the proof hash chain. It also re-parses the
 * reconstructed text and compares function signatures and statement kinds against the document
 * and, when supplied, the original source; mismatches are reported as differences and do not
 * affect {@link VerificationReport#passed()}.
 */
public final class KnowledgeToClarityTranslator {

  private static final Logger log = LoggerFactory.getLogger(KnowledgeToClarityTranslator.class);

  private final TranslatorConfig config;

  public KnowledgeToClarityTranslator(TranslatorConfig config) {
    this.config = config;
  }

  public ReverseTranslationResult reverse(JsonObject document) {
    return reverse(document, null, null);
  }

  public ReverseTranslationResult reverse(JsonObject document, TranslationProof proof) {
    return reverse(document, proof, null);
  }

  /**
   * Reconstructs {@code document}; verifies it when {@code proof} is non-null.
   *
   * @param sourceText original source text, or {@code null} if unavailable
   * @throws ProofVerificationException if verification fails and strict verification is on
   */
  public ReverseTranslationResult reverse(
      JsonObject document, TranslationProof proof, String sourceText) {
    String timestamp =
        LocalDateTime.now(config.clock()).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    List<String> lossy = new ArrayList<>();
    String text = reconstruct(document, timestamp, lossy);

    VerificationReport report = null;
    if (proof != null) {
      report = verify(document, proof, sourceText, text);
      if (!report.passed()) {
        log.warn("Translation proof verification failed: {}", report.failures());
        if (config.strictVerification()) {
          throw new ProofVerificationException(report.failures());
        }
      } else {
        log.debug("Translation proof {} verified", proof.proofHash());
      }
    }
    return new ReverseTranslationResult(
        text, report, lossy, config.translatorVersion(), timestamp);
  }

  /** Verifies {@code document} against {@code proof} without source text. */
  public VerificationReport verify(JsonObject document, TranslationProof proof) {
    return reverse(document, proof, null).verificationOrNull();
  }

  // === Reconstruction ===

  private String reconstruct(JsonObject document, String timestamp, List<String> lossy) {
    List<String> out = new ArrayList<>();
    JsonObject root = object(document, "structured_knowledge");
    out.add("// Auto-generated from BOC representation (v" + config.translatorVersion() + ")");
    out.add("// Translated at: " + timestamp);
    out.add(
        comment("// Original source: " + string(object(root, "provenance"), "author", "unknown")));
    out.add("");

    JsonArray components = components(document);
    for (int idx = 0; idx < components.size(); idx++) {
      JsonObject component = componentAt(components, idx);
      String ref = "components[" + idx + "]";
      if (isFunction(component)) {
        JsonObject fn = object(component, "structured_knowledge");
        out.add(functionCode(component, fn, idx));
        lossy.add(ref + " function " + string(fn, "name", "?") + ": body not reconstructed");
      } else if (component.has("belief")) {
        JsonObject belief = object(component, "belief");
        String fact = string(belief, "fact", "unknown");
        out.add(beliefComment(belief, fact, idx));
        lossy.add(ref + " belief " + fact + ": kept as comment");
      } else if (component.has("reasoning_context")) {
        out.add(conditionalCode(object(component, "reasoning_context"), idx));
        lossy.add(ref + " conditional: condition and branches kept as comments");
      } else {
        out.add("// Component " + idx + ": Generic element translated from BOC");
        lossy.add(ref + " generic element: not reconstructed");
      }
    }
    return String.join("\n", out) + "\n";
  }

  private static String functionCode(JsonObject component, JsonObject fn, int index) {
    JsonObject provenance = object(component, "provenance");
    JsonObject debugging = object(object(component, "reasoning_context"), "debugging_info");
    List<String> code = new ArrayList<>();
    code.add(
        "// Function #"
            + index
            + " - BOC Origin: "
            + (provenance.has("original_lines") ? provenance.get("original_lines") : "unknown"));
    code.add(
        "// Semantic preservation: " + string(fn, "semantic_preservation_level", "unknown"));
    code.add("// Confidence: " + scalar(fn.get("confidence")));
    if (debugging.size() > 0) {
      code.add(
          "// Logic flow: "
              + string(debugging, "original_logic_flow", "unknown")
              + ", side effects: "
              + scalar(debugging.get("side_effects")));
    }
    code.add("fn " + signature(fn).render() + " {");
    code.add("    // Body not reconstructed from BOC");
    code.add("}");
    return String.join("\n", code);
  }

  private static String beliefComment(JsonObject belief, String fact, int index) {
    if (fact.startsWith("variable_") && fact.endsWith("_initialized")) {
      return comment(
          "// ["
              + index
              + "] "
              + scalar(belief.get("confidence"))
              + " confidence that "
              + fact
              + " = "
              + scalar(belief.get("value")));
    }
    return comment(
        "// ["
            + index
            + "] Belief: "
            + fact
            + " (confidence: "
            + scalar(belief.get("confidence"))
            + ")");
  }

  private static String conditionalCode(JsonObject context, int index) {
    JsonObject debugging = object(context, "debugging_info");
    JsonObject branches = object(context, "branches");
    List<String> code = new ArrayList<>();
    code.add("// Conditional #" + index + " - Translation from BOC reasoning context");
    JsonElement coverage = debugging.get("branch_coverage");
    code.add("// Branch coverage tracking: " + (coverage == null ? "not_tracked" : coverage));
    code.add(comment("// Condition: " + string(context, "condition", "unknown")));
    JsonElement threshold = context.get("confidence_threshold");
    code.add("// Confidence threshold: " + (threshold == null ? "0.5" : scalar(threshold)));
    code.add("if true {");
    code.add("    // Then branch logic (from BOC)");
    branchComments(code, branches, "then");
    code.add("} else {");
    code.add("    // Else branch logic (from BOC)");
    branchComments(code, branches, "else");
    code.add("}");
    return String.join("\n", code);
  }

  private static void branchComments(List<String> code, JsonObject branches, String key) {
    JsonElement branch = branches.get(key);
    if (branch == null || !branch.isJsonArray()) {
      return;
    }
    for (JsonElement stmt : branch.getAsJsonArray()) {
      if (stmt.isJsonObject()) {
        code.add(comment("    //   " + string(stmt.getAsJsonObject(), "content", "?")));
      }
    }
  }

  // === Verification ===

  private VerificationReport verify(
      JsonObject document, TranslationProof proof, String sourceText, String reconstructed) {
    String targetHash = Hashing.documentHash(document);
    boolean targetMatches = targetHash.equals(proof.targetHash());
    boolean chainMatches =
        TranslationProof.chain(
                proof.sourceHash(), targetHash, proof.translatorVersion(), proof.timestamp())
            .equals(proof.proofHash());
    Boolean sourceMatches =
        sourceText == null ? null : Hashing.sha256(sourceText).equals(proof.sourceHash());

    List<String> failures = new ArrayList<>();
    if (!targetMatches) {
      failures.add(
          "target hash mismatch: proof has "
              + proof.targetHash()
              + ", document hashes to "
              + targetHash);
    }
    if (!chainMatches) {
      failures.add("proof hash is not reproducible from the proof fields and the document");
    }
    if (Boolean.FALSE.equals(sourceMatches)) {
      failures.add("source hash mismatch: supplied source text differs from the translated source");
    }
    boolean passed = failures.isEmpty();

    List<String> differences = new ArrayList<>();
    compareVersions(document, proof, differences);
    compareStructure(document, reconstructed, sourceText, differences);

    JsonArray coverage = new JsonArray();
    JsonArray components = components(document);
    for (int i = 0; i < components.size(); i++) {
      JsonObject c = componentAt(components, i);
      if (c.has("reasoning_context") && !isFunction(c)) {
        JsonObject debugging = object(object(c, "reasoning_context"), "debugging_info");
        if (debugging.has("branch_coverage")) {
          coverage.add(debugging.get("branch_coverage").deepCopy());
        }
      }
    }
    return new VerificationReport(
        passed, targetMatches, chainMatches, sourceMatches, failures, differences, coverage);
  }

  private static void compareVersions(
      JsonObject document, TranslationProof proof, List<String> differences) {
    JsonObject matrix = object(object(document, "versioning_info"), "compatibility_matrix");
    JsonElement compatible = matrix.get("compatible_deep_versions");
    if (compatible == null || !compatible.isJsonArray()) {
      differences.add("versioning_info lacks compatible_deep_versions");
      return;
    }
    for (JsonElement v : compatible.getAsJsonArray()) {
      if (v.isJsonPrimitive() && versionMatches(v.getAsString(), proof.translatorVersion())) {
        return;
      }
    }
    differences.add(
        "translator version "
            + proof.translatorVersion()
            + " not in compatible deep versions "
            + compatible);
  }

  static boolean versionMatches(String pattern, String version) {
    if (pattern.endsWith(".x")) {
      return version.startsWith(pattern.substring(0, pattern.length() - 1));
    }
    return pattern.equals(version);
  }

  private static void compareStructure(
      JsonObject document, String reconstructed, String sourceText, List<String> differences) {
    List<Signature> documented = new ArrayList<>();
    List<String> documentedKinds = new ArrayList<>();
    JsonArray components = components(document);
    for (int i = 0; i < components.size(); i++) {
      JsonObject c = componentAt(components, i);
      String kind = componentKind(c);
      documentedKinds.add(kind);
      if (kind.equals("FunctionDef")) {
        documented.add(signature(object(c, "structured_knowledge")));
      }
    }

    Program rebuilt;
    try {
      rebuilt = ClarityParser.parse(reconstructed);
    } catch (ClarityException e) {
      differences.add("reconstructed text does not parse: " + e.getMessage());
      return;
    }
    compareSignatures("reconstruction", documented, signatures(rebuilt), differences);
    long conditionals = documentedKinds.stream().filter("IfExpr"::equals).count();
    long rebuiltConditionals =
        rebuilt.statements().stream().filter(s -> s instanceof IfExpr).count();
    if (conditionals != rebuiltConditionals) {
      differences.add(
          "document has "
              + conditionals
              + " conditionals, reconstruction has "
              + rebuiltConditionals);
    }

    if (sourceText == null) {
      return;
    }
    Program source;
    try {
      source = ClarityParser.parse(sourceText);
    } catch (ClarityException e) {
      differences.add("source text does not parse: " + e.getMessage());
      return;
    }
    compareSignatures("source", documented, signatures(source), differences);
    List<Node> statements = source.statements();
    if (statements.size() != documentedKinds.size()) {
      differences.add(
          "source has "
              + statements.size()
              + " statements, document has "
              + documentedKinds.size()
              + " components");
    }
    for (int i = 0; i < Math.min(statements.size(), documentedKinds.size()); i++) {
      String expected = statements.get(i).nodeType();
      String actual = documentedKinds.get(i);
      if (!expected.equals(actual)) {
        differences.add(
            "components[" + i + "]: source has " + expected + ", document has " + actual);
      }
    }
  }

  private static void compareSignatures(
      String against,
      List<Signature> documented,
      List<Signature> actual,
      List<String> differences) {
    if (documented.size() != actual.size()) {
      differences.add(
          "document has " + documented.size() + " functions, " + against + " has " + actual.size());
    }
    for (int i = 0; i < Math.min(documented.size(), actual.size()); i++) {
      Signature d = documented.get(i);
      Signature a = actual.get(i);
      if (!d.equals(a)) {
        differences.add(
            "function #"
                + i
                + ": document declares "
                + d.render()
                + ", "
                + against
                + " has "
                + a.render());
      }
    }
  }

  private static List<Signature> signatures(Program program) {
    List<Signature> out = new ArrayList<>();
    for (Node stmt : program.statements()) {
      if (stmt instanceof FunctionDef f) {
        out.add(
            new Signature(
                f.name(),
                f.params().stream()
                    .map(p -> p.name() + ": " + p.type())
                    .collect(Collectors.toList()),
                f.returnType()));
      }
    }
    return out;
  }

  /** Surface node kind a component was translated from. */
  private static String componentKind(JsonObject component) {
    if (isFunction(component)) {
      return "FunctionDef";
    }
    if (component.has("belief")) {
      String fact = string(object(component, "belief"), "fact", "");
      if (fact.startsWith("variable_") && fact.endsWith("_initialized")) {
        return "VariableDecl";
      }
      if (fact.startsWith("program_contains_")) {
        return fact.substring("program_contains_".length());
      }
      return "unknown";
    }
    return component.has("reasoning_context") ? "IfExpr" : "unknown";
  }

  /** Function signature as it appears after {@code fn}. */
  record Signature(String name, List<String> params, String returnType) {
    String render() {
      return name
          + "("
          + String.join(", ", params)
          + ")"
          + (returnType == null ? "" : " -> " + returnType);
    }
  }

  private static Signature signature(JsonObject fn) {
    List<String> params = new ArrayList<>();
    JsonElement declared = fn.get("parameters");
    if (declared != null && declared.isJsonArray()) {
      for (JsonElement p : declared.getAsJsonArray()) {
        JsonObject param = p.isJsonObject() ? p.getAsJsonObject() : new JsonObject();
        params.add(string(param, "name", "?") + ": " + string(param, "type", "?"));
      }
    }
    JsonElement ret = fn.get("return_type");
    String returnType = ret == null || ret.isJsonNull() ? null : scalar(ret);
    return new Signature(string(fn, "name", "?"), params, returnType);
  }

  // === Lenient document access ===

  private static boolean isFunction(JsonObject component) {
    JsonObject knowledge = object(component, "structured_knowledge");
    return "function_definition".equals(string(knowledge, "type", null));
  }

  private static JsonObject componentAt(JsonArray components, int index) {
    JsonElement e = components.get(index);
    return e.isJsonObject() ? e.getAsJsonObject() : new JsonObject();
  }

  private static JsonArray components(JsonObject document) {
    JsonElement c = object(document, "structured_knowledge").get("components");
    return c != null && c.isJsonArray() ? c.getAsJsonArray() : new JsonArray();
  }

  private static JsonObject object(JsonObject parent, String key) {
    JsonElement e = parent.get(key);
    return e != null && e.isJsonObject() ? e.getAsJsonObject() : new JsonObject();
  }

  private static String string(JsonObject parent, String key, String fallback) {
    JsonElement e = parent.get(key);
    return e == null || e.isJsonNull() ? fallback : scalar(e);
  }

  private static String scalar(JsonElement e) {
    if (e == null || e.isJsonNull()) {
      return "unknown";
    }
    return e.isJsonPrimitive() ? e.getAsString() : e.toString();
  }

  /** Keeps a generated comment on one line. */
  private static String comment(String line) {
    return line.replace('\r', ' ').replace('\n', ' ');
  }
}
