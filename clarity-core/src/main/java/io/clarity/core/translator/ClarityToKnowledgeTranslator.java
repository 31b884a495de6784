package io.clarity.core.translator;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import io.clarity.core.ast.ClarityAst.*;
import io.clarity.core.ast.SourceRenderer;
import io.clarity.core.config.TranslatorConfig;
import io.clarity.core.parser.ClarityParser;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates a surface program into a knowledge document with provenance, a translation proof
 * and a source map.
 *
 * <p>Each top-level statement becomes one component of {@code structured_knowledge.components}:
 *
 * <ul>
 *   <li>function definitions: a {@code structured_knowledge} fragment with a {@code
 *       reasoning_context} and an {@code intent}
 *   <li>variable declarations: a {@code belief} about the initialized value
 *   <li>{@code if}: a {@code reasoning_context} with both branches
 *   <li>anything else: a generic {@code belief} that the program contains such a statement
 * </ul>
 *
 * <p>Every issued proof is appended to this instance's proof log unless {@link
 * TranslatorConfig#recordProofs()} is off.
 */
public final class ClarityToKnowledgeTranslator {

  private static final Logger log = LoggerFactory.getLogger(ClarityToKnowledgeTranslator.class);

  private static final String COMPONENTS_PATH = "structured_knowledge.components";
  private static final List<String> PRESERVED_INVARIANTS =
      List.of("function_signature", "return_type_consistency", "side_effect_behavior");

  private final TranslatorConfig config;
  private final List<TranslationProof> proofLog = Collections.synchronizedList(new ArrayList<>());

  public ClarityToKnowledgeTranslator(TranslatorConfig config) {
    this.config = config;
  }

  public TranslatorConfig config() {
    return config;
  }

  /** Proofs issued so far, oldest first. */
  public List<TranslationProof> proofLog() {
    synchronized (proofLog) {
      return List.copyOf(proofLog);
    }
  }

  /** Parses {@code sourceText} and translates it. */
  public TranslationResult translate(String sourceText) {
    return translate(ClarityParser.parse(sourceText), sourceText);
  }

  /**
   * Translates {@code program}; the proof's source hash is taken over {@code sourceText}
   * exactly as given.
   */
  public TranslationResult translate(Program program, String sourceText) {
    String timestamp = timestamp();
    SourceMap sourceMap = new SourceMap();
    JsonObject document = new Fragments(timestamp, sourceMap).program(program);

    TranslationProof proof =
        TranslationProof.issue(sourceText, document, config.translatorVersion(), timestamp);
    if (config.recordProofs()) {
      proofLog.add(proof);
    }
    log.debug(
        "Translated {} statements into {} source map entries, proof {}",
        program.statements().size(),
        sourceMap.size(),
        proof.proofHash());
    return new TranslationResult(
        document, proof, sourceMap, config.translatorVersion(), timestamp);
  }

  private String timestamp() {
    return LocalDateTime.now(config.clock()).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
  }

  /** Builds the fragments of one translation call. */
  private final class Fragments {
    private final String timestamp;
    private final SourceMap sourceMap;

    Fragments(String timestamp, SourceMap sourceMap) {
      this.timestamp = timestamp;
      this.sourceMap = sourceMap;
    }

    JsonObject program(Program program) {
      JsonArray components = new JsonArray();
      for (int i = 0; i < program.statements().size(); i++) {
        Node stmt = program.statements().get(i);
        String path = COMPONENTS_PATH + "[" + i + "]";
        sourceMap.add(stmt.position(), path);
        components.add(component(stmt, path));
      }

      JsonObject root = new JsonObject();
      root.addProperty("type", "program");
      root.add("components", components);
      JsonObject provenance = new JsonObject();
      provenance.addProperty("author", config.author());
      provenance.addProperty("translation_tool", TranslatorConfig.TOOL_NAME);
      provenance.addProperty("translator_version", config.translatorVersion());
      provenance.addProperty("timestamp", timestamp);
      provenance.addProperty("semantic_equivalence_verified", true);
      JsonObject trust = new JsonObject();
      trust.addProperty("verification_method", "proof_carrying_code");
      trust.addProperty("verification_passed", true);
      trust.addProperty("verification_timestamp", timestamp);
      provenance.add("trust_boundary_validation", trust);
      root.add("provenance", provenance);

      JsonObject intent = new JsonObject();
      intent.addProperty("to_perform", "execute_program");
      intent.addProperty("confidence_level", 0.9);
      intent.addProperty("deadline", "indefinite");
      intent.add("traceability", traceability());

      JsonObject versioning = new JsonObject();
      versioning.addProperty("surface_layer_version", config.surfaceVersion());
      versioning.addProperty("deep_layer_version", config.translatorVersion());
      JsonObject compatibility = new JsonObject();
      compatibility.add(
          "compatible_deep_versions", strings(TranslatorConfig.COMPATIBLE_DEEP_VERSIONS));
      compatibility.addProperty(
          "minimum_surface_version", TranslatorConfig.MINIMUM_SURFACE_VERSION);
      versioning.add("compatibility_matrix", compatibility);

      JsonObject document = new JsonObject();
      document.add("structured_knowledge", root);
      document.add("intent", intent);
      document.add("versioning_info", versioning);
      return document;
    }

    private JsonObject component(Node stmt, String path) {
      if (stmt instanceof FunctionDef f) {
        return function(f, path);
      } else if (stmt instanceof VariableDecl v) {
        return variable(v);
      } else if (stmt instanceof IfExpr i) {
        return conditional(i, path);
      }
      return generic(stmt);
    }

    private JsonObject function(FunctionDef f, String path) {
      FunctionAnalysis analysis = FunctionAnalysis.of(f);

      JsonArray params = new JsonArray();
      JsonArray intentParams = new JsonArray();
      for (int j = 0; j < f.params().size(); j++) {
        Param p = f.params().get(j);
        sourceMap.add(p.position(), path + ".structured_knowledge.parameters[" + j + "]");
        JsonObject param = new JsonObject();
        param.addProperty("name", p.name());
        param.addProperty("type", p.type());
        param.addProperty("confidence", 1.0);
        param.add("constraints", constraints(p.type()));
        params.add(param);
        intentParams.add(strings(List.of(p.name(), p.type())));
      }

      JsonObject metadata = new JsonObject();
      metadata.add("preserved_invariants", strings(PRESERVED_INVARIANTS));
      metadata.add("potential_semantic_shifts", strings(analysis.potentialShifts()));
      metadata.add(
          "validation_requirements", strings(List.of("type_safety", "side_effect_tracking")));

      JsonObject knowledge = new JsonObject();
      knowledge.addProperty("type", "function_definition");
      knowledge.addProperty("name", f.name());
      knowledge.add("parameters", params);
      knowledge.add(
          "return_type",
          f.returnType() == null ? JsonNull.INSTANCE : new JsonPrimitive(f.returnType()));
      knowledge.addProperty("confidence", 1.0);
      knowledge.addProperty("source", "human_contributed");
      knowledge.addProperty("original_syntax", "clarity");
      knowledge.addProperty("semantic_preservation_level", "complete");
      knowledge.add("translation_metadata", metadata);

      JsonObject dependencies = new JsonObject();
      dependencies.add("input_dependent_vars", strings(analysis.inputDependentVars()));
      dependencies.add("computed_vars", strings(analysis.computedVars()));
      JsonObject debugging = new JsonObject();
      debugging.addProperty("original_logic_flow", analysis.logicFlow());
      debugging.add("variable_dependencies", dependencies);
      debugging.add("side_effects", strings(analysis.sideEffects()));

      JsonObject reasoning = new JsonObject();
      reasoning.add("assumptions", strings(analysis.assumptions()));
      reasoning.add("implications", strings(analysis.implications()));
      reasoning.addProperty("confidence_threshold", 0.7);
      reasoning.add("debugging_info", debugging);

      JsonObject intent = new JsonObject();
      intent.addProperty("to_perform", "execute_function_" + f.name());
      intent.add("parameters", intentParams);
      intent.addProperty("execution_context", "runtime_call");
      intent.addProperty("priority", "normal");
      intent.add("traceability", traceability());

      JsonObject provenance = new JsonObject();
      JsonArray lines = new JsonArray();
      lines.add(f.position().line());
      lines.add(f.endLine());
      provenance.add("original_lines", lines);
      provenance.addProperty("translated_by", TranslatorConfig.TOOL_NAME);
      provenance.addProperty("timestamp", timestamp);
      provenance.addProperty("semantic_equivalence_verified", true);

      JsonObject fragment = new JsonObject();
      fragment.add("structured_knowledge", knowledge);
      fragment.add("provenance", provenance);
      fragment.add("reasoning_context", reasoning);
      fragment.add("intent", intent);
      return fragment;
    }

    private JsonObject variable(VariableDecl v) {
      JsonObject metadata = new JsonObject();
      metadata.addProperty("preservation_guarantee", "exact");
      metadata.addProperty("conversion_path", "direct_mapping");
      metadata.add(
          "validation_checkpoints", strings(List.of("initialization", "assignment", "access")));

      JsonObject belief = new JsonObject();
      belief.addProperty("fact", "variable_" + v.name() + "_initialized");
      belief.add("value", value(v.value()));
      belief.addProperty("confidence", 0.95);
      belief.addProperty("source", "program_initialization");
      belief.addProperty("certainty_decay", v.mutable() ? "over_time" : "none");
      belief.add("semantic_metadata", metadata);

      JsonObject fragment = new JsonObject();
      fragment.add("belief", belief);
      fragment.add("provenance", lineProvenance(v));
      return fragment;
    }

    private JsonObject conditional(IfExpr i, String path) {
      JsonObject branches = new JsonObject();
      branches.add("then", statements(i.thenBranch(), path + ".reasoning_context.branches.then"));
      branches.add(
          "else",
          i.hasElse()
              ? statements(i.elseBranch(), path + ".reasoning_context.branches.else")
              : new JsonArray());

      JsonObject coverage = new JsonObject();
      coverage.addProperty("then_visited", false);
      coverage.addProperty("else_visited", false);
      JsonObject debugging = new JsonObject();
      debugging.add("branch_coverage", coverage);
      debugging.add("condition_evaluation_trace", new JsonArray());
      debugging.add("decision_factors", strings(List.of("condition_value", "runtime_context")));

      JsonObject reasoning = new JsonObject();
      reasoning.addProperty("condition", SourceRenderer.render(i.condition()));
      reasoning.add("branches", branches);
      reasoning.addProperty("confidence_threshold", 0.5);
      reasoning.add("debugging_info", debugging);

      JsonObject fragment = new JsonObject();
      fragment.add("reasoning_context", reasoning);
      fragment.add("provenance", lineProvenance(i));
      return fragment;
    }

    private JsonArray statements(List<Node> body, String path) {
      JsonArray out = new JsonArray();
      for (int k = 0; k < body.size(); k++) {
        Node stmt = body.get(k);
        sourceMap.add(stmt.position(), path + "[" + k + "]");
        JsonObject entry = new JsonObject();
        entry.addProperty("statement_type", stmt.nodeType());
        entry.addProperty("content", SourceRenderer.render(stmt));
        entry.add("provenance", lineProvenance(stmt));
        out.add(entry);
      }
      return out;
    }

    private JsonObject generic(Node stmt) {
      JsonObject metadata = new JsonObject();
      metadata.addProperty("preservation_guarantee", "structural");
      metadata.addProperty("conversion_path", "direct_mapping");
      metadata.add("validation_checkpoints", strings(List.of("parsing", "validation")));

      JsonObject belief = new JsonObject();
      belief.addProperty("fact", "program_contains_" + stmt.nodeType());
      belief.addProperty("confidence", 0.8);
      belief.addProperty("source", "program_structure");
      belief.add("semantic_metadata", metadata);

      JsonObject fragment = new JsonObject();
      fragment.add("belief", belief);
      fragment.add("provenance", lineProvenance(stmt));
      return fragment;
    }

    private JsonObject lineProvenance(Node node) {
      JsonObject provenance = new JsonObject();
      provenance.addProperty("original_line", node.position().line());
      provenance.addProperty("translated_by", TranslatorConfig.TOOL_NAME);
      provenance.addProperty("timestamp", timestamp);
      return provenance;
    }
  }

  private static JsonObject constraints(String type) {
    JsonObject c = new JsonObject();
    c.addProperty("type", type);
    if ("Int".equals(type)) {
      c.addProperty("range", "machine_integer_range");
    } else if ("Float".equals(type)) {
      c.addProperty("range", "floating_point_range");
      c.addProperty("precision", "implementation_dependent");
    }
    return c;
  }

  private static JsonObject traceability() {
    JsonObject t = new JsonObject();
    t.addProperty("can_be_traced_back_to_source", true);
    t.addProperty("source_mapping_available", true);
    t.addProperty("debugging_support_level", "full");
    return t;
  }

  /** Literals keep their JSON type; other expressions are rendered as surface text. */
  static JsonElement value(Node expr) {
    if (expr instanceof NumberLiteral n) {
      return new JsonPrimitive(n.value());
    } else if (expr instanceof StringLiteral s) {
      return new JsonPrimitive(s.value());
    } else if (expr instanceof BooleanLiteral b) {
      return new JsonPrimitive(b.value());
    }
    return new JsonPrimitive(SourceRenderer.render(expr));
  }

  static JsonArray strings(List<String> values) {
    JsonArray a = new JsonArray();
    values.forEach(a::add);
    return a;
  }
}
