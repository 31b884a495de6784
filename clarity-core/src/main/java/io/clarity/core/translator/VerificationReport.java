package io.clarity.core.translator;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import java.util.List;

/**
 * Outcome of checking a knowledge document against a translation proof.
 *
 * @param passed true only if every hash check that could be run succeeded
 * @param targetHashMatches recomputed document hash equals the proof's target hash
 * @param proofHashReproducible proof hash recomputed from the stored source hash, the recomputed
 *     target hash, the version and the timestamp equals the stored proof hash
 * @param sourceHashMatches hash of the supplied source text equals the proof's source hash, or
 *     {@code null} when no source text was supplied
 * @param failures one line per failed check
 * @param differences structural mismatches between the reconstructed text, the document and, if
 *     supplied, the original source
 * @param branchCoverage branch coverage records copied from the document's conditionals
 */
public record VerificationReport(
    boolean passed,
    boolean targetHashMatches,
    boolean proofHashReproducible,
    Boolean sourceHashMatches,
    List<String> failures,
    List<String> differences,
    JsonArray branchCoverage) {

  public VerificationReport {
    failures = List.copyOf(failures);
    differences = List.copyOf(differences);
    branchCoverage = branchCoverage.deepCopy();
  }

  /** Hashes verified and no structural differences found. */
  public boolean semanticEquivalenceConfirmed() {
    return passed && differences.isEmpty();
  }

  public double confidenceLevel() {
    if (!passed) {
      return 0.0;
    }
    return differences.isEmpty() ? 0.95 : 0.5;
  }

  public JsonObject toJson() {
    JsonObject o = new JsonObject();
    o.addProperty("verification_passed", passed);
    o.addProperty("confidence_level", confidenceLevel());
    o.add("differences_detected", ClarityToKnowledgeTranslator.strings(differences));
    o.addProperty("semantic_equivalence_confirmed", semanticEquivalenceConfirmed());
    o.addProperty("target_hash_matches", targetHashMatches);
    o.addProperty("proof_hash_reproducible", proofHashReproducible);
    if (sourceHashMatches != null) {
      o.addProperty("source_hash_matches", sourceHashMatches);
    }
    o.add("failures", ClarityToKnowledgeTranslator.strings(failures));
    o.add("branch_coverage", branchCoverage.deepCopy());
    return o;
  }
}
