package io.clarity.core.translator;

import com.google.gson.JsonObject;
import java.util.List;
import java.util.Optional;

/**
 * Output of a reverse translation. Function bodies are never reconstructed; every component
 * whose behavior could not be materialized is named in {@code lossyComponents}.
 */
public record ReverseTranslationResult(
    String reconstructedText,
    VerificationReport verificationOrNull,
    List<String> lossyComponents,
    String translatorVersion,
    String timestamp) {

  public ReverseTranslationResult {
    lossyComponents = List.copyOf(lossyComponents);
  }

  /** Present when a proof was supplied. */
  public Optional<VerificationReport> verification() {
    return Optional.ofNullable(verificationOrNull);
  }

  public JsonObject toJson() {
    JsonObject o = new JsonObject();
    o.addProperty("clarity_code", reconstructedText);
    if (verificationOrNull != null) {
      o.add("verification_result", verificationOrNull.toJson());
    }
    o.add("lossy_components", ClarityToKnowledgeTranslator.strings(lossyComponents));
    o.addProperty("translator_version", translatorVersion);
    o.addProperty("timestamp", timestamp);
    return o;
  }
}
