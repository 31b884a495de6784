package io.clarity.core.translator;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.util.Objects;

/**
 * Hash chain binding a source text to the knowledge document translated from it.
 *
 * <p>{@code proof_hash = sha256(source_hash + target_hash + translator_version + timestamp)},
 * where {@code target_hash} is taken over the canonical JSON of the document.
 */
public record TranslationProof(
    String sourceHash,
    String targetHash,
    String translatorVersion,
    String timestamp,
    String proofHash) {

  public TranslationProof {
    Objects.requireNonNull(sourceHash, "source_hash");
    Objects.requireNonNull(targetHash, "target_hash");
    Objects.requireNonNull(translatorVersion, "translator_version");
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(proofHash, "proof_hash");
  }

  public static TranslationProof issue(
      String sourceText, JsonElement document, String translatorVersion, String timestamp) {
    String sourceHash = Hashing.sha256(sourceText);
    String targetHash = Hashing.documentHash(document);
    return new TranslationProof(
        sourceHash,
        targetHash,
        translatorVersion,
        timestamp,
        chain(sourceHash, targetHash, translatorVersion, timestamp));
  }

  static String chain(
      String sourceHash, String targetHash, String translatorVersion, String timestamp) {
    return Hashing.sha256(sourceHash + targetHash + translatorVersion + timestamp);
  }

  /** True only if both recomputed hashes and the recomputed proof hash match. */
  public boolean verify(String sourceText, JsonElement document) {
    String source = Hashing.sha256(sourceText);
    String target = Hashing.documentHash(document);
    return source.equals(sourceHash)
        && target.equals(targetHash)
        && chain(source, target, translatorVersion, timestamp).equals(proofHash);
  }

  public JsonObject toJson() {
    JsonObject o = new JsonObject();
    o.addProperty("source_hash", sourceHash);
    o.addProperty("target_hash", targetHash);
    o.addProperty("translator_version", translatorVersion);
    o.addProperty("timestamp", timestamp);
    o.addProperty("proof_hash", proofHash);
    return o;
  }

  /**
   * Reads a proof written by {@link #toJson()}.
   *
   * @throws IllegalArgumentException if a field is missing or not a string
   */
  public static TranslationProof fromJson(JsonObject o) {
    return new TranslationProof(
        field(o, "source_hash"),
        field(o, "target_hash"),
        field(o, "translator_version"),
        field(o, "timestamp"),
        field(o, "proof_hash"));
  }

  private static String field(JsonObject o, String name) {
    JsonElement e = o.get(name);
    if (e == null || !e.isJsonPrimitive() || !e.getAsJsonPrimitive().isString()) {
      throw new IllegalArgumentException("Proof field '" + name + "' missing or not a string");
    }
    return e.getAsString();
  }
}
