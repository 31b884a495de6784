package io.clarity.core.translator;

import com.google.gson.JsonObject;

/** Output of one forward translation. */
public record TranslationResult(
    JsonObject document,
    TranslationProof proof,
    SourceMap sourceMap,
    String translatorVersion,
    String timestamp) {

  /**
   * The envelope written by the command line: {@code boc_representation}, {@code proof}, {@code
   * source_map}, {@code translator_version}, {@code timestamp}.
   */
  public JsonObject toJson() {
    JsonObject o = new JsonObject();
    o.add("boc_representation", document.deepCopy());
    o.add("proof", proof.toJson());
    o.add("source_map", sourceMap.toJson());
    o.addProperty("translator_version", translatorVersion);
    o.addProperty("timestamp", timestamp);
    return o;
  }
}
