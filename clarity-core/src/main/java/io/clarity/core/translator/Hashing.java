package io.clarity.core.translator;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;

/** SHA-256 digests and the canonical JSON form that document hashes are computed over. */
public final class Hashing {

  private static final Gson CANONICAL =
      new GsonBuilder().serializeNulls().disableHtmlEscaping().create();

  private Hashing() {}

  /** Lowercase hex SHA-256 of the UTF-8 bytes of {@code text}. */
  public static String sha256(String text) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      // every JDK ships SHA-256
      throw new IllegalStateException(e);
    }
  }

  /** Object keys sorted recursively, compact separators. */
  public static String canonicalJson(JsonElement element) {
    return CANONICAL.toJson(sorted(element));
  }

  /** SHA-256 of {@link #canonicalJson(JsonElement)}. */
  public static String documentHash(JsonElement document) {
    return sha256(canonicalJson(document));
  }

  private static JsonElement sorted(JsonElement element) {
    if (element.isJsonObject()) {
      JsonObject source = element.getAsJsonObject();
      List<String> keys = new ArrayList<>(source.keySet());
      Collections.sort(keys);
      JsonObject copy = new JsonObject();
      for (String key : keys) {
        copy.add(key, sorted(source.get(key)));
      }
      return copy;
    }
    if (element.isJsonArray()) {
      JsonArray copy = new JsonArray();
      for (JsonElement e : element.getAsJsonArray()) {
        copy.add(sorted(e));
      }
      return copy;
    }
    return element;
  }
}
