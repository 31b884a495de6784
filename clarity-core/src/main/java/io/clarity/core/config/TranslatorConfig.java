package io.clarity.core.config;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Immutable translator settings. {@link #fromEnvironment()} resolves each setting from (in
 * order): system property, environment variable, default.
 *
 * <pre>
 * clarity.translator.version        CLARITY_TRANSLATOR_VERSION     2.0-enhanced
 * clarity.surface.version           CLARITY_SURFACE_VERSION        unspecified
 * clarity.translator.author         CLARITY_TRANSLATOR_AUTHOR      human_contributor
 * clarity.translator.recordProofs   CLARITY_RECORD_PROOFS          true
 * clarity.translator.strict         CLARITY_STRICT_VERIFICATION    false
 * </pre>
 */
public final class TranslatorConfig {

  public static final String TOOL_NAME = "clarity_to_boc_translator_v2";
  public static final List<String> COMPATIBLE_DEEP_VERSIONS = List.of("2.x");
  public static final String MINIMUM_SURFACE_VERSION = "1.0";

  public static final String DEFAULT_TRANSLATOR_VERSION = "2.0-enhanced";
  public static final String DEFAULT_SURFACE_VERSION = "unspecified";
  public static final String DEFAULT_AUTHOR = "human_contributor";

  static final String VERSION_PROPERTY = "clarity.translator.version";
  static final String VERSION_ENV = "CLARITY_TRANSLATOR_VERSION";
  static final String SURFACE_VERSION_PROPERTY = "clarity.surface.version";
  static final String SURFACE_VERSION_ENV = "CLARITY_SURFACE_VERSION";
  static final String AUTHOR_PROPERTY = "clarity.translator.author";
  static final String AUTHOR_ENV = "CLARITY_TRANSLATOR_AUTHOR";
  static final String RECORD_PROOFS_PROPERTY = "clarity.translator.recordProofs";
  static final String RECORD_PROOFS_ENV = "CLARITY_RECORD_PROOFS";
  static final String STRICT_PROPERTY = "clarity.translator.strict";
  static final String STRICT_ENV = "CLARITY_STRICT_VERIFICATION";

  private final String translatorVersion;
  private final String surfaceVersion;
  private final String author;
  private final boolean recordProofs;
  private final boolean strictVerification;
  private final Clock clock;

  private TranslatorConfig(Builder b) {
    this.translatorVersion = b.translatorVersion;
    this.surfaceVersion = b.surfaceVersion;
    this.author = b.author;
    this.recordProofs = b.recordProofs;
    this.strictVerification = b.strictVerification;
    this.clock = b.clock;
  }

  public static TranslatorConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Resolves settings from system properties and environment variables. */
  public static TranslatorConfig fromEnvironment() {
    return resolve(System::getProperty, System::getenv);
  }

  static TranslatorConfig resolve(UnaryOperator<String> properties, UnaryOperator<String> env) {
    return builder()
        .translatorVersion(
            lookup(properties, env, VERSION_PROPERTY, VERSION_ENV, DEFAULT_TRANSLATOR_VERSION))
        .surfaceVersion(
            lookup(
                properties,
                env,
                SURFACE_VERSION_PROPERTY,
                SURFACE_VERSION_ENV,
                DEFAULT_SURFACE_VERSION))
        .author(lookup(properties, env, AUTHOR_PROPERTY, AUTHOR_ENV, DEFAULT_AUTHOR))
        .recordProofs(
            Boolean.parseBoolean(
                lookup(properties, env, RECORD_PROOFS_PROPERTY, RECORD_PROOFS_ENV, "true")))
        .strictVerification(
            Boolean.parseBoolean(lookup(properties, env, STRICT_PROPERTY, STRICT_ENV, "false")))
        .build();
  }

  private static String lookup(
      UnaryOperator<String> properties,
      UnaryOperator<String> env,
      String property,
      String envVar,
      String fallback) {
    String value = properties.apply(property);
    if (value != null && !value.isBlank()) {
      return value.trim();
    }
    value = env.apply(envVar);
    if (value != null && !value.isBlank()) {
      return value.trim();
    }
    return fallback;
  }

  public String translatorVersion() {
    return translatorVersion;
  }

  public String surfaceVersion() {
    return surfaceVersion;
  }

  public String author() {
    return author;
  }

  /** Whether translators append every issued proof to their proof log. */
  public boolean recordProofs() {
    return recordProofs;
  }

  /** Whether a failed round-trip verification raises instead of being reported. */
  public boolean strictVerification() {
    return strictVerification;
  }

  public Clock clock() {
    return clock;
  }

  public Builder toBuilder() {
    return new Builder()
        .translatorVersion(translatorVersion)
        .surfaceVersion(surfaceVersion)
        .author(author)
        .recordProofs(recordProofs)
        .strictVerification(strictVerification)
        .clock(clock);
  }

  @Override
  public String toString() {
    return "TranslatorConfig{version="
        + translatorVersion
        + ", surface="
        + surfaceVersion
        + ", author="
        + author
        + ", recordProofs="
        + recordProofs
        + ", strict="
        + strictVerification
        + "}";
  }

  public static final class Builder {
    private String translatorVersion = DEFAULT_TRANSLATOR_VERSION;
    private String surfaceVersion = DEFAULT_SURFACE_VERSION;
    private String author = DEFAULT_AUTHOR;
    private boolean recordProofs = true;
    private boolean strictVerification;
    private Clock clock = Clock.systemDefaultZone();

    private Builder() {}

    public Builder translatorVersion(String v) {
      this.translatorVersion = Objects.requireNonNull(v);
      return this;
    }

    public Builder surfaceVersion(String v) {
      this.surfaceVersion = Objects.requireNonNull(v);
      return this;
    }

    public Builder author(String v) {
      this.author = Objects.requireNonNull(v);
      return this;
    }

    public Builder recordProofs(boolean v) {
      this.recordProofs = v;
      return this;
    }

    public Builder strictVerification(boolean v) {
      this.strictVerification = v;
      return this;
    }

    public Builder clock(Clock v) {
      this.clock = Objects.requireNonNull(v);
      return this;
    }

    public TranslatorConfig build() {
      return new TranslatorConfig(this);
    }
  }
}
