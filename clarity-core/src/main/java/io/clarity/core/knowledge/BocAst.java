package io.clarity.core.knowledge;

import io.clarity.core.lexer.Position;
import io.clarity.core.lexer.TokenKind;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * AST model for the BOC knowledge dialect: declarative blocks with attributes and key/value
 * bodies.
 *
 * <pre>
 * belief confidence=0.85 {
 *     fact: "temperature_in_celsius(22.5)"
 *     source: "sensor_123"
 * }
 * intent to_perform: "coordinate_meeting" @priority("high") @urgent {
 *     participants: ["agent_a", "agent_b"]
 * }
 * </pre>
 */
public final class BocAst {

  private BocAst() {}

  /** Block keywords, in dialect spelling. */
  public enum BlockKind {
    BELIEF("belief"),
    REASONING_CONTEXT("reasoning_context"),
    INTENT("intent"),
    SHARED_STATE("shared_state"),
    SELF_CAPABILITY("self_capability"),
    CALCULATE_WITH_UNCERTAINTY("calculate_with_uncertainty"),
    STRUCTURED_KNOWLEDGE("structured_knowledge");

    private final String keyword;

    BlockKind(String keyword) {
      this.keyword = keyword;
    }

    public String keyword() {
      return keyword;
    }

    /** Block kind introduced by {@code kind}, or {@code null} if it starts no block. */
    public static BlockKind fromToken(TokenKind kind) {
      return switch (kind) {
        case BELIEF -> BELIEF;
        case REASONING_CONTEXT -> REASONING_CONTEXT;
        case INTENT -> INTENT;
        case SHARED_STATE -> SHARED_STATE;
        case SELF_CAPABILITY -> SELF_CAPABILITY;
        case CALCULATE_WITH_UNCERTAINTY -> CALCULATE_WITH_UNCERTAINTY;
        case STRUCTURED_KNOWLEDGE -> STRUCTURED_KNOWLEDGE;
        default -> null;
      };
    }
  }

  public enum LiteralKind {
    STRING,
    NUMBER,
    BOOLEAN
  }

  public record Program(List<Statement> statements) {
    public Program {
      statements = List.copyOf(statements);
    }
  }

  public sealed interface Statement permits Block, Assignment {
    Position position();
  }

  /**
   * A declarative block. {@code confidence} is the inline {@code belief confidence=...} value and
   * {@code action} the inline {@code intent to_perform: ...} value; both are {@code null} when
   * absent.
   */
  public record Block(
      BlockKind kind,
      Expr confidence,
      Expr action,
      Map<String, Expr> attributes,
      List<Entry> content,
      Position position)
      implements Statement {
    public Block {
      attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
      content = List.copyOf(content);
    }
  }

  /** {@code name = expr} at top level. */
  public record Assignment(String name, Expr value, Position position) implements Statement {}

  /** One body entry; {@code key} is {@code null} for a bare expression. */
  public record Entry(String key, Expr value) {
    public boolean isKeyValue() {
      return key != null;
    }
  }

  // === Expressions: literals, identifiers, arrays ===

  public sealed interface Expr permits Literal, Ref, ArrayExpr {
    Position position();
  }

  public record Literal(LiteralKind kind, String text, Position position) implements Expr {

    /** String, Long, Double or Boolean value of the literal. */
    public Object value() {
      return switch (kind) {
        case STRING -> text;
        case BOOLEAN -> Boolean.parseBoolean(text.toLowerCase(java.util.Locale.ROOT));
        case NUMBER -> text.indexOf('.') >= 0 ? (Object) Double.parseDouble(text) : parseLong();
      };
    }

    private Object parseLong() {
      try {
        return Long.parseLong(text);
      } catch (NumberFormatException e) {
        return new java.math.BigInteger(text);
      }
    }
  }

  public record Ref(String name, Position position) implements Expr {}

  public record ArrayExpr(List<Expr> items, Position position) implements Expr {
    public ArrayExpr {
      items = List.copyOf(items);
    }
  }
}
