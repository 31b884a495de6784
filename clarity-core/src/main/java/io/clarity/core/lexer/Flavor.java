package io.clarity.core.lexer;

import static io.clarity.core.lexer.TokenKind.*;

import java.util.Locale;
import java.util.Map;

/**
 * Language flavor understood by a {@link Lexer}. Both flavors share the scanner; they differ in
 * reserved words, single-character tokens and the numeric literal rule.
 */
public enum Flavor {
  /** The general-purpose surface language. Integer-only numbers. */
  SOURCE(
      Map.ofEntries(
          Map.entry("fn", FN),
          Map.entry("let", LET),
          Map.entry("var", VAR),
          Map.entry("const", CONST),
          Map.entry("if", IF),
          Map.entry("else", ELSE),
          Map.entry("while", WHILE),
          Map.entry("for", FOR),
          Map.entry("in", IN),
          Map.entry("return", RETURN),
          Map.entry("match", MATCH),
          Map.entry("async", ASYNC),
          Map.entry("await", AWAIT),
          Map.entry("true", TRUE),
          Map.entry("false", FALSE)),
      Map.ofEntries(
          Map.entry('+', PLUS),
          Map.entry('-', MINUS),
          Map.entry('*', STAR),
          Map.entry('/', SLASH),
          Map.entry('%', PERCENT),
          Map.entry('=', ASSIGN),
          Map.entry('!', BANG),
          Map.entry('<', LT),
          Map.entry('>', GT),
          Map.entry('(', LPAREN),
          Map.entry(')', RPAREN),
          Map.entry('{', LBRACE),
          Map.entry('}', RBRACE),
          Map.entry('[', LBRACKET),
          Map.entry(']', RBRACKET),
          Map.entry(',', COMMA),
          Map.entry(':', COLON),
          Map.entry('.', DOT),
          Map.entry(';', SEMICOLON)),
      false),

  /** The declarative knowledge dialect. Numbers may carry one embedded '.'. */
  KNOWLEDGE(
      Map.ofEntries(
          Map.entry("belief", BELIEF),
          Map.entry("reasoning_context", REASONING_CONTEXT),
          Map.entry("intent", INTENT),
          Map.entry("shared_state", SHARED_STATE),
          Map.entry("self_capability", SELF_CAPABILITY),
          Map.entry("calculate_with_uncertainty", CALCULATE_WITH_UNCERTAINTY),
          Map.entry("structured_knowledge", STRUCTURED_KNOWLEDGE),
          Map.entry("true", TRUE),
          Map.entry("false", FALSE)),
      Map.ofEntries(
          Map.entry('=', ASSIGN),
          Map.entry('{', LBRACE),
          Map.entry('}', RBRACE),
          Map.entry('[', LBRACKET),
          Map.entry(']', RBRACKET),
          Map.entry('(', LPAREN),
          Map.entry(')', RPAREN),
          Map.entry(',', COMMA),
          Map.entry(':', COLON),
          Map.entry('.', DOT),
          Map.entry(';', SEMICOLON),
          Map.entry('@', AT)),
      true);

  private final Map<String, TokenKind> keywords;
  private final Map<Character, TokenKind> singleCharTokens;
  private final boolean fractionalNumbers;

  Flavor(
      Map<String, TokenKind> keywords,
      Map<Character, TokenKind> singleCharTokens,
      boolean fractionalNumbers) {
    this.keywords = keywords;
    this.singleCharTokens = singleCharTokens;
    this.fractionalNumbers = fractionalNumbers;
  }

  /** Case-insensitive keyword lookup; {@link TokenKind#IDENTIFIER} when not reserved. */
  public TokenKind classifyWord(String word) {
    return keywords.getOrDefault(word.toLowerCase(Locale.ROOT), IDENTIFIER);
  }

  TokenKind singleChar(char c) {
    return singleCharTokens.get(c);
  }

  boolean allowsFractionalNumbers() {
    return fractionalNumbers;
  }

  /**
   * Two-character operator starting with {@code first} and {@code second}, or {@code null}. The
   * range operator exists only in the knowledge flavor.
   */
  TokenKind twoChar(char first, char second) {
    switch (first) {
      case '=':
        if (second == '=') return this == SOURCE ? EQ : null;
        if (second == '>') return FAT_ARROW;
        return null;
      case '!':
        return second == '=' && this == SOURCE ? NE : null;
      case '<':
        return second == '=' && this == SOURCE ? LE : null;
      case '>':
        return second == '=' && this == SOURCE ? GE : null;
      case '&':
        return second == '&' && this == SOURCE ? AND : null;
      case '|':
        return second == '|' && this == SOURCE ? OR : null;
      case '-':
        return second == '>' && this == SOURCE ? ARROW : null;
      case '.':
        return second == '.' && this == KNOWLEDGE ? RANGE : null;
      default:
        return null;
    }
  }
}
