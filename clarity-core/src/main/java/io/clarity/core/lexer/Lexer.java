package io.clarity.core.lexer;

import io.clarity.core.error.LexicalException;
import java.util.ArrayList;
import java.util.List;

/**
 * Single-character lookahead scanner producing positioned {@link Token}s for either language
 * {@link Flavor}.
 *
 * <p>Whitespace and {@code //} line comments are skipped but still advance line and column.
 * Once the input is exhausted every further call to {@link #nextToken()} returns an equal
 * {@link TokenKind#EOF} token.
 *
 * <p>String literals keep escape sequences verbatim: a backslash and the character after it are
 * both part of the lexeme. A string missing its closing quote ends at end of input.
 */
public final class Lexer {

  private final String input;
  private final Flavor flavor;
  private int pos;
  private int line = 1;
  private int column;

  /** Saved scanner state, restored with {@link #reset(Mark)}. */
  public record Mark(int pos, int line, int column) {}

  public Lexer(String input, Flavor flavor) {
    this.input = input == null ? "" : input;
    this.flavor = flavor;
  }

  /** Surface-language lexer. */
  public static Lexer source(String input) {
    return new Lexer(input, Flavor.SOURCE);
  }

  /** Knowledge-dialect lexer. */
  public static Lexer knowledge(String input) {
    return new Lexer(input, Flavor.KNOWLEDGE);
  }

  public Flavor flavor() {
    return flavor;
  }

  public Mark mark() {
    return new Mark(pos, line, column);
  }

  public void reset(Mark mark) {
    this.pos = mark.pos();
    this.line = mark.line();
    this.column = mark.column();
  }

  /** Drains the remaining input; the returned list always ends with the EOF token. */
  public List<Token> tokenize() {
    List<Token> tokens = new ArrayList<>();
    Token t;
    do {
      t = nextToken();
      tokens.add(t);
    } while (t.kind() != TokenKind.EOF);
    return tokens;
  }

  public Token nextToken() {
    while (!isAtEnd()) {
      char c = peek();

      if (Character.isWhitespace(c)) {
        advance();
        continue;
      }
      if (c == '/' && peekNext() == '/') {
        skipComment();
        continue;
      }

      int startLine = line;
      int startCol = column;

      if (isDigit(c)) {
        return new Token(TokenKind.NUMBER, readNumber(), startLine, startCol);
      }
      if (isIdentStart(c)) {
        String word = readIdentifier();
        return new Token(flavor.classifyWord(word), word, startLine, startCol);
      }
      if (c == '"' || c == '\'') {
        return new Token(TokenKind.STRING, readString(), startLine, startCol);
      }

      if (pos + 1 < input.length()) {
        TokenKind two = flavor.twoChar(c, peekNext());
        if (two != null) {
          advance();
          advance();
          return new Token(two, two.symbol(), startLine, startCol);
        }
      }

      TokenKind single = flavor.singleChar(c);
      if (single != null) {
        advance();
        return new Token(single, String.valueOf(c), startLine, startCol);
      }

      throw new LexicalException(c, new Position(startLine, startCol));
    }
    return new Token(TokenKind.EOF, "", line, column);
  }

  private void skipComment() {
    while (!isAtEnd() && peek() != '\n') {
      advance();
    }
  }

  private String readNumber() {
    int start = pos;
    while (!isAtEnd() && isDigit(peek())) {
      advance();
    }
    // one embedded '.' followed by a digit; "1..5" stays NUMBER RANGE NUMBER
    if (flavor.allowsFractionalNumbers()
        && !isAtEnd()
        && peek() == '.'
        && pos + 1 < input.length()
        && isDigit(peekNext())) {
      advance();
      while (!isAtEnd() && isDigit(peek())) {
        advance();
      }
    }
    return input.substring(start, pos);
  }

  private String readIdentifier() {
    int start = pos;
    while (!isAtEnd() && isIdentPart(peek())) {
      advance();
    }
    return input.substring(start, pos);
  }

  private String readString() {
    char quote = advance();
    StringBuilder sb = new StringBuilder();
    while (!isAtEnd() && peek() != quote) {
      char c = advance();
      sb.append(c);
      if (c == '\\' && !isAtEnd()) {
        sb.append(advance());
      }
    }
    if (!isAtEnd()) {
      advance(); // closing quote
    }
    return sb.toString();
  }

  private char advance() {
    char c = input.charAt(pos++);
    if (c == '\n') {
      line++;
      column = 0;
    } else {
      column++;
    }
    return c;
  }

  private char peek() {
    return input.charAt(pos);
  }

  private char peekNext() {
    return pos + 1 < input.length() ? input.charAt(pos + 1) : '\0';
  }

  private boolean isAtEnd() {
    return pos >= input.length();
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || isDigit(c);
  }
}
