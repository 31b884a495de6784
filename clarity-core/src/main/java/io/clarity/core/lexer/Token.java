package io.clarity.core.lexer;

/** An immutable lexical token. Line is 1-based, column 0-based. */
public record Token(TokenKind kind, String lexeme, int line, int column) {

  public Position position() {
    return new Position(line, column);
  }

  public boolean is(TokenKind k) {
    return kind == k;
  }

  @Override
  public String toString() {
    return kind + " '" + lexeme + "' " + line + ":" + column;
  }
}
