package io.clarity.core.error;

import io.clarity.core.lexer.Position;

/** Thrown when the lexer meets a character that starts no token. */
public final class LexicalException extends ClarityException {

  private final char offending;

  public LexicalException(char offending, Position position) {
    super(ErrorKind.LEXICAL, "Illegal character '" + offending + "'", position);
    this.offending = offending;
  }

  public char offending() {
    return offending;
  }
}
