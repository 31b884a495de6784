package io.clarity.core.error;

import io.clarity.core.lexer.Position;

/** Exception thrown when parsing fails. There is no error recovery. */
public final class ClaritySyntaxException extends ClarityException {

  public ClaritySyntaxException(String message, Position position) {
    super(ErrorKind.SYNTAX, message, position);
  }

  public ClaritySyntaxException(String message, Position position, Throwable cause) {
    super(ErrorKind.SYNTAX, message, position, cause);
  }
}
