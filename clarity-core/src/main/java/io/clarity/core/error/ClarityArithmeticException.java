package io.clarity.core.error;

import io.clarity.core.lexer.Position;

/** Division or remainder by zero. */
public final class ClarityArithmeticException extends ClarityException {

  public ClarityArithmeticException(String message, Position position) {
    super(ErrorKind.ARITHMETIC, message, position);
  }
}
