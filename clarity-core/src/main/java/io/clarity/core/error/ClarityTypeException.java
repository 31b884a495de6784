package io.clarity.core.error;

import io.clarity.core.lexer.Position;

/** An operand, condition or iterable has the wrong kind of value. */
public class ClarityTypeException extends ClarityException {

  public ClarityTypeException(String message, Position position) {
    super(ErrorKind.TYPE, message, position);
  }
}
