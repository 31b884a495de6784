package io.clarity.core.error;

import io.clarity.core.lexer.Position;

/** A user-defined function was called with the wrong number of arguments. */
public final class ArityMismatchException extends ClarityTypeException {

  private final int expected;
  private final int actual;

  public ArityMismatchException(String function, int expected, int actual, Position position) {
    super(
        "Function " + function + " expects " + expected + " arguments but got " + actual,
        position);
    this.expected = expected;
    this.actual = actual;
  }

  public int expected() {
    return expected;
  }

  public int actual() {
    return actual;
  }
}
