package io.clarity.core.error;

import io.clarity.core.lexer.Position;

/** Nested user function calls went deeper than the interpreter allows. */
public final class RecursionDepthException extends ClarityException {

  public RecursionDepthException(int limit, Position position) {
    super(ErrorKind.RECURSION, "Maximum recursion depth exceeded (" + limit + ")", position);
  }
}
