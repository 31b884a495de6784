package io.clarity.core.error;

import io.clarity.core.lexer.Position;

/** No arm of a {@code match} expression accepted the scrutinee. */
public final class NoMatchException extends ClarityException {

  public NoMatchException(String scrutinee, Position position) {
    super(ErrorKind.NO_MATCH, "No match found for value: " + scrutinee, position);
  }
}
