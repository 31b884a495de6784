package io.clarity.core.error;

import io.clarity.core.lexer.Position;

/** Undefined variable, assignment to an unknown name, or a call to something not callable. */
public final class UndefinedNameException extends ClarityException {

  private final String name;

  public UndefinedNameException(String name, String message, Position position) {
    super(ErrorKind.NAME, message, position);
    this.name = name;
  }

  public static UndefinedNameException undefined(String name, Position position) {
    return new UndefinedNameException(name, "Undefined variable: " + name, position);
  }

  public String name() {
    return name;
  }
}
