package io.clarity.core.error;

/** Categories of fatal errors raised by the lexer, parsers, interpreter and translator. */
public enum ErrorKind {
  LEXICAL("LexicalError"),
  SYNTAX("SyntaxError"),
  NAME("NameError"),
  TYPE("TypeError"),
  ARITHMETIC("ArithmeticError"),
  NO_MATCH("NoMatchError"),
  RECURSION("RecursionError"),
  PROOF_VERIFICATION("ProofVerificationError");

  private final String displayName;

  ErrorKind(String displayName) {
    this.displayName = displayName;
  }

  public String displayName() {
    return displayName;
  }
}
