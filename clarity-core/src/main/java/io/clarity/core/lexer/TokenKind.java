package io.clarity.core.lexer;

/** Token kinds for both language flavors. */
public enum TokenKind {
  // literals
  IDENTIFIER,
  NUMBER,
  STRING,
  TRUE,
  FALSE,

  // surface reserved words
  FN,
  LET,
  VAR,
  CONST,
  IF,
  ELSE,
  WHILE,
  FOR,
  IN,
  RETURN,
  MATCH,
  ASYNC,
  AWAIT,

  // knowledge dialect reserved words
  BELIEF,
  REASONING_CONTEXT,
  INTENT,
  SHARED_STATE,
  SELF_CAPABILITY,
  CALCULATE_WITH_UNCERTAINTY,
  STRUCTURED_KNOWLEDGE,

  // operators
  PLUS("+"),
  MINUS("-"),
  STAR("*"),
  SLASH("/"),
  PERCENT("%"),
  ASSIGN("="),
  EQ("=="),
  NE("!="),
  LT("<"),
  GT(">"),
  LE("<="),
  GE(">="),
  AND("&&"),
  OR("||"),
  BANG("!"),
  ARROW("->"),
  FAT_ARROW("=>"),
  RANGE(".."),
  AT("@"),

  // delimiters
  LPAREN("("),
  RPAREN(")"),
  LBRACE("{"),
  RBRACE("}"),
  LBRACKET("["),
  RBRACKET("]"),
  COMMA(","),
  COLON(":"),
  DOT("."),
  SEMICOLON(";"),

  EOF;

  private final String symbol;

  TokenKind() {
    this.symbol = null;
  }

  TokenKind(String symbol) {
    this.symbol = symbol;
  }

  /** Fixed spelling of operator and delimiter kinds, {@code null} for the others. */
  public String symbol() {
    return symbol;
  }

  /** Human readable form used in syntax error messages. */
  public String describe() {
    return symbol != null ? name() + " '" + symbol + "'" : name();
  }
}
