package io.clarity.core.parser;

import io.clarity.core.ast.ClarityAst.*;
import io.clarity.core.error.ClaritySyntaxException;
import io.clarity.core.lexer.Lexer;
import io.clarity.core.lexer.Position;
import io.clarity.core.lexer.Token;
import io.clarity.core.lexer.TokenKind;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive descent parser for the Clarity surface language.
 *
 * <p>Grammar (simplified):
 *
 * <pre>
 * program    := statement*
 * statement  := fnDef | varDecl | constDecl | if | while | for | return | match
 *             | IDENT '=' expr | expr                      (each followed by an optional ';')
 * fnDef      := 'fn' IDENT '(' (param (',' param)*)? ')' ('->' IDENT)? block
 * varDecl    := ('let' | 'var') IDENT (':' IDENT)? '=' expr
 * if         := 'if' expr block ('else' block)?
 * for        := 'for' IDENT 'in' expr block
 * match      := 'match' expr '{' (pattern '=>' expr (',' pattern '=>' expr)* ','?)? '}'
 * expr       := or
 * or         := and ('||' and)*
 * and        := equality ('&&' equality)*
 * equality   := relational (('==' | '!=') relational)*
 * relational := additive (('<' | '>' | '<=' | '>=') additive)*
 * additive   := mul (('+' | '-') mul)*
 * mul        := unary (('*' | '/' | '%') unary)*
 * unary      := ('-' | '!') unary | call
 * call       := primary ('(' args? ')')*
 * primary    := NUMBER | STRING | 'true' | 'false' | IDENT | '(' expr ')' | '[' args? ']' | match
 * </pre>
 *
 * <p>The first structural error aborts the parse; there is no recovery.
 */
public final class ClarityParser {

  private static final Set<TokenKind> EQUALITY = EnumSet.of(TokenKind.EQ, TokenKind.NE);
  private static final Set<TokenKind> RELATIONAL =
      EnumSet.of(TokenKind.LT, TokenKind.GT, TokenKind.LE, TokenKind.GE);
  private static final Set<TokenKind> ADDITIVE = EnumSet.of(TokenKind.PLUS, TokenKind.MINUS);
  private static final Set<TokenKind> MULTIPLICATIVE =
      EnumSet.of(TokenKind.STAR, TokenKind.SLASH, TokenKind.PERCENT);

  private final Lexer lexer;
  private Token current;

  public ClarityParser(Lexer lexer) {
    this.lexer = lexer;
    this.current = lexer.nextToken();
  }

  /**
   * Parses a complete program.
   *
   * @param source program text
   * @return the program AST
   * @throws ClaritySyntaxException on the first structural error
   * @throws io.clarity.core.error.LexicalException on an illegal character
   */
  public static Program parse(String source) {
    return new ClarityParser(Lexer.source(source)).parseProgram();
  }

  /** Parses a single expression; trailing input is an error. */
  public static Node parseExpression(String source) {
    ClarityParser parser = new ClarityParser(Lexer.source(source));
    Node expr = parser.expression();
    parser.skipSemicolon();
    parser.expect(TokenKind.EOF);
    return expr;
  }

  public Program parseProgram() {
    List<Node> statements = new ArrayList<>();
    while (!check(TokenKind.EOF)) {
      statements.add(statement());
    }
    return new Program(statements, Position.START);
  }

  // === Statements ===

  private Node statement() {
    Node stmt =
        switch (current.kind()) {
          case FN -> functionDef();
          case LET -> variableDecl(false);
          case VAR -> variableDecl(true);
          case CONST -> constantDecl();
          case IF -> ifExpr();
          case WHILE -> whileLoop();
          case FOR -> forLoop();
          case RETURN -> returnStmt();
          case MATCH -> matchExpr();
          case IDENTIFIER -> assignmentOrExpression();
          default -> expression();
        };
    skipSemicolon();
    return stmt;
  }

  private Node assignmentOrExpression() {
    // one-token lookahead past the identifier; the lexer is rewound afterwards
    Lexer.Mark mark = lexer.mark();
    Token next = lexer.nextToken();
    lexer.reset(mark);

    if (next.kind() == TokenKind.ASSIGN) {
      Token name = expect(TokenKind.IDENTIFIER);
      expect(TokenKind.ASSIGN);
      Node value = expression();
      return new Assignment(name.lexeme(), value, name.position());
    }
    return expression();
  }

  private FunctionDef functionDef() {
    Token fn = expect(TokenKind.FN);
    String name = expect(TokenKind.IDENTIFIER).lexeme();

    expect(TokenKind.LPAREN);
    List<Param> params = new ArrayList<>();
    if (!check(TokenKind.RPAREN)) {
      do {
        Token paramName = expect(TokenKind.IDENTIFIER);
        expect(TokenKind.COLON);
        String type = expect(TokenKind.IDENTIFIER).lexeme();
        params.add(new Param(paramName.lexeme(), type, paramName.position()));
      } while (match(TokenKind.COMMA));
    }
    expect(TokenKind.RPAREN);

    String returnType = null;
    if (match(TokenKind.ARROW)) {
      returnType = expect(TokenKind.IDENTIFIER).lexeme();
    }

    expect(TokenKind.LBRACE);
    List<Node> body = statementsUntilRightBrace();
    Token close = expect(TokenKind.RBRACE);
    return new FunctionDef(name, params, returnType, body, fn.position(), close.line());
  }

  private VariableDecl variableDecl(boolean mutable) {
    Token keyword = advance(); // let | var
    String name = expect(TokenKind.IDENTIFIER).lexeme();
    String type = null;
    if (match(TokenKind.COLON)) {
      type = expect(TokenKind.IDENTIFIER).lexeme();
    }
    expect(TokenKind.ASSIGN);
    Node value = expression();
    return new VariableDecl(mutable, name, type, value, keyword.position());
  }

  private ConstantDecl constantDecl() {
    Token keyword = expect(TokenKind.CONST);
    String name = expect(TokenKind.IDENTIFIER).lexeme();
    expect(TokenKind.ASSIGN);
    Node value = expression();
    return new ConstantDecl(name, value, keyword.position());
  }

  private IfExpr ifExpr() {
    Token keyword = expect(TokenKind.IF);
    Node condition = expression();
    List<Node> thenBranch = block();
    List<Node> elseBranch = null;
    if (match(TokenKind.ELSE)) {
      elseBranch = block();
    }
    return new IfExpr(condition, thenBranch, elseBranch, keyword.position());
  }

  private WhileLoop whileLoop() {
    Token keyword = expect(TokenKind.WHILE);
    Node condition = expression();
    return new WhileLoop(condition, block(), keyword.position());
  }

  private ForLoop forLoop() {
    Token keyword = expect(TokenKind.FOR);
    String variable = expect(TokenKind.IDENTIFIER).lexeme();
    expect(TokenKind.IN);
    Node iterable = expression();
    return new ForLoop(variable, iterable, block(), keyword.position());
  }

  private ReturnStmt returnStmt() {
    Token keyword = expect(TokenKind.RETURN);
    Node value = null;
    if (!check(TokenKind.SEMICOLON) && !check(TokenKind.RBRACE) && !check(TokenKind.EOF)) {
      value = expression();
    }
    return new ReturnStmt(value, keyword.position());
  }

  private MatchExpr matchExpr() {
    Token keyword = expect(TokenKind.MATCH);
    Node scrutinee = expression();
    expect(TokenKind.LBRACE);
    List<MatchArm> arms = new ArrayList<>();
    while (!check(TokenKind.RBRACE)) {
      Node pattern = pattern();
      expect(TokenKind.FAT_ARROW);
      Node result = expression();
      arms.add(new MatchArm(pattern, result));
      if (!match(TokenKind.COMMA) && !check(TokenKind.RBRACE)) {
        throw unexpected("',' or '}' in match expression");
      }
    }
    expect(TokenKind.RBRACE);
    return new MatchExpr(scrutinee, arms, keyword.position());
  }

  private Node pattern() {
    switch (current.kind()) {
      case NUMBER:
      case STRING:
      case TRUE:
      case FALSE:
      case IDENTIFIER:
        return primary();
      case MINUS:
        Token minus = advance();
        if (!check(TokenKind.NUMBER)) {
          throw unexpected("number after '-' in match pattern");
        }
        return new UnaryOp(UnaryOperator.NEG, primary(), minus.position());
      default:
        throw unexpected("match pattern");
    }
  }

  private List<Node> block() {
    expect(TokenKind.LBRACE);
    List<Node> body = statementsUntilRightBrace();
    expect(TokenKind.RBRACE);
    return body;
  }

  private List<Node> statementsUntilRightBrace() {
    List<Node> body = new ArrayList<>();
    while (!check(TokenKind.RBRACE)) {
      if (check(TokenKind.EOF)) {
        throw unexpected(TokenKind.RBRACE.describe());
      }
      body.add(statement());
    }
    return body;
  }

  // === Expressions ===

  private Node expression() {
    return or();
  }

  private Node or() {
    Node left = and();
    while (check(TokenKind.OR)) {
      left = binary(left, this::and);
    }
    return left;
  }

  private Node and() {
    Node left = equality();
    while (check(TokenKind.AND)) {
      left = binary(left, this::equality);
    }
    return left;
  }

  private Node equality() {
    Node left = relational();
    while (EQUALITY.contains(current.kind())) {
      left = binary(left, this::relational);
    }
    return left;
  }

  private Node relational() {
    Node left = additive();
    while (RELATIONAL.contains(current.kind())) {
      left = binary(left, this::additive);
    }
    return left;
  }

  private Node additive() {
    Node left = multiplicative();
    while (ADDITIVE.contains(current.kind())) {
      left = binary(left, this::multiplicative);
    }
    return left;
  }

  private Node multiplicative() {
    Node left = unary();
    while (MULTIPLICATIVE.contains(current.kind())) {
      left = binary(left, this::unary);
    }
    return left;
  }

  private Node binary(Node left, java.util.function.Supplier<Node> operand) {
    Token op = advance();
    Node right = operand.get();
    return new BinaryOp(left, BinaryOperator.fromToken(op.kind()), right, left.position());
  }

  private Node unary() {
    if (check(TokenKind.MINUS) || check(TokenKind.BANG)) {
      Token op = advance();
      UnaryOperator operator = op.is(TokenKind.MINUS) ? UnaryOperator.NEG : UnaryOperator.NOT;
      return new UnaryOp(operator, unary(), op.position());
    }
    return call();
  }

  private Node call() {
    Node expr = primary();
    while (match(TokenKind.LPAREN)) {
      List<Node> args = new ArrayList<>();
      if (!check(TokenKind.RPAREN)) {
        do {
          args.add(expression());
        } while (match(TokenKind.COMMA));
      }
      expect(TokenKind.RPAREN);
      expr = new FunctionCall(expr, args, expr.position());
    }
    return expr;
  }

  private Node primary() {
    Token token = current;
    switch (token.kind()) {
      case NUMBER:
        advance();
        return new NumberLiteral(parseInteger(token), token.position());
      case STRING:
        advance();
        return new StringLiteral(token.lexeme(), token.position());
      case TRUE:
        advance();
        return new BooleanLiteral(true, token.position());
      case FALSE:
        advance();
        return new BooleanLiteral(false, token.position());
      case IDENTIFIER:
        advance();
        return new Identifier(token.lexeme(), token.position());
      case LPAREN:
        {
          advance();
          Node inner = expression();
          expect(TokenKind.RPAREN);
          return inner;
        }
      case LBRACKET:
        {
          advance();
          List<Node> elements = new ArrayList<>();
          if (!check(TokenKind.RBRACKET)) {
            do {
              elements.add(expression());
            } while (match(TokenKind.COMMA));
          }
          expect(TokenKind.RBRACKET);
          return new ListLiteral(elements, token.position());
        }
      case MATCH:
        return matchExpr();
      default:
        throw unexpected("expression");
    }
  }

  private static long parseInteger(Token token) {
    try {
      return Long.parseLong(token.lexeme());
    } catch (NumberFormatException e) {
      throw new ClaritySyntaxException(
          "Integer literal out of range: " + token.lexeme(), token.position(), e);
    }
  }

  // === Token helpers ===

  private boolean check(TokenKind kind) {
    return current.kind() == kind;
  }

  private boolean match(TokenKind kind) {
    if (check(kind)) {
      advance();
      return true;
    }
    return false;
  }

  private Token advance() {
    Token t = current;
    current = lexer.nextToken();
    return t;
  }

  private Token expect(TokenKind kind) {
    if (!check(kind)) {
      throw unexpected(kind.describe());
    }
    return advance();
  }

  private void skipSemicolon() {
    match(TokenKind.SEMICOLON);
  }

  private ClaritySyntaxException unexpected(String expected) {
    return new ClaritySyntaxException(
        "Expected " + expected + ", got " + describe(current), current.position());
  }

  private static String describe(Token t) {
    if (t.kind() == TokenKind.EOF) return "end of input";
    return t.kind().symbol() != null ? t.kind().describe() : t.kind() + " '" + t.lexeme() + "'";
  }
}
