package io.clarity.core.knowledge;

import io.clarity.core.error.ClaritySyntaxException;
import io.clarity.core.knowledge.BocAst.*;
import io.clarity.core.lexer.Lexer;
import io.clarity.core.lexer.Token;
import io.clarity.core.lexer.TokenKind;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive descent parser for the BOC knowledge dialect.
 *
 * <p>Grammar:
 *
 * <pre>
 * program    := statement*
 * statement  := block | IDENT '=' expr
 * block      := keyword inline? attribute* '{' entry* '}'
 * inline     := 'confidence' '=' expr          (belief only)
 *             | 'to_perform' ':' expr          (intent only)
 * attribute  := '@' IDENT ('(' expr ')')?      (bare form means true)
 * entry      := (IDENT ':')? expr (',' | ';')?
 * expr       := STRING | NUMBER | 'true' | 'false' | IDENT | '[' (expr (',' expr)*)? ']'
 * </pre>
 */
public final class KnowledgeParser {

  private final Lexer lexer;
  private Token current;

  public KnowledgeParser(Lexer lexer) {
    this.lexer = lexer;
    this.current = lexer.nextToken();
  }

  /**
   * Parses knowledge-dialect text.
   *
   * @throws ClaritySyntaxException on the first structural error
   */
  public static Program parse(String text) {
    return new KnowledgeParser(Lexer.knowledge(text)).parseProgram();
  }

  public Program parseProgram() {
    List<Statement> statements = new ArrayList<>();
    while (!check(TokenKind.EOF)) {
      statements.add(statement());
      match(TokenKind.SEMICOLON);
    }
    return new Program(statements);
  }

  private Statement statement() {
    BlockKind kind = BlockKind.fromToken(current.kind());
    if (kind != null) {
      return block(kind);
    }
    if (check(TokenKind.IDENTIFIER)) {
      Token name = advance();
      expect(TokenKind.ASSIGN);
      return new Assignment(name.lexeme(), expression(), name.position());
    }
    throw unexpected("block keyword or assignment");
  }

  private Block block(BlockKind kind) {
    Token keyword = advance();

    Expr confidence = null;
    Expr action = null;
    if (kind == BlockKind.BELIEF && checkWord("confidence")) {
      advance();
      expect(TokenKind.ASSIGN);
      confidence = expression();
    } else if (kind == BlockKind.INTENT && checkWord("to_perform")) {
      advance();
      expect(TokenKind.COLON);
      action = expression();
    }

    Map<String, Expr> attributes = attributes();
    List<Entry> content = body();
    return new Block(kind, confidence, action, attributes, content, keyword.position());
  }

  private Map<String, Expr> attributes() {
    Map<String, Expr> attributes = new LinkedHashMap<>();
    while (check(TokenKind.AT)) {
      advance();
      Token name = expect(TokenKind.IDENTIFIER);
      Expr value;
      if (match(TokenKind.LPAREN)) {
        value = expression();
        expect(TokenKind.RPAREN);
      } else {
        value = new Literal(LiteralKind.BOOLEAN, "true", name.position());
      }
      attributes.put(name.lexeme(), value);
    }
    return attributes;
  }

  private List<Entry> body() {
    expect(TokenKind.LBRACE);
    List<Entry> content = new ArrayList<>();
    while (!check(TokenKind.RBRACE)) {
      if (check(TokenKind.EOF)) {
        throw unexpected(TokenKind.RBRACE.describe());
      }
      content.add(entry());
      if (!match(TokenKind.COMMA)) {
        match(TokenKind.SEMICOLON);
      }
    }
    expect(TokenKind.RBRACE);
    return content;
  }

  private Entry entry() {
    if (check(TokenKind.IDENTIFIER) || BlockKind.fromToken(current.kind()) != null) {
      Lexer.Mark mark = lexer.mark();
      Token next = lexer.nextToken();
      lexer.reset(mark);
      if (next.kind() == TokenKind.COLON) {
        String key = advance().lexeme();
        advance(); // ':'
        return new Entry(key, expression());
      }
    }
    return new Entry(null, expression());
  }

  private Expr expression() {
    Token token = current;
    switch (token.kind()) {
      case STRING:
        advance();
        return new Literal(LiteralKind.STRING, token.lexeme(), token.position());
      case NUMBER:
        advance();
        return new Literal(LiteralKind.NUMBER, token.lexeme(), token.position());
      case TRUE:
      case FALSE:
        advance();
        return new Literal(LiteralKind.BOOLEAN, token.lexeme(), token.position());
      case IDENTIFIER:
        advance();
        return new Ref(token.lexeme(), token.position());
      case LBRACKET:
        return array();
      default:
        throw unexpected("literal, identifier or array");
    }
  }

  private ArrayExpr array() {
    Token open = expect(TokenKind.LBRACKET);
    List<Expr> items = new ArrayList<>();
    if (!check(TokenKind.RBRACKET)) {
      while (true) {
        items.add(expression());
        if (check(TokenKind.RBRACKET)) {
          break;
        }
        if (!match(TokenKind.COMMA)) {
          throw unexpected("',' or ']' in array");
        }
      }
    }
    expect(TokenKind.RBRACKET);
    return new ArrayExpr(items, open.position());
  }

  private boolean checkWord(String word) {
    return check(TokenKind.IDENTIFIER) && current.lexeme().equals(word);
  }

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

  private ClaritySyntaxException unexpected(String expected) {
    String actual =
        current.kind() == TokenKind.EOF
            ? "end of input"
            : current.kind() + " '" + current.lexeme() + "'";
    return new ClaritySyntaxException(
        "Expected " + expected + ", got " + actual, current.position());
  }
}
