package io.clarity.core.lexer;

import static org.junit.jupiter.api.Assertions.*;

import io.clarity.core.error.ErrorKind;
import io.clarity.core.error.LexicalException;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class LexerTest {

  private static List<TokenKind> kinds(Lexer lexer) {
    return lexer.tokenize().stream().map(Token::kind).collect(Collectors.toList());
  }

  @Test
  void tokenizesDeclarationWithPositions() {
    List<Token> tokens = Lexer.source("let x = 42").tokenize();

    assertEquals(5, tokens.size());
    assertEquals(new Token(TokenKind.LET, "let", 1, 0), tokens.get(0));
    assertEquals(new Token(TokenKind.IDENTIFIER, "x", 1, 4), tokens.get(1));
    assertEquals(new Token(TokenKind.ASSIGN, "=", 1, 6), tokens.get(2));
    assertEquals(new Token(TokenKind.NUMBER, "42", 1, 8), tokens.get(3));
    assertEquals(TokenKind.EOF, tokens.get(4).kind());
  }

  @Test
  void keywordsAreCaseInsensitive() {
    assertEquals(
        List.of(TokenKind.LET, TokenKind.FN, TokenKind.TRUE, TokenKind.IDENTIFIER, TokenKind.EOF),
        kinds(Lexer.source("LET Fn TRUE letter")));
  }

  @Test
  void twoCharacterOperatorsWinOverSingleCharacters() {
    assertEquals(
        List.of(
            TokenKind.EQ,
            TokenKind.NE,
            TokenKind.LE,
            TokenKind.GE,
            TokenKind.AND,
            TokenKind.OR,
            TokenKind.ARROW,
            TokenKind.FAT_ARROW,
            TokenKind.ASSIGN,
            TokenKind.BANG,
            TokenKind.EOF),
        kinds(Lexer.source("== != <= >= && || -> => = !")));
  }

  @Test
  void sourceNumbersAreIntegerOnly() {
    assertEquals(
        List.of(TokenKind.NUMBER, TokenKind.DOT, TokenKind.NUMBER, TokenKind.EOF),
        kinds(Lexer.source("3.14")));
  }

  @Test
  void knowledgeNumbersMayBeFractional() {
    List<Token> tokens = Lexer.knowledge("0.85").tokenize();
    assertEquals(new Token(TokenKind.NUMBER, "0.85", 1, 0), tokens.get(0));
  }

  @Test
  void knowledgeRangeIsNotAFraction() {
    List<Token> tokens = Lexer.knowledge("1..5").tokenize();
    assertEquals(
        List.of(TokenKind.NUMBER, TokenKind.RANGE, TokenKind.NUMBER, TokenKind.EOF),
        tokens.stream().map(Token::kind).collect(Collectors.toList()));
    assertEquals("1", tokens.get(0).lexeme());
    assertEquals("5", tokens.get(2).lexeme());
  }

  @Test
  void knowledgeFlavorHasBlockKeywordsAndAttributes() {
    assertEquals(
        List.of(
            TokenKind.BELIEF,
            TokenKind.IDENTIFIER,
            TokenKind.ASSIGN,
            TokenKind.NUMBER,
            TokenKind.AT,
            TokenKind.IDENTIFIER,
            TokenKind.LBRACE,
            TokenKind.RBRACE,
            TokenKind.EOF),
        kinds(Lexer.knowledge("belief confidence=0.9 @urgent {}")));
    // surface keywords are plain identifiers in the dialect
    assertEquals(TokenKind.IDENTIFIER, Lexer.knowledge("fn").nextToken().kind());
  }

  @Test
  void dialectSpecificCharactersAreIllegalInTheOtherFlavor() {
    LexicalException at = assertThrows(LexicalException.class, () -> Lexer.source("@").tokenize());
    assertEquals('@', at.offending());
    assertThrows(LexicalException.class, () -> Lexer.knowledge("a - b").tokenize());
  }

  @Test
  void illegalCharacterReportsPosition() {
    LexicalException e =
        assertThrows(LexicalException.class, () -> Lexer.source("let x\n  # 1").tokenize());
    assertEquals(ErrorKind.LEXICAL, e.kind());
    assertEquals(new Position(2, 2), e.position());
    assertEquals("LexicalError: Illegal character '#' at 2:2", e.getMessage());
  }

  @Test
  void commentsAndNewlinesAdvancePosition() {
    Token t = Lexer.source("// leading comment\n\n   value").nextToken();
    assertEquals(new Token(TokenKind.IDENTIFIER, "value", 3, 3), t);
  }

  @Test
  void stringsKeepEscapesVerbatim() {
    Token t = Lexer.source("\"say \\\"hi\\\"\"").nextToken();
    assertEquals(TokenKind.STRING, t.kind());
    assertEquals("say \\\"hi\\\"", t.lexeme());
  }

  @Test
  void singleQuotedStringsAreAccepted() {
    Token t = Lexer.knowledge("'it \"works\"'").nextToken();
    assertEquals(TokenKind.STRING, t.kind());
    assertEquals("it \"works\"", t.lexeme());
  }

  @Test
  void unterminatedStringEndsAtEndOfInput() {
    List<Token> tokens = Lexer.source("\"open").tokenize();
    assertEquals(2, tokens.size());
    assertEquals("open", tokens.get(0).lexeme());
    assertEquals(TokenKind.EOF, tokens.get(1).kind());
  }

  @Test
  void eofRepeatsOnceInputIsExhausted() {
    Lexer lexer = Lexer.source("x ");
    lexer.nextToken();
    Token first = lexer.nextToken();
    Token second = lexer.nextToken();
    assertEquals(TokenKind.EOF, first.kind());
    assertEquals(first, second);
    assertEquals(new Position(1, 2), first.position());
  }

  @Test
  void markAndResetRewindTheScanner() {
    Lexer lexer = Lexer.source("a b");
    lexer.nextToken();
    Lexer.Mark mark = lexer.mark();
    Token b = lexer.nextToken();
    lexer.reset(mark);
    assertEquals(b, lexer.nextToken());
  }

  @Test
  void tokenToStringShowsKindLexemeAndPosition() {
    assertEquals("IDENTIFIER 'x' 1:4", new Token(TokenKind.IDENTIFIER, "x", 1, 4).toString());
  }
}
