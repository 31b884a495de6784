package io.clarity.shell;

import io.clarity.core.error.ClarityException;
import io.clarity.core.interpreter.Interpreter;
import io.clarity.core.interpreter.Output;
import io.clarity.core.interpreter.Value;
import io.clarity.core.lexer.Lexer;
import io.clarity.core.lexer.Token;
import io.clarity.core.lexer.TokenKind;
import java.io.PrintWriter;

/**
 * Line-at-a-time evaluation state behind the REPL. Input is buffered until its braces, brackets
 * and parentheses balance, then parsed as a program and executed in one persistent {@link
 * Interpreter}.
 */
final class ReplSession {

  private final Interpreter interpreter;
  private final PrintWriter out;
  private final StringBuilder pending = new StringBuilder();

  ReplSession(PrintWriter out) {
    this.out = out;
    this.interpreter = new Interpreter(Output.of(out));
  }

  Interpreter interpreter() {
    return interpreter;
  }

  /** True while a multi-line entry is still open. */
  boolean isContinuation() {
    return pending.length() > 0;
  }

  /**
   * Accepts one line of input.
   *
   * @return false when the user asked to leave
   */
  boolean accept(String line) {
    String trimmed = line.trim();
    if (!isContinuation()) {
      if (trimmed.isEmpty()) {
        return true;
      }
      if (trimmed.equalsIgnoreCase("exit") || trimmed.equalsIgnoreCase("quit")) {
        return false;
      }
      if (trimmed.equalsIgnoreCase("help")) {
        printHelp();
        return true;
      }
    }

    pending.append(line).append('\n');
    String source = pending.toString();
    if (depth(source) > 0) {
      return true;
    }
    pending.setLength(0);

    try {
      Value result = interpreter.run(source);
      if (!(result instanceof Value.Null)) {
        out.println("=> " + result.describe());
      }
    } catch (ClarityException e) {
      out.println(e.getMessage());
    }
    out.flush();
    return true;
  }

  /** Nesting depth left open at the end of {@code source}; lexical errors count as closed. */
  static int depth(String source) {
    int depth = 0;
    try {
      for (Token t : Lexer.source(source).tokenize()) {
        if (t.is(TokenKind.LBRACE) || t.is(TokenKind.LPAREN) || t.is(TokenKind.LBRACKET)) {
          depth++;
        } else if (t.is(TokenKind.RBRACE)
            || t.is(TokenKind.RPAREN)
            || t.is(TokenKind.RBRACKET)) {
          depth--;
        }
      }
    } catch (ClarityException e) {
      return 0;
    }
    return depth;
  }

  private void printHelp() {
    out.println("Enter Clarity statements; blocks may span several lines.");
    out.println("Definitions persist for the whole session.");
    out.println("  help         show this help");
    out.println("  exit, quit   leave the REPL");
    out.flush();
  }
}
