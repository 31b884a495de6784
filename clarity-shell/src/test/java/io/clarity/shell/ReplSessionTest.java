package io.clarity.shell;

import static org.junit.jupiter.api.Assertions.*;

import io.clarity.core.interpreter.Value;
import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ReplSessionTest {

  private StringWriter buffer;
  private ReplSession session;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    session = new ReplSession(new PrintWriter(buffer, true));
  }

  private String output() {
    return buffer.toString().replace("\r\n", "\n");
  }

  @Test
  void echoesNonNullResults() {
    assertTrue(session.accept("let x = 2"));
    assertTrue(session.accept("x * 5"));
    assertEquals("=> 2\n=> 10\n", output());
  }

  @Test
  void bufferedMultiLineDefinition() {
    session.accept("fn inc(n: Int) -> Int {");
    assertTrue(session.isContinuation());
    session.accept("  return n + 1");
    assertTrue(session.isContinuation());
    session.accept("}");
    assertFalse(session.isContinuation());
    assertEquals("", output());

    session.accept("inc(41)");
    assertEquals("=> 42\n", output());
  }

  @Test
  void errorsArePrintedAndTheSessionContinues() {
    assertTrue(session.accept("1 / 0"));
    assertTrue(session.accept("1 + 1"));
    assertEquals("ArithmeticError: Division by zero at 1:0\n=> 2\n", output());
  }

  @Test
  void programOutputIsWrittenToTheSameWriter() {
    session.accept("println(\"hi\")");
    assertEquals("hi\n", output());
  }

  @Test
  void exitAndQuitEndTheSession() {
    assertFalse(session.accept("exit"));
    assertFalse(session.accept("  QUIT "));
  }

  @Test
  void helpAndBlankLines() {
    assertTrue(session.accept(""));
    assertTrue(session.accept("help"));
    assertTrue(output().contains("exit, quit"));
  }

  @Test
  void keywordsInsideAnOpenBlockAreNotCommands() {
    session.accept("if true {");
    assertTrue(session.accept("exit"));
    session.accept("}");
    assertTrue(output().contains("NameError: Undefined variable: exit"), output());
  }

  @Test
  void depthCountsOpenDelimiters() {
    assertEquals(1, ReplSession.depth("fn f() {"));
    assertEquals(2, ReplSession.depth("println([1, (2"));
    assertEquals(0, ReplSession.depth("let s = \"{\""));
    assertEquals(0, ReplSession.depth("let bad = #{"));
  }

  @Test
  void definitionsPersistAcrossLines() {
    session.accept("var count = 0");
    session.accept("count = count + 1");
    Value count = session.interpreter().globals().lookup("count", null);
    assertEquals(new Value.Int(1), count);
  }
}
