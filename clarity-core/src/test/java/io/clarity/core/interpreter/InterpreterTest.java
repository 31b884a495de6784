package io.clarity.core.interpreter;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import io.clarity.core.error.ArityMismatchException;
import io.clarity.core.error.ClarityArithmeticException;
import io.clarity.core.error.ClarityTypeException;
import io.clarity.core.error.ErrorKind;
import io.clarity.core.error.NoMatchException;
import io.clarity.core.error.RecursionDepthException;
import io.clarity.core.error.UndefinedNameException;
import io.clarity.core.interpreter.Value.Int;
import io.clarity.core.interpreter.Value.Real;
import io.clarity.core.interpreter.Value.Str;
import io.clarity.core.lexer.Position;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class InterpreterTest {

  private Output out;
  private Interpreter interpreter;

  @BeforeEach
  void setUp() {
    out = mock(Output.class);
    interpreter = new Interpreter(out);
  }

  private Value run(String source) {
    return interpreter.run(source);
  }

  @Test
  void forLoopPrintsElementsInOrder() {
    run("for item in [1, 2, 3] { println(item) }");

    InOrder inOrder = inOrder(out);
    inOrder.verify(out).println("1");
    inOrder.verify(out).println("2");
    inOrder.verify(out).println("3");
    verifyNoMoreInteractions(out);
  }

  @Test
  void callsUserFunction() {
    Value result = run("fn add(a: Int, b: Int) -> Int { return a + b }\nadd(2, 3)");
    assertEquals(Value.of(5), result);
  }

  @Test
  void wrongArgumentCountIsATypeError() {
    ArityMismatchException e =
        assertThrows(
            ArityMismatchException.class,
            () -> run("fn add(a: Int, b: Int) -> Int { return a + b }\nadd(1)"));
    assertEquals(ErrorKind.TYPE, e.kind());
    assertEquals(2, e.expected());
    assertEquals(1, e.actual());
    assertEquals("Function add expects 2 arguments but got 1", e.detail());
    assertEquals(new Position(2, 0), e.position());
  }

  @Test
  void divisionByZeroIsAnArithmeticError() {
    ClarityArithmeticException e =
        assertThrows(ClarityArithmeticException.class, () -> run("10 / 0"));
    assertEquals(ErrorKind.ARITHMETIC, e.kind());
    assertEquals("Division by zero", e.detail());
    assertThrows(ClarityArithmeticException.class, () -> run("10 % 0"));
  }

  @Test
  void divisionIsExactWhenPossible() {
    assertEquals(Value.of(2), run("6 / 3"));
    assertEquals(new Real(3.5), run("7 / 2"));
    assertEquals(Value.of(2), run("-7 % 3"));
    assertEquals(Value.of(-1), run("7 % -2"));
  }

  @Test
  void integerOverflowIsReported() {
    assertThrows(ClarityArithmeticException.class, () -> run("9223372036854775807 + 1"));
    assertThrows(
        ClarityArithmeticException.class, () -> run("let m = -9223372036854775807 - 1;\n-m"));
  }

  @Test
  void stringConcatenationDescribesTheOtherOperand() {
    assertEquals(Value.of("n=1"), run("\"n=\" + 1"));
    assertEquals(Value.of("true!"), run("true + \"!\""));
  }

  @Test
  void unsupportedOperandTypes() {
    ClarityTypeException e = assertThrows(ClarityTypeException.class, () -> run("true - 1"));
    assertEquals("Unsupported operand types for -: Boolean and Number", e.detail());
  }

  @Test
  void comparisonAndEquality() {
    assertEquals(Value.TRUE, run("1 == 1"));
    assertEquals(Value.TRUE, run("2 == 4 / 2"));
    assertEquals(Value.TRUE, run("\"a\" < \"b\""));
    assertEquals(Value.FALSE, run("[1, 2] != [1, 2]"));
    assertEquals(Value.FALSE, run("1 == \"1\""));
  }

  @Test
  void logicalOperatorsShortCircuit() {
    assertEquals(Value.FALSE, run("false && missing()"));
    assertEquals(Value.TRUE, run("true || missing()"));
    assertThrows(ClarityTypeException.class, () -> run("1 && true"));
  }

  @Test
  void firstMatchingArmWins() {
    assertEquals(Value.of("any"), run("match 5 { _ => \"any\", 5 => \"five\" }"));
    assertEquals(Value.of("five"), run("match 5 { 4 => \"four\", 5 => \"five\", _ => \"other\" }"));
    assertEquals(Value.of("minus"), run("match -1 { -1 => \"minus\", _ => \"other\" }"));
  }

  @Test
  void identifierPatternBindsTheScrutinee() {
    assertEquals(Value.of(10), run("match 5 { n => n * 2 }"));
    assertThrows(UndefinedNameException.class, () -> run("match 5 { n => n }\nn"));
  }

  @Test
  void unmatchedValueIsANoMatchError() {
    NoMatchException e =
        assertThrows(NoMatchException.class, () -> run("match 3 { 1 => \"one\" }"));
    assertEquals("No match found for value: 3", e.detail());
  }

  @Test
  void undefinedVariable() {
    UndefinedNameException e = assertThrows(UndefinedNameException.class, () -> run("y + 1"));
    assertEquals("y", e.name());
    assertEquals("NameError: Undefined variable: y at 1:0", e.getMessage());
  }

  @Test
  void assigningAnUndeclaredNameFails() {
    UndefinedNameException e = assertThrows(UndefinedNameException.class, () -> run("z = 1"));
    assertEquals("Cannot assign to undefined variable: z", e.detail());
  }

  @Test
  void blockBindingsAreDiscarded() {
    assertThrows(UndefinedNameException.class, () -> run("if true { let y = 2 }\ny"));
    assertEquals(1, interpreter.scopeDepth());
  }

  @Test
  void forLoopBindingsDoNotLeakIntoTheNextIteration() {
    UndefinedNameException e =
        assertThrows(
            UndefinedNameException.class,
            () -> run("for x in [1, 2, 3] { if x == 2 { println(y) } let y = x }"));
    assertEquals("NameError: Undefined variable: y at 1:41", e.getMessage());
    verifyNoInteractions(out);
    assertEquals(1, interpreter.scopeDepth());
  }

  @Test
  void innerDeclarationShadowsAndAssignmentUpdatesOuter() {
    assertEquals(Value.of(1), run("let x = 1\nif true { let x = 2 }\nx"));
    assertEquals(Value.of(5), run("var v = 1\nif true { v = 5 }\nv"));
  }

  @Test
  void scopeStackUnwindsAfterErrorsAndReturns() {
    assertThrows(
        ClarityArithmeticException.class,
        () -> run("fn f(n: Int) { for i in [1] { if true { return n / 0 } } }\nf(1)"));
    assertEquals(1, interpreter.scopeDepth());

    run("fn g() -> Int { while true { if true { return 7 } } }\ng()");
    assertEquals(1, interpreter.scopeDepth());
  }

  @Test
  void closuresCaptureTheirDefiningScope() {
    Value result =
        run(
            "fn make() {\n"
                + "  let base = 10\n"
                + "  fn addBase(n: Int) -> Int { return n + base }\n"
                + "  return addBase\n"
                + "}\n"
                + "let f = make()\n"
                + "f(5)");
    assertEquals(Value.of(15), result);
  }

  @Test
  void recursion() {
    assertEquals(
        Value.of(120),
        run("fn fact(n: Int) -> Int { if n <= 1 { return 1 } else { return n * fact(n - 1) } }\n"
            + "fact(5)"));
  }

  @Test
  void deepRecursionIsARecursionError() {
    run("fn count(n: Int) -> Int { if n == 0 { return 0 } return 1 + count(n - 1) }");
    assertEquals(Value.of(200), run("count(200)"));

    RecursionDepthException e =
        assertThrows(RecursionDepthException.class, () -> run("count(1000)"));
    assertEquals(ErrorKind.RECURSION, e.kind());
    assertTrue(
        e.getMessage().startsWith("RecursionError: Maximum recursion depth exceeded (256)"),
        e.getMessage());
    assertEquals(1, interpreter.scopeDepth());

    assertEquals(Value.of(10), run("count(10)"));
  }

  @Test
  void whileLoopRunsUntilConditionIsFalse() {
    assertEquals(Value.of(3), run("var i = 0\nwhile i < 3 { i = i + 1 }\ni"));
  }

  @Test
  void conditionMustBeBoolean() {
    ClarityTypeException e = assertThrows(ClarityTypeException.class, () -> run("if 1 { 2 }"));
    assertEquals("if condition must be Boolean, got Number", e.detail());
  }

  @Test
  void forLoopRequiresASequence() {
    ClarityTypeException e =
        assertThrows(ClarityTypeException.class, () -> run("for c in \"abc\" { c }"));
    assertEquals("Cannot iterate over String", e.detail());
  }

  @Test
  void callingANonFunction() {
    UndefinedNameException e =
        assertThrows(UndefinedNameException.class, () -> run("let x = 1\nx()"));
    assertEquals("'x' is not a function", e.detail());
  }

  @Test
  void topLevelReturnEndsTheProgram() {
    assertEquals(Value.of(1), run("return 1\nprintln(2)"));
    verifyNoInteractions(out);
  }

  @Test
  void definitionsPersistAcrossRuns() {
    run("let greeting = \"hi\"");
    assertEquals(Value.of("hi!"), run("greeting + \"!\""));
    assertTrue(interpreter.globals().isDefinedLocally("greeting"));
  }

  @Test
  void builtins() {
    assertEquals(Value.of(3), run("len([1, 2, 3])"));
    assertEquals(Value.of(5), run("len(\"hello\")"));
    assertEquals(new Real(4.0), run("sqrt(16)"));
    assertEquals(Value.of("[1, \"a\"]"), run("str([1, \"a\"])"));
    assertThrows(ClarityTypeException.class, () -> run("sqrt(-1)"));
    assertThrows(ArityMismatchException.class, () -> run("len()"));
  }

  @Test
  void printJoinsArgumentsWithSpaces() {
    run("println(\"a\", 1, true)\nprint(\"no newline\")");

    InOrder inOrder = inOrder(out);
    inOrder.verify(out).println("a 1 true");
    inOrder.verify(out).print("no newline");
  }

  @Test
  void sequencesConcatenate() {
    Value v = run("[1] + [2, 3]");
    assertEquals("[1, 2, 3]", v.describe());
    assertInstanceOf(Value.Sequence.class, v);
  }

  @Test
  void functionDefinitionEvaluatesToNull() {
    assertEquals(Value.NULL, run("fn f() {}"));
    assertInstanceOf(Value.Closure.class, interpreter.globals().lookup("f", Position.START));
  }

  @Test
  void valuesDescribeThemselves() {
    assertEquals("3.5", new Real(3.5).describe());
    assertEquals("text", new Str("text").describe());
    assertEquals("Number", new Int(1).typeName());
    assertEquals("<builtin println>", interpreter.globals().lookup("println", null).describe());
  }
}
