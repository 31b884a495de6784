package io.clarity.core.translator;

import static org.junit.jupiter.api.Assertions.*;

import io.clarity.core.ast.ClarityAst.FunctionDef;
import io.clarity.core.parser.ClarityParser;
import java.util.List;
import org.junit.jupiter.api.Test;

class FunctionAnalysisTest {

  private static FunctionAnalysis analyze(String source) {
    return FunctionAnalysis.of((FunctionDef) ClarityParser.parse(source).statements().get(0));
  }

  @Test
  void pureFunction() {
    FunctionAnalysis a = analyze("fn add(a: Int, b: Int) -> Int { return a + b }");

    assertEquals("sequential", a.logicFlow());
    assertEquals(List.of("a", "b"), a.inputDependentVars());
    assertEquals(List.of(), a.computedVars());
    assertEquals(List.of(FunctionAnalysis.NO_SIDE_EFFECTS), a.sideEffects());
    assertEquals(List.of("inputs_are_valid", "system_resources_available"), a.assumptions());
    assertEquals(
        List.of(
            "no_side_effects_expected", "resource_utilization_expected", "returns_declared_type"),
        a.implications());
    assertEquals(List.of("none_identified"), a.potentialShifts());
  }

  @Test
  void loopsOutputAndOuterAssignment() {
    FunctionAnalysis a =
        analyze(
            "fn report(items: List, unused: Int) {\n"
                + "  var seen = 0\n"
                + "  for item in items { println(item) seen = seen + 1 }\n"
                + "  while seen > 0 { seen = seen - 1 }\n"
                + "  total = seen\n"
                + "}");

    assertEquals("iterative", a.logicFlow());
    assertEquals(List.of("items"), a.inputDependentVars());
    assertEquals(List.of("seen", "item", "total"), a.computedVars());
    assertEquals(List.of("println", "assigns_outer_variable_total"), a.sideEffects());
    assertTrue(a.assumptions().containsAll(List.of("iterables_are_sequences", "loop_terminates")));
    assertEquals("side_effects_possible", a.implications().get(0));
    assertFalse(a.implications().contains("returns_declared_type"));
    assertEquals(List.of("output_ordering"), a.potentialShifts());
  }

  @Test
  void recursionConditionalsAndDivision() {
    FunctionAnalysis a =
        analyze(
            "fn halve(n: Int) -> Int { if n < 2 { return n } else { return halve(n / 2) } }");

    assertEquals("sequential_with_conditionals_recursive", a.logicFlow());
    assertTrue(a.assumptions().contains("divisor_is_non_zero"));
    assertEquals(
        List.of("floating_point_precision", "recursion_depth_limits"), a.potentialShifts());
  }

  @Test
  void emptyBody() {
    assertEquals("empty", analyze("fn nothing() {}").logicFlow());
  }

  @Test
  void floatSignatureImpliesPrecisionShift() {
    assertEquals(
        List.of("floating_point_precision"),
        analyze("fn id(x: Float) -> Float { return x }").potentialShifts());
  }
}
