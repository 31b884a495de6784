package io.clarity.core.translator;

import io.clarity.core.ast.AstWalker;
import io.clarity.core.ast.ClarityAst.*;
import io.clarity.core.interpreter.Builtins;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/** Static facts about a function body recorded in its knowledge fragment. */
record FunctionAnalysis(
    String logicFlow,
    List<String> inputDependentVars,
    List<String> computedVars,
    List<String> sideEffects,
    List<String> assumptions,
    List<String> implications,
    List<String> potentialShifts) {

  static final String NO_SIDE_EFFECTS = "none_identified_static_analysis";

  static FunctionAnalysis of(FunctionDef fn) {
    Scan scan = new Scan(fn.name());
    AstWalker.walk(fn.body(), scan);

    Set<String> params = new LinkedHashSet<>();
    fn.params().forEach(p -> params.add(p.name()));

    List<String> inputs = new ArrayList<>();
    for (String p : params) {
      if (scan.read.contains(p)) {
        inputs.add(p);
      }
    }
    List<String> computed = new ArrayList<>(scan.declared);
    for (String name : scan.assigned) {
      if (!computed.contains(name)) {
        computed.add(name);
      }
    }
    computed.removeAll(params);

    // assignments to names neither declared in the body nor bound as parameters
    Set<String> effects = new LinkedHashSet<>(scan.effects);
    for (String name : scan.assigned) {
      if (!params.contains(name) && !scan.declared.contains(name)) {
        effects.add("assigns_outer_variable_" + name);
      }
    }

    boolean floating =
        scan.floating
            || "Float".equals(fn.returnType())
            || fn.params().stream().anyMatch(p -> "Float".equals(p.type()));

    return new FunctionAnalysis(
        logicFlow(fn, scan),
        inputs,
        computed,
        effects.isEmpty() ? List.of(NO_SIDE_EFFECTS) : List.copyOf(effects),
        assumptions(scan),
        implications(!effects.isEmpty(), fn.returnType() != null),
        shifts(floating, scan.recursive, !effects.isEmpty()));
  }

  private static String logicFlow(FunctionDef fn, Scan scan) {
    if (fn.body().isEmpty()) {
      return "empty";
    }
    StringBuilder sb = new StringBuilder(scan.loops ? "iterative" : "sequential");
    if (scan.conditionals) {
      sb.append("_with_conditionals");
    }
    if (scan.recursive) {
      sb.append("_recursive");
    }
    return sb.toString();
  }

  private static List<String> assumptions(Scan scan) {
    List<String> out = new ArrayList<>(List.of("inputs_are_valid", "system_resources_available"));
    if (scan.division) out.add("divisor_is_non_zero");
    if (scan.forLoops) out.add("iterables_are_sequences");
    if (scan.whileLoops) out.add("loop_terminates");
    return out;
  }

  private static List<String> implications(boolean effects, boolean returnsValue) {
    List<String> out = new ArrayList<>();
    out.add(effects ? "side_effects_possible" : "no_side_effects_expected");
    out.add("resource_utilization_expected");
    if (returnsValue) out.add("returns_declared_type");
    return out;
  }

  private static List<String> shifts(boolean floating, boolean recursive, boolean effects) {
    List<String> out = new ArrayList<>();
    if (floating) out.add("floating_point_precision");
    if (recursive) out.add("recursion_depth_limits");
    if (effects) out.add("output_ordering");
    if (out.isEmpty()) out.add("none_identified");
    return out;
  }

  private static final class Scan implements Consumer<Node> {
    private final String functionName;
    final Set<String> read = new LinkedHashSet<>();
    final Set<String> declared = new LinkedHashSet<>();
    final Set<String> assigned = new LinkedHashSet<>();
    final Set<String> effects = new LinkedHashSet<>();
    boolean loops;
    boolean forLoops;
    boolean whileLoops;
    boolean conditionals;
    boolean division;
    boolean floating;
    boolean recursive;

    Scan(String functionName) {
      this.functionName = functionName;
    }

    @Override
    public void accept(Node node) {
      if (node instanceof Identifier id) {
        read.add(id.name());
      } else if (node instanceof VariableDecl v) {
        declared.add(v.name());
      } else if (node instanceof ConstantDecl c) {
        declared.add(c.name());
      } else if (node instanceof FunctionDef f) {
        declared.add(f.name());
      } else if (node instanceof Assignment a) {
        assigned.add(a.name());
      } else if (node instanceof ForLoop f) {
        declared.add(f.variable());
        loops = true;
        forLoops = true;
      } else if (node instanceof WhileLoop) {
        loops = true;
        whileLoops = true;
      } else if (node instanceof IfExpr || node instanceof MatchExpr) {
        conditionals = true;
      } else if (node instanceof BinaryOp b) {
        if (b.op() == BinaryOperator.DIV || b.op() == BinaryOperator.MOD) {
          division = true;
        }
        if (b.op() == BinaryOperator.DIV) {
          floating = true;
        }
      } else if (node instanceof FunctionCall c && c.callee() instanceof Identifier callee) {
        String name = callee.name();
        if (Builtins.EFFECTFUL.contains(name)) {
          effects.add(name);
        }
        if (name.equals("sqrt")) {
          floating = true;
        }
        if (name.equals(functionName)) {
          recursive = true;
        }
      }
    }
  }
}
