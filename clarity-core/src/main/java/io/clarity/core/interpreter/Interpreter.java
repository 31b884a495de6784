package io.clarity.core.interpreter;

import io.clarity.core.ast.ClarityAst.*;
import io.clarity.core.ast.SourceRenderer;
import io.clarity.core.error.ArityMismatchException;
import io.clarity.core.error.ClarityArithmeticException;
import io.clarity.core.error.ClarityTypeException;
import io.clarity.core.error.NoMatchException;
import io.clarity.core.error.RecursionDepthException;
import io.clarity.core.error.UndefinedNameException;
import io.clarity.core.interpreter.Value.*;
import io.clarity.core.lexer.Position;
import io.clarity.core.parser.ClarityParser;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tree-walking evaluator for the surface language.
 *
 * <p>The global environment holds the built-ins and lives as long as the interpreter, so
 * successive {@link #execute} calls see each other's definitions. Block bodies and calls run in
 * child frames pushed on a {@link ScopeStack}.
 *
 * <p>Identifier patterns in {@code match} accept any value and bind it for the arm's result
 * (except {@code _}). Arms are tried top to bottom, so a catch-all placed first makes the arms
 * after it unreachable.
 *
 * <p>User function calls may nest at most {@link #MAX_CALL_DEPTH} deep.
 */
public final class Interpreter {

  private static final Logger log = LoggerFactory.getLogger(Interpreter.class);

  public static final int MAX_CALL_DEPTH = 256;

  private final Environment globals = new Environment();
  private final ScopeStack scopes = new ScopeStack(globals);
  private int callDepth;

  public Interpreter(Output out) {
    Builtins.install(globals, out);
  }

  public Environment globals() {
    return globals;
  }

  int scopeDepth() {
    return scopes.depth();
  }

  /** Parses and executes {@code source}. */
  public Value run(String source) {
    return execute(ClarityParser.parse(source));
  }

  /**
   * Executes a program in the global environment. The result is the value of the last statement,
   * or the value of a top-level {@code return}, which ends the program.
   */
  public Value execute(Program program) {
    log.debug("Executing program with {} statements", program.statements().size());
    int depth = scopes.depth();
    int calls = callDepth;
    try {
      return sequence(program.statements());
    } catch (ReturnSignal r) {
      return r.value;
    } catch (StackOverflowError e) {
      // deeply nested expressions can exhaust the stack below the call limit
      scopes.unwindTo(depth);
      callDepth = calls;
      throw new RecursionDepthException(MAX_CALL_DEPTH, null);
    }
  }

  /** Evaluates a single node in the current scope. */
  public Value evaluate(Node node) {
    if (node instanceof Program p) {
      return execute(p);
    } else if (node instanceof FunctionDef f) {
      scopes.current().define(f.name(), new Closure(f, scopes.current()));
      return Value.NULL;
    } else if (node instanceof VariableDecl v) {
      Value value = evaluate(v.value());
      scopes.current().define(v.name(), value);
      return value;
    } else if (node instanceof ConstantDecl c) {
      Value value = evaluate(c.value());
      scopes.current().define(c.name(), value);
      return value;
    } else if (node instanceof Assignment a) {
      Value value = evaluate(a.value());
      scopes.current().assign(a.name(), value, a.position());
      return value;
    } else if (node instanceof IfExpr i) {
      return ifExpr(i);
    } else if (node instanceof WhileLoop w) {
      return whileLoop(w);
    } else if (node instanceof ForLoop f) {
      return forLoop(f);
    } else if (node instanceof ReturnStmt r) {
      throw new ReturnSignal(r.value() == null ? Value.NULL : evaluate(r.value()));
    } else if (node instanceof BinaryOp b) {
      return binary(b);
    } else if (node instanceof UnaryOp u) {
      return unary(u);
    } else if (node instanceof FunctionCall c) {
      return call(c);
    } else if (node instanceof Identifier id) {
      return scopes.current().lookup(id.name(), id.position());
    } else if (node instanceof NumberLiteral n) {
      return Value.of(n.value());
    } else if (node instanceof StringLiteral s) {
      return Value.of(s.value());
    } else if (node instanceof BooleanLiteral b) {
      return Value.of(b.value());
    } else if (node instanceof ListLiteral l) {
      List<Value> elements = new ArrayList<>(l.elements().size());
      for (Node e : l.elements()) {
        elements.add(evaluate(e));
      }
      return new Sequence(elements);
    } else if (node instanceof MatchExpr m) {
      return match(m);
    }
    throw new IllegalStateException("Unhandled node: " + node.nodeType());
  }

  private Value sequence(List<Node> statements) {
    Value result = Value.NULL;
    for (Node stmt : statements) {
      result = evaluate(stmt);
    }
    return result;
  }

  private Value block(List<Node> body) {
    try (ScopeStack.Scope ignored = scopes.enterBlock()) {
      return sequence(body);
    }
  }

  // === Control flow ===

  private Value ifExpr(IfExpr i) {
    if (condition(i.condition(), "if")) {
      return block(i.thenBranch());
    }
    return i.hasElse() ? block(i.elseBranch()) : Value.NULL;
  }

  private Value whileLoop(WhileLoop w) {
    Value result = Value.NULL;
    while (condition(w.condition(), "while")) {
      result = block(w.body());
    }
    return result;
  }

  private Value forLoop(ForLoop f) {
    Value iterable = evaluate(f.iterable());
    if (!(iterable instanceof Sequence seq)) {
      throw new ClarityTypeException(
          "Cannot iterate over " + iterable.typeName(), f.iterable().position());
    }
    Value result = Value.NULL;
    for (Value item : seq.elements()) {
      try (ScopeStack.Scope scope = scopes.enterBlock()) {
        scope.frame().define(f.variable(), item);
        result = sequence(f.body());
      }
    }
    return result;
  }

  private boolean condition(Node expr, String construct) {
    Value v = evaluate(expr);
    if (v instanceof Bool b) {
      return b.value();
    }
    throw new ClarityTypeException(
        construct + " condition must be Boolean, got " + v.typeName(), expr.position());
  }

  private Value match(MatchExpr m) {
    Value scrutinee = evaluate(m.scrutinee());
    for (MatchArm arm : m.arms()) {
      if (arm.pattern() instanceof Identifier id) {
        try (ScopeStack.Scope scope = scopes.enterBlock()) {
          if (!id.name().equals("_")) {
            scope.frame().define(id.name(), scrutinee);
          }
          return evaluate(arm.result());
        }
      }
      if (Values.equal(scrutinee, evaluate(arm.pattern()))) {
        return evaluate(arm.result());
      }
    }
    throw new NoMatchException(scrutinee.describe(), m.position());
  }

  // === Calls ===

  private Value call(FunctionCall c) {
    Value callee = evaluate(c.callee());
    if (!(callee instanceof Callable fn)) {
      throw new UndefinedNameException(
          c.calleeName(), "'" + c.calleeName() + "' is not a function", c.position());
    }
    List<Value> args = new ArrayList<>(c.args().size());
    for (Node arg : c.args()) {
      args.add(evaluate(arg));
    }
    return invoke(fn, args, c.position());
  }

  /** Calls {@code fn} with already evaluated arguments. */
  public Value invoke(Callable fn, List<Value> args, Position at) {
    if (fn instanceof Builtin b) {
      return b.function().call(args, at);
    }
    Closure closure = (Closure) fn;
    FunctionDef def = closure.definition();
    if (args.size() != def.params().size()) {
      throw new ArityMismatchException(def.name(), def.params().size(), args.size(), at);
    }
    if (callDepth >= MAX_CALL_DEPTH) {
      throw new RecursionDepthException(MAX_CALL_DEPTH, at);
    }
    callDepth++;
    try (ScopeStack.Scope scope = scopes.enter(closure.scope().child())) {
      for (int i = 0; i < args.size(); i++) {
        scope.frame().define(def.params().get(i).name(), args.get(i));
      }
      return sequence(def.body());
    } catch (ReturnSignal r) {
      return r.value;
    } finally {
      callDepth--;
    }
  }

  // === Operators ===

  private Value binary(BinaryOp b) {
    switch (b.op()) {
      case AND:
        return Value.of(logical(b.left(), "&&") && logical(b.right(), "&&"));
      case OR:
        return Value.of(logical(b.left(), "||") || logical(b.right(), "||"));
      default:
        return Values.binary(b.op(), evaluate(b.left()), evaluate(b.right()), b.position());
    }
  }

  private boolean logical(Node operand, String op) {
    Value v = evaluate(operand);
    if (v instanceof Bool bool) {
      return bool.value();
    }
    throw new ClarityTypeException(
        "Operand of " + op + " must be Boolean, got " + v.typeName(), operand.position());
  }

  private Value unary(UnaryOp u) {
    Value v = evaluate(u.operand());
    switch (u.op()) {
      case NOT:
        if (v instanceof Bool b) {
          return Value.of(!b.value());
        }
        throw new ClarityTypeException(
            "Operand of ! must be Boolean, got " + v.typeName(), u.position());
      case NEG:
        if (v instanceof Int i) {
          try {
            return Value.of(Math.negateExact(i.value()));
          } catch (ArithmeticException e) {
            throw new ClarityArithmeticException("Integer overflow in -" + i.value(), u.position());
          }
        }
        if (v instanceof Real r) {
          return new Real(-r.value());
        }
        throw new ClarityTypeException(
            "Cannot negate " + v.typeName() + " " + SourceRenderer.render(u.operand()),
            u.position());
      default:
        throw new IllegalStateException("Unknown unary operator " + u.op());
    }
  }

  /** Unwinds nested blocks and loops up to the enclosing call or program. */
  private static final class ReturnSignal extends RuntimeException {
    private final transient Value value;

    ReturnSignal(Value value) {
      super(null, null, false, false);
      this.value = value;
    }
  }
}
