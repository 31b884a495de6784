package io.clarity.core.interpreter;

import io.clarity.core.error.ArityMismatchException;
import io.clarity.core.error.ClarityTypeException;
import io.clarity.core.interpreter.Value.Builtin;
import io.clarity.core.interpreter.Value.Numeric;
import io.clarity.core.interpreter.Value.Sequence;
import io.clarity.core.interpreter.Value.Str;
import io.clarity.core.lexer.Position;
import java.util.List;
import java.util.stream.Collectors;

/** Native functions bound in every global environment. */
public final class Builtins {

  public static final List<String> NAMES = List.of("println", "print", "sqrt", "len", "str");

  /** Built-ins that write output. */
  public static final List<String> EFFECTFUL = List.of("println", "print");

  private Builtins() {}

  static void install(Environment globals, Output out) {
    define(globals, "println", (args, at) -> {
      out.println(join(args));
      return Value.NULL;
    });
    define(globals, "print", (args, at) -> {
      out.print(join(args));
      return Value.NULL;
    });
    define(globals, "sqrt", Builtins::sqrt);
    define(globals, "len", Builtins::len);
    define(globals, "str", (args, at) -> {
      expectArity("str", args, 1, at);
      return Value.of(args.get(0).describe());
    });
  }

  private static void define(Environment env, String name, Value.NativeFunction fn) {
    env.define(name, new Builtin(name, fn));
  }

  private static String join(List<Value> args) {
    return args.stream().map(Value::describe).collect(Collectors.joining(" "));
  }

  private static Value sqrt(List<Value> args, Position at) {
    expectArity("sqrt", args, 1, at);
    if (!(args.get(0) instanceof Numeric n)) {
      throw new ClarityTypeException(
          "sqrt expects a Number, got " + args.get(0).typeName(), at);
    }
    if (n.asDouble() < 0) {
      throw new ClarityTypeException("sqrt of negative number " + n.describe(), at);
    }
    return new Value.Real(Math.sqrt(n.asDouble()));
  }

  private static Value len(List<Value> args, Position at) {
    expectArity("len", args, 1, at);
    Value v = args.get(0);
    if (v instanceof Sequence s) {
      return Value.of(s.elements().size());
    }
    if (v instanceof Str s) {
      return Value.of(s.value().length());
    }
    throw new ClarityTypeException("len expects a Sequence or String, got " + v.typeName(), at);
  }

  private static void expectArity(String name, List<Value> args, int expected, Position at) {
    if (args.size() != expected) {
      throw new ArityMismatchException(name, expected, args.size(), at);
    }
  }
}
