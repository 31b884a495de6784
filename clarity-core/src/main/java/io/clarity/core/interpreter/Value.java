package io.clarity.core.interpreter;

import io.clarity.core.ast.ClarityAst.FunctionDef;
import io.clarity.core.lexer.Position;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runtime value of the surface language. Every operator switches over the closed set of
 * variants.
 */
public sealed interface Value permits Value.Numeric, Value.Str, Value.Bool, Value.Callable,
    Value.Null, Value.Sequence {

  /** Display form, as written by {@code println} and used by string concatenation. */
  String describe();

  /** Variant name used in type error messages. */
  String typeName();

  Null NULL = new Null();
  Bool TRUE = new Bool(true);
  Bool FALSE = new Bool(false);

  static Bool of(boolean b) {
    return b ? TRUE : FALSE;
  }

  static Int of(long n) {
    return new Int(n);
  }

  static Str of(String s) {
    return new Str(s);
  }

  /** Numbers: 64-bit integers, or doubles produced by inexact division and {@code sqrt}. */
  sealed interface Numeric extends Value permits Int, Real {
    double asDouble();

    @Override
    default String typeName() {
      return "Number";
    }
  }

  record Int(long value) implements Numeric {
    @Override
    public double asDouble() {
      return value;
    }

    @Override
    public String describe() {
      return Long.toString(value);
    }
  }

  record Real(double value) implements Numeric {
    @Override
    public double asDouble() {
      return value;
    }

    @Override
    public String describe() {
      return Double.toString(value);
    }
  }

  record Str(String value) implements Value {
    @Override
    public String describe() {
      return value;
    }

    @Override
    public String typeName() {
      return "String";
    }
  }

  record Bool(boolean value) implements Value {
    @Override
    public String describe() {
      return Boolean.toString(value);
    }

    @Override
    public String typeName() {
      return "Boolean";
    }
  }

  record Null() implements Value {
    @Override
    public String describe() {
      return "null";
    }

    @Override
    public String typeName() {
      return "Null";
    }
  }

  /** Ordered, immutable list of values, produced by list literals. */
  record Sequence(List<Value> elements) implements Value {
    public Sequence {
      elements = List.copyOf(elements);
    }

    @Override
    public String describe() {
      return elements.stream()
          .map(v -> v instanceof Str s ? '"' + s.value() + '"' : v.describe())
          .collect(Collectors.joining(", ", "[", "]"));
    }

    @Override
    public String typeName() {
      return "Sequence";
    }
  }

  /** Anything that can appear in callee position. */
  sealed interface Callable extends Value permits Builtin, Closure {
    String name();

    @Override
    default String typeName() {
      return "Callable";
    }
  }

  /** Native function body for a {@link Builtin}. */
  @FunctionalInterface
  interface NativeFunction {
    Value call(List<Value> args, Position callSite);
  }

  record Builtin(String name, NativeFunction function) implements Callable {
    @Override
    public String describe() {
      return "<builtin " + name + ">";
    }
  }

  /** User function closed over the environment it was defined in. */
  record Closure(FunctionDef definition, Environment scope) implements Callable {
    @Override
    public String name() {
      return definition.name();
    }

    @Override
    public String describe() {
      return "<fn " + definition.name() + ">";
    }

    @Override
    public boolean equals(Object o) {
      return this == o;
    }

    @Override
    public int hashCode() {
      return System.identityHashCode(this);
    }
  }
}
