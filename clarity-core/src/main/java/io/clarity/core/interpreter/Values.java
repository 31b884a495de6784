package io.clarity.core.interpreter;

import io.clarity.core.ast.ClarityAst.BinaryOperator;
import io.clarity.core.error.ClarityArithmeticException;
import io.clarity.core.error.ClarityTypeException;
import io.clarity.core.interpreter.Value.*;
import io.clarity.core.lexer.Position;
import java.util.ArrayList;
import java.util.List;

/** Equality and the non-short-circuit binary operators over {@link Value}s. */
final class Values {

  private Values() {}

  /** Value equality; integers and doubles compare numerically. */
  static boolean equal(Value a, Value b) {
    if (a instanceof Numeric x && b instanceof Numeric y) {
      if (x instanceof Int i && y instanceof Int j) {
        return i.value() == j.value();
      }
      return x.asDouble() == y.asDouble();
    }
    if (a instanceof Sequence x && b instanceof Sequence y) {
      if (x.elements().size() != y.elements().size()) {
        return false;
      }
      for (int i = 0; i < x.elements().size(); i++) {
        if (!equal(x.elements().get(i), y.elements().get(i))) {
          return false;
        }
      }
      return true;
    }
    return a.equals(b);
  }

  static Value binary(BinaryOperator op, Value left, Value right, Position at) {
    switch (op) {
      case EQ:
        return Value.of(equal(left, right));
      case NE:
        return Value.of(!equal(left, right));
      case LT:
        return Value.of(compare(op, left, right, at) < 0);
      case GT:
        return Value.of(compare(op, left, right, at) > 0);
      case LE:
        return Value.of(compare(op, left, right, at) <= 0);
      case GE:
        return Value.of(compare(op, left, right, at) >= 0);
      case ADD:
        if (left instanceof Str || right instanceof Str) {
          return Value.of(left.describe() + right.describe());
        }
        if (left instanceof Sequence a && right instanceof Sequence b) {
          List<Value> joined = new ArrayList<>(a.elements());
          joined.addAll(b.elements());
          return new Sequence(joined);
        }
        return arithmetic(op, left, right, at);
      case SUB:
      case MUL:
      case DIV:
      case MOD:
        return arithmetic(op, left, right, at);
      default:
        throw new IllegalArgumentException("Not an eager operator: " + op);
    }
  }

  private static int compare(BinaryOperator op, Value left, Value right, Position at) {
    if (left instanceof Int a && right instanceof Int b) {
      return Long.compare(a.value(), b.value());
    }
    if (left instanceof Numeric a && right instanceof Numeric b) {
      return Double.compare(a.asDouble(), b.asDouble());
    }
    if (left instanceof Str a && right instanceof Str b) {
      return a.value().compareTo(b.value());
    }
    throw unsupported(op, left, right, at);
  }

  private static Value arithmetic(BinaryOperator op, Value left, Value right, Position at) {
    if (!(left instanceof Numeric a) || !(right instanceof Numeric b)) {
      throw unsupported(op, left, right, at);
    }
    if (a instanceof Int x && b instanceof Int y) {
      return integral(op, x.value(), y.value(), at);
    }
    double x = a.asDouble();
    double y = b.asDouble();
    switch (op) {
      case ADD:
        return new Real(x + y);
      case SUB:
        return new Real(x - y);
      case MUL:
        return new Real(x * y);
      case DIV:
        if (y == 0) throw new ClarityArithmeticException("Division by zero", at);
        return new Real(x / y);
      case MOD:
        if (y == 0) throw new ClarityArithmeticException("Modulo by zero", at);
        double r = x % y;
        // result takes the sign of the divisor
        return new Real(r != 0 && (r < 0) != (y < 0) ? r + y : r);
      default:
        throw new IllegalArgumentException("Not arithmetic: " + op);
    }
  }

  private static Value integral(BinaryOperator op, long x, long y, Position at) {
    try {
      switch (op) {
        case ADD:
          return Value.of(Math.addExact(x, y));
        case SUB:
          return Value.of(Math.subtractExact(x, y));
        case MUL:
          return Value.of(Math.multiplyExact(x, y));
        case DIV:
          if (y == 0) throw new ClarityArithmeticException("Division by zero", at);
          if (x % y == 0) {
            if (x == Long.MIN_VALUE && y == -1) throw new ArithmeticException("long overflow");
            return Value.of(x / y);
          }
          return new Real((double) x / y);
        case MOD:
          if (y == 0) throw new ClarityArithmeticException("Modulo by zero", at);
          return Value.of(Math.floorMod(x, y));
        default:
          throw new IllegalArgumentException("Not arithmetic: " + op);
      }
    } catch (ClarityArithmeticException e) {
      throw e;
    } catch (ArithmeticException e) {
      throw new ClarityArithmeticException(
          "Integer overflow in " + x + " " + op.symbol() + " " + y, at);
    }
  }

  private static ClarityTypeException unsupported(
      BinaryOperator op, Value left, Value right, Position at) {
    return new ClarityTypeException(
        "Unsupported operand types for "
            + op.symbol()
            + ": "
            + left.typeName()
            + " and "
            + right.typeName(),
        at);
  }
}
