package io.clarity.core.ast;

import io.clarity.core.ast.ClarityAst.*;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders AST nodes back to Clarity surface syntax. Nested binary operations, and unary
 * operations in callee position, are parenthesized so the output re-parses to the same tree.
 */
public final class SourceRenderer {

  private static final String INDENT = "    ";

  private SourceRenderer() {}

  /** Renders a node as a single line; statement blocks are rendered inline. */
  public static String render(Node node) {
    StringBuilder sb = new StringBuilder();
    append(sb, node, -1);
    return sb.toString();
  }

  /** Renders a node as indented multi-line source. */
  public static String renderBlock(Node node) {
    StringBuilder sb = new StringBuilder();
    append(sb, node, 0);
    return sb.toString();
  }

  /**
   * Quotes string text that keeps its escapes verbatim, as lexemes do. Prefers single quotes when
   * the text holds a double quote but no single quote; otherwise unescaped double quotes and a
   * trailing lone backslash are escaped. Existing escape pairs are left alone.
   */
  public static String quote(String value) {
    boolean dangling = endsWithLoneBackslash(value);
    if (value.indexOf('"') >= 0 && value.indexOf('\'') < 0 && !dangling) {
      return '\'' + value + '\'';
    }
    StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == '\\') {
        if (i + 1 < value.length()) {
          sb.append(c).append(value.charAt(++i));
        } else {
          sb.append("\\\\");
        }
      } else if (c == '"') {
        sb.append("\\\"");
      } else {
        sb.append(c);
      }
    }
    return sb.append('"').toString();
  }

  private static boolean endsWithLoneBackslash(String value) {
    int run = 0;
    for (int i = value.length() - 1; i >= 0 && value.charAt(i) == '\\'; i--) {
      run++;
    }
    return run % 2 == 1;
  }

  // depth < 0 means single-line output
  private static void append(StringBuilder sb, Node node, int depth) {
    if (node instanceof Program p) {
      for (int i = 0; i < p.statements().size(); i++) {
        if (i > 0) sb.append(depth < 0 ? " " : "\n");
        append(sb, p.statements().get(i), depth);
      }
    } else if (node instanceof FunctionDef f) {
      sb.append("fn ").append(f.name()).append('(');
      sb.append(
          f.params().stream()
              .map(p -> p.name() + ": " + p.type())
              .collect(Collectors.joining(", ")));
      sb.append(')');
      if (f.returnType() != null) {
        sb.append(" -> ").append(f.returnType());
      }
      sb.append(' ');
      appendBlock(sb, f.body(), depth);
    } else if (node instanceof VariableDecl v) {
      sb.append(v.mutable() ? "var " : "let ").append(v.name());
      if (v.typeName() != null) {
        sb.append(": ").append(v.typeName());
      }
      sb.append(" = ");
      append(sb, v.value(), depth);
      sb.append(';');
    } else if (node instanceof ConstantDecl c) {
      sb.append("const ").append(c.name()).append(" = ");
      append(sb, c.value(), depth);
      sb.append(';');
    } else if (node instanceof Assignment a) {
      sb.append(a.name()).append(" = ");
      append(sb, a.value(), depth);
      sb.append(';');
    } else if (node instanceof IfExpr i) {
      sb.append("if ");
      append(sb, i.condition(), depth);
      sb.append(' ');
      appendBlock(sb, i.thenBranch(), depth);
      if (i.hasElse()) {
        sb.append(" else ");
        appendBlock(sb, i.elseBranch(), depth);
      }
    } else if (node instanceof WhileLoop w) {
      sb.append("while ");
      append(sb, w.condition(), depth);
      sb.append(' ');
      appendBlock(sb, w.body(), depth);
    } else if (node instanceof ForLoop f) {
      sb.append("for ").append(f.variable()).append(" in ");
      append(sb, f.iterable(), depth);
      sb.append(' ');
      appendBlock(sb, f.body(), depth);
    } else if (node instanceof ReturnStmt r) {
      sb.append("return");
      if (r.value() != null) {
        sb.append(' ');
        append(sb, r.value(), depth);
      }
      sb.append(';');
    } else if (node instanceof BinaryOp b) {
      appendOperand(sb, b.left(), depth);
      sb.append(' ').append(b.op().symbol()).append(' ');
      appendOperand(sb, b.right(), depth);
    } else if (node instanceof UnaryOp u) {
      sb.append(u.op().symbol());
      appendOperand(sb, u.operand(), depth);
    } else if (node instanceof FunctionCall c) {
      if (c.callee() instanceof UnaryOp) {
        sb.append('(');
        append(sb, c.callee(), depth);
        sb.append(')');
      } else {
        appendOperand(sb, c.callee(), depth);
      }
      sb.append('(');
      appendList(sb, c.args(), depth);
      sb.append(')');
    } else if (node instanceof Identifier id) {
      sb.append(id.name());
    } else if (node instanceof NumberLiteral n) {
      sb.append(n.value());
    } else if (node instanceof StringLiteral s) {
      sb.append(quote(s.value()));
    } else if (node instanceof BooleanLiteral b) {
      sb.append(b.value());
    } else if (node instanceof ListLiteral l) {
      sb.append('[');
      appendList(sb, l.elements(), depth);
      sb.append(']');
    } else if (node instanceof MatchExpr m) {
      sb.append("match ");
      append(sb, m.scrutinee(), depth);
      sb.append(" {");
      for (int i = 0; i < m.arms().size(); i++) {
        MatchArm arm = m.arms().get(i);
        sb.append(i == 0 ? " " : ", ");
        append(sb, arm.pattern(), depth);
        sb.append(" => ");
        append(sb, arm.result(), depth);
      }
      sb.append(" }");
    }
  }

  private static void appendOperand(StringBuilder sb, Node operand, int depth) {
    boolean wrap = operand instanceof BinaryOp || operand instanceof MatchExpr;
    if (wrap) sb.append('(');
    append(sb, operand, depth);
    if (wrap) sb.append(')');
  }

  private static void appendList(StringBuilder sb, List<Node> nodes, int depth) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) sb.append(", ");
      append(sb, nodes.get(i), depth);
    }
  }

  private static void appendBlock(StringBuilder sb, List<Node> body, int depth) {
    if (body.isEmpty()) {
      sb.append("{}");
      return;
    }
    if (depth < 0) {
      sb.append("{ ");
      for (Node stmt : body) {
        append(sb, stmt, depth);
        sb.append(' ');
      }
      sb.append('}');
      return;
    }
    sb.append("{\n");
    for (Node stmt : body) {
      sb.append(INDENT.repeat(depth + 1));
      append(sb, stmt, depth + 1);
      sb.append('\n');
    }
    sb.append(INDENT.repeat(depth)).append('}');
  }
}
