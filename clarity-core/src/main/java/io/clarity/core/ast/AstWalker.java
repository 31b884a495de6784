package io.clarity.core.ast;

import io.clarity.core.ast.ClarityAst.*;
import java.util.List;
import java.util.function.Consumer;

/** Pre-order traversal over surface AST nodes. */
public final class AstWalker {

  private AstWalker() {}

  /** Visits every node of {@code nodes} and their descendants, parents before children. */
  public static void walk(List<Node> nodes, Consumer<Node> visitor) {
    for (Node n : nodes) {
      walk(n, visitor);
    }
  }

  public static void walk(Node node, Consumer<Node> visitor) {
    visitor.accept(node);
    if (node instanceof Program p) {
      walk(p.statements(), visitor);
    } else if (node instanceof FunctionDef f) {
      walk(f.body(), visitor);
    } else if (node instanceof VariableDecl v) {
      walk(v.value(), visitor);
    } else if (node instanceof ConstantDecl c) {
      walk(c.value(), visitor);
    } else if (node instanceof Assignment a) {
      walk(a.value(), visitor);
    } else if (node instanceof IfExpr i) {
      walk(i.condition(), visitor);
      walk(i.thenBranch(), visitor);
      if (i.hasElse()) {
        walk(i.elseBranch(), visitor);
      }
    } else if (node instanceof WhileLoop w) {
      walk(w.condition(), visitor);
      walk(w.body(), visitor);
    } else if (node instanceof ForLoop f) {
      walk(f.iterable(), visitor);
      walk(f.body(), visitor);
    } else if (node instanceof ReturnStmt r) {
      if (r.value() != null) {
        walk(r.value(), visitor);
      }
    } else if (node instanceof BinaryOp b) {
      walk(b.left(), visitor);
      walk(b.right(), visitor);
    } else if (node instanceof UnaryOp u) {
      walk(u.operand(), visitor);
    } else if (node instanceof FunctionCall c) {
      walk(c.callee(), visitor);
      walk(c.args(), visitor);
    } else if (node instanceof ListLiteral l) {
      walk(l.elements(), visitor);
    } else if (node instanceof MatchExpr m) {
      walk(m.scrutinee(), visitor);
      for (MatchArm arm : m.arms()) {
        walk(arm.pattern(), visitor);
        walk(arm.result(), visitor);
      }
    }
  }
}
