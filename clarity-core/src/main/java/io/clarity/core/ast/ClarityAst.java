package io.clarity.core.ast;

import io.clarity.core.lexer.Position;
import io.clarity.core.lexer.TokenKind;
import java.util.List;

/**
 * AST model for the Clarity surface language. Every node owns its children exclusively and is
 * immutable once the parser has built it.
 *
 * <p>Example:
 *
 * <pre>
 * fn add(a: Int, b: Int) -> Int { return a + b; }
 * let r = add(2, 3);
 * for x in [1, 2, 3] { println(x); }
 * </pre>
 */
public final class ClarityAst {

  private ClarityAst() {}

  /** Binary operators, lowest precedence first. */
  public enum BinaryOperator {
    OR("||"),
    AND("&&"),
    EQ("=="),
    NE("!="),
    LT("<"),
    GT(">"),
    LE("<="),
    GE(">="),
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("%");

    private final String symbol;

    BinaryOperator(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }

    public static BinaryOperator fromToken(TokenKind kind) {
      return switch (kind) {
        case OR -> OR;
        case AND -> AND;
        case EQ -> EQ;
        case NE -> NE;
        case LT -> LT;
        case GT -> GT;
        case LE -> LE;
        case GE -> GE;
        case PLUS -> ADD;
        case MINUS -> SUB;
        case STAR -> MUL;
        case SLASH -> DIV;
        case PERCENT -> MOD;
        default -> throw new IllegalArgumentException("Not a binary operator: " + kind);
      };
    }
  }

  /** Prefix operators. */
  public enum UnaryOperator {
    NEG("-"),
    NOT("!");

    private final String symbol;

    UnaryOperator(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }
  }

  /** Base interface of all nodes; the position is that of the node's leading token. */
  public sealed interface Node
      permits Program,
          FunctionDef,
          VariableDecl,
          ConstantDecl,
          Assignment,
          BinaryOp,
          UnaryOp,
          IfExpr,
          WhileLoop,
          ForLoop,
          ReturnStmt,
          FunctionCall,
          Identifier,
          NumberLiteral,
          StringLiteral,
          BooleanLiteral,
          ListLiteral,
          MatchExpr {

    Position position();

    /** Node kind name, e.g. {@code FunctionDef}. */
    default String nodeType() {
      return getClass().getSimpleName();
    }
  }

  // === Statements ===

  public record Program(List<Node> statements, Position position) implements Node {
    public Program {
      statements = List.copyOf(statements);
    }
  }

  /** Declared parameter {@code name: Type}. */
  public record Param(String name, String type, Position position) {}

  public record FunctionDef(
      String name,
      List<Param> params,
      String returnType, // null when no '->' clause
      List<Node> body,
      Position position,
      int endLine)
      implements Node {
    public FunctionDef {
      params = List.copyOf(params);
      body = List.copyOf(body);
    }
  }

  /** {@code let} (immutable) or {@code var} (mutable) declaration. */
  public record VariableDecl(
      boolean mutable, String name, String typeName, Node value, Position position)
      implements Node {}

  public record ConstantDecl(String name, Node value, Position position) implements Node {}

  public record Assignment(String name, Node value, Position position) implements Node {}

  public record IfExpr(
      Node condition,
      List<Node> thenBranch,
      List<Node> elseBranch, // null when there is no else
      Position position)
      implements Node {
    public IfExpr {
      thenBranch = List.copyOf(thenBranch);
      elseBranch = elseBranch == null ? null : List.copyOf(elseBranch);
    }

    public boolean hasElse() {
      return elseBranch != null;
    }
  }

  public record WhileLoop(Node condition, List<Node> body, Position position) implements Node {
    public WhileLoop {
      body = List.copyOf(body);
    }
  }

  public record ForLoop(String variable, Node iterable, List<Node> body, Position position)
      implements Node {
    public ForLoop {
      body = List.copyOf(body);
    }
  }

  public record ReturnStmt(Node value, Position position) implements Node {}

  // === Expressions ===

  public record BinaryOp(Node left, BinaryOperator op, Node right, Position position)
      implements Node {}

  public record UnaryOp(UnaryOperator op, Node operand, Position position) implements Node {}

  /** Call of an arbitrary callee expression; {@code f(x)(y)} nests calls. */
  public record FunctionCall(Node callee, List<Node> args, Position position) implements Node {
    public FunctionCall {
      args = List.copyOf(args);
    }

    /** Name of the called identifier, or the rendered callee for computed callees. */
    public String calleeName() {
      return callee instanceof Identifier id ? id.name() : SourceRenderer.render(callee);
    }
  }

  public record Identifier(String name, Position position) implements Node {}

  public record NumberLiteral(long value, Position position) implements Node {}

  public record StringLiteral(String value, Position position) implements Node {}

  public record BooleanLiteral(boolean value, Position position) implements Node {}

  public record ListLiteral(List<Node> elements, Position position) implements Node {
    public ListLiteral {
      elements = List.copyOf(elements);
    }
  }

  /** One {@code pattern => result} arm. Identifier patterns match anything. */
  public record MatchArm(Node pattern, Node result) {
    public boolean isCatchAll() {
      return pattern instanceof Identifier;
    }
  }

  public record MatchExpr(Node scrutinee, List<MatchArm> arms, Position position)
      implements Node {
    public MatchExpr {
      arms = List.copyOf(arms);
    }
  }
}
