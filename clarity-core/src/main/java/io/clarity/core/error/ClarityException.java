package io.clarity.core.error;

import io.clarity.core.lexer.Position;

/**
 * Base class for every error the toolchain reports. All errors are fatal to the operation that
 * raised them: a failed parse yields no AST, a failed evaluation yields no value.
 */
public abstract class ClarityException extends RuntimeException {

  private final ErrorKind kind;
  private final Position position;
  private final String detail;

  protected ClarityException(ErrorKind kind, String detail, Position position) {
    super(format(kind, detail, position));
    this.kind = kind;
    this.detail = detail;
    this.position = position;
  }

  protected ClarityException(ErrorKind kind, String detail, Position position, Throwable cause) {
    super(format(kind, detail, position), cause);
    this.kind = kind;
    this.detail = detail;
    this.position = position;
  }

  public ErrorKind kind() {
    return kind;
  }

  /** Source position of the offending construct, or {@code null} when none is known. */
  public Position position() {
    return position;
  }

  /** The message without kind prefix and position suffix. */
  public String detail() {
    return detail;
  }

  private static String format(ErrorKind kind, String detail, Position position) {
    StringBuilder sb = new StringBuilder(kind.displayName()).append(": ").append(detail);
    if (position != null) {
      sb.append(" at ").append(position);
    }
    return sb.toString();
  }
}
