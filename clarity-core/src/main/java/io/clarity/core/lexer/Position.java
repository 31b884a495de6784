package io.clarity.core.lexer;

/** Source position: 1-based line, 0-based column. */
public record Position(int line, int column) implements Comparable<Position> {

  public static final Position START = new Position(1, 0);

  @Override
  public int compareTo(Position o) {
    int c = Integer.compare(line, o.line);
    return c != 0 ? c : Integer.compare(column, o.column);
  }

  @Override
  public String toString() {
    return line + ":" + column;
  }
}
