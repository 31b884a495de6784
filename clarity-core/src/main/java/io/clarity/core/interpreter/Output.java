package io.clarity.core.interpreter;

import java.io.PrintStream;
import java.io.PrintWriter;

/** Sink for program output written by the {@code print} and {@code println} built-ins. */
public interface Output {

  void print(String text);

  default void println(String text) {
    print(text + System.lineSeparator());
  }

  static Output of(PrintStream stream) {
    return new Output() {
      @Override
      public void print(String text) {
        stream.print(text);
        stream.flush();
      }

      @Override
      public void println(String text) {
        stream.println(text);
      }
    };
  }

  static Output of(PrintWriter writer) {
    return new Output() {
      @Override
      public void print(String text) {
        writer.print(text);
        writer.flush();
      }

      @Override
      public void println(String text) {
        writer.println(text);
        writer.flush();
      }
    };
  }
}
