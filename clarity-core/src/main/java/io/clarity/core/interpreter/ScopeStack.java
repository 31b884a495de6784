package io.clarity.core.interpreter;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Stack of active environments. Entering a block or a call pushes a frame and hands back a
 * {@link Scope}; closing it pops the frame, so try-with-resources restores the previous scope on
 * normal completion, {@code return} and errors alike.
 */
final class ScopeStack {

  private final Deque<Environment> frames = new ArrayDeque<>();

  ScopeStack(Environment globals) {
    frames.push(globals);
  }

  Environment current() {
    return frames.peek();
  }

  int depth() {
    return frames.size();
  }

  /** Pops frames until {@code depth} remain; used when the Java stack overflowed mid-call. */
  void unwindTo(int depth) {
    while (frames.size() > depth) {
      frames.pop();
    }
  }

  /** Pushes a fresh child of the current frame. */
  Scope enterBlock() {
    return enter(current().child());
  }

  /** Pushes {@code frame}; calls use a child of the callee's defining environment. */
  Scope enter(Environment frame) {
    frames.push(frame);
    return new Scope(frame, frames.size());
  }

  /** Handle for one pushed frame. */
  final class Scope implements AutoCloseable {
    private final Environment frame;
    private final int depth;
    private boolean closed;

    private Scope(Environment frame, int depth) {
      this.frame = frame;
      this.depth = depth;
    }

    Environment frame() {
      return frame;
    }

    @Override
    public void close() {
      if (closed) {
        return;
      }
      if (frames.size() != depth || frames.peek() != frame) {
        throw new IllegalStateException("Scopes must be closed in reverse order of entry");
      }
      frames.pop();
      closed = true;
    }
  }
}
