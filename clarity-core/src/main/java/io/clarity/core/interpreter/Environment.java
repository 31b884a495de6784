package io.clarity.core.interpreter;

import io.clarity.core.error.UndefinedNameException;
import io.clarity.core.lexer.Position;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * One binding frame plus an optional enclosing frame. {@link #define} is frame-local; {@link
 * #assign} and {@link #lookup} walk outward and fail with a NameError when nothing is bound.
 */
public final class Environment {

  private final Map<String, Value> values = new HashMap<>();
  private final Environment parent;

  public Environment() {
    this(null);
  }

  public Environment(Environment parent) {
    this.parent = parent;
  }

  public Environment parent() {
    return parent;
  }

  public Environment child() {
    return new Environment(this);
  }

  /** Binds {@code name} in this frame, shadowing any outer binding. */
  public void define(String name, Value value) {
    values.put(name, value);
  }

  /**
   * Rebinds the nearest existing binding of {@code name}.
   *
   * @throws UndefinedNameException if no enclosing frame binds the name
   */
  public void assign(String name, Value value, Position at) {
    for (Environment env = this; env != null; env = env.parent) {
      if (env.values.containsKey(name)) {
        env.values.put(name, value);
        return;
      }
    }
    throw new UndefinedNameException(
        name, "Cannot assign to undefined variable: " + name, at);
  }

  /**
   * Resolves {@code name} through the frame chain.
   *
   * @throws UndefinedNameException if no enclosing frame binds the name
   */
  public Value lookup(String name, Position at) {
    for (Environment env = this; env != null; env = env.parent) {
      Value v = env.values.get(name);
      if (v != null) {
        return v;
      }
    }
    throw UndefinedNameException.undefined(name, at);
  }

  public boolean isDefinedLocally(String name) {
    return values.containsKey(name);
  }

  /** Names bound in this frame only. */
  public Set<String> localNames() {
    return Collections.unmodifiableSet(values.keySet());
  }
}
