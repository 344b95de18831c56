package com.codeheadsystems.veil.resolve;

import java.util.Objects;
import java.util.function.Function;

/**
 * A value resolved per call against the owning instance. Keys and predicates take this shape.
 *
 * @param <T> the resolved type
 */
public sealed interface Resolvable<T> permits Resolvable.Literal, Resolvable.MethodRef, Resolvable.Computed {

  /**
   * A fixed value.
   *
   * @param value the value
   * @param <T>   the type
   * @return the resolvable
   */
  static <T> Resolvable<T> literal(final T value) {
    return new Literal<>(value);
  }

  /**
   * The return value of a zero-argument method on the instance.
   *
   * @param methodName the method name
   * @param <T>        the type
   * @return the resolvable
   */
  static <T> Resolvable<T> method(final String methodName) {
    return new MethodRef<>(methodName);
  }

  /**
   * The result of calling {@code function} with the instance.
   *
   * @param function the function
   * @param <I>      the instance type
   * @param <T>      the type
   * @return the resolvable
   */
  @SuppressWarnings("unchecked")
  static <I, T> Resolvable<T> computed(final Function<I, T> function) {
    return new Computed<>((Function<Object, T>) function);
  }

  /**
   * Whether an option value can be resolved without an instance. Plain values count as literals.
   *
   * @param candidate the option value
   * @return true for literals and plain values
   */
  static boolean isInstanceIndependent(final Object candidate) {
    return !(candidate instanceof MethodRef) && !(candidate instanceof Computed);
  }

  /**
   * Literal.
   *
   * @param value the value
   * @param <T>   the type
   */
  record Literal<T>(T value) implements Resolvable<T> {
    @Override
    public String toString() {
      return "Literal";
    }
  }

  /**
   * Reference to a zero-argument method on the instance.
   *
   * @param methodName the method name
   * @param <T>        the type
   */
  record MethodRef<T>(String methodName) implements Resolvable<T> {
    public MethodRef {
      Objects.requireNonNull(methodName, "methodName");
    }
  }

  /**
   * Function of the instance.
   *
   * @param function the function
   * @param <T>      the type
   */
  record Computed<T>(Function<Object, T> function) implements Resolvable<T> {
    public Computed {
      Objects.requireNonNull(function, "function");
    }
  }
}
