package com.codeheadsystems.veil.option;

import java.util.Optional;
import org.immutables.value.Value;

/**
 * Where a default option layer applies: process-wide, or to one class and its subclasses.
 */
@Value.Immutable
public interface OptionScope {

  /**
   * The global scope.
   *
   * @return the option scope
   */
  static OptionScope global() {
    return ImmutableOptionScope.builder().build();
  }

  /**
   * The scope of one class.
   *
   * @param type the class
   * @return the option scope
   */
  static OptionScope forClass(final Class<?> type) {
    return ImmutableOptionScope.builder().type(type).build();
  }

  /**
   * The class this scope is bound to.
   *
   * @return the class, empty for the global scope
   */
  Optional<Class<?>> type();
}
