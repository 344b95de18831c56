package com.codeheadsystems.veil.model;

import com.codeheadsystems.veil.option.OptionLayer;
import org.immutables.value.Value;

/**
 * A declared encrypted attribute. Created once at declaration time; re-declaring the attribute replaces it.
 */
@Value.Immutable
public interface AttributeSpec {

  /**
   * The class the attribute was declared on.
   *
   * @return the owner
   */
  Class<?> owner();

  /**
   * Logical attribute name.
   *
   * @return the name
   */
  String name();

  /**
   * Storage attribute name, derived from prefix, name and suffix or an explicit override.
   *
   * @return the storage attribute
   */
  String storageAttribute();

  /**
   * The per-attribute layer exactly as it was declared.
   *
   * @return the declared options
   */
  OptionLayer declaredOptions();

  /**
   * Global, class and attribute layers merged at declaration time.
   *
   * @return the merged options
   */
  OptionLayer options();

  /**
   * True when key and predicates can be resolved without an instance.
   *
   * @return true if instance-independent
   */
  boolean instanceIndependent();

}
