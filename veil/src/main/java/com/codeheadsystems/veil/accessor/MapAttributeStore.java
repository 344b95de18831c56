package com.codeheadsystems.veil.accessor;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Map-backed {@link AttributeStore}. Extend it, or hand the map to a persistence layer.
 */
public class MapAttributeStore implements AttributeStore {

  private final Map<String, Object> attributes = new HashMap<>();

  @Override
  public Object readAttribute(final String storageAttribute) {
    return attributes.get(storageAttribute);
  }

  @Override
  public void writeAttribute(final String storageAttribute, final Object value) {
    attributes.put(storageAttribute, value);
  }

  /**
   * Stored attributes.
   *
   * @return an unmodifiable view
   */
  public Map<String, Object> storedAttributes() {
    return Collections.unmodifiableMap(attributes);
  }
}
