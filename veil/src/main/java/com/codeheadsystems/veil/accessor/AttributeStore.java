package com.codeheadsystems.veil.accessor;

/**
 * Storage side of an object with encrypted attributes. Implementations only move values in and out; they never see
 * plaintext of encrypted attributes.
 */
public interface AttributeStore {

  /**
   * Reads a storage attribute.
   *
   * @param storageAttribute the storage attribute name
   * @return the stored value, null if unset
   */
  Object readAttribute(String storageAttribute);

  /**
   * Writes a storage attribute.
   *
   * @param storageAttribute the storage attribute name
   * @param value            the value, may be null
   */
  void writeAttribute(String storageAttribute, Object value);
}
