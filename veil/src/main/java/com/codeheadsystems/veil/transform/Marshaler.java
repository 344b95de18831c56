package com.codeheadsystems.veil.transform;

/**
 * Serializes structured values to text before encryption and back after decryption.
 */
public interface Marshaler {

  /**
   * Marshal.
   *
   * @param value the value
   * @return the serialized form
   */
  String marshal(Object value);

  /**
   * Unmarshal.
   *
   * @param serialized the serialized form
   * @return the value
   */
  Object unmarshal(String serialized);
}
