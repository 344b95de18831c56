package com.codeheadsystems.veil.transform;

/**
 * Steps of the transform pipeline, in write order followed by read order.
 */
public enum Stage {
  MARSHAL,
  ENCRYPT,
  ENCODE,
  DECODE,
  DECRYPT,
  UNMARSHAL
}
