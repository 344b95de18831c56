package com.codeheadsystems.veil.encryption;

import com.codeheadsystems.veil.model.ResolvedOptions;

/**
 * Performs the actual encrypt and decrypt transform for an attribute. The core forwards the algorithm, the key
 * under its configured parameter name and every extra option through {@link ResolvedOptions}, and never inspects
 * what the provider does with them.
 */
public interface CipherProvider {

  /**
   * Encrypts a value for storage.
   *
   * @param value   plaintext, a String or bytes (serialized text when marshaling is enabled)
   * @param options the resolved options for this call
   * @return the ciphertext
   */
  Object encrypt(Object value, ResolvedOptions options);

  /**
   * Decrypts a stored value.
   *
   * @param value   the ciphertext
   * @param options the resolved options for this call
   * @return the plaintext
   */
  Object decrypt(Object value, ResolvedOptions options);

  /**
   * Whether declarations using this provider must configure a key.
   *
   * @return true if a key is required
   */
  default boolean requiresKey() {
    return true;
  }
}
