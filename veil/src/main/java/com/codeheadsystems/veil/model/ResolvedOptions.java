package com.codeheadsystems.veil.model;

import com.codeheadsystems.veil.transform.Marshaler;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Fully merged and resolved configuration for exactly one accessor invocation. Never cached across calls.
 */
@Value.Immutable
public interface ResolvedOptions {

  /**
   * The logical attribute name.
   *
   * @return the name
   */
  String attributeName();

  /**
   * The storage attribute the ciphertext lives in.
   *
   * @return the storage attribute
   */
  String storageAttribute();

  /**
   * Key material, resolved against the instance.
   *
   * @return the key, if any
   */
  Optional<Object> key();

  /**
   * Name under which the key is forwarded to the cipher provider.
   *
   * @return the parameter name
   */
  String secretKeyParamName();

  /**
   * Provider-defined algorithm name.
   *
   * @return the algorithm
   */
  String algorithm();

  /**
   * Whether ciphertext is encoded to text after encryption.
   *
   * @return true if encoding
   */
  boolean encode();

  /**
   * Text encoding format used when {@link #encode()} is set.
   *
   * @return the format
   */
  String encodeFormat();

  /**
   * Whether the value is serialized before encryption.
   *
   * @return true if marshaling
   */
  boolean marshal();

  /**
   * The marshaler used when {@link #marshal()} is set.
   *
   * @return the marshaler
   */
  Marshaler marshaler();

  /**
   * Empty strings are encrypted instead of being treated as absent.
   *
   * @return true if empty strings are encrypted
   */
  boolean allowEmptyValue();

  /**
   * The cipher provider object.
   *
   * @return the provider
   */
  Object cipherProvider();

  /**
   * Entry point invoked on the provider to encrypt.
   *
   * @return the method name
   */
  String encryptMethod();

  /**
   * Entry point invoked on the provider to decrypt.
   *
   * @return the method name
   */
  String decryptMethod();

  /**
   * Options the core does not know about, forwarded verbatim.
   *
   * @return the extra options
   */
  Map<String, Object> extraOptions();

  /**
   * The parameters forwarded to a provider: the key under {@link #secretKeyParamName()}, the algorithm, and every
   * extra option.
   *
   * @return an unmodifiable view of the parameters
   */
  default Map<String, Object> parameters() {
    final Map<String, Object> parameters = new LinkedHashMap<>(extraOptions());
    parameters.put("algorithm", algorithm());
    key().ifPresent(k -> parameters.put(secretKeyParamName(), k));
    return Map.copyOf(parameters);
  }

}
