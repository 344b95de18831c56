package com.codeheadsystems.veil.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Process-level defaults. Becomes the global option layer.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableVeilConfiguration.class)
@JsonDeserialize(builder = ImmutableVeilConfiguration.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface VeilConfiguration {

  /**
   * Default configuration.
   *
   * @return the veil configuration
   */
  static VeilConfiguration defaults() {
    return ImmutableVeilConfiguration.builder().build();
  }

  /**
   * Storage attribute prefix.
   *
   * @return the prefix
   */
  @Value.Default
  default String prefix() {
    return "encrypted_";
  }

  /**
   * Storage attribute suffix.
   *
   * @return the suffix
   */
  @Value.Default
  default String suffix() {
    return "";
  }

  /**
   * Secret key param name.
   *
   * @return the string
   */
  @Value.Default
  default String secretKeyParamName() {
    return "key";
  }

  /**
   * Algorithm handed to the cipher provider.
   *
   * @return the algorithm
   */
  @Value.Default
  default String algorithm() {
    return "aes-256-cbc";
  }

  /**
   * Encode.
   *
   * @return true if ciphertext is text-encoded by default
   */
  @Value.Default
  default boolean encode() {
    return false;
  }

  /**
   * Encode format, one of base64, base64url or hex.
   *
   * @return the format
   */
  @Value.Default
  default String encodeFormat() {
    return "base64";
  }

  /**
   * Marshal.
   *
   * @return true if values are serialized by default
   */
  @Value.Default
  default boolean marshal() {
    return false;
  }

  /**
   * Allow empty value.
   *
   * @return true if empty strings are encrypted by default
   */
  @Value.Default
  default boolean allowEmptyValue() {
    return false;
  }

}
