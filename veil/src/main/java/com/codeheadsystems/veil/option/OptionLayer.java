package com.codeheadsystems.veil.option;

import com.codeheadsystems.veil.transform.Marshaler;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import org.immutables.value.Value;

/**
 * One precedence level of configuration. Values are keyed by {@link OptionKey}; unrecognised names are kept as
 * extra options. Iteration order is fixed by the enum and by extra option name, never by insertion order.
 */
@Value.Immutable
public interface OptionLayer {

  /**
   * Empty option layer.
   *
   * @return the option layer
   */
  static OptionLayer empty() {
    return builder().build();
  }

  /**
   * Builder.
   *
   * @return the builder
   */
  static Builder builder() {
    return new Builder();
  }

  /**
   * Merges layers. Later layers take precedence over earlier ones.
   *
   * @param lowestFirst layers ordered from lowest to highest precedence
   * @return the merged layer
   */
  static OptionLayer merge(final List<OptionLayer> lowestFirst) {
    final Builder builder = builder();
    lowestFirst.forEach(builder::from);
    return builder.build();
  }

  /**
   * Known options. Values may hold key material, so they stay out of {@code toString}.
   *
   * @return the values
   */
  @Value.NaturalOrder
  @Value.Redacted
  SortedMap<OptionKey, Object> values();

  /**
   * Options with names outside {@link OptionKey}, forwarded to the cipher provider.
   *
   * @return the extra options
   */
  @Value.NaturalOrder
  @Value.Redacted
  SortedMap<String, Object> extraOptions();

  /**
   * Returns this layer with {@code higher} laid over it.
   *
   * @param higher the layer taking precedence
   * @return the merged layer
   */
  default OptionLayer overlay(final OptionLayer higher) {
    return builder().from(this).from(higher).build();
  }

  /**
   * Get.
   *
   * @param key the key
   * @return the value, if set
   */
  default Optional<Object> get(final OptionKey key) {
    return Optional.ofNullable(values().get(key));
  }

  /**
   * Get, only if the value has the expected type.
   *
   * @param key  the key
   * @param type the expected type
   * @param <T>  the type
   * @return the value
   */
  default <T> Optional<T> get(final OptionKey key, final Class<T> type) {
    return get(key).filter(type::isInstance).map(type::cast);
  }

  /**
   * Contains.
   *
   * @param key the key
   * @return true if set in this layer
   */
  default boolean contains(final OptionKey key) {
    return values().containsKey(key);
  }

  /**
   * Is empty.
   *
   * @return true if nothing is set
   */
  default boolean isEmpty() {
    return values().isEmpty() && extraOptions().isEmpty();
  }

  /**
   * Builds option layers. Setting an option twice keeps the last value, and {@code from} lays a whole layer over
   * what is already set.
   */
  class Builder extends ImmutableOptionLayer.Builder {

    /**
     * Sets an option by configuration name. Unknown names become extra options.
     *
     * @param name  the option name
     * @param value the value
     * @return the builder
     */
    public Builder option(final String name, final Object value) {
      Objects.requireNonNull(value, name);
      final Optional<OptionKey> key = OptionKey.fromName(name);
      if (key.isPresent()) {
        return set(key.get(), value);
      }
      putExtraOptions(name, value);
      return this;
    }

    /**
     * Sets a known option.
     *
     * @param key   the key
     * @param value the value
     * @return the builder
     */
    public Builder set(final OptionKey key, final Object value) {
      putValues(key, Objects.requireNonNull(value, key.optionName()));
      return this;
    }

    /**
     * Key material: a literal, a {@link com.codeheadsystems.veil.resolve.Resolvable}, or any plain value.
     *
     * @param key the key
     * @return the builder
     */
    public Builder key(final Object key) {
      return set(OptionKey.KEY, key);
    }

    /**
     * Secret key param name.
     *
     * @param name the name, or a resolvable producing it
     * @return the builder
     */
    public Builder secretKeyParamName(final Object name) {
      return set(OptionKey.SECRET_KEY_PARAM_NAME, name);
    }

    /**
     * Explicit storage attribute name.
     *
     * @param attribute the attribute
     * @return the builder
     */
    public Builder attribute(final String attribute) {
      return set(OptionKey.STORAGE_ATTRIBUTE, attribute);
    }

    /**
     * Prefix.
     *
     * @param prefix the prefix
     * @return the builder
     */
    public Builder prefix(final String prefix) {
      return set(OptionKey.PREFIX, prefix);
    }

    /**
     * Suffix.
     *
     * @param suffix the suffix
     * @return the builder
     */
    public Builder suffix(final String suffix) {
      return set(OptionKey.SUFFIX, suffix);
    }

    /**
     * The {@code if} gate: transforms run only when it is true.
     *
     * @param predicate a Boolean or a resolvable
     * @return the builder
     */
    public Builder onlyIf(final Object predicate) {
      return set(OptionKey.IF_PREDICATE, predicate);
    }

    /**
     * The {@code unless} gate: transforms are skipped when it is true.
     *
     * @param predicate a Boolean or a resolvable
     * @return the builder
     */
    public Builder unless(final Object predicate) {
      return set(OptionKey.UNLESS_PREDICATE, predicate);
    }

    /**
     * Cipher provider.
     *
     * @param provider a {@link com.codeheadsystems.veil.encryption.CipherProvider} or any object exposing the
     *                 configured entry points
     * @return the builder
     */
    public Builder cipherProvider(final Object provider) {
      return set(OptionKey.CIPHER_PROVIDER, provider);
    }

    /**
     * Encrypt method.
     *
     * @param method the method
     * @return the builder
     */
    public Builder encryptMethod(final String method) {
      return set(OptionKey.ENCRYPT_METHOD, method);
    }

    /**
     * Decrypt method.
     *
     * @param method the method
     * @return the builder
     */
    public Builder decryptMethod(final String method) {
      return set(OptionKey.DECRYPT_METHOD, method);
    }

    /**
     * Algorithm.
     *
     * @param algorithm the algorithm
     * @return the builder
     */
    public Builder algorithm(final String algorithm) {
      return set(OptionKey.ALGORITHM, algorithm);
    }

    /**
     * Encode.
     *
     * @param encode the encode
     * @return the builder
     */
    public Builder encode(final boolean encode) {
      return set(OptionKey.ENCODE, encode);
    }

    /**
     * Turns encoding on with an explicit format.
     *
     * @param format the format
     * @return the builder
     */
    public Builder encode(final String format) {
      set(OptionKey.ENCODE, Boolean.TRUE);
      return set(OptionKey.ENCODE_FORMAT, format);
    }

    /**
     * Encode format.
     *
     * @param format the format
     * @return the builder
     */
    public Builder encodeFormat(final String format) {
      return set(OptionKey.ENCODE_FORMAT, format);
    }

    /**
     * Marshal.
     *
     * @param marshal the marshal
     * @return the builder
     */
    public Builder marshal(final boolean marshal) {
      return set(OptionKey.MARSHAL, marshal);
    }

    /**
     * Marshaler.
     *
     * @param marshaler the marshaler
     * @return the builder
     */
    public Builder marshaler(final Marshaler marshaler) {
      return set(OptionKey.MARSHALER, marshaler);
    }

    /**
     * Allow empty value.
     *
     * @param allowEmptyValue the allow empty value
     * @return the builder
     */
    public Builder allowEmptyValue(final boolean allowEmptyValue) {
      return set(OptionKey.ALLOW_EMPTY_VALUE, allowEmptyValue);
    }
  }
}
