package com.codeheadsystems.veil.option;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The fixed set of options the core understands. Anything else is an extra option forwarded to the cipher provider.
 */
public enum OptionKey {

  KEY("key"),
  SECRET_KEY_PARAM_NAME("secretKeyParamName"),
  STORAGE_ATTRIBUTE("attribute", "storageAttribute"),
  PREFIX("prefix"),
  SUFFIX("suffix"),
  IF_PREDICATE("if", "ifPredicate"),
  UNLESS_PREDICATE("unless", "unlessPredicate"),
  CIPHER_PROVIDER("cipherProvider"),
  ENCRYPT_METHOD("encryptMethod"),
  DECRYPT_METHOD("decryptMethod"),
  ALGORITHM("algorithm"),
  ENCODE("encode"),
  ENCODE_FORMAT("encodeFormat"),
  MARSHAL("marshal"),
  MARSHALER("marshaler"),
  ALLOW_EMPTY_VALUE("allowEmptyValue");

  private final List<String> names;

  OptionKey(final String... names) {
    this.names = List.of(names);
  }

  /**
   * Finds the option key for a configuration name.
   *
   * @param name the name, e.g. "secretKeyParamName" or "if"
   * @return the key, or empty if the name is an extra option
   */
  public static Optional<OptionKey> fromName(final String name) {
    return Arrays.stream(values())
        .filter(k -> k.names.contains(name))
        .findFirst();
  }

  /**
   * The canonical configuration name.
   *
   * @return the name
   */
  public String optionName() {
    return names.get(0);
  }
}
