package com.codeheadsystems.veil;

import com.codeheadsystems.veil.accessor.AttributeAccessor;
import com.codeheadsystems.veil.accessor.ClassCipher;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The encrypted attribute table of one class: attribute name to bound accessor, plus class-level helpers for the
 * attributes that qualify. Attributes declared on superclasses are visible unless redeclared here.
 *
 * @param <T> the class
 */
public class EncryptedClass<T> {

  private static final Logger log = LoggerFactory.getLogger(EncryptedClass.class);

  private final Class<T> type;
  private final Supplier<Optional<EncryptedClass<?>>> parent;
  private final Map<String, AttributeAccessor> accessors;
  private final Map<String, ClassCipher> classCiphers;

  EncryptedClass(final Class<T> type, final Supplier<Optional<EncryptedClass<?>>> parent) {
    this.type = type;
    this.parent = parent;
    this.accessors = new LinkedHashMap<>();
    this.classCiphers = new HashMap<>();
  }

  void register(final AttributeAccessor accessor, final Optional<ClassCipher> classCipher) {
    final String name = accessor.spec().name();
    accessors.put(name, accessor);
    classCipher.ifPresentOrElse(c -> classCiphers.put(name, c), () -> classCiphers.remove(name));
  }

  /**
   * The class.
   *
   * @return the type
   */
  public Class<T> type() {
    return type;
  }

  /**
   * Reads and decrypts an attribute.
   *
   * @param instance the instance
   * @param name     the attribute
   * @return the logical value
   */
  public Object get(final T instance, final String name) {
    return require(name).get(instance);
  }

  /**
   * Reads and decrypts an attribute, cast to the expected type.
   *
   * @param instance the instance
   * @param name     the attribute
   * @param valueType the expected type
   * @param <V>      the type
   * @return the logical value
   */
  public <V> V get(final T instance, final String name, final Class<V> valueType) {
    return valueType.cast(get(instance, name));
  }

  /**
   * Encrypts and stores an attribute.
   *
   * @param instance the instance
   * @param name     the attribute
   * @param value    the logical value
   * @return the logical value
   */
  public Object set(final T instance, final String name, final Object value) {
    return require(name).set(instance, value);
  }

  /**
   * Accessor for an attribute.
   *
   * @param name the attribute
   * @return the accessor, if the attribute is encrypted
   */
  public Optional<AttributeAccessor> accessor(final String name) {
    final AttributeAccessor accessor = accessors.get(name);
    if (accessor != null) {
      return Optional.of(accessor);
    }
    return parent.get().flatMap(p -> p.accessor(name));
  }

  /**
   * Is encrypted.
   *
   * @param name the attribute
   * @return true if the attribute is declared encrypted on this class or a superclass
   */
  public boolean isEncrypted(final String name) {
    return accessor(name).isPresent();
  }

  /**
   * Names of every encrypted attribute, inherited ones first.
   *
   * @return the names
   */
  public Set<String> attributeNames() {
    final Set<String> names = new LinkedHashSet<>();
    parent.get().ifPresent(p -> names.addAll(p.attributeNames()));
    names.addAll(accessors.keySet());
    return Collections.unmodifiableSet(names);
  }

  /**
   * Class-level encrypt/decrypt for an attribute with an instance-independent key and predicates.
   *
   * @param name the attribute
   * @return the class cipher, empty if the attribute is unknown or instance-dependent
   */
  public Optional<ClassCipher> classCipher(final String name) {
    if (accessors.containsKey(name)) {
      return Optional.ofNullable(classCiphers.get(name));
    }
    return parent.get().flatMap(p -> p.classCipher(name));
  }

  /**
   * Logical attribute name to storage attribute name, for persistence adapters.
   *
   * @return the mapping
   */
  public Map<String, String> storageAttributes() {
    final Map<String, String> mapping = new LinkedHashMap<>();
    attributeNames().forEach(name -> mapping.put(name, require(name).spec().storageAttribute()));
    return Collections.unmodifiableMap(mapping);
  }

  /**
   * The subset of {@link #storageAttributes()} that can be queried by ciphertext.
   *
   * @return the mapping
   */
  public Map<String, String> queryableStorageAttributes() {
    final Map<String, String> mapping = new LinkedHashMap<>();
    storageAttributes().forEach((name, storage) -> {
      if (classCipher(name).isPresent()) {
        mapping.put(name, storage);
      }
    });
    return Collections.unmodifiableMap(mapping);
  }

  /**
   * Rewrites query criteria on logical attributes into criteria on storage attributes. Values of encrypted
   * attributes are encrypted the way the accessor would store them; other criteria pass through.
   *
   * @param criteria attribute name to plaintext value
   * @return storage attribute name to stored value
   * @throws IllegalArgumentException if an encrypted attribute depends on the instance
   */
  public Map<String, Object> translateCriteria(final Map<String, Object> criteria) {
    log.trace("translateCriteria({})", criteria.keySet());
    final Map<String, Object> translated = new LinkedHashMap<>();
    criteria.forEach((name, value) -> {
      if (!isEncrypted(name)) {
        translated.put(name, value);
        return;
      }
      final ClassCipher cipher = classCipher(name).orElseThrow(() -> new IllegalArgumentException(
          "Attribute '" + name + "' of " + type.getName() + " has an instance-dependent key and cannot be queried"));
      translated.put(cipher.spec().storageAttribute(), cipher.encrypt(value));
    });
    return translated;
  }

  private AttributeAccessor require(final String name) {
    return accessor(name).orElseThrow(() -> new IllegalArgumentException(
        type.getName() + " has no encrypted attribute '" + name + "'"));
  }
}
