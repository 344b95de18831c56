package com.codeheadsystems.veil;

import com.codeheadsystems.veil.accessor.AccessorSynthesizer;
import com.codeheadsystems.veil.dagger.VeilComponent;
import com.codeheadsystems.veil.model.AttributeSpec;
import com.codeheadsystems.veil.model.VeilConfiguration;
import com.codeheadsystems.veil.option.OptionLayer;
import com.codeheadsystems.veil.option.OptionRegistry;
import com.codeheadsystems.veil.option.OptionScope;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Declaration surface. Owns the option registry and one {@link EncryptedClass} table per class.
 *
 * <pre>{@code
 * EncryptedAttributes encrypted = EncryptedAttributes.create();
 * EncryptedClass<User> users = encrypted.declare(User.class,
 *     OptionLayer.builder().key(Resolvable.method("encryptionKey")).encode(true).build(),
 *     "ssn", "email");
 * users.set(user, "ssn", "123-45-6789");
 * }</pre>
 */
@Singleton
public class EncryptedAttributes {

  private static final Logger log = LoggerFactory.getLogger(EncryptedAttributes.class);

  private final OptionRegistry optionRegistry;
  private final AccessorSynthesizer accessorSynthesizer;
  private final Map<Class<?>, EncryptedClass<?>> tables;

  /**
   * Instantiates a new Encrypted attributes.
   *
   * @param optionRegistry      the option registry
   * @param accessorSynthesizer the accessor synthesizer
   */
  @Inject
  public EncryptedAttributes(final OptionRegistry optionRegistry,
                             final AccessorSynthesizer accessorSynthesizer) {
    log.info("EncryptedAttributes({}, {})", optionRegistry, accessorSynthesizer);
    this.optionRegistry = optionRegistry;
    this.accessorSynthesizer = accessorSynthesizer;
    this.tables = new HashMap<>();
  }

  /**
   * A fresh instance with default configuration.
   *
   * @return the encrypted attributes
   */
  public static EncryptedAttributes create() {
    return create(VeilConfiguration.defaults());
  }

  /**
   * A fresh instance.
   *
   * @param configuration the configuration
   * @return the encrypted attributes
   */
  public static EncryptedAttributes create(final VeilConfiguration configuration) {
    return VeilComponent.instance(configuration).encryptedAttributes();
  }

  /**
   * Merges options into the global defaults. Affects later declarations only.
   *
   * @param options the options
   */
  public void setGlobalDefaults(final OptionLayer options) {
    optionRegistry.setDefault(OptionScope.global(), options);
  }

  /**
   * Merges options into the defaults of a class and its subclasses. Affects later declarations only.
   *
   * @param type    the class
   * @param options the options
   */
  public void setDefaults(final Class<?> type, final OptionLayer options) {
    optionRegistry.setDefault(OptionScope.forClass(type), options);
  }

  /**
   * Declares attributes with default options.
   *
   * @param type  the class
   * @param name  the first attribute
   * @param more  further attributes
   * @param <T>   the class
   * @return the table of the class
   */
  public <T> EncryptedClass<T> declare(final Class<T> type, final String name, final String... more) {
    return declare(type, OptionLayer.empty(), name, more);
  }

  /**
   * Declares attributes sharing one option layer.
   *
   * @param type    the class
   * @param options the per-attribute options
   * @param name    the first attribute
   * @param more    further attributes
   * @param <T>     the class
   * @return the table of the class
   */
  public <T> EncryptedClass<T> declare(final Class<T> type,
                                       final OptionLayer options,
                                       final String name,
                                       final String... more) {
    final List<String> names = new ArrayList<>();
    names.add(name);
    names.addAll(Arrays.asList(more));
    log.info("declare({}, {})", type.getName(), names);

    final List<AttributeSpec> specs = optionRegistry.declareAttributes(type, names, options);
    final EncryptedClass<T> table = forClass(type);
    specs.forEach(spec -> table.register(
        accessorSynthesizer.accessor(spec),
        accessorSynthesizer.classCipher(spec)));
    return table;
  }

  /**
   * The table of a class, empty if nothing was declared on it or its superclasses.
   *
   * @param type the class
   * @param <T>  the class
   * @return the table
   */
  @SuppressWarnings("unchecked")
  public <T> EncryptedClass<T> forClass(final Class<T> type) {
    return (EncryptedClass<T>) tables.computeIfAbsent(type,
        t -> new EncryptedClass<>(type, () -> nearestTable(type.getSuperclass())));
  }

  /**
   * Is encrypted.
   *
   * @param type the class
   * @param name the attribute
   * @return true if declared on the class or a superclass
   */
  public boolean isEncrypted(final Class<?> type, final String name) {
    return optionRegistry.attribute(type, name).isPresent();
  }

  /**
   * Option registry.
   *
   * @return the option registry
   */
  public OptionRegistry optionRegistry() {
    return optionRegistry;
  }

  private Optional<EncryptedClass<?>> nearestTable(final Class<?> type) {
    for (Class<?> current = type; current != null; current = current.getSuperclass()) {
      final EncryptedClass<?> table = tables.get(current);
      if (table != null) {
        return Optional.of(table);
      }
    }
    return Optional.empty();
  }
}
