package com.codeheadsystems.veil.option;

import com.codeheadsystems.veil.encryption.CipherProvider;
import com.codeheadsystems.veil.exception.DeclarationException;
import com.codeheadsystems.veil.model.AttributeSpec;
import com.codeheadsystems.veil.model.ImmutableAttributeSpec;
import com.codeheadsystems.veil.resolve.Resolvable;
import com.codeheadsystems.veil.transform.Encoding;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the global, per-class and per-attribute option layers and the declared attributes.
 *
 * <p>Precedence is attribute over class over global; a subclass layer wins over its superclass layer. Each
 * declaration snapshots the merged layers, so defaults changed later only affect later declarations.</p>
 *
 * <p>Declarations are expected to happen at start-up; the registry does no locking.</p>
 */
@Singleton
public class OptionRegistry {

  /**
   * Name of the injected global default layer.
   */
  public static final String GLOBAL_DEFAULTS = "veilGlobalDefaults";

  private static final Logger log = LoggerFactory.getLogger(OptionRegistry.class);

  private static final List<OptionKey> REQUIRED = List.of(
      OptionKey.SECRET_KEY_PARAM_NAME, OptionKey.ALGORITHM, OptionKey.CIPHER_PROVIDER,
      OptionKey.ENCRYPT_METHOD, OptionKey.DECRYPT_METHOD, OptionKey.MARSHALER);

  private final Map<Class<?>, OptionLayer> classDefaults;
  private final Map<Class<?>, Map<String, AttributeSpec>> attributes;
  private OptionLayer globalDefaults;

  /**
   * Instantiates a new Option registry.
   *
   * @param globalDefaults the global default layer
   */
  @Inject
  public OptionRegistry(@Named(GLOBAL_DEFAULTS) final OptionLayer globalDefaults) {
    log.info("OptionRegistry({})", globalDefaults);
    this.globalDefaults = globalDefaults;
    this.classDefaults = new HashMap<>();
    this.attributes = new HashMap<>();
  }

  /**
   * Merges options into the default layer of a scope.
   *
   * @param scope   the scope
   * @param options the options to merge in
   */
  public void setDefault(final OptionScope scope, final OptionLayer options) {
    log.info("setDefault({}, {})", scope, options);
    if (scope.type().isEmpty()) {
      globalDefaults = globalDefaults.overlay(options);
    } else {
      classDefaults.merge(scope.type().get(), options, OptionLayer::overlay);
    }
  }

  /**
   * Declares one attribute.
   *
   * @param type    the owning class
   * @param name    the logical name
   * @param options the per-attribute options
   * @return the attribute spec
   */
  public AttributeSpec declareAttribute(final Class<?> type, final String name, final OptionLayer options) {
    return declareAttributes(type, List.of(name), options).get(0);
  }

  /**
   * Declares several attributes sharing one option layer. Either every attribute is registered or none is.
   *
   * @param type    the owning class
   * @param names   the logical names
   * @param options the per-attribute options
   * @return the attribute specs, in the order given
   */
  public List<AttributeSpec> declareAttributes(final Class<?> type,
                                               final List<String> names,
                                               final OptionLayer options) {
    log.trace("declareAttributes({}, {})", type.getName(), names);
    if (names.isEmpty()) {
      throw new DeclarationException("At least one attribute name is required for " + type.getName());
    }
    final Map<String, String> storageNames = new HashMap<>();
    attributes(type).forEach((name, spec) -> storageNames.put(spec.storageAttribute(), name));
    names.forEach(name -> storageNames.values().remove(name));

    final List<AttributeSpec> specs = new ArrayList<>();
    for (String name : names) {
      final AttributeSpec spec = buildSpec(type, name, options);
      final String existing = storageNames.putIfAbsent(spec.storageAttribute(), name);
      if (existing != null && !existing.equals(name)) {
        throw new DeclarationException("Attributes '" + existing + "' and '" + name + "' of " + type.getName()
            + " both store to '" + spec.storageAttribute() + "'");
      }
      specs.add(spec);
    }
    final Map<String, AttributeSpec> declared = attributes.computeIfAbsent(type, t -> new LinkedHashMap<>());
    specs.forEach(spec -> declared.put(spec.name(), spec));
    return specs;
  }

  /**
   * The layers that apply to an attribute, lowest precedence first: global, each class from the root of the
   * hierarchy down to {@code type}, and the attribute's own layer when it is declared.
   *
   * @param type the class
   * @param name the attribute
   * @return the layers
   */
  public List<OptionLayer> effectiveLayers(final Class<?> type, final String name) {
    final List<OptionLayer> layers = classLayers(type);
    attribute(type, name).ifPresent(spec -> layers.add(spec.declaredOptions()));
    return layers;
  }

  /**
   * Looks up a declared attribute, including attributes inherited from superclasses.
   *
   * @param type the class
   * @param name the attribute
   * @return the attribute spec, if declared
   */
  public Optional<AttributeSpec> attribute(final Class<?> type, final String name) {
    return Optional.ofNullable(attributes(type).get(name));
  }

  /**
   * All attributes visible on a class. Subclass declarations shadow inherited ones.
   *
   * @param type the class
   * @return attribute name to spec, superclass declarations first
   */
  public Map<String, AttributeSpec> attributes(final Class<?> type) {
    final Map<String, AttributeSpec> result = new LinkedHashMap<>();
    hierarchy(type).forEach(c -> result.putAll(attributes.getOrDefault(c, Map.of())));
    return Collections.unmodifiableMap(result);
  }

  private AttributeSpec buildSpec(final Class<?> type, final String name, final OptionLayer declared) {
    final List<OptionLayer> layers = classLayers(type);
    layers.add(declared);
    final OptionLayer merged = OptionLayer.merge(layers);

    for (OptionKey key : REQUIRED) {
      if (!merged.contains(key)) {
        throw new DeclarationException("Option '" + key.optionName() + "' is not configured for " + name);
      }
    }
    final Object provider = merged.get(OptionKey.CIPHER_PROVIDER).get();
    final boolean keyRequired = !(provider instanceof CipherProvider) || ((CipherProvider) provider).requiresKey();
    if (keyRequired && !merged.contains(OptionKey.KEY)) {
      throw new DeclarationException("No key configured for attribute '" + name + "' of " + type.getName());
    }
    final Object encode = merged.get(OptionKey.ENCODE).orElse(Boolean.FALSE);
    final Object format = encode instanceof String ? encode : merged.get(OptionKey.ENCODE_FORMAT).orElse(null);
    if (!Boolean.FALSE.equals(encode) && format != null) {
      try {
        Encoding.forFormat(String.valueOf(format));
      } catch (IllegalArgumentException e) {
        throw new DeclarationException("Attribute '" + name + "': " + e.getMessage(), e);
      }
    }

    return ImmutableAttributeSpec.builder()
        .owner(type)
        .name(name)
        .storageAttribute(storageAttribute(name, merged))
        .declaredOptions(declared)
        .options(merged)
        .instanceIndependent(isInstanceIndependent(merged))
        .build();
  }

  private String storageAttribute(final String name, final OptionLayer merged) {
    return merged.get(OptionKey.STORAGE_ATTRIBUTE, String.class)
        .orElseGet(() -> merged.get(OptionKey.PREFIX, String.class).orElse("")
            + name
            + merged.get(OptionKey.SUFFIX, String.class).orElse(""));
  }

  private boolean isInstanceIndependent(final OptionLayer merged) {
    return List.of(OptionKey.KEY, OptionKey.SECRET_KEY_PARAM_NAME, OptionKey.IF_PREDICATE,
            OptionKey.UNLESS_PREDICATE).stream()
        .map(merged::get)
        .flatMap(Optional::stream)
        .allMatch(Resolvable::isInstanceIndependent);
  }

  private List<OptionLayer> classLayers(final Class<?> type) {
    final List<OptionLayer> layers = new ArrayList<>();
    layers.add(globalDefaults);
    hierarchy(type).stream()
        .map(classDefaults::get)
        .filter(layer -> layer != null)
        .forEach(layers::add);
    return layers;
  }

  // root first
  private List<Class<?>> hierarchy(final Class<?> type) {
    final List<Class<?>> chain = new ArrayList<>();
    for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
      chain.add(0, current);
    }
    return chain;
  }
}
