package com.codeheadsystems.veil.accessor;

import com.codeheadsystems.veil.model.AttributeSpec;
import com.codeheadsystems.veil.model.ResolvedOptions;
import com.codeheadsystems.veil.resolve.DescriptorResolver;
import com.codeheadsystems.veil.resolve.PredicateEvaluator;
import com.codeheadsystems.veil.transform.TransformPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Getter and setter of one encrypted attribute, bound to its spec. Options are resolved on every call.
 *
 * <p>The pair does a non-atomic read and store; callers mutating one instance from several threads synchronize
 * externally.</p>
 */
public class AttributeAccessor {

  private static final Logger log = LoggerFactory.getLogger(AttributeAccessor.class);

  private final AttributeSpec spec;
  private final DescriptorResolver descriptorResolver;
  private final PredicateEvaluator predicateEvaluator;
  private final TransformPipeline transformPipeline;

  AttributeAccessor(final AttributeSpec spec,
                    final DescriptorResolver descriptorResolver,
                    final PredicateEvaluator predicateEvaluator,
                    final TransformPipeline transformPipeline) {
    this.spec = spec;
    this.descriptorResolver = descriptorResolver;
    this.predicateEvaluator = predicateEvaluator;
    this.transformPipeline = transformPipeline;
  }

  /**
   * Reads and decrypts the attribute.
   *
   * @param instance the instance
   * @return the logical value
   */
  public Object get(final Object instance) {
    log.trace("get({})", spec.name());
    final Object stored = store(instance).readAttribute(spec.storageAttribute());
    final ResolvedOptions options = descriptorResolver.resolve(instance, spec);
    if (!predicateEvaluator.isAllowed(instance, spec.options())) {
      return stored;
    }
    return transformPipeline.read(stored, options);
  }

  /**
   * Encrypts and stores the attribute. Storage is only written once the whole pipeline succeeded.
   *
   * @param instance the instance
   * @param value    the logical value
   * @return the logical value, not its encrypted form
   */
  public Object set(final Object instance, final Object value) {
    log.trace("set({})", spec.name());
    final AttributeStore store = store(instance);
    final ResolvedOptions options = descriptorResolver.resolve(instance, spec);
    final Object stored = predicateEvaluator.isAllowed(instance, spec.options())
        ? transformPipeline.write(value, options)
        : value;
    store.writeAttribute(spec.storageAttribute(), stored);
    return value;
  }

  /**
   * Spec.
   *
   * @return the attribute spec
   */
  public AttributeSpec spec() {
    return spec;
  }

  private AttributeStore store(final Object instance) {
    if (!(instance instanceof AttributeStore)) {
      throw new IllegalArgumentException(
          (instance == null ? "null" : instance.getClass().getName()) + " is not an " + AttributeStore.class.getName());
    }
    return (AttributeStore) instance;
  }
}
