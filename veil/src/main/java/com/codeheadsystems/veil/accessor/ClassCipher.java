package com.codeheadsystems.veil.accessor;

import com.codeheadsystems.veil.model.AttributeSpec;
import com.codeheadsystems.veil.model.ResolvedOptions;
import com.codeheadsystems.veil.resolve.DescriptorResolver;
import com.codeheadsystems.veil.resolve.PredicateEvaluator;
import com.codeheadsystems.veil.transform.TransformPipeline;

/**
 * Class-level encrypt and decrypt for an attribute whose key and predicates do not depend on an instance. Runs the
 * same resolver and pipeline as {@link AttributeAccessor}, so output matches what the accessor stores.
 */
public class ClassCipher {

  private final AttributeSpec spec;
  private final DescriptorResolver descriptorResolver;
  private final PredicateEvaluator predicateEvaluator;
  private final TransformPipeline transformPipeline;

  ClassCipher(final AttributeSpec spec,
              final DescriptorResolver descriptorResolver,
              final PredicateEvaluator predicateEvaluator,
              final TransformPipeline transformPipeline) {
    this.spec = spec;
    this.descriptorResolver = descriptorResolver;
    this.predicateEvaluator = predicateEvaluator;
    this.transformPipeline = transformPipeline;
  }

  /**
   * Encrypt.
   *
   * @param value the logical value
   * @return the stored form
   */
  public Object encrypt(final Object value) {
    final ResolvedOptions options = descriptorResolver.resolve(null, spec);
    return predicateEvaluator.isAllowed(null, spec.options()) ? transformPipeline.write(value, options) : value;
  }

  /**
   * Decrypt.
   *
   * @param value the stored form
   * @return the logical value
   */
  public Object decrypt(final Object value) {
    final ResolvedOptions options = descriptorResolver.resolve(null, spec);
    return predicateEvaluator.isAllowed(null, spec.options()) ? transformPipeline.read(value, options) : value;
  }

  /**
   * Spec.
   *
   * @return the attribute spec
   */
  public AttributeSpec spec() {
    return spec;
  }
}
