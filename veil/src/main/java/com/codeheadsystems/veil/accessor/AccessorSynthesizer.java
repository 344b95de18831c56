package com.codeheadsystems.veil.accessor;

import com.codeheadsystems.veil.model.AttributeSpec;
import com.codeheadsystems.veil.resolve.DescriptorResolver;
import com.codeheadsystems.veil.resolve.PredicateEvaluator;
import com.codeheadsystems.veil.transform.TransformPipeline;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the accessors and class-level helpers of declared attributes.
 */
@Singleton
public class AccessorSynthesizer {

  private static final Logger log = LoggerFactory.getLogger(AccessorSynthesizer.class);

  private final DescriptorResolver descriptorResolver;
  private final PredicateEvaluator predicateEvaluator;
  private final TransformPipeline transformPipeline;

  /**
   * Instantiates a new Accessor synthesizer.
   *
   * @param descriptorResolver the descriptor resolver
   * @param predicateEvaluator the predicate evaluator
   * @param transformPipeline  the transform pipeline
   */
  @Inject
  public AccessorSynthesizer(final DescriptorResolver descriptorResolver,
                             final PredicateEvaluator predicateEvaluator,
                             final TransformPipeline transformPipeline) {
    log.info("AccessorSynthesizer({}, {}, {})", descriptorResolver, predicateEvaluator, transformPipeline);
    this.descriptorResolver = descriptorResolver;
    this.predicateEvaluator = predicateEvaluator;
    this.transformPipeline = transformPipeline;
  }

  /**
   * Accessor for an attribute.
   *
   * @param spec the attribute spec
   * @return the attribute accessor
   */
  public AttributeAccessor accessor(final AttributeSpec spec) {
    log.trace("accessor({})", spec.name());
    return new AttributeAccessor(spec, descriptorResolver, predicateEvaluator, transformPipeline);
  }

  /**
   * Class-level helper for an attribute, only when its key and predicates are instance-independent.
   *
   * @param spec the attribute spec
   * @return the class cipher, if eligible
   */
  public Optional<ClassCipher> classCipher(final AttributeSpec spec) {
    if (!spec.instanceIndependent()) {
      log.trace("classCipher({}): instance-dependent", spec.name());
      return Optional.empty();
    }
    return Optional.of(new ClassCipher(spec, descriptorResolver, predicateEvaluator, transformPipeline));
  }
}
