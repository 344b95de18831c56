package com.codeheadsystems.veil.resolve;

import com.codeheadsystems.veil.exception.ResolutionException;
import com.codeheadsystems.veil.option.OptionKey;
import com.codeheadsystems.veil.option.OptionLayer;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates the {@code if} and {@code unless} gates of an attribute.
 */
@Singleton
public class PredicateEvaluator {

  private static final Logger log = LoggerFactory.getLogger(PredicateEvaluator.class);

  private final ValueResolver valueResolver;

  /**
   * Instantiates a new Predicate evaluator.
   *
   * @param valueResolver the value resolver
   */
  @Inject
  public PredicateEvaluator(final ValueResolver valueResolver) {
    log.info("PredicateEvaluator({})", valueResolver);
    this.valueResolver = valueResolver;
  }

  /**
   * Evaluates one predicate. A null result counts as false.
   *
   * @param instance  the instance, may be null for class-level helpers
   * @param predicate a Boolean or a resolvable yielding one
   * @return the result
   */
  public boolean evaluate(final Object instance, final Object predicate) {
    final Object result = valueResolver.resolve(instance, predicate);
    if (result == null) {
      return false;
    }
    if (!(result instanceof Boolean)) {
      throw new ResolutionException("Predicate must resolve to a Boolean but was " + result.getClass().getName());
    }
    return (Boolean) result;
  }

  /**
   * Whether the transform pipeline may run. A missing {@code if} is true, a missing {@code unless} is false.
   *
   * @param instance the instance
   * @param options  the merged options of the attribute
   * @return true if allowed
   */
  public boolean isAllowed(final Object instance, final OptionLayer options) {
    final boolean ifResult = options.get(OptionKey.IF_PREDICATE)
        .map(p -> evaluate(instance, p))
        .orElse(true);
    if (!ifResult) {
      log.trace("isAllowed: if gate closed");
      return false;
    }
    final boolean unlessResult = options.get(OptionKey.UNLESS_PREDICATE)
        .map(p -> evaluate(instance, p))
        .orElse(false);
    log.trace("isAllowed: unless={}", unlessResult);
    return !unlessResult;
  }
}
