package com.codeheadsystems.veil.resolve;

import com.codeheadsystems.veil.exception.ResolutionException;
import com.codeheadsystems.veil.model.AttributeSpec;
import com.codeheadsystems.veil.model.ImmutableResolvedOptions;
import com.codeheadsystems.veil.model.ResolvedOptions;
import com.codeheadsystems.veil.option.OptionKey;
import com.codeheadsystems.veil.option.OptionLayer;
import com.codeheadsystems.veil.transform.Marshaler;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the merged option layer of an attribute into the concrete options for one call. Nothing is memoized: key
 * material may depend on instance state.
 */
@Singleton
public class DescriptorResolver {

  private static final Logger log = LoggerFactory.getLogger(DescriptorResolver.class);

  private final ValueResolver valueResolver;

  /**
   * Instantiates a new Descriptor resolver.
   *
   * @param valueResolver the value resolver
   */
  @Inject
  public DescriptorResolver(final ValueResolver valueResolver) {
    log.info("DescriptorResolver({})", valueResolver);
    this.valueResolver = valueResolver;
  }

  /**
   * Resolve options for one accessor call.
   *
   * @param instance the instance, null for class-level helpers
   * @param spec     the attribute
   * @return the resolved options
   */
  public ResolvedOptions resolve(final Object instance, final AttributeSpec spec) {
    log.trace("resolve({})", spec.name());
    final OptionLayer options = spec.options();
    final ImmutableResolvedOptions.Builder builder = ImmutableResolvedOptions.builder()
        .attributeName(spec.name())
        .storageAttribute(spec.storageAttribute())
        .secretKeyParamName(String.valueOf(resolveRequired(instance, options, OptionKey.SECRET_KEY_PARAM_NAME)))
        .algorithm(String.valueOf(require(options, OptionKey.ALGORITHM)))
        .marshal(flag(options, OptionKey.MARSHAL))
        .allowEmptyValue(flag(options, OptionKey.ALLOW_EMPTY_VALUE))
        .cipherProvider(require(options, OptionKey.CIPHER_PROVIDER))
        .encryptMethod(String.valueOf(require(options, OptionKey.ENCRYPT_METHOD)))
        .decryptMethod(String.valueOf(require(options, OptionKey.DECRYPT_METHOD)))
        .extraOptions(options.extraOptions());

    options.get(OptionKey.KEY)
        .map(k -> valueResolver.resolve(instance, k))
        .ifPresent(builder::key);

    // encode may carry the format itself
    final Object encode = options.get(OptionKey.ENCODE).orElse(Boolean.FALSE);
    if (encode instanceof String) {
      builder.encode(true).encodeFormat((String) encode);
    } else {
      builder.encode(Boolean.TRUE.equals(encode))
          .encodeFormat(options.get(OptionKey.ENCODE_FORMAT, String.class).orElse("base64"));
    }

    final Object marshaler = require(options, OptionKey.MARSHALER);
    if (!(marshaler instanceof Marshaler)) {
      throw new ResolutionException("Option 'marshaler' must be a " + Marshaler.class.getName());
    }
    return builder.marshaler((Marshaler) marshaler).build();
  }

  private Object resolveRequired(final Object instance, final OptionLayer options, final OptionKey key) {
    final Object value = valueResolver.resolve(instance, require(options, key));
    if (value == null) {
      throw new ResolutionException("Option '" + key.optionName() + "' resolved to null");
    }
    return value;
  }

  private Object require(final OptionLayer options, final OptionKey key) {
    return options.get(key)
        .orElseThrow(() -> new ResolutionException("Option '" + key.optionName() + "' is not configured"));
  }

  private boolean flag(final OptionLayer options, final OptionKey key) {
    return options.get(key, Boolean.class).orElse(false);
  }
}
