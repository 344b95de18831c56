package com.codeheadsystems.veil.transform;

import com.codeheadsystems.veil.encryption.CipherProvider;
import com.codeheadsystems.veil.exception.TransformException;
import com.codeheadsystems.veil.model.ResolvedOptions;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Calls the configured entry point of a cipher provider.
 *
 * <p>A {@link CipherProvider} using the default entry points {@code encrypt}/{@code decrypt} is called directly.
 * Any other provider object or entry point name is looked up by name and must accept {@code (value,
 * ResolvedOptions)} or {@code (value, Map<String, Object>)}; the map form receives
 * {@link ResolvedOptions#parameters()}. When both overloads exist the {@code ResolvedOptions} one is called.</p>
 *
 * <p>Unchecked exceptions raised by the provider propagate unwrapped.</p>
 */
@Singleton
public class CipherInvoker {

  /**
   * Default encrypt entry point.
   */
  public static final String ENCRYPT = "encrypt";
  /**
   * Default decrypt entry point.
   */
  public static final String DECRYPT = "decrypt";

  private static final Logger log = LoggerFactory.getLogger(CipherInvoker.class);

  /**
   * Instantiates a new Cipher invoker.
   */
  @Inject
  public CipherInvoker() {
    log.info("CipherInvoker()");
  }

  /**
   * Encrypt.
   *
   * @param value   the value
   * @param options the options
   * @return the ciphertext
   */
  public Object encrypt(final Object value, final ResolvedOptions options) {
    final Object provider = options.cipherProvider();
    final Object result;
    if (provider instanceof CipherProvider && ENCRYPT.equals(options.encryptMethod())) {
      result = ((CipherProvider) provider).encrypt(value, options);
    } else {
      result = invoke(Stage.ENCRYPT, provider, options.encryptMethod(), value, options);
    }
    return requireResult(Stage.ENCRYPT, result, options);
  }

  /**
   * Decrypt.
   *
   * @param value   the value
   * @param options the options
   * @return the plaintext
   */
  public Object decrypt(final Object value, final ResolvedOptions options) {
    final Object provider = options.cipherProvider();
    final Object result;
    if (provider instanceof CipherProvider && DECRYPT.equals(options.decryptMethod())) {
      result = ((CipherProvider) provider).decrypt(value, options);
    } else {
      result = invoke(Stage.DECRYPT, provider, options.decryptMethod(), value, options);
    }
    return requireResult(Stage.DECRYPT, result, options);
  }

  private Object requireResult(final Stage stage, final Object result, final ResolvedOptions options) {
    if (result == null) {
      throw new TransformException(stage, "cipher provider returned no value for " + options.attributeName());
    }
    return result;
  }

  private Object invoke(final Stage stage,
                        final Object provider,
                        final String methodName,
                        final Object value,
                        final ResolvedOptions options) {
    log.trace("invoke({}, {}, {})", stage, provider.getClass().getName(), methodName);
    final Method method = findEntryPoint(provider.getClass(), methodName, value)
        .orElseThrow(() -> new TransformException(stage,
            provider.getClass().getName() + " has no entry point '" + methodName + "'"));
    final Object argument = Map.class.isAssignableFrom(method.getParameterTypes()[1])
        ? options.parameters()
        : options;
    try {
      method.setAccessible(true);
      return method.invoke(provider, value, argument);
    } catch (InvocationTargetException e) {
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      if (e.getCause() instanceof Error) {
        throw (Error) e.getCause();
      }
      throw new TransformException(stage, "entry point '" + methodName + "' failed", e.getCause());
    } catch (IllegalAccessException | RuntimeException e) {
      throw new TransformException(stage, "entry point '" + methodName + "' is not accessible", e);
    }
  }

  private Optional<Method> findEntryPoint(final Class<?> type, final String methodName, final Object value) {
    return Arrays.stream(type.getMethods())
        .filter(m -> m.getName().equals(methodName))
        .filter(m -> m.getParameterCount() == 2)
        .filter(m -> m.getParameterTypes()[0].isInstance(value))
        .filter(m -> acceptsOptions(m) || Map.class.isAssignableFrom(m.getParameterTypes()[1]))
        .sorted(Comparator.comparing((Method m) -> !acceptsOptions(m)).thenComparing(Method::toGenericString))
        .findFirst();
  }

  private boolean acceptsOptions(final Method method) {
    return method.getParameterTypes()[1].isAssignableFrom(ResolvedOptions.class);
  }
}
