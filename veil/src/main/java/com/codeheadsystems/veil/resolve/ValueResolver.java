package com.codeheadsystems.veil.resolve;

import com.codeheadsystems.veil.exception.ResolutionException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves option values against an instance. Shared by key and predicate resolution.
 */
@Singleton
public class ValueResolver {

  private static final Logger log = LoggerFactory.getLogger(ValueResolver.class);

  /**
   * Instantiates a new Value resolver.
   */
  @Inject
  public ValueResolver() {
    log.info("ValueResolver()");
  }

  /**
   * Resolves the candidate. Anything that is not a {@link Resolvable} is returned unchanged.
   *
   * @param instance  the owning instance, null when resolving for a class-level helper
   * @param candidate the option value
   * @return the resolved value, may be null
   */
  public Object resolve(final Object instance, final Object candidate) {
    if (candidate instanceof Resolvable.Literal) {
      return ((Resolvable.Literal<?>) candidate).value();
    } else if (candidate instanceof Resolvable.MethodRef) {
      return invoke(instance, ((Resolvable.MethodRef<?>) candidate).methodName());
    } else if (candidate instanceof Resolvable.Computed) {
      return ((Resolvable.Computed<?>) candidate).function().apply(instance);
    } else {
      return candidate;
    }
  }

  private Object invoke(final Object instance, final String methodName) {
    log.trace("invoke({}, {})", instance == null ? null : instance.getClass().getName(), methodName);
    if (instance == null) {
      throw new ResolutionException("Method reference '" + methodName + "' needs an instance to resolve against");
    }
    final Method method = findMethod(instance.getClass(), methodName)
        .orElseThrow(() -> new ResolutionException(
            instance.getClass().getName() + " does not expose a zero-argument method '" + methodName + "'"));
    try {
      method.setAccessible(true);
      return method.invoke(instance);
    } catch (InvocationTargetException e) {
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      if (e.getCause() instanceof Error) {
        throw (Error) e.getCause();
      }
      throw new ResolutionException("Method '" + methodName + "' failed", e.getCause());
    } catch (IllegalAccessException | RuntimeException e) {
      throw new ResolutionException("Method '" + methodName + "' is not accessible", e);
    }
  }

  private Optional<Method> findMethod(final Class<?> type, final String methodName) {
    for (Class<?> current = type; current != null; current = current.getSuperclass()) {
      for (Method method : current.getDeclaredMethods()) {
        if (method.getName().equals(methodName) && method.getParameterCount() == 0) {
          return Optional.of(method);
        }
      }
    }
    try {
      // default methods on interfaces
      return Optional.of(type.getMethod(methodName));
    } catch (NoSuchMethodException e) {
      return Optional.empty();
    }
  }
}
