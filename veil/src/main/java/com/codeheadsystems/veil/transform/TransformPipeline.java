package com.codeheadsystems.veil.transform;

import com.codeheadsystems.veil.exception.TransformException;
import com.codeheadsystems.veil.model.ResolvedOptions;
import java.nio.charset.StandardCharsets;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orders the transforms around the cipher provider call.
 *
 * <p>Write: marshal, encrypt, encode. Read: decode, decrypt, unmarshal. Absent values (null, and the empty string
 * unless empty values are allowed) pass through untouched without running any stage.</p>
 */
@Singleton
public class TransformPipeline {

  private static final Logger log = LoggerFactory.getLogger(TransformPipeline.class);

  private final CipherInvoker cipherInvoker;

  /**
   * Instantiates a new Transform pipeline.
   *
   * @param cipherInvoker the cipher invoker
   */
  @Inject
  public TransformPipeline(final CipherInvoker cipherInvoker) {
    log.info("TransformPipeline({})", cipherInvoker);
    this.cipherInvoker = cipherInvoker;
  }

  /**
   * Runs the write path.
   *
   * @param raw     the logical value
   * @param options the resolved options
   * @return the value to store
   */
  public Object write(final Object raw, final ResolvedOptions options) {
    log.trace("write({})", options.attributeName());
    if (isAbsent(raw, options)) {
      return raw;
    }
    final Object plaintext = options.marshal()
        ? stage(Stage.MARSHAL, options, () -> options.marshaler().marshal(raw))
        : raw;
    final Object ciphertext = cipherInvoker.encrypt(plaintext, options);
    if (!options.encode()) {
      return ciphertext;
    }
    return stage(Stage.ENCODE, options, () -> Encoding.forFormat(options.encodeFormat()).encode(bytes(ciphertext)));
  }

  /**
   * Runs the read path.
   *
   * @param stored  the stored value
   * @param options the resolved options
   * @return the logical value
   */
  public Object read(final Object stored, final ResolvedOptions options) {
    log.trace("read({})", options.attributeName());
    if (isAbsent(stored, options)) {
      return stored;
    }
    final Object ciphertext = options.encode()
        ? stage(Stage.DECODE, options, () -> Encoding.forFormat(options.encodeFormat()).decode(text(stored)))
        : stored;
    final Object plaintext = cipherInvoker.decrypt(ciphertext, options);
    if (!options.marshal()) {
      return plaintext;
    }
    return stage(Stage.UNMARSHAL, options, () -> options.marshaler().unmarshal(text(plaintext)));
  }

  /**
   * Whether the value is the absent marker for these options.
   *
   * @param value   the value
   * @param options the options
   * @return true if absent
   */
  public boolean isAbsent(final Object value, final ResolvedOptions options) {
    return value == null || (!options.allowEmptyValue() && "".equals(value));
  }

  private <T> T stage(final Stage stage, final ResolvedOptions options, final Supplier<T> work) {
    try {
      return work.get();
    } catch (TransformException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new TransformException(stage, "failed for attribute " + options.attributeName(), e);
    }
  }

  private byte[] bytes(final Object value) {
    if (value instanceof byte[]) {
      return (byte[]) value;
    }
    if (value instanceof String) {
      return ((String) value).getBytes(StandardCharsets.UTF_8);
    }
    throw new IllegalArgumentException("Expected bytes or text but got " + value.getClass().getName());
  }

  private String text(final Object value) {
    if (value instanceof String) {
      return (String) value;
    }
    if (value instanceof byte[]) {
      return new String((byte[]) value, StandardCharsets.UTF_8);
    }
    throw new IllegalArgumentException("Expected text or bytes but got " + value.getClass().getName());
  }
}
