package com.codeheadsystems.veil.encryption;

import com.codeheadsystems.veil.model.ResolvedOptions;
import java.nio.charset.StandardCharsets;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Provider that performs no encryption. Text goes in, its UTF-8 bytes come out, and the reverse on decrypt. Needs
 * no key.
 */
@Singleton
public class PassthroughCipherProvider implements CipherProvider {

  private static final Logger log = LoggerFactory.getLogger(PassthroughCipherProvider.class);

  /**
   * Instantiates a new Passthrough cipher provider.
   */
  public PassthroughCipherProvider() {
    log.info("PassthroughCipherProvider()");
  }

  @Override
  public Object encrypt(final Object value, final ResolvedOptions options) {
    if (value instanceof String) {
      return ((String) value).getBytes(StandardCharsets.UTF_8);
    }
    return value;
  }

  @Override
  public Object decrypt(final Object value, final ResolvedOptions options) {
    if (value instanceof byte[]) {
      return new String((byte[]) value, StandardCharsets.UTF_8);
    }
    return value;
  }

  @Override
  public boolean requiresKey() {
    return false;
  }
}
