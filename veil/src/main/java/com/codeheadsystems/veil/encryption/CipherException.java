package com.codeheadsystems.veil.encryption;

/**
 * Raised by the built-in cipher providers. Propagates to the accessor caller unwrapped.
 */
public class CipherException extends RuntimeException {

  /**
   * Instantiates a new Cipher exception.
   *
   * @param message the message
   */
  public CipherException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Cipher exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public CipherException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
