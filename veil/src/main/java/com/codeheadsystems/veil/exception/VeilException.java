package com.codeheadsystems.veil.exception;

/**
 * Base type for every failure raised by the attribute encryption core. Errors raised by a cipher provider are not
 * wrapped in this type.
 */
public class VeilException extends RuntimeException {

  /**
   * Instantiates a new Veil exception.
   *
   * @param message the message
   */
  public VeilException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Veil exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public VeilException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
