package com.codeheadsystems.veil.exception;

/**
 * Thrown when an attribute declaration cannot be accepted, for example when two attributes of one class map to
 * the same storage attribute.
 */
public class DeclarationException extends VeilException {

  /**
   * Instantiates a new Declaration exception.
   *
   * @param message the message
   */
  public DeclarationException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Declaration exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public DeclarationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
