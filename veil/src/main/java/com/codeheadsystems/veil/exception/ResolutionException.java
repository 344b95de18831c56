package com.codeheadsystems.veil.exception;

/**
 * Thrown when a key or predicate cannot be resolved against an instance at call time.
 */
public class ResolutionException extends VeilException {

  /**
   * Instantiates a new Resolution exception.
   *
   * @param message the message
   */
  public ResolutionException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Resolution exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public ResolutionException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
