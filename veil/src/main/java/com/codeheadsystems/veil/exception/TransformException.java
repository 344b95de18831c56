package com.codeheadsystems.veil.exception;

import com.codeheadsystems.veil.transform.Stage;

/**
 * Thrown when a stage of the transform pipeline fails. The failing stage is always available.
 */
public class TransformException extends VeilException {

  private final Stage stage;

  /**
   * Instantiates a new Transform exception.
   *
   * @param stage   the failing stage
   * @param message the message
   */
  public TransformException(final Stage stage, final String message) {
    super(stage + ": " + message);
    this.stage = stage;
  }

  /**
   * Instantiates a new Transform exception.
   *
   * @param stage   the failing stage
   * @param message the message
   * @param cause   the cause
   */
  public TransformException(final Stage stage, final String message, final Throwable cause) {
    super(stage + ": " + message, cause);
    this.stage = stage;
  }

  /**
   * The stage that failed.
   *
   * @return the stage
   */
  public Stage stage() {
    return stage;
  }
}
