package ca.gc.cra.edgeingest.application.port;

import java.io.IOException;

/**
 * Checked exception raised when a persisted checkpoint cannot be read or has an unsupported schema.
 *
 * @since 0.1.0
 */
public final class CheckpointException extends IOException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public CheckpointException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause parse or IO failure
   */
  public CheckpointException(String msg, Throwable cause) { super(msg, cause); }
}
