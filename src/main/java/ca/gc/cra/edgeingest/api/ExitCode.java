package ca.gc.cra.edgeingest.api;

/**
 * <strong>What:</strong> Process exit codes shared by the agent's commands.
 * <p><strong>Why:</strong> The service manager restarts the agent on failure; distinct codes tell operators
 * whether a restart can help (I/O) or the configuration must change first.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments or configuration values were invalid. */
  INVALID_ARGS(2),
  /** File I/O failed, including an unreadable checkpoint. */
  IO_ERROR(3),
  /** The configuration file was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** Stopped by a signal before completing. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric process status.
   *
   * @return exit status
   */
  public int code() {
    return code;
  }
}
