package io.lexlink.courier.api;

/**
 * Process exit codes shared by Courier commands.
 *
 * @since 1.0.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid or the conversation identity was incomplete. */
  INVALID_ARGS(2),
  /** Reading the console or a configuration file failed. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** Interrupted while the session was running. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
