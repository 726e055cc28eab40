package ca.gc.cra.sluice.api;

import ca.gc.cra.sluice.domain.transfer.TransferErrorKind;

/**
 * <strong>What:</strong> Process exit codes shared by the sluice commands.
 * <p><strong>Why:</strong> Scripts distinguish bad arguments, I/O failures and interruption without parsing
 * log output.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** Reading the input or writing the output failed. */
  IO_ERROR(3),
  /** Configuration file was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected failure, including protocol violations between components. */
  RUNTIME_FAILURE(5),
  /** The transfer was cancelled or the process interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /**
   * Maps a transfer failure category to the exit code reported for it.
   *
   * @param kind failure category
   * @return exit code
   */
  public static ExitCode forFailure(TransferErrorKind kind) {
    return switch (kind) {
      case SOURCE_READ, SINK_WRITE -> IO_ERROR;
      case PIPELINE_ABORT -> INTERRUPTED;
      case STAGE, PROTOCOL_VIOLATION -> RUNTIME_FAILURE;
    };
  }
}
