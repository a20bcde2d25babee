package ca.gc.cra.match.api;

/**
 * Process exit codes returned by the {@code match} CLI.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Run completed and the artifact was written, or help/dry-run finished. */
  SUCCESS(0),
  /** Malformed or unknown arguments, or invalid configuration values. */
  INVALID_ARGS(2),
  /** Configuration file or output could not be read or written. */
  IO_ERROR(3),
  /** Input collections were unusable (missing file, malformed JSON, missing or duplicate ids). */
  CONFIG_ERROR(4),
  /** Scoring, solving, reporting or capacity failure. */
  RUNTIME_FAILURE(5),
  /** Interrupted before completion. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
