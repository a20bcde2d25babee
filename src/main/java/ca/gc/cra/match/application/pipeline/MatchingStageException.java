package ca.gc.cra.match.application.pipeline;

import ca.gc.cra.match.domain.error.MatchingException;
import java.util.Objects;

/**
 * Fatal run failure tagged with the stage that was executing.
 *
 * @since 0.1.0
 */
public final class MatchingStageException extends MatchingException {
  private static final long serialVersionUID = 1L;

  private final RunStage stage;

  /**
   * Creates a stage failure.
   *
   * @param stage stage that failed; never DONE or FAILED
   * @param message condition description
   * @param cause underlying failure; may be {@code null}
   */
  public MatchingStageException(RunStage stage, String message, Throwable cause) {
    super("[" + Objects.requireNonNull(stage, "stage") + "] " + message, cause);
    this.stage = stage;
  }

  public RunStage stage() {
    return stage;
  }
}
