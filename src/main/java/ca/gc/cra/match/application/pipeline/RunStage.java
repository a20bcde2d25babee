package ca.gc.cra.match.application.pipeline;

import java.util.Locale;

/**
 * Stages of a matching run, in execution order.
 * <p>A run moves INIT, SCORING, SOLVING, REPORTING, PERSISTING, DONE. Any failure moves it to
 * FAILED; both DONE and FAILED are terminal.</p>
 *
 * @since 0.1.0
 */
public enum RunStage {
  INIT,
  SCORING,
  SOLVING,
  REPORTING,
  PERSISTING,
  DONE,
  FAILED;

  /**
   * Indicates whether no further transition is allowed.
   *
   * @return {@code true} for DONE and FAILED
   */
  public boolean terminal() {
    return this == DONE || this == FAILED;
  }

  /**
   * Checks whether this stage may move to {@code next}.
   *
   * @param next candidate stage
   * @return {@code true} when {@code next} directly follows this stage, or is FAILED from a live stage
   */
  public boolean canAdvanceTo(RunStage next) {
    if (terminal()) {
      return false;
    }
    if (next == FAILED) {
      return true;
    }
    return next.ordinal() == ordinal() + 1;
  }

  /** Lowercase name used in metric keys. */
  public String metricName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
