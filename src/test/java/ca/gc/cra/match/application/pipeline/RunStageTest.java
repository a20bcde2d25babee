package ca.gc.cra.match.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class RunStageTest {

  @Test
  void stagesAdvanceStrictlyInOrder() {
    assertTrue(RunStage.INIT.canAdvanceTo(RunStage.SCORING));
    assertTrue(RunStage.PERSISTING.canAdvanceTo(RunStage.DONE));
    assertFalse(RunStage.INIT.canAdvanceTo(RunStage.SOLVING));
    assertFalse(RunStage.SOLVING.canAdvanceTo(RunStage.SCORING));
  }

  @Test
  void anyActiveStageMayFailButTerminalStagesAreFinal() {
    for (RunStage stage : RunStage.values()) {
      assertEquals(!stage.terminal(), stage.canAdvanceTo(RunStage.FAILED), stage.name());
    }
    assertFalse(RunStage.DONE.canAdvanceTo(RunStage.INIT));
    assertFalse(RunStage.FAILED.canAdvanceTo(RunStage.INIT));
    assertEquals("reporting", RunStage.REPORTING.metricName());
  }
}
