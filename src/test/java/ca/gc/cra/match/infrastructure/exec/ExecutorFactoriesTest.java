package ca.gc.cra.match.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {

  @Test
  void scoringPoolUsesNamedDaemonThreads() throws Exception {
    ExecutorService pool = ExecutorFactories.newScoringPool(2, "score-test", null);
    try {
      Callable<Thread> task = Thread::currentThread;
      Future<Thread> worker = pool.submit(task);
      Thread thread = worker.get(5, TimeUnit.SECONDS);

      assertTrue(thread.isDaemon());
      assertTrue(thread.getName().startsWith("score-test"), thread.getName());
    } finally {
      pool.shutdownNow();
    }
  }
}
