package com.heatlabs.replay.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {

  @Test
  void workerThreadsAreNamedDaemons() throws Exception {
    ExecutorService pool = ExecutorFactories.newWorkerPool(2, "replay-scan", null);
    try {
      Thread worker = pool.submit(Thread::currentThread).get(5, TimeUnit.SECONDS);

      assertTrue(worker.getName().startsWith("replay-scan-"), worker.getName());
      assertTrue(worker.isDaemon());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void blankPrefixFallsBackToDefault() throws Exception {
    ExecutorService pool = ExecutorFactories.newWorkerPool(1, " ", null);
    try {
      String name = pool.submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS);

      assertEquals("replay-worker-0", name);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void rejectsNonPositiveSize() {
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newWorkerPool(0, "x", null));
  }

  @Test
  void defaultWorkerCountIsAtLeastTwo() {
    assertTrue(ExecutorFactories.defaultWorkerCount() >= 2);
  }
}
