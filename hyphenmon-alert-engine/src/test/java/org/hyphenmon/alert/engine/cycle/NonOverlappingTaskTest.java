package org.hyphenmon.alert.engine.cycle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class NonOverlappingTaskTest {

  @Test
  void testTickWhileRunningIsSkipped() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    AtomicInteger runs = new AtomicInteger();
    NonOverlappingTask task =
        new NonOverlappingTask(
            "slow",
            () -> {
              runs.incrementAndGet();
              started.countDown();
              try {
                release.await(5, TimeUnit.SECONDS);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
            });
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      Future<Boolean> first = executor.submit(task::tick);
      assertTrue(started.await(5, TimeUnit.SECONDS));

      assertTrue(task.isRunning());
      assertFalse(task.tick());
      assertFalse(task.tick());

      release.countDown();
      assertTrue(first.get(5, TimeUnit.SECONDS));
    } finally {
      executor.shutdownNow();
    }

    assertFalse(task.isRunning());
    assertTrue(task.tick());
    assertEquals(2, runs.get());
  }

  @Test
  void testFailingRunReleasesTheTask() {
    AtomicInteger runs = new AtomicInteger();
    NonOverlappingTask task =
        new NonOverlappingTask(
            "failing",
            () -> {
              if (runs.incrementAndGet() == 1) {
                throw new IllegalStateException("boom");
              }
            });

    assertThrows(IllegalStateException.class, task::tick);
    assertFalse(task.isRunning());
    assertTrue(task.tick());
    assertEquals(2, runs.get());
  }
}
