package org.hyphenmon.alert.engine.cycle;

import io.micrometer.core.instrument.Counter;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.metrics.EngineMetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a task on each tick unless the previous run is still in progress, in which case the tick
 * is dropped. Ticks are never queued.
 */
public class NonOverlappingTask {
  private static final Logger LOGGER = LoggerFactory.getLogger(NonOverlappingTask.class);
  private static final String SKIPPED_TICK_COUNTER = "hyphenmon.alert.engine.tick.skipped";

  private final String name;
  private final Runnable task;
  private final AtomicBoolean running = new AtomicBoolean(false);
  private final Counter skippedTickCounter;

  public NonOverlappingTask(String name, Runnable task) {
    this.name = name;
    this.task = task;
    this.skippedTickCounter =
        EngineMetricsRegistry.registerCounter(SKIPPED_TICK_COUNTER, Map.of("task", name));
  }

  /** Returns false when the tick was skipped. */
  public boolean tick() {
    if (!running.compareAndSet(false, true)) {
      skippedTickCounter.increment();
      LOGGER.warn("Previous {} run still in progress, skipping tick", name);
      return false;
    }
    try {
      task.run();
      return true;
    } finally {
      running.set(false);
    }
  }

  public boolean isRunning() {
    return running.get();
  }
}
