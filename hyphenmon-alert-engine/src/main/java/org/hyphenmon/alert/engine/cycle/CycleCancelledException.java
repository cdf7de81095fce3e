package org.hyphenmon.alert.engine.cycle;

/** Raised at a stage boundary once {@link CorrelationCycle#cancel()} was requested. */
public class CycleCancelledException extends RuntimeException {
  public CycleCancelledException(String cycleId) {
    super("Cycle " + cycleId + " was cancelled");
  }
}
