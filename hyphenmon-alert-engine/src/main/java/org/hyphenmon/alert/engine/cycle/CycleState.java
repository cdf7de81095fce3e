package org.hyphenmon.alert.engine.cycle;

public enum CycleState {
  IDLE,
  FETCHING,
  CORRELATING,
  EVALUATING,
  DISPATCHING
}
