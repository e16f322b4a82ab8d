package com.mk.fx.qa.load.runner.executors;

import java.time.Duration;

/**
 * Pacing decision for the next tick.
 *
 * @param delay time to wait before sending; zero or negative means send immediately
 * @param stop true when the run must end instead of sending
 */
public record Pace(Duration delay, boolean stop) {

  static final Pace PROCEED = new Pace(Duration.ZERO, false);
  static final Pace STOP = new Pace(Duration.ZERO, true);

  /** Returns true when the caller actually has to sleep. */
  public boolean hasWait() {
    return !stop && delay.compareTo(Duration.ZERO) > 0;
  }
}
