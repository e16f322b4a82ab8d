package com.mk.fx.qa.load.runner.executors;

import com.mk.fx.qa.load.runner.model.SendStamp;
import java.time.Duration;
import java.time.Instant;

/** Start time of a run and the send-order sequence shared by its workers. */
final class RunClock {

  private final Instant began;
  private final long beganNanos;
  private long seq;

  RunClock() {
    this.began = Instant.now();
    this.beganNanos = System.nanoTime();
  }

  Duration elapsed() {
    return Duration.ofNanos(System.nanoTime() - beganNanos);
  }

  /** Assigns the next sequence number together with its send time. */
  synchronized SendStamp nextSend() {
    long now = System.nanoTime();
    return new SendStamp(seq++, began.plusNanos(now - beganNanos), now);
  }
}
