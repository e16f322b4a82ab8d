package com.mk.fx.qa.load.runner.executors;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/** One-shot stop event observable by any number of threads. */
public final class StopSignal {

  private final AtomicBoolean triggered = new AtomicBoolean(false);
  private final CountDownLatch latch = new CountDownLatch(1);

  /**
   * Triggers the signal.
   *
   * @return true only for the call that performed the transition
   */
  public boolean trigger() {
    if (triggered.compareAndSet(false, true)) {
      latch.countDown();
      return true;
    }
    return false;
  }

  public boolean isTriggered() {
    return triggered.get();
  }

  /**
   * Waits until the signal is triggered or the timeout elapses.
   *
   * @return true if the signal was triggered
   */
  public boolean await(Duration timeout) throws InterruptedException {
    return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }
}
