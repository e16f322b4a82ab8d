package com.mk.fx.qa.load.runner.executors;

import static com.mk.fx.qa.load.runner.utils.LoadUtils.saturatedMultiply;

import java.time.Duration;

/**
 * Maps elapsed run time and the number of requests already sent to the wait before the next one.
 *
 * <p>The pacer targets the average rate: once the run falls behind the whole-second schedule it
 * releases requests without waiting until it has caught up, which produces short bursts.
 */
public final class Pacer {

  private static final long NANOS_PER_SECOND = 1_000_000_000L;

  private final long qps;
  private final long intervalNanos;

  public Pacer(long qps) {
    if (qps <= 0) {
      throw new IllegalArgumentException("qps must be > 0, got " + qps);
    }
    this.qps = qps;
    this.intervalNanos = Math.max(1, NANOS_PER_SECOND / qps);
  }

  public Pace pace(Duration elapsed, long sent) {
    long expected = saturatedMultiply(qps, elapsed.getSeconds());
    if (sent < expected) {
      return Pace.PROCEED;
    }

    // (sent + 1) * interval must stay representable
    if (sent >= Long.MAX_VALUE / intervalNanos) {
      return Pace.STOP;
    }

    long target = (sent + 1) * intervalNanos;
    return new Pace(Duration.ofNanos(target - elapsed.toNanos()), false);
  }

  public Duration interval() {
    return Duration.ofNanos(intervalNanos);
  }
}
