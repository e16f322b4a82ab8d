package com.mk.fx.qa.load.runner.metrics;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/** Running latency statistics in nanoseconds; percentiles come from a {@link Reservoir}. */
final class LatencyTracker {

  private final AtomicLong count = new AtomicLong();
  private final AtomicLong min = new AtomicLong(Long.MAX_VALUE);
  private final AtomicLong max = new AtomicLong(Long.MIN_VALUE);
  private final AtomicLong sum = new AtomicLong();
  private final Reservoir reservoir;

  LatencyTracker(int reservoirCapacity) {
    this.reservoir = new Reservoir(reservoirCapacity);
  }

  void record(Duration latency) {
    long nanos = Math.max(0, latency.toNanos());
    count.incrementAndGet();
    sum.addAndGet(nanos);
    min.accumulateAndGet(nanos, Math::min);
    max.accumulateAndGet(nanos, Math::max);
    reservoir.add(nanos);
  }

  Optional<Duration> average() {
    long n = count.get();
    return n == 0 ? Optional.empty() : Optional.of(Duration.ofNanos(sum.get() / n));
  }

  Optional<Duration> min() {
    long v = min.get();
    return v == Long.MAX_VALUE ? Optional.empty() : Optional.of(Duration.ofNanos(v));
  }

  Optional<Duration> max() {
    long v = max.get();
    return v == Long.MIN_VALUE ? Optional.empty() : Optional.of(Duration.ofNanos(v));
  }

  Optional<Duration> percentile(int p) {
    return reservoir.percentile(p).map(Duration::ofNanos);
  }
}
