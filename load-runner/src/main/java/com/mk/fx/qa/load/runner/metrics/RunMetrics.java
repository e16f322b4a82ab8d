package com.mk.fx.qa.load.runner.metrics;

import com.mk.fx.qa.load.runner.model.Result;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BinaryOperator;

/**
 * Aggregates the results of a run into a {@link RunSummary}. Safe to feed from several threads.
 */
public class RunMetrics {

  private static final int RESERVOIR_CAPACITY = 5000;

  private final AtomicLong total = new AtomicLong();
  private final AtomicLong successes = new AtomicLong();
  private final LatencyTracker latency = new LatencyTracker(RESERVOIR_CAPACITY);
  private final ErrorTracker errors = new ErrorTracker();
  private final AtomicReference<Instant> firstSend = new AtomicReference<>();
  private final AtomicReference<Instant> lastSend = new AtomicReference<>();

  public void record(Result result) {
    Objects.requireNonNull(result, "result");
    total.incrementAndGet();
    latency.record(result.latency());
    if (Result.isSuccessCode(result.code())) {
      successes.incrementAndGet();
    } else {
      errors.recordFailure(result);
    }
    firstSend.accumulateAndGet(result.timestamp(), earliest());
    lastSend.accumulateAndGet(result.timestamp(), latest());
  }

  public long totalRequests() {
    return total.get();
  }

  public RunSummary summarise() {
    long count = total.get();
    long ok = successes.get();
    long failed = count - ok;
    return new RunSummary(
        count,
        ok,
        failed,
        count == 0 ? 0.0 : failed * 100.0 / count,
        achievedRps(count),
        latency.average().orElse(null),
        latency.min().orElse(null),
        latency.max().orElse(null),
        latency.percentile(95).orElse(null),
        latency.percentile(99).orElse(null),
        errors.breakdownSnapshot(),
        errors.samplesSnapshot());
  }

  private double achievedRps(long count) {
    Instant first = firstSend.get();
    Instant last = lastSend.get();
    if (count < 2 || first == null || last == null) {
      return count;
    }
    double seconds = Math.max(0.001, Duration.between(first, last).toNanos() / 1e9);
    return (count - 1) / seconds;
  }

  private static BinaryOperator<Instant> earliest() {
    return (current, candidate) ->
        current == null || candidate.isBefore(current) ? candidate : current;
  }

  private static BinaryOperator<Instant> latest() {
    return (current, candidate) ->
        current == null || candidate.isAfter(current) ? candidate : current;
  }
}
