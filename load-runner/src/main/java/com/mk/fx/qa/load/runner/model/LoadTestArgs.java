package com.mk.fx.qa.load.runner.model;

import static com.mk.fx.qa.load.runner.utils.LoadUtils.toDuration;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable parameters of a single load run.
 *
 * @param target URL every request is sent to, parsed per request so a malformed one fails each
 *     request instead of the run
 * @param duration how long ticks are produced for; {@link Duration#ZERO} runs until stopped
 * @param qps target requests per second, must be positive
 * @param workers number of workers started with the run
 * @param maxWorkers upper bound the pool may grow to when autoscaling
 * @param autoscale whether workers are added when none is idle at tick time
 * @param timeout per-request timeout; {@link Duration#ZERO} disables it
 * @param method HTTP method used for every request
 */
public record LoadTestArgs(
    String target,
    Duration duration,
    long qps,
    int workers,
    int maxWorkers,
    boolean autoscale,
    Duration timeout,
    String method) {

  public LoadTestArgs {
    Objects.requireNonNull(target, "target");
    if (target.isBlank()) {
      throw new IllegalArgumentException("target URL is required");
    }
    target = target.trim();
    duration = toDuration(duration);
    timeout = toDuration(timeout);
    if (duration.isNegative()) {
      throw new IllegalArgumentException("duration must not be negative: " + duration);
    }
    if (timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must not be negative: " + timeout);
    }
    if (qps <= 0) {
      throw new IllegalArgumentException("qps must be > 0, got " + qps);
    }
    if (workers < 1) {
      throw new IllegalArgumentException("workers must be >= 1, got " + workers);
    }
    if (method == null || method.isBlank()) {
      throw new IllegalArgumentException("HTTP method is required");
    }
    method = method.trim().toUpperCase(Locale.ROOT);
  }

  /** Returns true when the run has a finite duration. */
  public boolean isBounded() {
    return !duration.isZero();
  }

  /** Returns true when the pool is allowed to grow past its current size. */
  public boolean canGrowBeyond(int currentWorkers) {
    return autoscale && currentWorkers < maxWorkers;
  }
}
