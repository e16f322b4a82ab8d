package com.mk.fx.qa.load.runner.metrics;

import java.util.Arrays;
import java.util.Optional;
import java.util.Random;

/**
 * Fixed-size uniform sample of latency values (Algorithm R) for approximate percentiles.
 *
 * <p>Thread-safe; all access is synchronized on the reservoir.
 */
public final class Reservoir {

  private final long[] samples;
  private final Random random;
  private long seen;

  public Reservoir(int capacity) {
    this(capacity, new Random());
  }

  public Reservoir(int capacity, Random random) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("Capacity must be > 0");
    }
    this.samples = new long[capacity];
    this.random = random;
  }

  public synchronized void add(long value) {
    seen++;
    if (seen <= samples.length) {
      samples[(int) seen - 1] = value;
      return;
    }
    long slot = random.nextLong(seen);
    if (slot < samples.length) {
      samples[(int) slot] = value;
    }
  }

  /** Nearest-rank percentile of the sampled values, empty when nothing was added. */
  public synchronized Optional<Long> percentile(int p) {
    if (p < 0 || p > 100) {
      throw new IllegalArgumentException("Percentile must be between 0 and 100");
    }
    int size = (int) Math.min(seen, samples.length);
    if (size == 0) {
      return Optional.empty();
    }
    long[] sorted = Arrays.copyOf(samples, size);
    Arrays.sort(sorted);
    int rank = (int) Math.ceil(p / 100.0 * size);
    return Optional.of(sorted[Math.min(size - 1, Math.max(0, rank - 1))]);
  }

  public synchronized long seen() {
    return seen;
  }
}
