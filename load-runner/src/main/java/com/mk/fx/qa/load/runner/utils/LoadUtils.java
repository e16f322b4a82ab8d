package com.mk.fx.qa.load.runner.utils;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

public final class LoadUtils {

  private LoadUtils() {
    // Utility class, no instantiation
  }

  public static Duration toDuration(Duration duration) {
    return duration != null ? duration : Duration.ZERO;
  }

  /** Multiplies two non-negative longs, returning {@link Long#MAX_VALUE} instead of overflowing. */
  public static long saturatedMultiply(long a, long b) {
    long high = Math.multiplyHigh(a, b);
    long low = a * b;
    if (high != 0 || low < 0) {
      return Long.MAX_VALUE;
    }
    return low;
  }

  public static long toEpochNanos(Instant instant) {
    return Math.addExact(
        Math.multiplyExact(instant.getEpochSecond(), 1_000_000_000L), instant.getNano());
  }

  /** Formats a latency with the largest unit that keeps it above one, e.g. {@code 1.503ms}. */
  public static String formatLatency(Duration duration) {
    if (duration == null) {
      return "n/a";
    }
    long nanos = duration.toNanos();
    if (nanos < 1_000L) {
      return nanos + "ns";
    }
    if (nanos < 1_000_000L) {
      return String.format(Locale.ROOT, "%.3fµs", nanos / 1e3);
    }
    if (nanos < 1_000_000_000L) {
      return String.format(Locale.ROOT, "%.3fms", nanos / 1e6);
    }
    return String.format(Locale.ROOT, "%.3fs", nanos / 1e9);
  }
}
