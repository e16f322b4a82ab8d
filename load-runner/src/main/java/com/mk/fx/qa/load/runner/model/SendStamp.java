package com.mk.fx.qa.load.runner.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Identity of a request taken at send time.
 *
 * @param seq zero-based send order within the run
 * @param timestamp wall-clock send time
 * @param nanoTime monotonic send time used for latency
 */
public record SendStamp(long seq, Instant timestamp, long nanoTime) {

  public Duration latency() {
    return Duration.ofNanos(Math.max(0, System.nanoTime() - nanoTime));
  }

  /** Builds the result of a response carrying {@code code}. */
  public Result completed(int code, String error) {
    boolean success = Result.isSuccessCode(code);
    return new Result(success, latency(), timestamp, seq, success ? "" : error, code);
  }

  /** Builds the result of an attempt that never received a response. */
  public Result failed(String error) {
    return new Result(false, latency(), timestamp, seq, error, 0);
  }
}
