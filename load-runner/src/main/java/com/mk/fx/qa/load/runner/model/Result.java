package com.mk.fx.qa.load.runner.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of a single request attempt.
 *
 * <p>{@code seq} and {@code timestamp} are assigned when the request is sent, so ordering by either
 * reflects issue order rather than completion order.
 *
 * @param success true when a response with a status in {@code [200, 399]} was received
 * @param latency wall time between send and completion
 * @param timestamp send time
 * @param seq zero-based send order across all workers of the run
 * @param error error text, empty on success
 * @param code HTTP status code, 0 when no response was received
 */
public record Result(
    boolean success, Duration latency, Instant timestamp, long seq, String error, int code) {

  public Result {
    error = error == null ? "" : error;
  }

  /** Returns true when the failure happened before a response was received. */
  public boolean isTransportFailure() {
    return !success && code == 0;
  }

  public static boolean isSuccessCode(int code) {
    return code >= 200 && code < 400;
  }
}
