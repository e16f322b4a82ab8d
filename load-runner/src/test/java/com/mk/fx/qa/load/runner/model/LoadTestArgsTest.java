package com.mk.fx.qa.load.runner.model;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class LoadTestArgsTest {

  private static final String TARGET = "http://localhost:8080/";

  private static LoadTestArgs args(long qps, int workers, int maxWorkers, boolean autoscale) {
    return new LoadTestArgs(
        TARGET, Duration.ofSeconds(1), qps, workers, maxWorkers, autoscale, Duration.ZERO, "get");
  }

  @Test
  void zeroOrNegativeQps_rejected() {
    assertThrows(IllegalArgumentException.class, () -> args(0, 1, 1, false));
    assertThrows(IllegalArgumentException.class, () -> args(-1, 1, 1, false));
  }

  @Test
  void invalidWorkersDurationAndMethod_rejected() {
    assertThrows(IllegalArgumentException.class, () -> args(10, 0, 1, false));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new LoadTestArgs(
                TARGET, Duration.ofSeconds(-1), 1, 1, 1, false, Duration.ZERO, "GET"));
    assertThrows(
        IllegalArgumentException.class,
        () -> new LoadTestArgs(TARGET, Duration.ZERO, 1, 1, 1, false, Duration.ofMillis(-1), "GET"));
    assertThrows(
        IllegalArgumentException.class,
        () -> new LoadTestArgs(TARGET, Duration.ZERO, 1, 1, 1, false, Duration.ZERO, " "));
    assertThrows(
        IllegalArgumentException.class,
        () -> new LoadTestArgs("  ", Duration.ZERO, 1, 1, 1, false, Duration.ZERO, "GET"));
    assertThrows(
        NullPointerException.class,
        () -> new LoadTestArgs(null, Duration.ZERO, 1, 1, 1, false, Duration.ZERO, "GET"));
  }

  @Test
  void defaultsAndNormalisation() {
    var args = new LoadTestArgs(TARGET, null, 5, 1, 1, false, null, " post ");

    assertEquals(Duration.ZERO, args.duration());
    assertEquals(Duration.ZERO, args.timeout());
    assertFalse(args.isBounded());
    assertEquals("POST", args.method());
  }

  @Test
  void canGrowBeyond_requiresAutoscaleAndHeadroom() {
    assertTrue(args(10, 1, 3, true).canGrowBeyond(2));
    assertFalse(args(10, 1, 3, true).canGrowBeyond(3));
    assertFalse(args(10, 1, 3, false).canGrowBeyond(1));
    assertFalse(args(10, 4, 2, true).canGrowBeyond(4));
  }
}
