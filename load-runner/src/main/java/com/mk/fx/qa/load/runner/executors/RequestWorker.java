package com.mk.fx.qa.load.runner.executors;

import com.mk.fx.qa.load.runner.model.Result;
import com.mk.fx.qa.load.runner.model.SendStamp;
import lombok.extern.slf4j.Slf4j;

/** Consumes ticks until the channel closes, producing exactly one result per tick. */
@Slf4j
final class RequestWorker implements Runnable {

  private final String runId;
  private final int index;
  private final TickChannel ticks;
  private final RunClock clock;
  private final RequestExecutor executor;
  private final ResultStream results;

  RequestWorker(
      String runId,
      int index,
      TickChannel ticks,
      RunClock clock,
      RequestExecutor executor,
      ResultStream results) {
    this.runId = runId;
    this.index = index;
    this.ticks = ticks;
    this.clock = clock;
    this.executor = executor;
    this.results = results;
  }

  @Override
  public void run() {
    log.debug("Run {} worker {} started", runId, index);
    long handled = 0;
    try {
      while (ticks.receive()) {
        results.putUninterruptibly(execute());
        handled++;
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      log.warn("Run {} worker {} interrupted after {} requests", runId, index, handled);
      return;
    }
    log.debug("Run {} worker {} finished after {} requests", runId, index, handled);
  }

  private Result execute() {
    SendStamp stamp = clock.nextSend();
    try {
      Result result = executor.execute(stamp);
      if (result == null) {
        return stamp.failed("no result produced");
      }
      return result;
    } catch (RuntimeException ex) {
      log.error(
          "Run {} worker {} request {} failed unexpectedly: {}",
          runId,
          index,
          stamp.seq(),
          ex.getMessage(),
          ex);
      return stamp.failed(ex.toString());
    }
  }
}
