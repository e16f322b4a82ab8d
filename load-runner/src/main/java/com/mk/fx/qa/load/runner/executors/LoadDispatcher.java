package com.mk.fx.qa.load.runner.executors;

import com.mk.fx.qa.load.runner.model.LoadTestArgs;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * Produces ticks at the pace computed by {@link Pacer}, grows the worker pool when no worker is
 * idle, and drains the run when the duration elapses, pacing overflows or the stop signal fires.
 *
 * <p>Threading: the loop runs on a single dispatcher thread. Workers run on {@link WorkerPool}
 * threads and only share the tick channel, the result stream and the run clock with it.
 */
@Slf4j
final class LoadDispatcher implements Runnable {

  private final String runId;
  private final LoadTestArgs args;
  private final Pacer pacer;
  private final RunClock clock;
  private final StopSignal stopSignal;
  private final RequestExecutor executor;
  private final ResultStream results;
  private final TickChannel ticks = new TickChannel();
  private final WorkerPool pool;
  private final AtomicLong dispatched = new AtomicLong();
  private final CountDownLatch drained = new CountDownLatch(1);

  LoadDispatcher(
      String runId,
      LoadTestArgs args,
      StopSignal stopSignal,
      RequestExecutor executor,
      ResultStream results) {
    this.runId = runId;
    this.args = args;
    this.pacer = new Pacer(args.qps());
    this.clock = new RunClock();
    this.stopSignal = stopSignal;
    this.executor = executor;
    this.results = results;
    this.pool = new WorkerPool(runId);
  }

  /** Starts the initial workers; called before the dispatcher thread begins. */
  void startWorkers() {
    for (int i = 0; i < args.workers(); i++) {
      spawnWorker();
    }
  }

  @Override
  public void run() {
    String reason = "stop requested";
    try {
      while (true) {
        Duration elapsed = clock.elapsed();
        if (args.isBounded() && elapsed.compareTo(args.duration()) > 0) {
          reason = "duration elapsed";
          break;
        }

        Pace pace = pacer.pace(elapsed, dispatched.get());
        if (pace.stop()) {
          reason = "pacing overflow";
          log.warn(
              "Run {} stopping: pacing interval overflow after {} requests",
              runId,
              dispatched.get());
          break;
        }

        if (pace.hasWait() && stopSignal.await(pace.delay())) {
          break;
        }

        if (args.canGrowBeyond(pool.size())) {
          if (ticks.trySend()) {
            dispatched.incrementAndGet();
            continue;
          }
          if (stopSignal.isTriggered()) {
            break;
          }
          // every worker is busy, add one and hand it this tick
          int workers = spawnWorker();
          log.debug("Run {} scaled up to {} workers", runId, workers);
        }

        if (!ticks.send(stopSignal)) {
          break;
        }
        dispatched.incrementAndGet();
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      reason = "dispatcher interrupted";
      log.warn("Run {} dispatcher interrupted", runId);
    } catch (RuntimeException ex) {
      reason = "dispatcher error";
      log.error("Run {} dispatcher failed: {}", runId, ex.getMessage(), ex);
    } finally {
      drain(reason);
    }
  }

  private int spawnWorker() {
    return pool.spawn(
        index -> new RequestWorker(runId, index, ticks, clock, executor, results));
  }

  /** Closes ticks, joins every worker, closes the results and finally fires the stop signal. */
  private void drain(String reason) {
    log.info(
        "Run {} draining ({}): dispatched={} workers={} elapsed={}",
        runId,
        reason,
        dispatched.get(),
        pool.size(),
        clock.elapsed());
    try {
      ticks.close(pool::liveCount);
      pool.awaitAll();
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      log.warn("Run {} interrupted while waiting for workers to drain", runId);
    } finally {
      results.close();
      stopSignal.trigger();
      drained.countDown();
      log.info("Run {} drained", runId);
    }
  }

  boolean awaitDrained(Duration timeout) throws InterruptedException {
    return drained.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  int workerCount() {
    return pool.size();
  }

  long dispatched() {
    return dispatched.get();
  }
}
