package com.mk.fx.qa.load.runner.executors;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.load.runner.model.LoadTestArgs;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for a single paced load run.
 *
 * <p>{@link #startTest()} launches the dispatcher and returns the stream of results; the run is
 * complete once that stream ends. {@link #stop()} is the only way to end an unbounded run early and
 * may be called from any thread.
 */
@Slf4j
public class LoadTestRunner {

  static final int RESULT_BUFFER = 16;

  @Getter private final String runId;
  @Getter private final LoadTestArgs args;
  private final RequestExecutor executor;
  private final StopSignal stopSignal = new StopSignal();
  private final AtomicReference<LoadDispatcher> dispatcher = new AtomicReference<>();

  public LoadTestRunner(LoadTestArgs args, RequestExecutor executor) {
    this(UUID.randomUUID().toString().substring(0, 8), args, executor);
  }

  public LoadTestRunner(String runId, LoadTestArgs args, RequestExecutor executor) {
    this.runId = Objects.requireNonNull(runId, "runId");
    this.args = Objects.requireNonNull(args, "args");
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  /**
   * Starts issuing requests.
   *
   * @return the results of this run, ending once every worker has exited
   * @throws IllegalStateException if the run was already started
   */
  public ResultStream startTest() {
    var results = new ResultStream(RESULT_BUFFER);
    var created = new LoadDispatcher(runId, args, stopSignal, executor, results);
    if (!dispatcher.compareAndSet(null, created)) {
      throw new IllegalStateException("Run " + runId + " has already been started");
    }

    log.info(
        "Run {} starting: target={} method={} qps={} duration={} workers={} maxWorkers={} autoscale={}",
        runId,
        args.target(),
        args.method(),
        args.qps(),
        args.isBounded() ? args.duration() : "unbounded",
        args.workers(),
        args.maxWorkers(),
        args.autoscale());

    created.startWorkers();
    Thread thread = new Thread(created, "load-dispatcher-" + runId);
    thread.setDaemon(true);
    thread.start();
    return results;
  }

  /**
   * Requests a graceful stop: no further ticks are produced and in-flight requests are drained.
   *
   * @return true if this call stopped the run, false if it was already stopped
   */
  public boolean stop() {
    boolean stopped = stopSignal.trigger();
    if (stopped) {
      log.info("Run {} stop requested", runId);
    }
    return stopped;
  }

  public boolean isStopped() {
    return stopSignal.isTriggered();
  }

  /**
   * Waits for the run to drain.
   *
   * @return true if the run drained within the timeout
   */
  public boolean awaitCompletion(Duration timeout) throws InterruptedException {
    LoadDispatcher current = dispatcher.get();
    if (current == null) {
      throw new IllegalStateException("Run " + runId + " has not been started");
    }
    return current.awaitDrained(timeout);
  }

  /** Current pool size; never decreases during a run. */
  public int workerCount() {
    LoadDispatcher current = dispatcher.get();
    return current == null ? 0 : current.workerCount();
  }

  /** Number of ticks handed to workers so far. */
  public long ticksDispatched() {
    LoadDispatcher current = dispatcher.get();
    return current == null ? 0 : current.dispatched();
  }

  @VisibleForTesting
  StopSignal stopSignal() {
    return stopSignal;
  }
}
