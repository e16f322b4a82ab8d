package com.mk.fx.qa.load.runner.service;

import com.mk.fx.qa.load.runner.cfg.LoadTestProperties;
import com.mk.fx.qa.load.runner.executors.LoadTestRunner;
import com.mk.fx.qa.load.runner.executors.RequestExecutor;
import com.mk.fx.qa.load.runner.executors.ResultStream;
import com.mk.fx.qa.load.runner.metrics.RunMetrics;
import com.mk.fx.qa.load.runner.metrics.RunSummary;
import com.mk.fx.qa.load.runner.model.LoadTestArgs;
import com.mk.fx.qa.load.runner.model.Result;
import com.mk.fx.qa.load.runner.output.CsvResultWriter;
import com.mk.fx.qa.load.runner.output.SummaryPrinter;
import com.mk.fx.qa.load.runner.rest.LoadHttpClient;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.io.OutputStream;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Runs a load test end to end: opens the result output, starts the runner, writes every result as
 * it arrives and prints the summary once the run has drained.
 *
 * <p>External stop requests go through {@link #requestStop()}. The first one drains the run
 * gracefully; a second one while the drain is still in progress makes {@link #run(String)} return
 * without waiting for in-flight requests.
 */
@Slf4j
@Service
public class LoadTestService {

  private static final Duration POLL_INTERVAL = Duration.ofMillis(100);
  private static final Duration ABANDON_WAIT = Duration.ofSeconds(1);

  private final LoadTestProperties properties;
  private final SummaryPrinter summaryPrinter;
  private final Function<LoadTestArgs, RequestExecutor> executorFactory;
  private final OutputStream stdout;
  private final AtomicReference<ActiveRun> current = new AtomicReference<>();
  private final AtomicBoolean abandoned = new AtomicBoolean(false);

  @Autowired
  public LoadTestService(LoadTestProperties properties, SummaryPrinter summaryPrinter) {
    this(properties, summaryPrinter, LoadHttpClient::new, System.out);
  }

  LoadTestService(
      LoadTestProperties properties,
      SummaryPrinter summaryPrinter,
      Function<LoadTestArgs, RequestExecutor> executorFactory,
      OutputStream stdout) {
    this.properties = Objects.requireNonNull(properties, "properties");
    this.summaryPrinter = Objects.requireNonNull(summaryPrinter, "summaryPrinter");
    this.executorFactory = Objects.requireNonNull(executorFactory, "executorFactory");
    this.stdout = Objects.requireNonNull(stdout, "stdout");
  }

  /**
   * Runs a load test against {@code target} and blocks until it has drained or was abandoned.
   *
   * @return the summary of every result received
   * @throws IOException if the output cannot be opened or written; the run is stopped and drained
   *     first
   * @throws IllegalArgumentException if the target or settings are invalid
   */
  public RunSummary run(String target) throws IOException, InterruptedException {
    LoadTestArgs args = properties.toArgs(target);
    RunMetrics metrics = new RunMetrics();

    try (CsvResultWriter writer = CsvResultWriter.open(properties.getOutputFile(), stdout)) {
      var active =
          new ActiveRun(new LoadTestRunner(args, executorFactory.apply(args)), new CountDownLatch(1));
      if (!current.compareAndSet(null, active)) {
        throw new IllegalStateException("A load test is already running");
      }
      abandoned.set(false);
      try {
        LoadTestRunner runner = active.runner();
        drain(runner, runner.startTest(), writer, metrics);

        RunSummary summary = metrics.summarise();
        log.info(
            "Load test against {} finished: requests={} successes={} failures={}",
            args.target(),
            summary.totalRequests(),
            summary.successCount(),
            summary.failureCount());
        summaryPrinter.print(summary, properties.getSummaryFormat());
        return summary;
      } finally {
        current.compareAndSet(active, null);
        active.finished().countDown();
      }
    }
  }

  private void drain(
      LoadTestRunner runner, ResultStream results, CsvResultWriter writer, RunMetrics metrics)
      throws IOException, InterruptedException {
    while (!results.isFinished()) {
      if (abandoned.get()) {
        log.warn("Run {} abandoned with requests still in flight", runner.getRunId());
        return;
      }
      Optional<Result> next = results.poll(POLL_INTERVAL);
      if (next.isEmpty()) {
        continue;
      }
      metrics.record(next.get());
      try {
        writer.write(next.get());
      } catch (IOException ex) {
        log.error("Run {} failed writing results: {}", runner.getRunId(), ex.getMessage(), ex);
        runner.stop();
        discardRemaining(runner, results);
        throw ex;
      }
    }
  }

  /** Keeps workers unblocked until the stopped run has drained, bounded by the grace period. */
  private void discardRemaining(LoadTestRunner runner, ResultStream results)
      throws InterruptedException {
    long deadline = System.nanoTime() + properties.getShutdownGracePeriod().toNanos();
    long discarded = 0;
    while (!results.isFinished() && !abandoned.get()) {
      if (System.nanoTime() - deadline > 0) {
        log.warn(
            "Run {} did not drain within {} after an output failure",
            runner.getRunId(),
            properties.getShutdownGracePeriod());
        return;
      }
      if (results.poll(POLL_INTERVAL).isPresent()) {
        discarded++;
      }
    }
    log.debug("Run {} discarded {} results after an output failure", runner.getRunId(), discarded);
  }

  /**
   * Bridges an external stop request (e.g. an operator interrupt) to the running test.
   *
   * @return true if the run is now draining gracefully, false if it was already stopping, in which
   *     case the caller should exit without waiting
   */
  public boolean requestStop() {
    ActiveRun active = current.get();
    if (active == null) {
      return false;
    }
    LoadTestRunner runner = active.runner();
    if (runner.stop()) {
      log.info("Shutting down run {}...", runner.getRunId());
      return true;
    }
    abandoned.set(true);
    log.warn("Run {} already stopping, exiting without waiting for the drain", runner.getRunId());
    return false;
  }

  public boolean isRunning() {
    return current.get() != null;
  }

  /**
   * Process shutdown (SIGINT or SIGTERM) stops the run and waits for it to drain and print its
   * summary. A drain that outlives the grace period is treated as a second stop: in-flight
   * requests are abandoned and the summary covers the results received so far.
   */
  @PreDestroy
  void onShutdown() {
    ActiveRun active = current.get();
    if (active == null) {
      return;
    }
    String runId = active.runner().getRunId();
    requestStop();
    Duration grace = properties.getShutdownGracePeriod();
    try {
      if (await(active.finished(), grace)) {
        return;
      }
      log.warn("Run {} did not drain within {}, abandoning in-flight requests", runId, grace);
      requestStop();
      if (!await(active.finished(), ABANDON_WAIT)) {
        log.warn("Run {} did not finish after being abandoned, exiting anyway", runId);
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for run {} to drain", runId);
    }
  }

  private static boolean await(CountDownLatch latch, Duration timeout)
      throws InterruptedException {
    return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  /** The runner of the test in progress and the latch released once {@code run} has returned. */
  private record ActiveRun(LoadTestRunner runner, CountDownLatch finished) {}
}
