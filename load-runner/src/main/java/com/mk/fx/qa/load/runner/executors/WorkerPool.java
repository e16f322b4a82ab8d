package com.mk.fx.qa.load.runner.executors;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;
import lombok.extern.slf4j.Slf4j;

/**
 * Growable set of worker threads. Workers are only ever added during a run and every one of them is
 * joined by {@link #awaitAll()}.
 */
@Slf4j
final class WorkerPool {

  private final String runId;
  private final ExecutorService executor;
  private final List<Future<?>> workers = new CopyOnWriteArrayList<>();
  private final AtomicInteger size = new AtomicInteger();
  private final AtomicInteger live = new AtomicInteger();

  WorkerPool(String runId) {
    this.runId = runId;
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("load-worker-" + runId + "-" + thread.getId());
          thread.setDaemon(true);
          return thread;
        };
    this.executor = Executors.newCachedThreadPool(threadFactory);
  }

  /**
   * Starts one more worker.
   *
   * @param workerFactory creates the worker body from its zero-based index
   * @return the pool size after growing
   */
  int spawn(IntFunction<Runnable> workerFactory) {
    int index = size.getAndIncrement();
    Runnable worker = workerFactory.apply(index);
    live.incrementAndGet();
    try {
      workers.add(
          executor.submit(
              () -> {
                try {
                  worker.run();
                } finally {
                  live.decrementAndGet();
                }
              }));
    } catch (RuntimeException ex) {
      live.decrementAndGet();
      size.decrementAndGet();
      throw ex;
    }
    return index + 1;
  }

  int size() {
    return size.get();
  }

  int liveCount() {
    return live.get();
  }

  /** Joins every worker spawned so far and releases the threads. */
  void awaitAll() throws InterruptedException {
    for (Future<?> worker : workers) {
      try {
        worker.get();
      } catch (ExecutionException ex) {
        log.error(
            "Run {} worker terminated abnormally: {}",
            runId,
            ex.getCause().getMessage(),
            ex.getCause());
      }
    }
    executor.shutdown();
    if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
      log.warn("Run {} worker threads did not terminate in time", runId);
    }
  }
}
