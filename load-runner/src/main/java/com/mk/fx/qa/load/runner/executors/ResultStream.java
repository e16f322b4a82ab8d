package com.mk.fx.qa.load.runner.executors;

import com.google.common.util.concurrent.Uninterruptibles;
import com.mk.fx.qa.load.runner.model.Result;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Closable channel of results from the workers to a single consumer.
 *
 * <p>Results arrive in completion order; each carries its send-order sequence number. The stream
 * ends when the run has drained and cannot be restarted.
 */
public final class ResultStream {

  private static final Object END = new Object();

  private final BlockingQueue<Object> queue;
  private volatile boolean closed;
  private volatile boolean finished;

  public ResultStream(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("Capacity must be > 0");
    }
    this.queue = new LinkedBlockingQueue<>(capacity);
  }

  /** Publishes a result, blocking while the buffer is full. */
  public void put(Result result) throws InterruptedException {
    if (closed) {
      throw new IllegalStateException("Result stream is closed");
    }
    queue.put(result);
  }

  /**
   * Publishes a result like {@link #put(Result)} but keeps waiting through interrupts, restoring the
   * interrupt flag afterwards, so a result that has been produced is never lost.
   */
  public void putUninterruptibly(Result result) {
    if (closed) {
      throw new IllegalStateException("Result stream is closed");
    }
    Uninterruptibles.putUninterruptibly(queue, result);
  }

  /** Marks the end of the stream. Calling it more than once has no effect. */
  public synchronized void close() {
    if (!closed) {
      closed = true;
      Uninterruptibles.putUninterruptibly(queue, END);
    }
  }

  /**
   * Waits for the next result.
   *
   * @return the result, or empty once the stream has ended
   */
  public Optional<Result> next() throws InterruptedException {
    if (finished) {
      return Optional.empty();
    }
    return unwrap(queue.take());
  }

  /**
   * Waits up to {@code timeout} for the next result.
   *
   * @return the result, or empty on timeout or end of stream; see {@link #isFinished()}
   */
  public Optional<Result> poll(Duration timeout) throws InterruptedException {
    if (finished) {
      return Optional.empty();
    }
    Object item = queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    return item == null ? Optional.empty() : unwrap(item);
  }

  /** Hands every remaining result to {@code consumer} until the stream ends. */
  public void forEachRemaining(Consumer<? super Result> consumer) throws InterruptedException {
    Optional<Result> result;
    while ((result = next()).isPresent()) {
      consumer.accept(result.get());
    }
  }

  /** Returns true once the consumer has read the end of the stream. */
  public boolean isFinished() {
    return finished;
  }

  public boolean isClosed() {
    return closed;
  }

  private Optional<Result> unwrap(Object item) {
    if (item == END) {
      finished = true;
      return Optional.empty();
    }
    return Optional.of((Result) item);
  }
}
