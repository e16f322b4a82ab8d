package com.mk.fx.qa.load.runner.executors;

import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.IntSupplier;

/**
 * Unbuffered hand-off of ticks from the dispatcher to idle workers.
 *
 * <p>A tick is only accepted by a worker that is already waiting, so a failed {@link #trySend()}
 * means every worker is busy.
 */
final class TickChannel {

  private static final long POLL_MILLIS = 10L;

  private enum Signal {
    TICK,
    END
  }

  private final SynchronousQueue<Signal> queue = new SynchronousQueue<>();
  private volatile boolean closed;

  /** Hands a tick to an idle worker without blocking. */
  boolean trySend() {
    ensureOpen();
    return queue.offer(Signal.TICK);
  }

  /**
   * Blocks until a worker takes the tick or the stop signal fires.
   *
   * @return true if the tick was delivered, false if the run was stopped first
   */
  boolean send(StopSignal stopSignal) throws InterruptedException {
    ensureOpen();
    while (!stopSignal.isTriggered()) {
      if (queue.offer(Signal.TICK, POLL_MILLIS, TimeUnit.MILLISECONDS)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Waits for the next tick.
   *
   * @return true for a tick, false once the channel has been closed
   */
  boolean receive() throws InterruptedException {
    return queue.take() == Signal.TICK;
  }

  /**
   * Closes the channel and hands an end marker to each worker still running. Workers busy with a
   * request receive theirs once they come back for the next tick.
   */
  void close(IntSupplier liveWorkers) throws InterruptedException {
    closed = true;
    while (liveWorkers.getAsInt() > 0) {
      queue.offer(Signal.END, POLL_MILLIS, TimeUnit.MILLISECONDS);
    }
  }

  boolean isClosed() {
    return closed;
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("Tick channel is closed");
    }
  }
}
