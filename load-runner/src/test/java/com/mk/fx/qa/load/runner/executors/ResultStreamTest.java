package com.mk.fx.qa.load.runner.executors;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.load.runner.model.Result;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ResultStreamTest {

  private static Result result(long seq) {
    return new Result(true, Duration.ofMillis(1), Instant.now(), seq, "", 200);
  }

  @Test
  void consumerDrainsBufferedResultsThenSeesEnd() throws Exception {
    ResultStream stream = new ResultStream(4);
    stream.put(result(0));
    stream.put(result(1));
    stream.close();

    assertEquals(0, stream.next().orElseThrow().seq());
    assertEquals(1, stream.next().orElseThrow().seq());
    assertTrue(stream.next().isEmpty());
    assertTrue(stream.isFinished());
    assertTrue(stream.next().isEmpty());
  }

  @Test
  void forEachRemaining_deliversEveryResultFromProducerThread() throws Exception {
    ResultStream stream = new ResultStream(1);
    Thread producer =
        new Thread(
            () -> {
              try {
                for (int i = 0; i < 20; i++) {
                  stream.put(result(i));
                }
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              } finally {
                stream.close();
              }
            });
    producer.start();

    List<Long> seqs = new ArrayList<>();
    stream.forEachRemaining(r -> seqs.add(r.seq()));

    assertEquals(20, seqs.size());
    assertEquals(19L, seqs.get(19));
    producer.join(5_000);
  }

  @Test
  void poll_timesOutWithoutFinishing() throws Exception {
    ResultStream stream = new ResultStream(2);

    assertTrue(stream.poll(Duration.ofMillis(10)).isEmpty());
    assertFalse(stream.isFinished());
  }

  @Test
  void putAfterClose_rejected_andCloseIsIdempotent() {
    ResultStream stream = new ResultStream(2);
    stream.close();
    stream.close();

    assertTrue(stream.isClosed());
    assertThrows(IllegalStateException.class, () -> stream.put(result(0)));
  }

  @Test
  void putUninterruptibly_keepsResultOfInterruptedProducer() throws Exception {
    ResultStream stream = new ResultStream(2);

    Thread.currentThread().interrupt();
    try {
      stream.putUninterruptibly(result(7));
      assertTrue(Thread.currentThread().isInterrupted());
    } finally {
      Thread.interrupted();
    }

    assertEquals(7, stream.poll(Duration.ofSeconds(1)).orElseThrow().seq());
    stream.close();
    assertThrows(IllegalStateException.class, () -> stream.putUninterruptibly(result(8)));
  }

  @Test
  void capacityMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> new ResultStream(0));
  }
}
