package com.mk.fx.qa.load.runner.service;

import static org.junit.jupiter.api.Assertions.*;

import com.google.common.base.Throwables;
import com.mk.fx.qa.load.runner.cfg.LoadTestProperties;
import com.mk.fx.qa.load.runner.cfg.ObjectMapperConfig;
import com.mk.fx.qa.load.runner.executors.RequestExecutor;
import com.mk.fx.qa.load.runner.metrics.RunSummary;
import com.mk.fx.qa.load.runner.model.LoadTestArgs;
import com.mk.fx.qa.load.runner.output.SummaryPrinter;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LoadTestServiceTest {

  private static final String TARGET = "http://localhost:1/";

  private final ByteArrayOutputStream summaryOut = new ByteArrayOutputStream();
  private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
  private final ExecutorService caller = Executors.newSingleThreadExecutor();

  @AfterEach
  void tearDown() {
    caller.shutdownNow();
  }

  private static LoadTestProperties props(Duration duration, long qps, int workers) {
    LoadTestProperties p = new LoadTestProperties();
    p.setDuration(duration);
    p.setQps(qps);
    p.setWorkers(workers);
    p.setMaxWorkers(workers);
    p.setAutoscale(false);
    p.setShutdownGracePeriod(Duration.ofSeconds(2));
    return p;
  }

  private LoadTestService service(
      LoadTestProperties properties, Function<LoadTestArgs, RequestExecutor> executors) {
    var printer =
        new SummaryPrinter(
            new ObjectMapperConfig().objectMapper(),
            new PrintStream(summaryOut, true, StandardCharsets.UTF_8));
    return new LoadTestService(properties, printer, executors, stdout);
  }

  private static Function<LoadTestArgs, RequestExecutor> counting(AtomicInteger calls) {
    return args ->
        stamp -> {
          calls.incrementAndGet();
          return stamp.completed(200, "");
        };
  }

  private static void waitUntil(BooleanSupplier condition, Duration timeout)
      throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        fail("condition not met within " + timeout);
      }
      Thread.sleep(10);
    }
  }

  @Test
  void boundedRun_writesOneRecordPerResultAndPrintsSummary(@TempDir Path dir) throws Exception {
    Path out = dir.resolve("results.csv");
    var properties = props(Duration.ofMillis(300), 50, 2);
    properties.setOutputFile(out.toString());
    AtomicInteger calls = new AtomicInteger();

    RunSummary summary = service(properties, counting(calls)).run(TARGET);

    List<String> lines = Files.readAllLines(out);
    assertTrue(summary.totalRequests() > 0);
    assertEquals(summary.totalRequests(), lines.size());
    assertEquals(calls.get(), summary.totalRequests());
    assertEquals(summary.totalRequests(), summary.successCount());
    assertEquals(0, stdout.size());
    assertTrue(
        summaryOut
            .toString(StandardCharsets.UTF_8)
            .contains("Successful Requests: " + summary.totalRequests() + ", Failed Requests: 0"));
  }

  @Test
  void stdoutOutput_receivesCsvRecords() throws Exception {
    var properties = props(Duration.ofMillis(200), 20, 1);
    properties.setOutputFile("stdout");

    RunSummary summary = service(properties, counting(new AtomicInteger())).run(TARGET);

    String csv = stdout.toString(StandardCharsets.UTF_8);
    assertEquals(summary.totalRequests(), csv.lines().count());
    assertTrue(csv.lines().allMatch(line -> line.contains(",200,")));
  }

  @Test
  void unopenableOutput_failsBeforeAnyRequest(@TempDir Path dir) {
    var properties = props(Duration.ofMillis(200), 20, 1);
    properties.setOutputFile(dir.resolve("missing").resolve("out.csv").toString());
    AtomicInteger calls = new AtomicInteger();
    var service = service(properties, counting(calls));

    IOException ex = assertThrows(IOException.class, () -> service.run(TARGET));

    assertTrue(ex.getMessage().startsWith("error opening"));
    assertEquals(0, calls.get());
    assertFalse(service.isRunning());
    assertEquals(0, summaryOut.size());
  }

  @Test
  void invalidTarget_rejected() {
    var service = service(props(Duration.ofMillis(100), 10, 1), counting(new AtomicInteger()));

    assertThrows(IllegalArgumentException.class, () -> service.run(" "));
    assertFalse(service.isRunning());
  }

  @Test
  void requestStop_withoutRun_returnsFalse() {
    var service = service(props(Duration.ZERO, 10, 1), counting(new AtomicInteger()));

    assertFalse(service.requestStop());
    assertFalse(service.isRunning());
  }

  @Test
  void requestStop_drainsUnboundedRun() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    var service = service(props(Duration.ZERO, 100, 2), counting(calls));

    Future<RunSummary> run = caller.submit(() -> service.run(TARGET));
    waitUntil(() -> calls.get() >= 5, Duration.ofSeconds(5));

    assertTrue(service.requestStop());
    RunSummary summary = run.get(5, TimeUnit.SECONDS);

    assertEquals(calls.get(), summary.totalRequests());
    assertEquals(summary.totalRequests(), stdout.toString(StandardCharsets.UTF_8).lines().count());
    assertFalse(service.isRunning());
  }

  @Test
  void secondStop_abandonsDrainOfStuckRequests() throws Exception {
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    Function<LoadTestArgs, RequestExecutor> blocking =
        args ->
            stamp -> {
              entered.countDown();
              try {
                release.await();
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
              return stamp.completed(200, "");
            };
    var service = service(props(Duration.ZERO, 10, 1), blocking);

    try {
      Future<RunSummary> run = caller.submit(() -> service.run(TARGET));
      assertTrue(entered.await(5, TimeUnit.SECONDS));

      assertTrue(service.requestStop());
      assertFalse(service.requestStop());

      RunSummary summary = run.get(2, TimeUnit.SECONDS);
      assertEquals(0, summary.totalRequests());
      assertFalse(service.isRunning());
    } finally {
      release.countDown();
    }
  }

  @Test
  void shutdownHook_returnsOnlyAfterResultsAndSummaryAreWritten() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    var properties = props(Duration.ZERO, 2000, 8);
    properties.setShutdownGracePeriod(Duration.ofSeconds(5));
    var service = service(properties, counting(calls));

    Future<RunSummary> run = caller.submit(() -> service.run(TARGET));
    waitUntil(() -> calls.get() >= 50, Duration.ofSeconds(5));

    service.onShutdown();

    String summary = summaryOut.toString(StandardCharsets.UTF_8);
    assertTrue(
        summary.contains("Successful Requests: " + calls.get() + ", Failed Requests: 0"), summary);
    assertEquals(calls.get(), stdout.toString(StandardCharsets.UTF_8).lines().count());
    assertEquals(calls.get(), run.get(5, TimeUnit.SECONDS).totalRequests());
  }

  @Test
  void shutdownHook_abandonsStuckRequestsOnceGracePeriodExpires() throws Exception {
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    Function<LoadTestArgs, RequestExecutor> blocking =
        args ->
            stamp -> {
              entered.countDown();
              try {
                release.await();
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
              return stamp.completed(200, "");
            };
    var properties = props(Duration.ZERO, 10, 1);
    properties.setShutdownGracePeriod(Duration.ofMillis(300));
    var service = service(properties, blocking);

    try {
      Future<RunSummary> run = caller.submit(() -> service.run(TARGET));
      assertTrue(entered.await(5, TimeUnit.SECONDS));

      long start = System.nanoTime();
      service.onShutdown();
      Duration waited = Duration.ofNanos(System.nanoTime() - start);

      assertTrue(waited.compareTo(Duration.ofMillis(300)) >= 0, "waited=" + waited);
      assertTrue(waited.compareTo(Duration.ofSeconds(2)) < 0, "waited=" + waited);
      assertEquals(0, run.get(1, TimeUnit.SECONDS).totalRequests());
      assertTrue(
          summaryOut
              .toString(StandardCharsets.UTF_8)
              .contains("Successful Requests: 0, Failed Requests: 0"));
      assertFalse(service.isRunning());
    } finally {
      release.countDown();
    }
  }

  @Test
  void outputFailureMidRun_stopsRunJoinsWorkersAndSurfacesError() throws Exception {
    AtomicInteger writes = new AtomicInteger();
    OutputStream failing =
        new OutputStream() {
          @Override
          public void write(int b) throws IOException {
            write(new byte[] {(byte) b}, 0, 1);
          }

          @Override
          public void write(byte[] b, int off, int len) throws IOException {
            if (writes.incrementAndGet() > 5) {
              throw new IOException("disk full");
            }
          }
        };
    var printer =
        new SummaryPrinter(
            new ObjectMapperConfig().objectMapper(),
            new PrintStream(summaryOut, true, StandardCharsets.UTF_8));
    var properties = props(Duration.ZERO, 2000, 40);
    var service = new LoadTestService(properties, printer, counting(new AtomicInteger()), failing);

    IOException ex = assertThrows(IOException.class, () -> service.run(TARGET));

    assertTrue(
        Throwables.getCausalChain(ex).stream().anyMatch(t -> "disk full".equals(t.getMessage())),
        ex.toString());
    assertFalse(service.isRunning());
    assertEquals(0, summaryOut.size());
    waitUntil(() -> runThreads().isEmpty(), Duration.ofSeconds(5));
  }

  private static List<String> runThreads() {
    return Thread.getAllStackTraces().keySet().stream()
        .filter(Thread::isAlive)
        .map(Thread::getName)
        .filter(name -> name.startsWith("load-worker-") || name.startsWith("load-dispatcher-"))
        .collect(Collectors.toList());
  }
}
