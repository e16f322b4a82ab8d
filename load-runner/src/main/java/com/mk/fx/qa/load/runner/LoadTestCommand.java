package com.mk.fx.qa.load.runner;

import com.mk.fx.qa.load.runner.service.LoadTestService;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/** Command line front end: {@code loadtest [options] target}. */
@Slf4j
@Component
public class LoadTestCommand implements ApplicationRunner, ExitCodeGenerator {

  static final String VERSION = "1.0";

  static final String USAGE =
      String.join(
          System.lineSeparator(),
          "Usage: loadtest [options] target",
          "  --load.duration=<duration>     Duration of the test [0 = forever] (default 0)",
          "  --load.qps=<n>                 Queries per second (default 100)",
          "  --load.workers=<n>             Number of initial workers (default 100)",
          "  --load.max-workers=<n>         Max number of workers (default 100)",
          "  --load.autoscale=<bool>        Whether to automatically scale the number of workers"
              + " (default true)",
          "  --load.timeout=<duration>      Timeout to wait for each request (default 30s)",
          "  --load.method=<method>         HTTP method to use (default GET)",
          "  --load.output-file=<path>      Output file to write results to (default stdout)",
          "  --load.summary-format=<fmt>    TEXT or JSON (default TEXT)",
          "  --version                      Print version and exit");

  private final LoadTestService loadTestService;
  private final PrintStream out;
  private final PrintStream err;
  private volatile int exitCode;

  @Autowired
  public LoadTestCommand(LoadTestService loadTestService) {
    this(loadTestService, System.out, System.err);
  }

  LoadTestCommand(LoadTestService loadTestService, PrintStream out, PrintStream err) {
    this.loadTestService = loadTestService;
    this.out = out;
    this.err = err;
  }

  @Override
  public void run(ApplicationArguments arguments) {
    if (arguments.containsOption("version")) {
      out.println("Version: " + VERSION);
      return;
    }

    List<String> targets = arguments.getNonOptionArgs();
    if (targets.size() != 1) {
      err.println(USAGE);
      exitCode = 1;
      return;
    }

    try {
      loadTestService.run(targets.get(0));
    } catch (IOException | IllegalArgumentException | IllegalStateException ex) {
      log.debug("Load test failed", ex);
      err.println("Error: " + ex.getMessage());
      exitCode = 1;
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      err.println("Error: interrupted");
      exitCode = 1;
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }
}
