package com.mk.fx.qa.load.runner.cfg;

import com.mk.fx.qa.load.runner.model.LoadTestArgs;
import com.mk.fx.qa.load.runner.model.SummaryFormat;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Run settings bound from {@code load.*}, e.g. {@code --load.qps=250 --load.duration=30s}. */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "load")
public class LoadTestProperties {

  /** Duration of the test, 0 runs until interrupted. */
  @NotNull private Duration duration = Duration.ZERO;

  @Positive private long qps = 100;

  /** Workers started with the run; several are needed for high rates against slow targets. */
  @Min(1)
  private int workers = 100;

  @Min(1)
  private int maxWorkers = 100;

  private boolean autoscale = true;

  /** Per-request timeout, 0 disables it. */
  @NotNull private Duration timeout = Duration.ofSeconds(30);

  @NotBlank private String method = "GET";

  /** File results are written to, {@code stdout} for standard output. */
  @NotBlank private String outputFile = "stdout";

  @NotNull private SummaryFormat summaryFormat = SummaryFormat.TEXT;

  /** How long a shutdown waits for in-flight requests before exiting anyway. */
  @NotNull private Duration shutdownGracePeriod = Duration.ofSeconds(10);

  public LoadTestArgs toArgs(String target) {
    if (target == null || target.isBlank()) {
      throw new IllegalArgumentException("target URL is required");
    }
    return new LoadTestArgs(
        target, duration, qps, workers, maxWorkers, autoscale, timeout, method);
  }
}
