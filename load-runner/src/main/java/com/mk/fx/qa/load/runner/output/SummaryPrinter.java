package com.mk.fx.qa.load.runner.output;

import static com.mk.fx.qa.load.runner.utils.LoadUtils.formatLatency;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.load.runner.metrics.RunSummary;
import com.mk.fx.qa.load.runner.model.SummaryFormat;
import java.io.PrintStream;
import java.util.Locale;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/** Prints the end-of-run summary as plain text lines or as a JSON document. */
@Slf4j
public class SummaryPrinter {

  private final ObjectMapper objectMapper;
  private final PrintStream out;

  public SummaryPrinter(ObjectMapper objectMapper, PrintStream out) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.out = Objects.requireNonNull(out, "out");
  }

  public void print(RunSummary summary, SummaryFormat format) {
    if (format == SummaryFormat.JSON) {
      try {
        out.println(objectMapper.writeValueAsString(summary));
        out.flush();
        return;
      } catch (JsonProcessingException e) {
        log.warn("Run summary could not be serialised, falling back to text: {}", e.getMessage());
      }
    }
    out.print(toText(summary));
    out.flush();
  }

  static String toText(RunSummary summary) {
    var sb = new StringBuilder();
    sb.append(
            String.format(
                Locale.ROOT,
                "Successful Requests: %d, Failed Requests: %d%n",
                summary.successCount(),
                summary.failureCount()))
        .append("Average latency: ")
        .append(formatLatency(summary.latencyAvg()))
        .append(System.lineSeparator())
        .append(String.format(Locale.ROOT, "Error rate: %.2f%%%n", summary.errorRatePercent()));
    if (summary.totalRequests() > 0) {
      sb.append("Latency min/p95/p99/max: ")
          .append(formatLatency(summary.latencyMin()))
          .append(" / ")
          .append(formatLatency(summary.latencyP95()))
          .append(" / ")
          .append(formatLatency(summary.latencyP99()))
          .append(" / ")
          .append(formatLatency(summary.latencyMax()))
          .append(System.lineSeparator())
          .append(String.format(Locale.ROOT, "Achieved rate: %.2f req/s%n", summary.achievedRps()));
    }
    summary
        .errorBreakdown()
        .forEach(
            (category, count) ->
                sb.append("  ")
                    .append(category)
                    .append(": ")
                    .append(count)
                    .append(System.lineSeparator()));
    return sb.toString();
  }
}
