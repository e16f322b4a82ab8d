package com.mk.fx.qa.load.runner.metrics;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * End-of-run statistics over every result a run produced.
 *
 * @param totalRequests number of results
 * @param successCount results with a status code in {@code [200, 399]}
 * @param failureCount every other result
 * @param errorRatePercent failures as a percentage of all results
 * @param achievedRps results per second between the first and the last send
 * @param latencyAvg mean latency, null without results
 * @param latencyMin minimum latency, null without results
 * @param latencyMax maximum latency, null without results
 * @param latencyP95 approximate 95th percentile, null without results
 * @param latencyP99 approximate 99th percentile, null without results
 * @param errorBreakdown failures per category such as {@code HTTP_503} or {@code HTTP_TIMEOUT}
 * @param errorSamples first distinct error texts
 */
public record RunSummary(
    long totalRequests,
    long successCount,
    long failureCount,
    double errorRatePercent,
    double achievedRps,
    Duration latencyAvg,
    Duration latencyMin,
    Duration latencyMax,
    Duration latencyP95,
    Duration latencyP99,
    Map<String, Long> errorBreakdown,
    List<String> errorSamples) {}
