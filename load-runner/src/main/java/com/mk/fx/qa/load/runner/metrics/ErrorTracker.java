package com.mk.fx.qa.load.runner.metrics;

import com.mk.fx.qa.load.runner.model.Result;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/** Counts failed results per category and keeps the first few distinct error texts. */
final class ErrorTracker {

  static final int MAX_ERROR_SAMPLES = 5;

  private final Map<String, AtomicLong> breakdown = new ConcurrentHashMap<>();
  private final List<String> samples = new CopyOnWriteArrayList<>();

  void recordFailure(Result result) {
    breakdown.computeIfAbsent(classify(result), k -> new AtomicLong()).incrementAndGet();
    String error = result.error();
    if (!error.isEmpty() && samples.size() < MAX_ERROR_SAMPLES && !samples.contains(error)) {
      samples.add(error);
    }
  }

  Map<String, Long> breakdownSnapshot() {
    Map<String, Long> map = new TreeMap<>();
    breakdown.forEach((key, count) -> map.put(key, count.get()));
    return Map.copyOf(map);
  }

  List<String> samplesSnapshot() {
    return List.copyOf(samples);
  }

  static String classify(Result result) {
    if (result.code() != 0) {
      return "HTTP_" + result.code();
    }
    String error = result.error();
    if (error.contains("ConnectException")) {
      return "CONNECTION_REFUSED";
    }
    if (error.contains("HttpConnectTimeoutException") || error.contains("HttpTimeoutException")) {
      return "HTTP_TIMEOUT";
    }
    if (error.contains("UnknownHostException")) {
      return "UNKNOWN_HOST";
    }
    if (error.contains("SSLException") || error.contains("SSLHandshakeException")) {
      return "SSL_ERROR";
    }
    if (error.contains("IllegalArgumentException") || error.contains("URISyntaxException")) {
      return "INVALID_REQUEST";
    }
    return error.isEmpty() ? "UNKNOWN" : "TRANSPORT_ERROR";
  }
}
