package com.mk.fx.qa.load.runner.rest;

import com.mk.fx.qa.load.runner.executors.RequestExecutor;
import com.mk.fx.qa.load.runner.model.LoadTestArgs;
import com.mk.fx.qa.load.runner.model.Result;
import com.mk.fx.qa.load.runner.model.SendStamp;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;

/**
 * Sends the run's request with the JDK {@link HttpClient}: configured method and target, no body,
 * response body discarded.
 *
 * <p>Build and transport failures become results with status code 0; responses outside
 * {@code [200, 399]} become failed results carrying the real status code and its status line.
 */
@Slf4j
public class LoadHttpClient implements RequestExecutor {

  private final String target;
  private final String method;
  private final Duration timeout;
  private final HttpClient client;

  public LoadHttpClient(LoadTestArgs args) {
    this(args.target(), args.method(), args.timeout());
  }

  public LoadHttpClient(String target, String method, Duration timeout) {
    this.target = Objects.requireNonNull(target, "target");
    this.method = Objects.requireNonNull(method, "method");
    this.timeout = timeout != null ? timeout : Duration.ZERO;
    var builder = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL);
    if (!this.timeout.isZero()) {
      builder.connectTimeout(this.timeout);
    }
    this.client = builder.build();
  }

  @Override
  public Result execute(SendStamp stamp) {
    HttpRequest request;
    try {
      request = buildRequest();
    } catch (URISyntaxException | IllegalArgumentException ex) {
      log.debug("Request {} could not be built: {}", stamp.seq(), ex.getMessage());
      return stamp.failed(describe(ex));
    }

    try {
      HttpResponse<Void> response = client.send(request, HttpResponse.BodyHandlers.discarding());
      int code = response.statusCode();
      return stamp.completed(code, statusLine(code));
    } catch (IOException ex) {
      return stamp.failed(describe(ex));
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      return stamp.failed(method + " " + target + ": request interrupted");
    }
  }

  private HttpRequest buildRequest() throws URISyntaxException {
    var builder =
        HttpRequest.newBuilder(new URI(target))
            .method(method, HttpRequest.BodyPublishers.noBody());
    if (!timeout.isZero()) {
      builder.timeout(timeout);
    }
    return builder.build();
  }

  private String describe(Exception ex) {
    String detail =
        ex.getMessage() == null || ex.getMessage().isBlank()
            ? ex.getClass().getSimpleName()
            : ex.getClass().getSimpleName() + ": " + ex.getMessage();
    return method + " " + target + ": " + detail;
  }

  /** Formats {@code code} the way a status line reads, e.g. {@code 503 Service Unavailable}. */
  static String statusLine(int code) {
    HttpStatus status = HttpStatus.resolve(code);
    return status != null ? code + " " + status.getReasonPhrase() : String.valueOf(code);
  }
}
