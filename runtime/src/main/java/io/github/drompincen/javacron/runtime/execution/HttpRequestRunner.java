package io.github.drompincen.javacron.runtime.execution;

import io.github.drompincen.javacron.protocol.api.HttpRequestSpec;
import io.github.drompincen.javacron.runtime.jobs.JobOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Locale;

/**
 * Runs HTTP-request events. A 2xx response is a success and its body is the output.
 */
@Component
public class HttpRequestRunner {

    private static final Logger log = LoggerFactory.getLogger(HttpRequestRunner.class);

    private final HttpClient client;

    public HttpRequestRunner() {
        this(HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    HttpRequestRunner(HttpClient client) {
        this.client = client;
    }

    public JobOutcome execute(HttpRequestSpec spec, Duration timeout) {
        if (spec == null || spec.url() == null || spec.url().isBlank()) {
            return JobOutcome.failure("HTTP request has no URL");
        }
        String method = spec.method() == null || spec.method().isBlank()
                ? "GET" : spec.method().toUpperCase(Locale.ROOT);
        try {
            HttpRequest.BodyPublisher body = spec.body() == null || method.equals("GET") || method.equals("HEAD")
                    ? HttpRequest.BodyPublishers.noBody()
                    : HttpRequest.BodyPublishers.ofString(spec.body());
            HttpRequest.Builder request = HttpRequest.newBuilder()
                    .uri(URI.create(spec.url()))
                    .timeout(timeout)
                    .method(method, body);
            if (spec.headers() != null) {
                spec.headers().forEach(request::header);
            }

            HttpResponse<String> response = client.send(request.build(), HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            log.debug("{} {} -> {}", method, spec.url(), status);
            if (status >= 200 && status < 300) {
                return new JobOutcome(true, 0, response.body(), "", null, null);
            }
            return new JobOutcome(false, 1, response.body(), "HTTP " + status + " from " + spec.url(), null, null);
        } catch (HttpTimeoutException e) {
            return new JobOutcome(false, -1, "", "Request timed out after " + timeout.toSeconds() + "s", null, null);
        } catch (IOException | IllegalArgumentException e) {
            return JobOutcome.failure("HTTP request failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return JobOutcome.failure("HTTP request interrupted");
        }
    }
}
