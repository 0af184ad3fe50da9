package com.libragraph.relay.core.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * The worker's view of the broker control plane.
 *
 * <p>State-advance calls return whether the broker applied them. A 404 (the job
 * was deleted meanwhile) or an {@code ignored} answer (illegal transition, e.g. a
 * duplicate report) is logged and returns false. Transport failures and 5xx
 * responses throw {@link BrokerUnavailableException}.
 */
@ApplicationScoped
public class BrokerClient {

    private static final Logger log = Logger.getLogger(BrokerClient.class);

    @Inject
    HttpClient httpClient;

    @Inject
    ObjectMapper objectMapper;

    @ConfigProperty(name = "relay.worker.broker-url", defaultValue = "http://127.0.0.1:8080")
    String brokerUrl;

    @ConfigProperty(name = "relay.worker.request-timeout", defaultValue = "10s")
    Duration requestTimeout;

    /** The oldest queued job, or empty when the queue is idle. */
    public Optional<DispatchedJob> nextJob() {
        HttpResponse<String> response = send(HttpRequest.newBuilder(uri("/queue/next")).GET(), "fetch next job");
        if (response.statusCode() / 100 != 2) {
            throw new BrokerUnavailableException("Broker answered HTTP " + response.statusCode() + " to /queue/next");
        }
        try {
            DispatchedJob job = objectMapper.readValue(response.body(), DispatchedJob.class);
            return job.jobId() == null ? Optional.empty() : Optional.of(job);
        } catch (IOException e) {
            throw new BrokerUnavailableException("Unparsable /queue/next response: " + response.body(), e);
        }
    }

    public boolean markStarted(String jobId) {
        return report(jobId, "start", null, null);
    }

    public boolean markComplete(String jobId, String resultPath) {
        return report(jobId, "complete", "result_path", resultPath);
    }

    public boolean markError(String jobId, String errorMessage) {
        return report(jobId, "error", "error_message", errorMessage);
    }

    private boolean report(String jobId, String action, String field, String value) {
        HttpRequest.BodyPublisher body = field == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(
                        field + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8));
        HttpRequest.Builder request = HttpRequest.newBuilder(
                        uri("/jobs/" + URLEncoder.encode(jobId, StandardCharsets.UTF_8) + "/" + action))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(body);
        HttpResponse<String> response = send(request, action + " job " + jobId);

        int status = response.statusCode();
        if (status == 404) {
            log.warnf("Job %s no longer exists on the broker, %s report dropped", jobId, action);
            return false;
        }
        if (status / 100 == 5) {
            throw new BrokerUnavailableException(
                    "Broker answered HTTP " + status + " to " + action + " for job " + jobId);
        }
        if (status / 100 != 2) {
            log.warnf("Broker refused %s for job %s: HTTP %d %s", action, jobId, status, response.body());
            return false;
        }
        if (!"ok".equals(statusField(response.body()))) {
            log.warnf("Broker ignored %s for job %s: %s", action, jobId, response.body());
            return false;
        }
        return true;
    }

    private String statusField(String body) {
        try {
            JsonNode node = objectMapper.readTree(body);
            return node.path("status").asText("");
        } catch (IOException e) {
            return "";
        }
    }

    private HttpResponse<String> send(HttpRequest.Builder request, String what) {
        try {
            return httpClient.send(request.timeout(requestTimeout).build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new BrokerUnavailableException("Cannot reach broker at " + brokerUrl + " to " + what, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerUnavailableException("Interrupted while trying to " + what, e);
        }
    }

    private URI uri(String path) {
        String base = brokerUrl.endsWith("/") ? brokerUrl.substring(0, brokerUrl.length() - 1) : brokerUrl;
        return URI.create(base + path);
    }
}
