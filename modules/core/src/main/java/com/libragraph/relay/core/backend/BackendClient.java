package com.libragraph.relay.core.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libragraph.relay.core.workflow.WorkflowRequest;
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
import java.util.UUID;

/**
 * Drives one backend execution to completion. The only class that speaks the
 * backend's wire protocol:
 * <ul>
 *   <li>{@code POST /prompt} with {@code {"prompt": graph, "client_id": id}} returns {@code {"prompt_id": ...}}</li>
 *   <li>{@code GET /history/{id}} returns {@code {id: entry}} once the execution has finished, {@code {}} before</li>
 *   <li>{@code GET /system_stats} answers when the backend is up</li>
 * </ul>
 * Polling never cancels backend work: a timed-out execution may still finish
 * and write its outputs later.
 */
@ApplicationScoped
public class BackendClient {

    private static final Logger log = Logger.getLogger(BackendClient.class);

    private static final int MAX_BODY_IN_MESSAGE = 500;

    @Inject
    HttpClient httpClient;

    @Inject
    ObjectMapper objectMapper;

    @ConfigProperty(name = "relay.backend.url", defaultValue = "http://127.0.0.1:8188")
    String backendUrl;

    @ConfigProperty(name = "relay.backend.poll-interval", defaultValue = "1s")
    Duration pollInterval;

    @ConfigProperty(name = "relay.backend.timeout", defaultValue = "10m")
    Duration timeout;

    @ConfigProperty(name = "relay.backend.request-timeout", defaultValue = "30s")
    Duration requestTimeout;

    private final String clientId = UUID.randomUUID().toString();

    /** Submits and polls with the configured interval and timeout. */
    public ExecutionRecord execute(WorkflowRequest request) throws InterruptedException {
        String executionId = submit(request);
        return pollUntilTerminal(executionId, pollInterval, timeout);
    }

    /**
     * Queues the request's graph on the backend.
     *
     * @return the backend-assigned execution id
     * @throws BackendUnavailableException if the backend cannot be reached or refuses the request
     */
    public String submit(WorkflowRequest request) throws InterruptedException {
        ObjectNode body = objectMapper.createObjectNode();
        body.set("prompt", request.graph());
        body.put("client_id", clientId);

        HttpResponse<String> response;
        try {
            HttpRequest httpRequest = HttpRequest.newBuilder(uri("/prompt"))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                    .build();
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new BackendUnavailableException("Cannot reach backend at " + baseUrl() + ": " + describe(e), e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new BackendUnavailableException("Backend rejected job " + request.jobId()
                    + " with HTTP " + response.statusCode() + ": " + abbreviate(response.body()));
        }

        String executionId;
        try {
            executionId = objectMapper.readTree(response.body()).path("prompt_id").asText("");
        } catch (IOException e) {
            throw new BackendUnavailableException("Unparsable submission response: " + abbreviate(response.body()), e);
        }
        if (executionId.isEmpty()) {
            throw new BackendUnavailableException("Submission response has no prompt_id: " + abbreviate(response.body()));
        }
        log.infof("Queued backend execution %s for job %s", executionId, request.jobId());
        return executionId;
    }

    /**
     * Fetches history every {@code interval} until the execution reaches a terminal
     * state. Transport errors and non-2xx responses count as "still running".
     *
     * @throws BackendExecutionFailedException if the backend reports an error status
     * @throws BackendTimeoutException if nothing terminal arrives within {@code budget}
     */
    public ExecutionRecord pollUntilTerminal(String executionId, Duration interval, Duration budget)
            throws InterruptedException {
        long started = System.nanoTime();
        IOException lastError = null;

        while (true) {
            try {
                Optional<ExecutionRecord> record = fetchHistory(executionId);
                lastError = null;
                if (record.isPresent()) {
                    ExecutionRecord r = record.get();
                    if (r.isError()) {
                        throw new BackendExecutionFailedException(executionId, r.errorDetail());
                    }
                    if (r.isSuccess()) {
                        log.infof("Backend execution %s completed with %d output(s)",
                                executionId, r.outputs().size());
                        return r;
                    }
                }
            } catch (IOException e) {
                lastError = e;
                log.debugf("History poll for %s failed, retrying: %s", executionId, describe(e));
            }

            if (Duration.ofNanos(System.nanoTime() - started).compareTo(budget) > 0) {
                throw new BackendTimeoutException(executionId, budget, lastError);
            }
            Thread.sleep(interval.toMillis());
        }
    }

    /**
     * One history lookup.
     *
     * @return empty while the execution has not finished
     * @throws IOException on transport errors, non-2xx responses or malformed JSON
     */
    public Optional<ExecutionRecord> fetchHistory(String executionId) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(
                        uri("/history/" + URLEncoder.encode(executionId, StandardCharsets.UTF_8)))
                .timeout(requestTimeout)
                .GET()
                .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() / 100 != 2) {
            throw new IOException("History request returned HTTP " + response.statusCode());
        }
        JsonNode entry = objectMapper.readTree(response.body()).get(executionId);
        if (entry == null || !entry.isObject()) {
            return Optional.empty();
        }
        return Optional.of(ExecutionRecord.parse(executionId, entry));
    }

    /** Whether the backend answers {@code GET /system_stats}. */
    public boolean ping() {
        try {
            HttpRequest request = HttpRequest.newBuilder(uri("/system_stats"))
                    .timeout(requestTimeout)
                    .GET()
                    .build();
            return httpClient.send(request, HttpResponse.BodyHandlers.discarding()).statusCode() / 100 == 2;
        } catch (IOException e) {
            log.debugf("Backend ping failed: %s", describe(e));
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration timeout() {
        return timeout;
    }

    String baseUrl() {
        return backendUrl.endsWith("/") ? backendUrl.substring(0, backendUrl.length() - 1) : backendUrl;
    }

    private URI uri(String path) {
        return URI.create(baseUrl() + path);
    }

    private static String describe(IOException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= MAX_BODY_IN_MESSAGE ? body : body.substring(0, MAX_BODY_IN_MESSAGE) + "...";
    }
}
