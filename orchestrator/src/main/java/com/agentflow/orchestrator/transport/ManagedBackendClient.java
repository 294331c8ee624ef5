package com.agentflow.orchestrator.transport;

import com.agentflow.orchestrator.agent.AgentException;
import com.agentflow.orchestrator.engine.TransportException;
import com.agentflow.orchestrator.model.AgentTask;
import com.agentflow.orchestrator.model.ExecutionContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * HTTP client for agents hosted as backend functions.
 *
 * Each agent is a function at {@code POST {endpoint}/functions/v1/{agent}};
 * the access key goes in both the bearer token and the {@code apikey}
 * header. Both values come from the process environment
 * (SUPABASE_URL / SUPABASE_SERVICE_ROLE_KEY).
 *
 * 401 / 403 and connection failures are transport failures. A 404 only
 * means this one function is not deployed, so it is an application error.
 */
@Component
public class ManagedBackendClient {

    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       endpointUrl;
    private final String       accessKey;

    public ManagedBackendClient(@Value("${agentflow.managed.endpoint-url:}") String endpointUrl,
                                @Value("${agentflow.managed.access-key:}") String accessKey,
                                ObjectMapper objectMapper) {
        this.endpointUrl = ProtocolClient.stripTrailingSlash(endpointUrl);
        this.accessKey   = accessKey == null ? "" : accessKey.trim();
        this.json        = objectMapper;
        this.http        = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /** True only when both the endpoint URL and the access key are present. */
    public boolean hasCredentials() {
        return !endpointUrl.isEmpty() && !accessKey.isEmpty();
    }

    /**
     * Invoke the function named after the task's agent with the task input
     * as JSON body.
     *
     * @return parsed JSON response, or null for an empty body
     */
    public JsonNode invoke(AgentTask task, ExecutionContext ctx, long timeoutMs) throws TimeoutException {
        if (!hasCredentials()) {
            throw new TransportException("Managed backend credentials are missing");
        }
        Duration timeout = timeoutMs > 0 ? Duration.ofMillis(timeoutMs) : DEFAULT_TIMEOUT;
        String opName = "managed function '" + task.name() + "'";

        HttpResponse<String> resp;
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(endpointUrl + "/functions/v1/"
                            + URLEncoder.encode(task.name(), StandardCharsets.UTF_8)))
                    .timeout(timeout)
                    .header("Content-Type",  "application/json")
                    .header("Authorization", "Bearer " + accessKey)
                    .header("apikey",        accessKey)
                    .header("X-Run-Id",      ctx.runId())
                    .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(task.input())))
                    .build();
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new TimeoutException(opName + " timed out after " + timeout.toMillis() + " ms");
        } catch (JsonProcessingException e) {
            throw new AgentException("Cannot serialize input of " + opName, e);
        } catch (IOException | IllegalArgumentException e) {
            throw new TransportException(opName + " failed: cannot reach " + endpointUrl, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentException(opName + " interrupted", e);
        }

        int code = resp.statusCode();
        if (code == 401 || code == 403) {
            throw new TransportException(opName + " rejected credentials (HTTP " + code + ")");
        }
        if (code < 200 || code >= 300) {
            throw new AgentException(opName + " failed with HTTP " + code + ": " + resp.body());
        }
        String body = resp.body();
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return json.readTree(body);
        } catch (JsonProcessingException e) {
            throw new AgentException("Failed to parse " + opName + " response", e);
        }
    }
}
