package com.agentflow.orchestrator.transport;

import com.agentflow.orchestrator.agent.AgentException;
import com.agentflow.orchestrator.engine.TransportException;
import com.agentflow.orchestrator.transport.dto.ProtocolTaskRequest;
import com.agentflow.orchestrator.transport.dto.ProtocolTaskResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * HTTP client for the external agent-protocol service.
 *
 * Uses java.net.http.HttpClient directly; the wire format is one JSON
 * request and one JSON response per task.
 *
 * Failure mapping:
 * <ul>
 *   <li>request deadline exceeded → {@link TimeoutException}</li>
 *   <li>connection failure, HTTP 401 / 403 / 404, service not configured →
 *       {@link TransportException}</li>
 *   <li>any other non-2xx or unreadable body → {@link AgentException}</li>
 * </ul>
 */
@Component
public class ProtocolClient {

    private static final Logger log = LoggerFactory.getLogger(ProtocolClient.class);

    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;

    public ProtocolClient(@Value("${agentflow.protocol.base-url:}") String baseUrl,
                          ObjectMapper objectMapper) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public boolean isConfigured() {
        return !baseUrl.isEmpty();
    }

    /**
     * Dispatch one task to the protocol service.
     *
     * @throws TimeoutException when the HTTP deadline passes before a response
     */
    public ProtocolTaskResponse execute(ProtocolTaskRequest request) throws TimeoutException {
        if (!isConfigured()) {
            throw new TransportException("Agent-protocol service is not configured (agentflow.protocol.base-url)");
        }
        Duration timeout = request.timeoutMs() > 0 ? Duration.ofMillis(request.timeoutMs()) : DEFAULT_TIMEOUT;
        String opName = "protocol task '" + request.task() + "'";

        HttpResponse<String> resp;
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/tasks/execute"))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .header("X-Run-Id",     request.runId())
                    .POST(HttpRequest.BodyPublishers.ofString(toJson(request)))
                    .build();
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new TimeoutException(opName + " timed out after " + timeout.toMillis() + " ms");
        } catch (IOException | IllegalArgumentException e) {
            throw new TransportException(opName + " failed: cannot reach " + baseUrl, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentException(opName + " interrupted", e);
        }

        int code = resp.statusCode();
        if (code == 401 || code == 403 || code == 404) {
            throw new TransportException(opName + " rejected with HTTP " + code + ": " + resp.body());
        }
        if (code < 200 || code >= 300) {
            throw new AgentException(opName + " failed with HTTP " + code + ": " + resp.body());
        }
        try {
            ProtocolTaskResponse parsed = json.readValue(resp.body(), ProtocolTaskResponse.class);
            log.debug("{} answered with status '{}'", opName, parsed.status());
            return parsed;
        } catch (JsonProcessingException e) {
            throw new AgentException("Failed to parse " + opName + " response", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new AgentException("JSON serialization failed", e);
        }
    }

    static String stripTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        String trimmed = url.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
