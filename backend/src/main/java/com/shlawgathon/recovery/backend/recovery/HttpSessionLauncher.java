package com.shlawgathon.recovery.backend.recovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.recovery.backend.dto.LaunchRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.CompletableFuture;

/**
 * Starts and stops agent sessions through the agent module's HTTP API.
 */
@Service
public class HttpSessionLauncher implements SessionLauncher {

    private static final Logger log = LoggerFactory.getLogger(HttpSessionLauncher.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String agentModuleUrl;

    public HttpSessionLauncher(ObjectMapper objectMapper,
            @Value("${agent.module.url}") String agentModuleUrl) {
        // Force HTTP/1.1 - the agent module does not speak HTTP/2
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        this.objectMapper = objectMapper;
        this.agentModuleUrl = agentModuleUrl;
    }

    @Override
    public CompletableFuture<String> launchSession(LaunchRequest launch) {
        String body;
        try {
            body = objectMapper.writeValueAsString(launch);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(new SessionLaunchException("Failed to encode launch request", e));
        }

        String fullUrl = agentModuleUrl + "/agent/sessions";
        log.info("[SUPERVISOR HTTP] Launching {} session for story: {} | Resume: {} | Refresh context: {}",
                launch.getAgentType(), launch.getStoryId(),
                launch.getResumeFrom() != null ? launch.getResumeFrom().getCommitHash() : "none",
                launch.isRefreshContext());

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(fullUrl))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    if (error != null) {
                        throw new SessionLaunchException("Agent module unreachable at " + fullUrl, error);
                    }
                    if (response.statusCode() != 200 && response.statusCode() != 201 && response.statusCode() != 202) {
                        throw new SessionLaunchException("Agent module rejected launch with status "
                                + response.statusCode() + ": " + response.body());
                    }
                    return sessionIdFrom(response.body());
                });
    }

    @Override
    public CompletableFuture<Void> terminateSession(String sessionId) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(agentModuleUrl + "/agent/sessions/" + sessionId))
                .header("Content-Type", "application/json")
                .DELETE()
                .build();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenAccept(response -> {
                    if (response.statusCode() == 200 || response.statusCode() == 204) {
                        log.info("[SUPERVISOR HTTP] Terminated session: {}", sessionId);
                    } else {
                        log.warn("[SUPERVISOR HTTP] Failed to terminate session: {} - Status: {}",
                                sessionId, response.statusCode());
                    }
                });
    }

    private String sessionIdFrom(String body) {
        try {
            JsonNode node = objectMapper.readTree(body);
            JsonNode sessionId = node.get("sessionId");
            if (sessionId == null || sessionId.asText().isBlank()) {
                throw new SessionLaunchException("Launch response carried no sessionId: " + body);
            }
            return sessionId.asText();
        } catch (IOException e) {
            throw new SessionLaunchException("Unreadable launch response: " + body, e);
        }
    }
}
