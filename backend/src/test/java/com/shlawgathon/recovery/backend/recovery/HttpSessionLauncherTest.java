package com.shlawgathon.recovery.backend.recovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.recovery.backend.dto.LaunchRequest;
import com.shlawgathon.recovery.backend.dto.ResumeCheckpoint;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HttpSessionLauncherTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicReference<String> receivedBody = new AtomicReference<>();
    private final AtomicReference<String> receivedDelete = new AtomicReference<>();

    private HttpServer server;
    private volatile int launchStatus = 201;
    private volatile String launchResponse = "{\"sessionId\":\"session-new\"}";

    private HttpSessionLauncher launcher;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/agent/sessions", exchange -> {
            if ("POST".equals(exchange.getRequestMethod())) {
                receivedBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
                byte[] body = launchResponse.getBytes(StandardCharsets.UTF_8);
                exchange.sendResponseHeaders(launchStatus, body.length);
                try (OutputStream out = exchange.getResponseBody()) {
                    out.write(body);
                }
            } else {
                receivedDelete.set(exchange.getRequestURI().getPath());
                exchange.sendResponseHeaders(204, -1);
                exchange.close();
            }
        });
        server.start();
        launcher = new HttpSessionLauncher(objectMapper, "http://localhost:" + server.getAddress().getPort());
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private static LaunchRequest launch() {
        return LaunchRequest.builder()
                .agentType("dev")
                .projectId("proj-789")
                .workspaceId("ws-456")
                .storyId("story-11-9")
                .resumeFrom(ResumeCheckpoint.builder()
                        .commitHash("abc123")
                        .branch("story-11-9")
                        .filesModified(List.of("src/App.java"))
                        .build())
                .refreshContext(true)
                .build();
    }

    @Test
    void shouldLaunchSessionAndReturnItsId() throws Exception {
        String sessionId = launcher.launchSession(launch()).join();

        assertEquals("session-new", sessionId);
        JsonNode sent = objectMapper.readTree(receivedBody.get());
        assertEquals("dev", sent.get("agentType").asText());
        assertEquals("abc123", sent.get("resumeFrom").get("commitHash").asText());
        assertTrue(sent.get("refreshContext").asBoolean());
    }

    @Test
    void shouldFailWhenAgentModuleRejectsLaunch() {
        launchStatus = 503;
        launchResponse = "{\"error\":\"busy\"}";

        CompletionException error = assertThrows(CompletionException.class,
                () -> launcher.launchSession(launch()).join());

        assertInstanceOf(SessionLaunchException.class, error.getCause());
        assertTrue(error.getCause().getMessage().contains("503"));
    }

    @Test
    void shouldFailWhenResponseHasNoSessionId() {
        launchResponse = "{}";

        CompletionException error = assertThrows(CompletionException.class,
                () -> launcher.launchSession(launch()).join());

        assertInstanceOf(SessionLaunchException.class, error.getCause());
    }

    @Test
    void shouldFailWhenAgentModuleIsUnreachable() {
        HttpSessionLauncher unreachable = new HttpSessionLauncher(objectMapper, "http://localhost:1");

        CompletionException error = assertThrows(CompletionException.class,
                () -> unreachable.launchSession(launch()).join());

        assertInstanceOf(SessionLaunchException.class, error.getCause());
    }

    @Test
    void shouldTerminateSession() {
        launcher.terminateSession("session-123").join();

        assertEquals("/agent/sessions/session-123", receivedDelete.get());
    }
}
