package com.shlawgathon.recovery.backend.controller;

import com.shlawgathon.recovery.backend.BaseE2ETest;
import com.shlawgathon.recovery.backend.detector.FailureDetector;
import com.jayway.jsonpath.JsonPath;
import com.shlawgathon.recovery.backend.dto.LaunchRequest;
import com.shlawgathon.recovery.backend.model.RecoveryAction;
import com.shlawgathon.recovery.backend.repository.RecoveryHistoryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
class RecoveryFlowE2ETest extends BaseE2ETest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private FailureDetector failureDetector;

    @Autowired
    private RecoveryHistoryRepository historyRepository;

    @BeforeEach
    void setUp() {
        historyRepository.deleteAll();
        failureDetector.getActiveFailures().forEach(f -> failureDetector.resolveFailure(f.getId()));
        reset(sessionLauncher);
        when(sessionLauncher.terminateSession(anyString())).thenReturn(CompletableFuture.completedFuture(null));
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met within 10 seconds");
            }
            Thread.sleep(50);
        }
    }

    private void register(String sessionId, String projectId) throws Exception {
        mockMvc.perform(post("/internal/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sessionId":"%s","agentId":"agent-001","agentType":"dev","projectId":"%s",
                                 "workspaceId":"ws-456","storyId":"story-11-9"}
                                """.formatted(sessionId, projectId)))
                .andExpect(status().isCreated());
    }

    @Test
    void shouldRecoverCrashedSessionFromCheckpoint() throws Exception {
        // Given
        when(sessionLauncher.launchSession(any())).thenReturn(CompletableFuture.completedFuture("session-e2e-2"));
        register("session-e2e-1", "proj-e2e");
        mockMvc.perform(post("/internal/sessions/session-e2e-1/checkpoints")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"projectId":"proj-e2e","workspaceId":"ws-456","storyId":"story-11-9",
                                 "commitHash":"abc123","filesModified":["src/App.java"],"testsPassed":true}
                                """))
                .andExpect(status().isCreated());

        // When
        mockMvc.perform(post("/internal/sessions/session-e2e-1/exit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"exitCode\":137,\"signal\":\"SIGKILL\",\"stderr\":\"Killed\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.failureType").value("CRASH"))
                .andExpect(jsonPath("$.lastCheckpoint").value("abc123"));

        // Then
        await(() -> failureDetector.isTracking("session-e2e-2"));
        await(() -> historyRepository.count() == 1);

        ArgumentCaptor<LaunchRequest> captor = ArgumentCaptor.forClass(LaunchRequest.class);
        verify(sessionLauncher).launchSession(captor.capture());
        assertEquals("abc123", captor.getValue().getResumeFrom().getCommitHash());

        mockMvc.perform(get("/api/failures/active"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));

        mockMvc.perform(get("/api/failures").param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.items[0].strategy").value("RETRY"))
                .andExpect(jsonPath("$.items[0].success").value(true))
                .andExpect(jsonPath("$.items[0].createdAt").exists());

        mockMvc.perform(get("/api/projects/proj-e2e/recovery-status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalRetries").value(1))
                .andExpect(jsonPath("$.escalated").value(false))
                .andExpect(jsonPath("$.recoveryHistory.length()").value(1));

        failureDetector.unregisterSession("session-e2e-2");
    }

    @Test
    void shouldEscalateAndAcceptTerminateOverride() throws Exception {
        // Given a crash nobody owns
        String response = mockMvc.perform(post("/internal/sessions/ghost-e2e/exit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"exitCode\":1,\"stderr\":\"boom\"}"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        String failureId = JsonPath.read(response, "$.id");

        await(() -> failureDetector.getFailure(failureId)
                .map(f -> f.getRecoveryAction() == RecoveryAction.ESCALATED)
                .orElse(false));
        verify(sessionLauncher, never()).launchSession(any());

        // When
        MvcResult pending = mockMvc.perform(post("/api/failures/" + failureId + "/override")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"TERMINATE\",\"userId\":\"user-1\"}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        // Then
        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.strategy").value("MANUAL_OVERRIDE"));
        assertTrue(failureDetector.getFailure(failureId).isEmpty());

        mockMvc.perform(post("/api/failures/" + failureId + "/override")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"TERMINATE\"}"))
                .andExpect(status().isNotFound());
    }
}
