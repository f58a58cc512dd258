package com.shlawgathon.recovery.backend.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.shlawgathon.recovery.backend.dto.CheckpointRequest;
import com.shlawgathon.recovery.backend.model.Checkpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.ZSetOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CheckpointServiceTest {

    private static final Duration TTL = Duration.ofDays(7);

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ZSetOperations<String, String> zSetOperations;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private ObjectMapper objectMapper;
    private CheckpointService checkpointService;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        checkpointService = new CheckpointService(redisTemplate, objectMapper, TTL);
    }

    private static CheckpointRequest request() {
        return CheckpointRequest.builder()
                .agentId("agent-001")
                .projectId("proj-789")
                .workspaceId("ws-456")
                .storyId("story-11-9")
                .commitHash("abc123")
                .branch("story-11-9")
                .filesModified(List.of("src/App.java", "src/AppTest.java"))
                .testsPassed(true)
                .description("Login form validated")
                .build();
    }

    @Test
    void shouldAppendToSessionHistoryAndAdvanceStoryPointer() throws Exception {
        // Given
        when(redisTemplate.opsForZSet()).thenReturn(zSetOperations);
        when(redisTemplate.execute(eq(CheckpointService.STORY_POINTER_SCRIPT), anyList(),
                any(), any(), any(), any())).thenReturn(1L);

        // When
        Checkpoint checkpoint = checkpointService.createCheckpoint("session-123", request());

        // Then
        assertNotNull(checkpoint.getId());
        assertNotNull(checkpoint.getCreatedAt());
        assertEquals("session-123", checkpoint.getSessionId());

        ArgumentCaptor<String> stored = ArgumentCaptor.forClass(String.class);
        verify(zSetOperations).add(eq("checkpoints:session-123"), stored.capture(),
                eq((double) checkpoint.getCreatedAt().toEpochMilli()));
        assertEquals("abc123", objectMapper.readValue(stored.getValue(), Checkpoint.class).getCommitHash());
        verify(redisTemplate).expire("checkpoints:session-123", TTL);

        ArgumentCaptor<String> pointer = ArgumentCaptor.forClass(String.class);
        verify(redisTemplate).execute(eq(CheckpointService.STORY_POINTER_SCRIPT),
                eq(List.of("story-checkpoints:ws-456:story-11-9")),
                pointer.capture(),
                eq(String.valueOf(checkpoint.getCreatedAt().toEpochMilli())),
                eq(String.valueOf(checkpoint.getCreatedAt().getNano() % 1_000_000)),
                eq(String.valueOf(TTL.toMillis())));
        CheckpointService.StoryPointer written =
                objectMapper.readValue(pointer.getValue(), CheckpointService.StoryPointer.class);
        assertEquals(checkpoint.getCreatedAt().toEpochMilli(), written.score());
        assertEquals(checkpoint.getCreatedAt().getNano() % 1_000_000, written.nanos());
        assertEquals("abc123", written.checkpoint().getCommitHash());
    }

    @Test
    void shouldSkipStoryPointerWithoutStory() {
        when(redisTemplate.opsForZSet()).thenReturn(zSetOperations);
        CheckpointRequest request = request();
        request.setStoryId(null);

        checkpointService.createCheckpoint("session-123", request);

        verify(zSetOperations).add(eq("checkpoints:session-123"), anyString(), anyDouble());
        verify(redisTemplate, never()).execute(eq(CheckpointService.STORY_POINTER_SCRIPT), anyList(),
                any(), any(), any(), any());
    }

    @Test
    void shouldPropagateRedisWriteFailure() {
        when(redisTemplate.opsForZSet()).thenReturn(zSetOperations);
        when(zSetOperations.add(anyString(), anyString(), anyDouble()))
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThrows(RedisConnectionFailureException.class,
                () -> checkpointService.createCheckpoint("session-123", request()));
    }

    @Test
    void shouldReturnNewestSessionCheckpoint() throws Exception {
        Checkpoint stored = Checkpoint.builder()
                .id("cp-1")
                .sessionId("session-123")
                .commitHash("abc123")
                .filesModified(List.of("src/App.java"))
                .testsPassed(true)
                .createdAt(Instant.parse("2026-01-01T10:00:00Z"))
                .build();
        when(redisTemplate.opsForZSet()).thenReturn(zSetOperations);
        when(zSetOperations.reverseRange("checkpoints:session-123", 0, 0))
                .thenReturn(Set.of(objectMapper.writeValueAsString(stored)));

        Optional<Checkpoint> latest = checkpointService.getLatestCheckpoint("session-123");

        assertTrue(latest.isPresent());
        assertEquals("abc123", latest.get().getCommitHash());
        assertEquals(List.of("src/App.java"), latest.get().getFilesModified());
        assertTrue(latest.get().isTestsPassed());
        assertEquals(stored.getCreatedAt(), latest.get().getCreatedAt());
    }

    @Test
    void shouldTreatMissingHistoryAsAbsent() {
        when(redisTemplate.opsForZSet()).thenReturn(zSetOperations);
        when(zSetOperations.reverseRange("checkpoints:session-123", 0, 0)).thenReturn(Set.of());

        assertTrue(checkpointService.getLatestCheckpoint("session-123").isEmpty());
    }

    @Test
    void shouldTreatUnreadableCheckpointAsAbsent() {
        when(redisTemplate.opsForZSet()).thenReturn(zSetOperations);
        when(zSetOperations.reverseRange("checkpoints:session-123", 0, 0)).thenReturn(Set.of("{not json"));

        assertTrue(checkpointService.getLatestCheckpoint("session-123").isEmpty());
    }

    @Test
    void shouldSkipUnreadableEntriesInHistory() throws Exception {
        Set<String> entries = new LinkedHashSet<>();
        entries.add(objectMapper.writeValueAsString(Checkpoint.builder().commitHash("newest").build()));
        entries.add("garbage");
        entries.add(objectMapper.writeValueAsString(Checkpoint.builder().commitHash("oldest").build()));
        when(redisTemplate.opsForZSet()).thenReturn(zSetOperations);
        when(zSetOperations.reverseRange("checkpoints:session-123", 0, -1)).thenReturn(entries);

        List<Checkpoint> history = checkpointService.getSessionCheckpoints("session-123");

        assertEquals(List.of("newest", "oldest"), history.stream().map(Checkpoint::getCommitHash).toList());
    }

    @Test
    void shouldReadStoryPointer() throws Exception {
        Checkpoint checkpoint = Checkpoint.builder().commitHash("def456").storyId("story-11-9").build();
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("story-checkpoints:ws-456:story-11-9"))
                .thenReturn(objectMapper.writeValueAsString(new CheckpointService.StoryPointer(42L, 0, checkpoint)));

        Optional<Checkpoint> latest = checkpointService.getLatestStoryCheckpoint("ws-456", "story-11-9");

        assertEquals("def456", latest.orElseThrow().getCommitHash());
    }

    @Test
    void shouldReturnEmptyWhenStoryHasNoCheckpoint() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        assertTrue(checkpointService.getLatestStoryCheckpoint("ws-456", "story-11-9").isEmpty());
    }

    @Test
    void shouldDeleteOnlySessionHistory() {
        checkpointService.deleteSessionCheckpoints("session-123");

        verify(redisTemplate).delete("checkpoints:session-123");
        verifyNoMoreInteractions(redisTemplate);
    }
}
