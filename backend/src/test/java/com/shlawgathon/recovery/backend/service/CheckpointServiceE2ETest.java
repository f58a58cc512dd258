package com.shlawgathon.recovery.backend.service;

import com.shlawgathon.recovery.backend.BaseE2ETest;
import com.shlawgathon.recovery.backend.dto.CheckpointRequest;
import com.shlawgathon.recovery.backend.model.Checkpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CheckpointServiceE2ETest extends BaseE2ETest {

    @Autowired
    private CheckpointService checkpointService;

    @Autowired
    private StringRedisTemplate redisTemplate;

    @BeforeEach
    void setUp() {
        try (RedisConnection connection = redisTemplate.getRequiredConnectionFactory().getConnection()) {
            connection.serverCommands().flushAll();
        }
    }

    private static CheckpointRequest request(String commitHash) {
        return CheckpointRequest.builder()
                .agentId("agent-001")
                .projectId("proj-789")
                .workspaceId("ws-456")
                .storyId("story-11-9")
                .commitHash(commitHash)
                .branch("story-11-9")
                .filesModified(List.of("src/App.java", "src/AppTest.java"))
                .testsPassed(true)
                .description("Checkpoint " + commitHash)
                .build();
    }

    @Test
    void shouldRoundTripLatestCheckpoint() {
        // Given
        Checkpoint saved = checkpointService.createCheckpoint("session-1", request("abc123"));

        // When
        Optional<Checkpoint> latest = checkpointService.getLatestCheckpoint("session-1");

        // Then
        assertTrue(latest.isPresent());
        assertEquals(saved.getId(), latest.get().getId());
        assertEquals("abc123", latest.get().getCommitHash());
        assertEquals(List.of("src/App.java", "src/AppTest.java"), latest.get().getFilesModified());
        assertTrue(latest.get().isTestsPassed());
    }

    @Test
    void shouldListSessionHistoryNewestFirst() throws Exception {
        checkpointService.createCheckpoint("session-1", request("first"));
        Thread.sleep(5);
        checkpointService.createCheckpoint("session-1", request("second"));
        Thread.sleep(5);
        checkpointService.createCheckpoint("session-1", request("third"));

        List<Checkpoint> history = checkpointService.getSessionCheckpoints("session-1");

        assertEquals(List.of("third", "second", "first"),
                history.stream().map(Checkpoint::getCommitHash).toList());
        assertEquals("third", checkpointService.getLatestCheckpoint("session-1").orElseThrow().getCommitHash());
    }

    @Test
    void shouldExpireHistoryAfterTtl() {
        checkpointService.createCheckpoint("session-1", request("abc123"));

        Long ttl = redisTemplate.getExpire("checkpoints:session-1");
        Long storyTtl = redisTemplate.getExpire("story-checkpoints:ws-456:story-11-9");

        assertNotNull(ttl);
        assertTrue(ttl > Duration.ofDays(6).toSeconds() && ttl <= Duration.ofDays(7).toSeconds());
        assertNotNull(storyTtl);
        assertTrue(storyTtl > Duration.ofDays(6).toSeconds());
    }

    @Test
    void shouldPointStoryAtNewestCheckpointAcrossSessions() throws Exception {
        checkpointService.createCheckpoint("session-1", request("old"));
        Thread.sleep(5);
        checkpointService.createCheckpoint("session-2", request("new"));

        Optional<Checkpoint> latest = checkpointService.getLatestStoryCheckpoint("ws-456", "story-11-9");

        assertEquals("new", latest.orElseThrow().getCommitHash());
        assertEquals("session-2", latest.get().getSessionId());
    }

    @Test
    void shouldKeepNewerStoryPointerAgainstLateWrite() {
        // Given a pointer written in the future, as a slower writer would see it
        long future = System.currentTimeMillis() + Duration.ofMinutes(5).toMillis();
        Checkpoint newer = Checkpoint.builder().id("cp-newer").commitHash("newer").storyId("story-11-9").build();
        redisTemplate.execute(CheckpointService.STORY_POINTER_SCRIPT,
                List.of(CheckpointService.storyKey("ws-456", "story-11-9")),
                "{\"score\":" + future + ",\"checkpoint\":{\"id\":\"cp-newer\",\"commitHash\":\"newer\"}}",
                String.valueOf(future),
                "0",
                String.valueOf(Duration.ofDays(7).toMillis()));

        // When
        checkpointService.createCheckpoint("session-late", request("late"));

        // Then
        assertEquals(newer.getCommitHash(),
                checkpointService.getLatestStoryCheckpoint("ws-456", "story-11-9").orElseThrow().getCommitHash());
        assertEquals("late", checkpointService.getLatestCheckpoint("session-late").orElseThrow().getCommitHash());
    }

    @Test
    void shouldOrderStoryPointerWritesWithinTheSameMillisecond() {
        // Given
        String key = CheckpointService.storyKey("ws-456", "story-11-9");
        long millis = 1_767_261_600_000L;
        String ttl = String.valueOf(Duration.ofDays(7).toMillis());
        redisTemplate.execute(CheckpointService.STORY_POINTER_SCRIPT, List.of(key),
                pointer(millis, 500_000, "middle"), String.valueOf(millis), "500000", ttl);

        // When
        Long earlier = redisTemplate.execute(CheckpointService.STORY_POINTER_SCRIPT, List.of(key),
                pointer(millis, 400_000, "earlier"), String.valueOf(millis), "400000", ttl);
        String afterEarlier = storyCommit();
        Long later = redisTemplate.execute(CheckpointService.STORY_POINTER_SCRIPT, List.of(key),
                pointer(millis, 600_000, "later"), String.valueOf(millis), "600000", ttl);

        // Then
        assertEquals(0L, earlier);
        assertEquals("middle", afterEarlier);
        assertEquals(1L, later);
        assertEquals("later", storyCommit());
    }

    private static String pointer(long millis, int nanos, String commitHash) {
        return "{\"score\":" + millis + ",\"nanos\":" + nanos
                + ",\"checkpoint\":{\"id\":\"cp-" + commitHash + "\",\"commitHash\":\"" + commitHash + "\"}}";
    }

    private String storyCommit() {
        return checkpointService.getLatestStoryCheckpoint("ws-456", "story-11-9").orElseThrow().getCommitHash();
    }

    @Test
    void shouldKeepStoryPointerWhenSessionHistoryIsDeleted() {
        checkpointService.createCheckpoint("session-1", request("abc123"));

        checkpointService.deleteSessionCheckpoints("session-1");

        assertTrue(checkpointService.getSessionCheckpoints("session-1").isEmpty());
        assertTrue(checkpointService.getLatestCheckpoint("session-1").isEmpty());
        assertEquals("abc123",
                checkpointService.getLatestStoryCheckpoint("ws-456", "story-11-9").orElseThrow().getCommitHash());
    }

    @Test
    void shouldTreatCorruptStoryPointerAsAbsent() {
        redisTemplate.opsForValue().set(CheckpointService.storyKey("ws-456", "story-9"), "not json");

        assertTrue(checkpointService.getLatestStoryCheckpoint("ws-456", "story-9").isEmpty());
    }
}
