package com.shlawgathon.recovery.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.recovery.backend.dto.CheckpointRequest;
import com.shlawgathon.recovery.backend.model.Checkpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Durable store of verified resume points, backed by Redis.
 * <p>
 * Each session keeps a sorted set of checkpoints scored by write time
 * ({@code checkpoints:<sessionId>}); each story keeps a single pointer to the newest
 * checkpoint any session wrote for it ({@code story-checkpoints:<workspaceId>:<storyId>}).
 * Both keys expire after the configured TTL. Unreadable records are logged and treated
 * as absent; Redis I/O errors propagate to the caller.
 */
@Service
public class CheckpointService {

    private static final Logger log = LoggerFactory.getLogger(CheckpointService.class);

    static final String SESSION_KEY_PREFIX = "checkpoints:";
    static final String STORY_KEY_PREFIX = "story-checkpoints:";

    private static final int NANOS_PER_MILLI = 1_000_000;

    // Replaces the story pointer unless it already holds a newer checkpoint.
    // ARGV: pointer json, epoch millis, nanos within the milli, ttl millis
    static final RedisScript<Long> STORY_POINTER_SCRIPT = new DefaultRedisScript<>("""
            local current = redis.call('GET', KEYS[1])
            if current then
              local ok, decoded = pcall(cjson.decode, current)
              if ok and type(decoded) == 'table' then
                local score = tonumber(decoded['score'])
                local nanos = tonumber(decoded['nanos']) or 0
                local incoming = tonumber(ARGV[2])
                if score and (score > incoming or (score == incoming and nanos > tonumber(ARGV[3]))) then
                  return 0
                end
              end
            end
            redis.call('SET', KEYS[1], ARGV[1], 'PX', ARGV[4])
            return 1
            """, Long.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public CheckpointService(StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            @Value("${recovery.checkpoint.ttl:7d}") Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = ttl;
    }

    /**
     * Record a checkpoint for a session and advance the story pointer.
     */
    public Checkpoint createCheckpoint(String sessionId, CheckpointRequest request) {
        Checkpoint checkpoint = Checkpoint.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(sessionId)
                .agentId(request.getAgentId())
                .projectId(request.getProjectId())
                .workspaceId(request.getWorkspaceId())
                .storyId(request.getStoryId())
                .commitHash(request.getCommitHash())
                .branch(request.getBranch())
                .filesModified(request.getFilesModified() != null
                        ? new ArrayList<>(request.getFilesModified())
                        : new ArrayList<>())
                .testsPassed(request.isTestsPassed())
                .description(request.getDescription())
                .createdAt(Instant.now())
                .build();

        long score = checkpoint.getCreatedAt().toEpochMilli();
        int nanos = checkpoint.getCreatedAt().getNano() % NANOS_PER_MILLI;
        String sessionKey = sessionKey(sessionId);

        redisTemplate.opsForZSet().add(sessionKey, write(checkpoint), score);
        redisTemplate.expire(sessionKey, ttl);

        if (checkpoint.getWorkspaceId() != null && checkpoint.getStoryId() != null) {
            Long replaced = redisTemplate.execute(STORY_POINTER_SCRIPT,
                    List.of(storyKey(checkpoint.getWorkspaceId(), checkpoint.getStoryId())),
                    write(new StoryPointer(score, nanos, checkpoint)),
                    String.valueOf(score),
                    String.valueOf(nanos),
                    String.valueOf(ttl.toMillis()));
            if (replaced != null && replaced == 0L) {
                log.info("[CHECKPOINT] Story {}/{} already points at a newer checkpoint",
                        checkpoint.getWorkspaceId(), checkpoint.getStoryId());
            }
        }

        log.info("[CHECKPOINT] Session: {} | Story: {} | Commit: {} | Files: {}",
                sessionId, checkpoint.getStoryId(), checkpoint.getCommitHash(),
                checkpoint.getFilesModified().size());
        return checkpoint;
    }

    /**
     * Get the most recent checkpoint of a session.
     */
    public Optional<Checkpoint> getLatestCheckpoint(String sessionId) {
        Set<String> latest = redisTemplate.opsForZSet().reverseRange(sessionKey(sessionId), 0, 0);
        if (latest == null || latest.isEmpty()) {
            return Optional.empty();
        }
        return read(latest.iterator().next(), Checkpoint.class);
    }

    /**
     * Get all checkpoints of a session, newest first.
     */
    public List<Checkpoint> getSessionCheckpoints(String sessionId) {
        Set<String> entries = redisTemplate.opsForZSet().reverseRange(sessionKey(sessionId), 0, -1);
        if (entries == null) {
            return List.of();
        }

        List<Checkpoint> checkpoints = new ArrayList<>(entries.size());
        for (String entry : entries) {
            read(entry, Checkpoint.class).ifPresent(checkpoints::add);
        }
        return checkpoints;
    }

    /**
     * Get the newest checkpoint written for a story by any session.
     */
    public Optional<Checkpoint> getLatestStoryCheckpoint(String workspaceId, String storyId) {
        String value = redisTemplate.opsForValue().get(storyKey(workspaceId, storyId));
        if (value == null) {
            return Optional.empty();
        }
        return read(value, StoryPointer.class).map(StoryPointer::checkpoint);
    }

    /**
     * Drop a session's checkpoint history. The story pointer is kept.
     */
    public void deleteSessionCheckpoints(String sessionId) {
        redisTemplate.delete(sessionKey(sessionId));
        log.info("[CHECKPOINT] Deleted checkpoints for session: {}", sessionId);
    }

    static String sessionKey(String sessionId) {
        return SESSION_KEY_PREFIX + sessionId;
    }

    static String storyKey(String workspaceId, String storyId) {
        return STORY_KEY_PREFIX + workspaceId + ":" + storyId;
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize checkpoint", e);
        }
    }

    private <T> Optional<T> read(String json, Class<T> type) {
        try {
            return Optional.ofNullable(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            log.error("[CHECKPOINT] Discarding unreadable {} record: {}", type.getSimpleName(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Story pointer value. The pointer script orders writes by {@code score} (epoch millis of
     * {@code createdAt}), then by {@code nanos} within that millisecond.
     */
    record StoryPointer(long score, int nanos, Checkpoint checkpoint) {
    }
}
