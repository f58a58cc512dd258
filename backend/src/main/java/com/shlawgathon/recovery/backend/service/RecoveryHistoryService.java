package com.shlawgathon.recovery.backend.service;

import com.shlawgathon.recovery.backend.dto.HistoryPage;
import com.shlawgathon.recovery.backend.model.Failure;
import com.shlawgathon.recovery.backend.model.ManualOverrideParams;
import com.shlawgathon.recovery.backend.model.RecoveryHistoryEntry;
import com.shlawgathon.recovery.backend.model.RecoveryStrategy;
import com.shlawgathon.recovery.backend.repository.RecoveryHistoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Audit trail of recovery attempts, escalations and manual overrides.
 */
@Service
public class RecoveryHistoryService {

    private static final Logger log = LoggerFactory.getLogger(RecoveryHistoryService.class);

    public static final int MAX_PAGE_SIZE = 100;

    private final RecoveryHistoryRepository historyRepository;
    private final MongoTemplate mongoTemplate;

    public RecoveryHistoryService(RecoveryHistoryRepository historyRepository, MongoTemplate mongoTemplate) {
        this.historyRepository = historyRepository;
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Record a recovery step. Storage failures are logged, never propagated.
     */
    public void record(Failure failure, RecoveryStrategy strategy, int retryCount, boolean success,
            String checkpointUsed, String error, long startedAtMillis) {
        save(failure, strategy, retryCount, success, checkpointUsed, error, startedAtMillis, Map.of());
    }

    /**
     * Record a human decision on a failure.
     */
    public void recordOverride(Failure failure, ManualOverrideParams override, boolean success,
            String checkpointUsed, String error, long startedAtMillis) {
        Map<String, Object> extra = new HashMap<>();
        extra.put("overrideAction", override.getAction() != null ? override.getAction().name() : null);
        extra.put("userId", override.getUserId());
        if (override.getReassignToAgentType() != null) {
            extra.put("reassignToAgentType", override.getReassignToAgentType());
        }
        if (override.getGuidance() != null) {
            extra.put("guidance", override.getGuidance());
        }
        save(failure, RecoveryStrategy.MANUAL_OVERRIDE, failure.getRetryCount(), success,
                checkpointUsed, error, startedAtMillis, extra);
    }

    private void save(Failure failure, RecoveryStrategy strategy, int retryCount, boolean success,
            String checkpointUsed, String error, long startedAtMillis, Map<String, Object> extra) {
        try {
            Map<String, Object> metadata = new HashMap<>();
            if (failure.getMetadata() != null) {
                metadata.putAll(failure.getMetadata());
            }
            metadata.putAll(extra);

            RecoveryHistoryEntry entry = RecoveryHistoryEntry.builder()
                    .failureId(failure.getId())
                    .workspaceId(failure.getWorkspaceId())
                    .projectId(failure.getProjectId())
                    .storyId(failure.getStoryId())
                    .sessionId(failure.getSessionId())
                    .agentId(failure.getAgentId())
                    .agentType(failure.getAgentType())
                    .failureType(failure.getFailureType())
                    .strategy(strategy)
                    .retryCount(retryCount)
                    .checkpointCommitHash(checkpointUsed)
                    .success(success)
                    .errorDetails(error != null ? error : failure.getErrorDetails())
                    .durationMs(System.currentTimeMillis() - startedAtMillis)
                    .metadata(metadata)
                    .build();
            historyRepository.save(entry);
        } catch (RuntimeException e) {
            log.error("[RECOVERY] Failed to record history for failure: {}", failure.getId(), e);
        }
    }

    /**
     * Most recent entries of a project, newest first.
     */
    public List<RecoveryHistoryEntry> recentForProject(String projectId, int limit) {
        return historyRepository.findByProjectIdOrderByCreatedAtDesc(projectId,
                PageRequest.of(0, Math.max(1, limit)));
    }

    /**
     * All entries, newest first, by offset and limit.
     */
    public HistoryPage page(int limit, int offset) {
        int size = Math.min(Math.max(1, limit), MAX_PAGE_SIZE);
        int skip = Math.max(0, offset);

        Query query = new Query()
                .with(Sort.by(Sort.Direction.DESC, "createdAt"))
                .skip(skip)
                .limit(size);

        List<RecoveryHistoryEntry> items = mongoTemplate.find(query, RecoveryHistoryEntry.class);
        long total = mongoTemplate.count(new Query(), RecoveryHistoryEntry.class);

        return HistoryPage.builder()
                .items(items)
                .total(total)
                .limit(size)
                .offset(skip)
                .build();
    }
}
