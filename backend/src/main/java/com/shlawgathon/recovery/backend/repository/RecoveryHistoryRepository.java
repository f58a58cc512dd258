package com.shlawgathon.recovery.backend.repository;

import com.shlawgathon.recovery.backend.model.RecoveryHistoryEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RecoveryHistoryRepository extends MongoRepository<RecoveryHistoryEntry, String> {

    List<RecoveryHistoryEntry> findByProjectIdOrderByCreatedAtDesc(String projectId, Pageable pageable);

}
