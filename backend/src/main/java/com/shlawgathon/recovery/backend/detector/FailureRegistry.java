package com.shlawgathon.recovery.backend.detector;

import com.shlawgathon.recovery.backend.model.Failure;

import java.util.List;
import java.util.Optional;

/**
 * Storage of active (unresolved) failures.
 * <p>
 * The {@link FailureDetector} is the only writer; resolved failures are evicted.
 */
public interface FailureRegistry {

    void save(Failure failure);

    Optional<Failure> find(String failureId);

    Optional<Failure> remove(String failureId);

    /**
     * Unresolved failures, oldest first.
     */
    List<Failure> unresolved();
}
