package com.shlawgathon.recovery.backend.model;

/**
 * Classification of a detected agent session failure.
 */
public enum FailureType {
    STUCK, // No output for longer than the stall window
    CRASH, // Process exited with a non-zero code or a signal
    API_ERROR, // Consecutive failed model API calls
    LOOP, // Same file edited repeatedly without passing tests
    TIMEOUT // Session outlived its maximum duration
}
