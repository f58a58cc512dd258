package com.shlawgathon.recovery.backend.recovery;

/**
 * No active failure with the given id.
 */
public class FailureNotFoundException extends RuntimeException {

    public FailureNotFoundException(String failureId) {
        super("Failure " + failureId + " not found");
    }
}
