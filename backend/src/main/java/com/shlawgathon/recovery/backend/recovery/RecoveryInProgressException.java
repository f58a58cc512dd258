package com.shlawgathon.recovery.backend.recovery;

/**
 * The failure already has a recovery in progress.
 */
public class RecoveryInProgressException extends IllegalStateException {

    public RecoveryInProgressException(String failureId) {
        super("Recovery of failure " + failureId + " is already in progress");
    }
}
