package com.shlawgathon.recovery.backend.recovery;

/**
 * The process supervisor could not start a session.
 */
public class SessionLaunchException extends RuntimeException {

    public SessionLaunchException(String message) {
        super(message);
    }

    public SessionLaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
