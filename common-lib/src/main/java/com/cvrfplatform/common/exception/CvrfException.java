package com.cvrfplatform.common.exception;

/**
 * Base of the engine's error taxonomy. Always carries the user the failed
 * operation was issued for.
 */
public class CvrfException extends RuntimeException {
    private final String userId;

    public CvrfException(String userId, String message) {
        super("[" + userId + "] " + message);
        this.userId = userId;
    }

    public CvrfException(String userId, String message, Throwable cause) {
        super("[" + userId + "] " + message, cause);
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}
