package com.cvrfplatform.common.exception;

/**
 * A cycle for this user is already running, or the belief version changed between
 * read and commit. Retryable once the in-flight cycle resolves.
 */
public class ConcurrentCycleException extends CvrfException {

    public ConcurrentCycleException(String userId, String message) {
        super(userId, message);
    }
}
