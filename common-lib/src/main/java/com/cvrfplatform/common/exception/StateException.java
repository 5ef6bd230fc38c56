package com.cvrfplatform.common.exception;

/**
 * Operation is invalid for the user's current lifecycle state, e.g. recording a
 * decision with no active episode or starting a second active episode.
 */
public class StateException extends CvrfException {

    public StateException(String userId, String message) {
        super(userId, message);
    }
}
