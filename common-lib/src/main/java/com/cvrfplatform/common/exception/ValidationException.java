package com.cvrfplatform.common.exception;

/**
 * Malformed input: factor snapshot, metrics or an out-of-bounds value.
 * {@link #getField()} names the offending field.
 */
public class ValidationException extends CvrfException {
    private final String field;

    public ValidationException(String userId, String field, String message) {
        super(userId, field + ": " + message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
