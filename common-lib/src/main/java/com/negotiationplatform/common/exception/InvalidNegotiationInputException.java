package com.negotiationplatform.common.exception;

/**
 * Raised by request validation before the engine runs, when an input has the wrong shape
 * (missing profile, score outside [0, 1], non-positive round, ...). The engine itself never
 * throws it.
 */
public class InvalidNegotiationInputException extends RuntimeException {
    private final String field;

    public InvalidNegotiationInputException(String field, String message) {
        super("[" + field + "] " + message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
