package com.z254.sentinel.exception;

/**
 * The metric source could not be reached while evaluating an entity.
 */
public class EvaluationException extends SentinelException {

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }

    public EvaluationException(String message) {
        super(message);
    }
}
