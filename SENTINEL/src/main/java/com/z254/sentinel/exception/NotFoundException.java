package com.z254.sentinel.exception;

/**
 * Unknown detector, rule or alert id.
 */
public class NotFoundException extends SentinelException {

    public NotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
    }
}
