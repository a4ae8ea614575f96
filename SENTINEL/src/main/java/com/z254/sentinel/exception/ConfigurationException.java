package com.z254.sentinel.exception;

import lombok.Getter;

import java.util.List;

/**
 * Invalid detector or rule definition, rejected at admin time.
 */
@Getter
public class ConfigurationException extends SentinelException {

    private final String entityId;
    private final List<String> violations;

    public ConfigurationException(String entityId, List<String> violations) {
        super("Invalid configuration for '" + entityId + "': " + String.join("; ", violations));
        this.entityId = entityId;
        this.violations = List.copyOf(violations);
    }

    public ConfigurationException(String entityId, String violation) {
        this(entityId, List.of(violation));
    }
}
