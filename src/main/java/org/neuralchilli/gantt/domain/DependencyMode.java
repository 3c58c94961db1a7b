package org.neuralchilli.gantt.domain;

/**
 * Project-wide policy for propagating date changes to dependent tasks.
 */
public enum DependencyMode {
    /**
     * Cascade is computed and applied in the same update as the original change.
     */
    STRICT,

    /**
     * Cascade is returned as a preview and applied only on explicit confirmation.
     */
    FLEXIBLE,

    /**
     * No cascading. Dependencies only drive the blocked indicator and the critical path.
     */
    OFF;

    public static DependencyMode fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Dependency mode cannot be null or empty");
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Invalid dependency mode: " + value + ". Must be one of: Strict, Flexible, Off"
            );
        }
    }
}
