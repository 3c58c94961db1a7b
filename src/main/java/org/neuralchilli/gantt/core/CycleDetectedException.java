package org.neuralchilli.gantt.core;

import java.util.List;

/**
 * Thrown when a dependency edge would close a cycle.
 * Carries the would-be cycle so the caller can present it, e.g.
 * {@code [A, C, A]} for adding "C depends on A" while A already depends on C.
 */
public class CycleDetectedException extends RuntimeException {

    private final List<String> cyclePath;

    public CycleDetectedException(String message) {
        this(message, List.of());
    }

    public CycleDetectedException(String message, List<String> cyclePath) {
        super(message);
        this.cyclePath = cyclePath != null ? List.copyOf(cyclePath) : List.of();
    }

    public CycleDetectedException(String message, Throwable cause) {
        super(message, cause);
        this.cyclePath = List.of();
    }

    public List<String> cyclePath() {
        return cyclePath;
    }

    /**
     * Render a path as "A → C → A"
     */
    public static String describe(List<String> path) {
        return String.join(" → ", path);
    }
}
