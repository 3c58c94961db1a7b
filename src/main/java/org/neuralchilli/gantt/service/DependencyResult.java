package org.neuralchilli.gantt.service;

import org.neuralchilli.gantt.domain.Dependency;

import java.util.List;
import java.util.Optional;

/**
 * Result of creating or changing a dependency edge.
 * Provides type-safe success/failure handling with clear error messages.
 */
public sealed interface DependencyResult {

    /**
     * Check if the edge was stored
     */
    boolean isSuccess();

    /**
     * Get error message if rejected
     */
    Optional<String> error();

    /**
     * New edge stored
     */
    record Added(Dependency dependency) implements DependencyResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<String> error() {
            return Optional.empty();
        }
    }

    /**
     * Type or lag of an existing edge changed
     */
    record Updated(Dependency dependency) implements DependencyResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<String> error() {
            return Optional.empty();
        }
    }

    /**
     * Edge refused because it would close a cycle. The path starts and ends
     * at the same task, e.g. A, C, A.
     */
    record CycleDetected(Dependency candidate, List<String> cyclePath, String message) implements DependencyResult {
        public CycleDetected {
            cyclePath = cyclePath != null ? List.copyOf(cyclePath) : List.of();
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<String> error() {
            return Optional.of(message);
        }
    }

    /**
     * Edge refused for any other reason (unknown task, duplicate edge)
     */
    record Rejected(Dependency candidate, String reason) implements DependencyResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<String> error() {
            return Optional.of(reason);
        }
    }

    static DependencyResult added(Dependency dependency) {
        return new Added(dependency);
    }

    static DependencyResult updated(Dependency dependency) {
        return new Updated(dependency);
    }

    static DependencyResult cycleDetected(Dependency candidate, List<String> cyclePath, String message) {
        return new CycleDetected(candidate, cyclePath, message);
    }

    static DependencyResult rejected(Dependency candidate, String reason) {
        return new Rejected(candidate, reason);
    }

    static DependencyResult rejected(Dependency candidate, Exception e) {
        return new Rejected(candidate, e.getMessage());
    }
}
