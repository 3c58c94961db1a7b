package org.neuralchilli.gantt.service;

import org.neuralchilli.gantt.domain.CascadeResult;
import org.neuralchilli.gantt.domain.DependencyMode;

import java.util.Optional;

/**
 * Result of moving a task's dates, shaped by the project's dependency mode.
 */
public sealed interface CascadeOutcome {

    DependencyMode mode();

    /**
     * Check if the new dates were stored
     */
    boolean isApplied();

    /**
     * Number of distinct dependents that moved (or would move, for a preview)
     */
    int totalAffected();

    /**
     * Get error message if rejected
     */
    default Optional<String> error() {
        return Optional.empty();
    }

    /**
     * Task and cascade were written together.
     */
    record Applied(DependencyMode mode, CascadeResult cascade) implements CascadeOutcome {
        @Override
        public boolean isApplied() {
            return true;
        }

        @Override
        public int totalAffected() {
            return cascade.totalAffected();
        }
    }

    /**
     * Flexible mode: nothing written, the shifts await confirmation.
     */
    record Preview(CascadeResult cascade) implements CascadeOutcome {
        @Override
        public DependencyMode mode() {
            return DependencyMode.FLEXIBLE;
        }

        @Override
        public boolean isApplied() {
            return false;
        }

        @Override
        public int totalAffected() {
            return cascade.totalAffected();
        }
    }

    /**
     * Off mode: the task's own dates were written, dependents untouched.
     */
    record NotCascaded(String taskId, boolean blocked) implements CascadeOutcome {
        @Override
        public DependencyMode mode() {
            return DependencyMode.OFF;
        }

        @Override
        public boolean isApplied() {
            return true;
        }

        @Override
        public int totalAffected() {
            return 0;
        }
    }

    /**
     * A confirmed preview no longer matches the schedule. Nothing was written;
     * {@code current} is the recomputed cascade to review again.
     */
    record StalePreview(DependencyMode mode, CascadeResult current) implements CascadeOutcome {
        @Override
        public boolean isApplied() {
            return false;
        }

        @Override
        public int totalAffected() {
            return current.totalAffected();
        }

        @Override
        public Optional<String> error() {
            return Optional.of("Schedule changed since the preview was computed, review the cascade again");
        }
    }

    record Rejected(DependencyMode mode, String taskId, String reason) implements CascadeOutcome {
        @Override
        public boolean isApplied() {
            return false;
        }

        @Override
        public int totalAffected() {
            return 0;
        }

        @Override
        public Optional<String> error() {
            return Optional.of(reason);
        }
    }
}
