package org.neuralchilli.gantt.domain;

import javax.annotation.Nonnull;
import java.io.Serializable;

/**
 * A dependency edge: {@code taskId} cannot satisfy its type constraint until
 * {@code dependsOnId} does. Lag may be negative (lead time).
 */
public record Dependency(
        String taskId,
        String dependsOnId,
        DependencyType type,
        int lagDays
) implements Serializable {

    public Dependency {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("Dependency task cannot be null or empty");
        }
        if (dependsOnId == null || dependsOnId.isBlank()) {
            throw new IllegalArgumentException("Dependency target cannot be null or empty");
        }
        if (type == null) {
            type = DependencyType.FINISH_TO_START;
        }
    }

    public static Dependency finishToStart(String taskId, String dependsOnId) {
        return new Dependency(taskId, dependsOnId, DependencyType.FINISH_TO_START, 0);
    }

    public boolean isSelfLoop() {
        return taskId.equals(dependsOnId);
    }

    /**
     * Check if this edge links the same ordered pair of tasks as another
     */
    public boolean connects(String task, String dependsOn) {
        return taskId.equals(task) && dependsOnId.equals(dependsOn);
    }

    public Dependency withTypeAndLag(DependencyType newType, int newLagDays) {
        return new Dependency(taskId, dependsOnId, newType, newLagDays);
    }

    @Nonnull
    @Override
    public String toString() {
        return String.format("Dependency[%s -> %s %s%+d]", dependsOnId, taskId, type.code(), lagDays);
    }
}
