package org.neuralchilli.gantt.core;

import org.neuralchilli.gantt.domain.Dependency;
import org.neuralchilli.gantt.domain.DependencyType;

import javax.annotation.Nonnull;

/**
 * JGraphT edge carrying a dependency's type and lag.
 * Directed from the predecessor ({@code dependsOn}) to the dependent task.
 * Compared by identity, as JGraphT expects of edge objects.
 */
public final class DependencyEdge {

    private final Dependency dependency;

    public DependencyEdge(Dependency dependency) {
        if (dependency == null) {
            throw new IllegalArgumentException("Dependency cannot be null");
        }
        this.dependency = dependency;
    }

    public Dependency dependency() {
        return dependency;
    }

    public String predecessorId() {
        return dependency.dependsOnId();
    }

    public String dependentId() {
        return dependency.taskId();
    }

    public DependencyType type() {
        return dependency.type();
    }

    public int lagDays() {
        return dependency.lagDays();
    }

    @Nonnull
    @Override
    public String toString() {
        return dependency.toString();
    }
}
