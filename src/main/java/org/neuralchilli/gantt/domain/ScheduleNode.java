package org.neuralchilli.gantt.domain;

import javax.annotation.Nonnull;
import java.io.Serializable;
import java.util.Objects;

/**
 * Vertex of the scheduling graph. Wraps an item id for use in JGraphT.
 */
public record ScheduleNode(
        String id,
        NodeKind kind
) implements Serializable {

    public ScheduleNode {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Node id cannot be null or empty");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Node kind cannot be null");
        }
    }

    public static ScheduleNode task(String id) {
        return new ScheduleNode(id, NodeKind.TASK);
    }

    public static ScheduleNode milestone(String id) {
        return new ScheduleNode(id, NodeKind.MILESTONE);
    }

    public boolean isTask() {
        return kind == NodeKind.TASK;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        ScheduleNode that = (ScheduleNode) obj;
        // Ids are unique per project across tasks and milestones
        return Objects.equals(this.id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Nonnull
    @Override
    public String toString() {
        return String.format("ScheduleNode[%s:%s]", kind, id);
    }
}
