package org.neuralchilli.gantt.domain;

import java.io.Serializable;
import java.time.LocalDate;

/**
 * A milestone shares the Gantt ordering space with tasks but takes no part
 * in dependency scheduling. Its due date is both its start and its end.
 */
public record Milestone(
        String id,
        String name,
        LocalDate dueDate,
        double sortOrder,
        long creationIndex
) implements Serializable {

    public Milestone {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Milestone id cannot be null or empty");
        }
        if (name == null || name.isBlank()) {
            name = id;
        }
        if (creationIndex < 0) {
            throw new IllegalArgumentException("Creation index cannot be negative");
        }
    }

    public Milestone withSortOrder(double newSortOrder) {
        return new Milestone(id, name, dueDate, newSortOrder, creationIndex);
    }
}
