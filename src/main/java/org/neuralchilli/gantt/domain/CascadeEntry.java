package org.neuralchilli.gantt.domain;

import java.time.LocalDate;

/**
 * One date change produced by a cascade.
 * A positive shift delays the task, a negative one moves it earlier.
 */
public record CascadeEntry(
        String taskId,
        String taskName,
        DateField field,
        LocalDate oldValue,
        LocalDate newValue,
        long daysShift
) {
    public CascadeEntry {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("Cascade entry task cannot be null or empty");
        }
        if (field == null || oldValue == null || newValue == null) {
            throw new IllegalArgumentException("Cascade entry for " + taskId + " is incomplete");
        }
    }

    public boolean isDelay() {
        return daysShift > 0;
    }
}
