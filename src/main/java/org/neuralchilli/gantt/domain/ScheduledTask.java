package org.neuralchilli.gantt.domain;

import java.io.Serializable;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * A task as seen by the scheduling engine.
 * Both dates are optional; a task missing either date is unscheduled.
 */
public record ScheduledTask(
        String id,
        String name,
        LocalDate startDate,
        LocalDate dueDate,
        TaskStatus status,
        double sortOrder,
        long creationIndex
) implements Serializable {

    public ScheduledTask {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Task id cannot be null or empty");
        }
        if (name == null || name.isBlank()) {
            name = id;
        }
        if (status == null) {
            status = TaskStatus.OPEN;
        }
        if (creationIndex < 0) {
            throw new IllegalArgumentException("Creation index cannot be negative");
        }
    }

    /**
     * Check if both dates are set
     */
    public boolean isScheduled() {
        return startDate != null && dueDate != null;
    }

    public boolean isCompleted() {
        return status.isCompleted();
    }

    /**
     * Inclusive length in days (a task starting and ending on the same day lasts one day).
     * Only meaningful for scheduled tasks.
     */
    public long durationDays() {
        if (!isScheduled()) {
            throw new IllegalStateException("Task '" + id + "' is not scheduled");
        }
        return ChronoUnit.DAYS.between(startDate, dueDate) + 1;
    }

    public ScheduledTask withDates(LocalDate newStart, LocalDate newDue) {
        return new ScheduledTask(id, name, newStart, newDue, status, sortOrder, creationIndex);
    }

    public ScheduledTask withStatus(TaskStatus newStatus) {
        return new ScheduledTask(id, name, startDate, dueDate, newStatus, sortOrder, creationIndex);
    }

    public ScheduledTask withSortOrder(double newSortOrder) {
        return new ScheduledTask(id, name, startDate, dueDate, status, newSortOrder, creationIndex);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static class Builder {
        private final String id;
        private String name;
        private LocalDate startDate;
        private LocalDate dueDate;
        private TaskStatus status = TaskStatus.OPEN;
        private double sortOrder;
        private long creationIndex;

        public Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder dates(LocalDate startDate, LocalDate dueDate) {
            this.startDate = startDate;
            this.dueDate = dueDate;
            return this;
        }

        public Builder startDate(LocalDate startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder dueDate(LocalDate dueDate) {
            this.dueDate = dueDate;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder sortOrder(double sortOrder) {
            this.sortOrder = sortOrder;
            return this;
        }

        public Builder creationIndex(long creationIndex) {
            this.creationIndex = creationIndex;
            return this;
        }

        public ScheduledTask build() {
            return new ScheduledTask(id, name, startDate, dueDate, status, sortOrder, creationIndex);
        }
    }
}
