package org.neuralchilli.gantt.domain;

/**
 * Workflow status of a task.
 */
public enum TaskStatus {
    OPEN("Open"),
    IN_PROGRESS("In Progress"),
    REVIEW("Review"),
    /**
     * Completed predecessors never block their dependents and completed
     * tasks are never moved by a cascade.
     */
    COMPLETED("Completed"),
    CANCELLED("Cancelled");

    private final String label;

    TaskStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isCompleted() {
        return this == COMPLETED;
    }

    /**
     * Parse status from its label ("In Progress") or constant name ("IN_PROGRESS").
     */
    public static TaskStatus fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Task status cannot be null or empty");
        }

        String normalized = value.trim();
        for (TaskStatus status : values()) {
            if (status.label.equalsIgnoreCase(normalized) || status.name().equalsIgnoreCase(normalized)) {
                return status;
            }
        }

        throw new IllegalArgumentException("Unknown task status: " + value);
    }
}
