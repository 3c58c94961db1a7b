package org.neuralchilli.gantt.domain;

/**
 * Non-fatal finding attached to a scheduling result so the caller can flag
 * an incomplete schedule.
 */
public record ScheduleWarning(
        Kind kind,
        String taskId,
        String message
) {

    public enum Kind {
        /**
         * A predecessor without the dates its dependency type needs; it contributes no constraint
         */
        UNSCHEDULED_PREDECESSOR,

        /**
         * A task without dates; the default duration was assumed
         */
        UNSCHEDULED_TASK,

        /**
         * Neither the project nor any task carries a date to anchor the schedule
         */
        NO_PROJECT_START
    }

    public ScheduleWarning {
        if (kind == null) {
            throw new IllegalArgumentException("Warning kind cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("Warning message cannot be null or empty");
        }
    }

    public static ScheduleWarning unscheduledPredecessor(String predecessorId, String dependentId) {
        return new ScheduleWarning(
                Kind.UNSCHEDULED_PREDECESSOR,
                predecessorId,
                "Task '" + predecessorId + "' has no dates; treated as zero duration for '" + dependentId + "'"
        );
    }

    public static ScheduleWarning unscheduledTask(String taskId, int assumedDays) {
        return new ScheduleWarning(
                Kind.UNSCHEDULED_TASK,
                taskId,
                "Task '" + taskId + "' has no dates; assuming " + assumedDays + " day(s)"
        );
    }

    public static ScheduleWarning noProjectStart(String projectId) {
        return new ScheduleWarning(
                Kind.NO_PROJECT_START,
                null,
                "Project '" + projectId + "' has no start date and no dated tasks"
        );
    }
}
