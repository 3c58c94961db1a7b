package org.neuralchilli.gantt.domain;

import java.time.LocalDate;

/**
 * Critical path figures for one task. Finish dates are the last working day
 * (inclusive), matching how due dates are stored.
 */
public record TaskSchedule(
        String taskId,
        LocalDate earliestStart,
        LocalDate earliestFinish,
        LocalDate latestStart,
        LocalDate latestFinish,
        long slackDays,
        boolean critical
) {
    public TaskSchedule {
        if (slackDays < 0) {
            throw new IllegalArgumentException("Slack cannot be negative for task " + taskId);
        }
    }
}
