package org.neuralchilli.gantt.domain;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Output of a critical path analysis.
 *
 * @param schedules     per-task figures in topological order
 * @param criticalTasks ids of zero-slack tasks in topological order
 */
public record CriticalPathResult(
        LocalDate projectStart,
        LocalDate projectFinish,
        Map<String, TaskSchedule> schedules,
        List<String> criticalTasks,
        List<ScheduleWarning> warnings
) {
    public CriticalPathResult {
        schedules = schedules != null ? Collections.unmodifiableMap(new LinkedHashMap<>(schedules)) : Map.of();
        criticalTasks = criticalTasks != null ? List.copyOf(criticalTasks) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static CriticalPathResult empty(List<ScheduleWarning> warnings) {
        return new CriticalPathResult(null, null, Map.of(), List.of(), warnings);
    }

    public Optional<TaskSchedule> schedule(String taskId) {
        return Optional.ofNullable(schedules.get(taskId));
    }

    public boolean isCritical(String taskId) {
        TaskSchedule schedule = schedules.get(taskId);
        return schedule != null && schedule.critical();
    }

    /**
     * Slack per task, for the Gantt float overlay
     */
    public Map<String, Long> slackByTask() {
        Map<String, Long> slack = new LinkedHashMap<>();
        schedules.forEach((id, s) -> slack.put(id, s.slackDays()));
        return slack;
    }
}
