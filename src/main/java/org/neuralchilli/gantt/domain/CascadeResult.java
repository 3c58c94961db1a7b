package org.neuralchilli.gantt.domain;

import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Date shifts required on dependents after a change to one task.
 * Entries are listed in the order the cascade reached them (topological).
 */
public record CascadeResult(
        String changedTaskId,
        LocalDate newStart,
        LocalDate newEnd,
        List<CascadeEntry> entries,
        List<ScheduleWarning> warnings
) {
    public CascadeResult {
        if (changedTaskId == null || changedTaskId.isBlank()) {
            throw new IllegalArgumentException("Changed task cannot be null or empty");
        }
        entries = entries != null ? List.copyOf(entries) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static CascadeResult none(String changedTaskId, LocalDate newStart, LocalDate newEnd) {
        return new CascadeResult(changedTaskId, newStart, newEnd, List.of(), List.of());
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Number of distinct tasks that move
     */
    public int totalAffected() {
        return affectedTaskIds().size();
    }

    public Set<String> affectedTaskIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (CascadeEntry entry : entries) {
            ids.add(entry.taskId());
        }
        return ids;
    }

    public long delayedTasks() {
        return entries.stream().filter(CascadeEntry::isDelay).map(CascadeEntry::taskId).distinct().count();
    }

    public long advancedTasks() {
        return entries.stream().filter(e -> e.daysShift() < 0).map(CascadeEntry::taskId).distinct().count();
    }

    public long maxShift() {
        return entries.stream().mapToLong(CascadeEntry::daysShift).max().orElse(0);
    }

    /**
     * Compare the shifts of two results, ignoring warnings. Used to decide
     * whether a confirmed preview still matches the current schedule.
     */
    public boolean sameChangesAs(CascadeResult other) {
        return other != null
                && changedTaskId.equals(other.changedTaskId)
                && Objects.equals(newStart, other.newStart)
                && Objects.equals(newEnd, other.newEnd)
                && entries.equals(other.entries);
    }

    /**
     * Human readable summary for the confirmation dialog
     */
    public String summary() {
        long delayed = delayedTasks();
        long advanced = advancedTasks();
        if (delayed > 0 && advanced > 0) {
            return delayed + " task(s) delayed, " + advanced + " task(s) advanced";
        } else if (delayed > 0) {
            return delayed + " task(s) will be delayed";
        } else if (advanced > 0) {
            return advanced + " task(s) will move earlier";
        }
        return "No tasks affected";
    }
}
