package org.neuralchilli.gantt.domain;

import java.time.LocalDate;
import java.util.Comparator;

/**
 * A task or milestone as positioned on the Gantt chart.
 */
public record SequencedItem(
        String id,
        NodeKind kind,
        double sortOrder,
        long creationIndex,
        LocalDate startDate,
        LocalDate dueDate
) {

    /**
     * Display order: sort key first, creation order breaks ties.
     */
    public static final Comparator<SequencedItem> DISPLAY_ORDER =
            Comparator.comparingDouble(SequencedItem::sortOrder)
                    .thenComparingLong(SequencedItem::creationIndex)
                    .thenComparing(SequencedItem::id);

    /**
     * Order used when keys are first assigned: by dates, then creation.
     */
    public static final Comparator<SequencedItem> INITIAL_ORDER =
            Comparator.comparing(SequencedItem::startDate, Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparing(SequencedItem::dueDate, Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparingLong(SequencedItem::creationIndex)
                    .thenComparing(SequencedItem::id);

    public static SequencedItem of(ScheduledTask task) {
        return new SequencedItem(task.id(), NodeKind.TASK, task.sortOrder(), task.creationIndex(),
                task.startDate(), task.dueDate());
    }

    public static SequencedItem of(Milestone milestone) {
        return new SequencedItem(milestone.id(), NodeKind.MILESTONE, milestone.sortOrder(),
                milestone.creationIndex(), milestone.dueDate(), milestone.dueDate());
    }
}
