package org.neuralchilli.gantt.service;

import org.neuralchilli.gantt.domain.CascadeResult;
import org.neuralchilli.gantt.domain.TaskStatus;

import java.util.List;

/**
 * A stored status change, the dependents it unblocked and, on completion,
 * the successors moved up to start after the completed task.
 */
public record StatusChange(
        String taskId,
        TaskStatus previousStatus,
        TaskStatus status,
        List<String> unblocked,
        CascadeResult advanced
) {
    public StatusChange {
        unblocked = unblocked != null ? List.copyOf(unblocked) : List.of();
        if (advanced == null) {
            advanced = CascadeResult.none(taskId, null, null);
        }
    }
}
