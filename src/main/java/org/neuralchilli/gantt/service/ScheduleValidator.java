package org.neuralchilli.gantt.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.gantt.core.CycleDetectedException;
import org.neuralchilli.gantt.core.CycleGuard;
import org.neuralchilli.gantt.core.ValidationException;
import org.neuralchilli.gantt.domain.Dependency;
import org.neuralchilli.gantt.domain.Milestone;
import org.neuralchilli.gantt.domain.ProjectSnapshot;
import org.neuralchilli.gantt.domain.ScheduledTask;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Validates project snapshots beyond basic domain validation.
 * Checks for duplicate ids, inverted dates, dangling or duplicate
 * dependencies and circular dependencies.
 */
@ApplicationScoped
public class ScheduleValidator {

    private final CycleGuard cycleGuard;

    @Inject
    public ScheduleValidator(CycleGuard cycleGuard) {
        this.cycleGuard = cycleGuard;
    }

    /**
     * Validate a whole project snapshot
     *
     * @throws ValidationException if validation fails
     */
    public void validateSnapshot(ProjectSnapshot snapshot) {
        List<String> errors = new ArrayList<>();

        Set<String> taskIds = validateIds(snapshot, errors);
        for (ScheduledTask task : snapshot.tasks()) {
            checkDates(task, errors);
        }
        validateDependencies(snapshot, taskIds, errors);
        validateNoCycles(snapshot, errors);

        if (!errors.isEmpty()) {
            throw new ValidationException("Schedule validation failed for '" + snapshot.projectId() + "':\n" +
                    String.join("\n", errors));
        }
    }

    /**
     * Validate a single task's dates
     *
     * @throws ValidationException if validation fails
     */
    public void validateTask(ScheduledTask task) {
        List<String> errors = new ArrayList<>();
        checkDates(task, errors);

        if (!errors.isEmpty()) {
            throw new ValidationException("Task validation failed for '" + task.id() + "':\n" +
                    String.join("\n", errors));
        }
    }

    private Set<String> validateIds(ProjectSnapshot snapshot, List<String> errors) {
        Set<String> taskIds = new HashSet<>();
        Set<String> allIds = new HashSet<>();

        for (ScheduledTask task : snapshot.tasks()) {
            taskIds.add(task.id());
            if (!allIds.add(task.id())) {
                errors.add("Duplicate id '" + task.id() + "'");
            }
        }
        for (Milestone milestone : snapshot.milestones()) {
            if (!allIds.add(milestone.id())) {
                errors.add("Duplicate id '" + milestone.id() + "'");
            }
        }
        return taskIds;
    }

    private void checkDates(ScheduledTask task, List<String> errors) {
        if (task.isScheduled() && task.dueDate().isBefore(task.startDate())) {
            errors.add("Task '" + task.id() + "' is due " + task.dueDate() +
                    " before it starts " + task.startDate());
        }
    }

    private void validateDependencies(ProjectSnapshot snapshot, Set<String> taskIds, List<String> errors) {
        Set<String> seen = new HashSet<>();

        for (Dependency dependency : snapshot.dependencies()) {
            if (dependency.isSelfLoop()) {
                errors.add("Task '" + dependency.taskId() + "' cannot depend on itself");
                continue;
            }
            if (!taskIds.contains(dependency.taskId())) {
                errors.add("Dependency " + dependency + " refers to '" + dependency.taskId() +
                        "' which is not a task of this project");
            }
            if (!taskIds.contains(dependency.dependsOnId())) {
                errors.add("Dependency " + dependency + " refers to '" + dependency.dependsOnId() +
                        "' which is not a task of this project");
            }
            if (!seen.add(dependency.taskId() + "\u0000" + dependency.dependsOnId())) {
                errors.add("Task '" + dependency.taskId() + "' depends on '" +
                        dependency.dependsOnId() + "' more than once");
            }
        }
    }

    /**
     * Replays the edges through the cycle guard in order; the first edge that
     * closes a loop is reported with the loop it closes.
     */
    private void validateNoCycles(ProjectSnapshot snapshot, List<String> errors) {
        List<Dependency> accepted = new ArrayList<>();
        for (Dependency dependency : snapshot.dependencies()) {
            if (dependency.isSelfLoop()) {
                continue; // reported separately
            }
            Optional<List<String>> cycle = cycleGuard.findCycle(dependency, accepted);
            if (cycle.isPresent()) {
                errors.add("Circular dependency detected: " + CycleDetectedException.describe(cycle.get()));
                return; // Only report first cycle found
            }
            accepted.add(dependency);
        }
    }
}
