package org.neuralchilli.gantt.core;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.neuralchilli.gantt.config.SchedulingConfig;
import org.neuralchilli.gantt.domain.CascadeEntry;
import org.neuralchilli.gantt.domain.CascadeResult;
import org.neuralchilli.gantt.domain.DateField;
import org.neuralchilli.gantt.domain.DependencyType;
import org.neuralchilli.gantt.domain.ScheduleWarning;
import org.neuralchilli.gantt.domain.ScheduledTask;
import org.neuralchilli.gantt.domain.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Propagates a date change on one task to the tasks that depend on it.
 * <p>
 * Dates are inclusive days. A dependency requires:
 * <ul>
 *   <li>FS: dependent start &ge; predecessor due + 1 + lag</li>
 *   <li>SS: dependent start &ge; predecessor start + lag</li>
 *   <li>FF: dependent due &ge; predecessor due + lag</li>
 *   <li>SF: dependent due &ge; predecessor start + lag - 1</li>
 * </ul>
 * A dependent moves by the smallest shift that satisfies all of its
 * constraints at once, keeping its duration. Dependents are visited in
 * topological order, so a task reached along several paths is evaluated once,
 * after every predecessor has settled, and takes the largest required shift.
 * Completed tasks never move and neither block nor constrain their dependents.
 */
@Singleton
public class CascadeEngine {

    private static final Logger log = LoggerFactory.getLogger(CascadeEngine.class);

    private final boolean pullBack;

    @Inject
    public CascadeEngine(SchedulingConfig config) {
        this(config.cascade().pullBack());
    }

    /**
     * @param pullBack also move dependents earlier when their constraints loosen
     */
    public CascadeEngine(boolean pullBack) {
        this.pullBack = pullBack;
    }

    /**
     * Compute the shifts needed after moving a task to new dates.
     * A null date leaves that boundary unchanged. The graph is not modified.
     *
     * @throws ValidationException if the task is unknown or the new due date precedes the new start
     */
    public CascadeResult computeCascade(
            ScheduleGraph graph,
            String changedTaskId,
            LocalDate newStart,
            LocalDate newEnd
    ) {
        ScheduledTask changed = graph.requireTask(changedTaskId);
        LocalDate start = newStart != null ? newStart : changed.startDate();
        LocalDate end = newEnd != null ? newEnd : changed.dueDate();

        if (start != null && end != null && end.isBefore(start)) {
            throw new ValidationException(
                    "Due date " + end + " cannot be before start date " + start + " for task '" + changedTaskId + "'"
            );
        }

        boolean startMoved = !Objects.equals(start, changed.startDate());
        boolean endMoved = !Objects.equals(end, changed.dueDate());
        if (!startMoved && !endMoved) {
            return CascadeResult.none(changedTaskId, newStart, newEnd);
        }
        if (changed.isCompleted()) {
            log.debug("Task {} is completed; its dependents are not constrained by it", changedTaskId);
            return CascadeResult.none(changedTaskId, newStart, newEnd);
        }

        Map<String, ScheduledTask> working = new HashMap<>();
        working.put(changedTaskId, changed.withDates(start, end));

        PriorityQueue<String> frontier = new PriorityQueue<>(Comparator.comparingInt(graph::topologicalIndex));
        Set<String> queued = new HashSet<>();

        for (DependencyEdge edge : graph.outgoingEdges(changedTaskId)) {
            if (movesConstrainingBoundary(edge.type(), startMoved, endMoved) && queued.add(edge.dependentId())) {
                frontier.add(edge.dependentId());
            }
        }

        List<CascadeEntry> entries = new ArrayList<>();
        Set<ScheduleWarning> warnings = new LinkedHashSet<>();

        while (!frontier.isEmpty()) {
            String id = frontier.poll();
            ScheduledTask dependent = current(graph, working, id);

            if (dependent.isCompleted()) {
                log.trace("Cascade stops at completed task {}", id);
                continue;
            }
            if (dependent.startDate() == null && dependent.dueDate() == null) {
                log.trace("Cascade stops at unscheduled task {}", id);
                continue;
            }

            long shift = requiredShift(graph, working, dependent, warnings);
            if (shift == 0) {
                continue;
            }

            ScheduledTask moved = dependent.withDates(
                    dependent.startDate() != null ? dependent.startDate().plusDays(shift) : null,
                    dependent.dueDate() != null ? dependent.dueDate().plusDays(shift) : null
            );
            if (dependent.startDate() != null) {
                entries.add(new CascadeEntry(id, dependent.name(), DateField.START_DATE,
                        dependent.startDate(), moved.startDate(), shift));
            }
            if (dependent.dueDate() != null) {
                entries.add(new CascadeEntry(id, dependent.name(), DateField.DUE_DATE,
                        dependent.dueDate(), moved.dueDate(), shift));
            }
            working.put(id, moved);

            for (DependencyEdge edge : graph.outgoingEdges(id)) {
                if (queued.add(edge.dependentId())) {
                    frontier.add(edge.dependentId());
                }
            }
        }

        CascadeResult result = new CascadeResult(changedTaskId, newStart, newEnd, entries, new ArrayList<>(warnings));
        log.debug("Cascade from task {} in project {}: {} task(s) affected",
                changedTaskId, graph.projectId(), result.totalAffected());
        return result;
    }

    /**
     * Move the Finish-to-Start successors of a completed task so they start
     * right after it: {@code max(today, predecessor due + 1) + lag}, keeping
     * their duration. This can pull a successor earlier as well as push it
     * later. A successor moves only once none of its Finish-to-Start
     * predecessors is still open; completed, cancelled and undated successors
     * stay put. Only direct successors move.
     *
     * @throws ValidationException if the task is unknown or not completed
     */
    public CascadeResult advanceOnCompletion(ScheduleGraph graph, String completedTaskId, LocalDate today) {
        Objects.requireNonNull(today, "Today cannot be null");
        ScheduledTask completed = graph.requireTask(completedTaskId);
        if (!completed.isCompleted()) {
            throw new ValidationException("Task '" + completedTaskId + "' is not completed");
        }

        LocalDate anchor = today;
        if (completed.dueDate() != null && completed.dueDate().plusDays(1).isAfter(today)) {
            anchor = completed.dueDate().plusDays(1);
        }

        List<CascadeEntry> entries = new ArrayList<>();
        for (DependencyEdge edge : graph.outgoingEdges(completedTaskId)) {
            if (edge.type() != DependencyType.FINISH_TO_START) {
                continue;
            }
            ScheduledTask successor = graph.requireTask(edge.dependentId());
            if (successor.isCompleted() || successor.status() == TaskStatus.CANCELLED
                    || successor.startDate() == null || isBlocked(graph, successor.id())) {
                continue;
            }

            LocalDate newStart = anchor.plusDays(edge.lagDays());
            long shift = ChronoUnit.DAYS.between(successor.startDate(), newStart);
            if (shift == 0) {
                continue;
            }
            entries.add(new CascadeEntry(successor.id(), successor.name(), DateField.START_DATE,
                    successor.startDate(), newStart, shift));
            if (successor.dueDate() != null) {
                entries.add(new CascadeEntry(successor.id(), successor.name(), DateField.DUE_DATE,
                        successor.dueDate(), successor.dueDate().plusDays(shift), shift));
            }
        }

        CascadeResult result = new CascadeResult(completedTaskId, null, null, entries, List.of());
        log.debug("Completion of task {} in project {} advances {} successor(s)",
                completedTaskId, graph.projectId(), result.totalAffected());
        return result;
    }

    /**
     * A task is blocked while any Finish-to-Start predecessor is not completed.
     */
    public boolean isBlocked(ScheduleGraph graph, String taskId) {
        for (DependencyEdge edge : graph.incomingEdges(taskId)) {
            if (edge.type() == DependencyType.FINISH_TO_START && !graph.isSatisfiedByCompletion(edge)) {
                return true;
            }
        }
        return false;
    }

    /**
     * All blocked tasks of the project, in topological order.
     */
    public Set<String> blockedTasks(ScheduleGraph graph) {
        Set<String> blocked = new LinkedHashSet<>();
        for (ScheduledTask task : graph.topologicalTasks()) {
            if (isBlocked(graph, task.id())) {
                blocked.add(task.id());
            }
        }
        return blocked;
    }

    /**
     * Smallest shift (in days) that satisfies every constraint on the dependent.
     */
    private long requiredShift(
            ScheduleGraph graph,
            Map<String, ScheduledTask> working,
            ScheduledTask dependent,
            Set<ScheduleWarning> warnings
    ) {
        Long needed = null;

        for (DependencyEdge edge : graph.incomingEdges(dependent.id())) {
            ScheduledTask predecessor = current(graph, working, edge.predecessorId());
            if (predecessor.isCompleted()) {
                continue;
            }

            DependencyType type = edge.type();
            LocalDate anchor = switch (type) {
                case FINISH_TO_START, FINISH_TO_FINISH -> predecessor.dueDate();
                case START_TO_START, START_TO_FINISH -> predecessor.startDate();
            };
            if (anchor == null) {
                warnings.add(ScheduleWarning.unscheduledPredecessor(predecessor.id(), dependent.id()));
                continue;
            }

            long lag = edge.lagDays();
            LocalDate required = switch (type) {
                case FINISH_TO_START -> anchor.plusDays(1 + lag);
                case START_TO_START, FINISH_TO_FINISH -> anchor.plusDays(lag);
                case START_TO_FINISH -> anchor.plusDays(lag - 1);
            };
            LocalDate actual = switch (type) {
                case FINISH_TO_START, START_TO_START -> dependent.startDate();
                case FINISH_TO_FINISH, START_TO_FINISH -> dependent.dueDate();
            };
            if (actual == null) {
                continue;
            }

            long delta = ChronoUnit.DAYS.between(actual, required);
            needed = needed == null ? delta : Math.max(needed, delta);
        }

        if (needed == null) {
            return 0;
        }
        return pullBack ? needed : Math.max(0, needed);
    }

    private static boolean movesConstrainingBoundary(DependencyType type, boolean startMoved, boolean endMoved) {
        return switch (type) {
            case FINISH_TO_START, FINISH_TO_FINISH -> endMoved;
            case START_TO_START, START_TO_FINISH -> startMoved;
        };
    }

    private static ScheduledTask current(ScheduleGraph graph, Map<String, ScheduledTask> working, String id) {
        ScheduledTask task = working.get(id);
        return task != null ? task : graph.requireTask(id);
    }
}
