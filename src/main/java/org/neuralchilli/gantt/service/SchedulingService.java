package org.neuralchilli.gantt.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.gantt.config.ProjectYamlParser;
import org.neuralchilli.gantt.core.CascadeEngine;
import org.neuralchilli.gantt.core.CriticalPathAnalyzer;
import org.neuralchilli.gantt.core.CycleDetectedException;
import org.neuralchilli.gantt.core.CycleGuard;
import org.neuralchilli.gantt.core.ScheduleGraph;
import org.neuralchilli.gantt.core.Sequencer;
import org.neuralchilli.gantt.core.ValidationException;
import org.neuralchilli.gantt.domain.CascadeEntry;
import org.neuralchilli.gantt.domain.CascadeResult;
import org.neuralchilli.gantt.domain.CriticalPathResult;
import org.neuralchilli.gantt.domain.Dependency;
import org.neuralchilli.gantt.domain.DependencyMode;
import org.neuralchilli.gantt.domain.DependencyType;
import org.neuralchilli.gantt.domain.ProjectSnapshot;
import org.neuralchilli.gantt.domain.ReorderResult;
import org.neuralchilli.gantt.domain.ScheduledTask;
import org.neuralchilli.gantt.domain.TaskStatus;
import org.neuralchilli.gantt.monitoring.SchedulingMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.InputStream;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Entry point of the scheduling engine.
 * <p>
 * Every mutating operation runs inside {@link ProjectStore#update}, so the
 * graph checked (for cycles, for cascade shifts) is the graph that gets
 * written. Engine exceptions are turned into typed results here; callers only
 * see exceptions for unknown projects.
 */
@ApplicationScoped
public class SchedulingService {

    private static final Logger log = LoggerFactory.getLogger(SchedulingService.class);

    private final ProjectStore store;
    private final CycleGuard cycleGuard;
    private final CriticalPathAnalyzer criticalPathAnalyzer;
    private final CascadeEngine cascadeEngine;
    private final Sequencer sequencer;
    private final ScheduleValidator validator;
    private final ProjectYamlParser yamlParser;
    private final SchedulingMonitor monitor;

    @Inject
    public SchedulingService(
            ProjectStore store,
            CycleGuard cycleGuard,
            CriticalPathAnalyzer criticalPathAnalyzer,
            CascadeEngine cascadeEngine,
            Sequencer sequencer,
            ScheduleValidator validator,
            ProjectYamlParser yamlParser,
            SchedulingMonitor monitor
    ) {
        this.store = store;
        this.cycleGuard = cycleGuard;
        this.criticalPathAnalyzer = criticalPathAnalyzer;
        this.cascadeEngine = cascadeEngine;
        this.sequencer = sequencer;
        this.validator = validator;
        this.yamlParser = yamlParser;
        this.monitor = monitor;
    }

    // ---------------------------------------------------------------- projects

    /**
     * Validate and store a project, replacing any previous version.
     *
     * @throws ValidationException if the snapshot is malformed
     */
    public ProjectSnapshot createProject(ProjectSnapshot snapshot) {
        validator.validateSnapshot(snapshot);
        ProjectSnapshot stored = store.save(snapshot);
        log.info("Stored project {} ({} tasks, {} milestones, {} dependencies) at version {}",
                stored.projectId(), stored.tasks().size(), stored.milestones().size(),
                stored.dependencies().size(), stored.version());
        return stored;
    }

    /**
     * Parse a project from YAML, then validate and store it.
     *
     * @throws ValidationException if the document or the schedule it describes is invalid
     */
    public ProjectSnapshot importProject(InputStream yaml) {
        ProjectSnapshot parsed;
        try {
            parsed = yamlParser.parseProject(yaml);
        } catch (IllegalArgumentException | YAMLException e) {
            throw new ValidationException("Invalid project document: " + e.getMessage(), e);
        }
        log.debug("Parsed project {} from YAML", parsed.projectId());
        return createProject(parsed);
    }

    public boolean deleteProject(String projectId) {
        boolean deleted = store.delete(projectId);
        if (deleted) {
            log.info("Deleted project {}", projectId);
        }
        return deleted;
    }

    public ProjectSnapshot project(String projectId) {
        return store.get(projectId);
    }

    public DependencyMode dependencyMode(String projectId) {
        return store.get(projectId).dependencyMode();
    }

    public void setDependencyMode(String projectId, DependencyMode mode) {
        Objects.requireNonNull(mode, "Dependency mode cannot be null");
        store.update(projectId, snapshot -> StoreUpdate.write(snapshot.withDependencyMode(mode), mode));
        log.info("Project {} dependency mode set to {}", projectId, mode);
    }

    // ------------------------------------------------------------ dependencies

    /**
     * Add "taskId depends on dependsOnId". The cycle check and the insert run
     * against the same snapshot under the project lock.
     */
    public DependencyResult addDependency(
            String projectId,
            String taskId,
            String dependsOnId,
            DependencyType type,
            int lagDays
    ) {
        if (isBlank(taskId) || isBlank(dependsOnId)) {
            return DependencyResult.rejected(null, "Both the task and the task it depends on are required");
        }
        Dependency candidate = new Dependency(taskId, dependsOnId, type, lagDays);

        try {
            DependencyResult result = store.update(projectId, snapshot -> {
                requireTask(snapshot, taskId);
                requireTask(snapshot, dependsOnId);
                if (snapshot.findDependency(taskId, dependsOnId).isPresent()) {
                    throw new ValidationException("Task '" + taskId + "' already depends on '" + dependsOnId + "'");
                }
                cycleGuard.check(candidate, snapshot.dependencies());
                return StoreUpdate.write(snapshot.withDependency(candidate), DependencyResult.added(candidate));
            });
            monitor.recordDependencyAdded();
            log.info("Added dependency {} to project {}", candidate, projectId);
            return result;
        } catch (CycleDetectedException e) {
            monitor.recordCycleRejected();
            log.warn("Refused dependency {} in project {}: {}", candidate, projectId, e.getMessage());
            return DependencyResult.cycleDetected(candidate, e.cyclePath(), e.getMessage());
        } catch (ValidationException e) {
            log.warn("Refused dependency {} in project {}: {}", candidate, projectId, e.getMessage());
            return DependencyResult.rejected(candidate, e);
        }
    }

    public DependencyResult addDependency(String projectId, String taskId, String dependsOnId) {
        return addDependency(projectId, taskId, dependsOnId, DependencyType.FINISH_TO_START, 0);
    }

    /**
     * Change the type or lag of an existing edge. Endpoints never change, so
     * no cycle check is needed.
     */
    public DependencyResult updateDependency(
            String projectId,
            String taskId,
            String dependsOnId,
            DependencyType type,
            int lagDays
    ) {
        return store.update(projectId, snapshot -> {
            Dependency existing = snapshot.findDependency(taskId, dependsOnId).orElse(null);
            if (existing == null) {
                return StoreUpdate.readOnly(DependencyResult.rejected(null,
                        "Task '" + taskId + "' does not depend on '" + dependsOnId + "'"));
            }

            Dependency changed = existing.withTypeAndLag(type, lagDays);
            List<Dependency> dependencies = new ArrayList<>();
            for (Dependency dependency : snapshot.dependencies()) {
                dependencies.add(dependency.connects(taskId, dependsOnId) ? changed : dependency);
            }
            log.info("Updated dependency {} in project {}", changed, projectId);
            return StoreUpdate.write(snapshot.withDependencies(dependencies), DependencyResult.updated(changed));
        });
    }

    /**
     * @return false if the edge did not exist
     */
    public boolean removeDependency(String projectId, String taskId, String dependsOnId) {
        return store.update(projectId, snapshot -> {
            if (snapshot.findDependency(taskId, dependsOnId).isEmpty()) {
                return StoreUpdate.readOnly(false);
            }
            List<Dependency> remaining = snapshot.dependencies().stream()
                    .filter(d -> !d.connects(taskId, dependsOnId))
                    .toList();
            log.info("Removed dependency of {} on {} in project {}", taskId, dependsOnId, projectId);
            return StoreUpdate.write(snapshot.withDependencies(remaining), true);
        });
    }

    /**
     * Read-only cycle check for the dependency picker.
     *
     * @return the cycle the edge would close (first and last element equal),
     *         or an empty list if the edge is safe
     */
    public List<String> checkCircularDependency(String projectId, String taskId, String dependsOnId) {
        ProjectSnapshot snapshot = store.get(projectId);
        return cycleGuard.findCycle(Dependency.finishToStart(taskId, dependsOnId), snapshot.dependencies())
                .orElse(List.of());
    }

    // ----------------------------------------------------------- critical path

    public CriticalPathResult criticalPath(String projectId) {
        SchedulingMonitor.Timer timer = monitor.startTimer("critical-path");
        try {
            ScheduleGraph graph = ScheduleGraph.from(store.get(projectId));
            CriticalPathResult result = criticalPathAnalyzer.analyze(graph);
            log.debug("Project {} critical path: {}", projectId, result.criticalTasks());
            return result;
        } finally {
            timer.stop();
        }
    }

    // ----------------------------------------------------------------- cascade

    /**
     * Side-effect-free cascade computation, whatever the project's mode.
     */
    public CascadeResult previewCascade(String projectId, String taskId, LocalDate newStart, LocalDate newEnd) {
        ScheduleGraph graph = ScheduleGraph.from(store.get(projectId));
        CascadeResult result = computeCascade(graph, taskId, newStart, newEnd);
        log.debug("Preview for task {} in project {}: {}", taskId, projectId, result.summary());
        return result;
    }

    /**
     * Move a task, handling its dependents according to the project's mode:
     * <ul>
     *   <li>STRICT: the task and every shifted dependent are written together, or nothing is</li>
     *   <li>FLEXIBLE: if dependents would move, nothing is written and a preview is returned
     *       for {@link #applyCascade}; otherwise the task's dates are written</li>
     *   <li>OFF: only the task's dates are written</li>
     * </ul>
     * A null date leaves that boundary unchanged.
     */
    public CascadeOutcome updateTaskDates(String projectId, String taskId, LocalDate newStart, LocalDate newEnd) {
        SchedulingMonitor.Timer timer = monitor.startTimer("update-task-dates");
        try {
            return store.<CascadeOutcome>update(projectId, snapshot -> {
                DependencyMode mode = snapshot.dependencyMode();
                try {
                    return dispatch(mode, snapshot, taskId, newStart, newEnd);
                } catch (ValidationException e) {
                    monitor.recordCascadeRejected();
                    log.warn("Date change on task {} in project {} rejected: {}", taskId, projectId, e.getMessage());
                    return StoreUpdate.readOnly(new CascadeOutcome.Rejected(mode, taskId, e.getMessage()));
                }
            });
        } finally {
            timer.stop();
        }
    }

    /**
     * Confirm a Flexible-mode preview. The cascade is recomputed under the
     * project lock and applied only if it still matches the preview; a
     * confirmation replayed after success (task and every shift already
     * stored) is answered without writing.
     */
    public CascadeOutcome applyCascade(
            String projectId,
            String taskId,
            LocalDate newStart,
            LocalDate newEnd,
            CascadeResult preview
    ) {
        Objects.requireNonNull(preview, "Preview cannot be null");

        return store.<CascadeOutcome>update(projectId, snapshot -> {
            DependencyMode mode = snapshot.dependencyMode();
            if (mode == DependencyMode.OFF) {
                return StoreUpdate.readOnly(new CascadeOutcome.Rejected(mode, taskId,
                        "Dependency cascading is turned off for project '" + projectId + "'"));
            }

            try {
                ScheduleGraph graph = ScheduleGraph.from(snapshot);
                ScheduledTask task = graph.requireTask(taskId);
                CascadeResult fresh = computeCascade(graph, taskId, newStart, newEnd);

                if (fresh.isEmpty() && isAt(task, newStart, newEnd) && isWritten(snapshot, preview)) {
                    log.debug("Cascade for task {} in project {} already applied", taskId, projectId);
                    return StoreUpdate.readOnly(new CascadeOutcome.Applied(mode, preview));
                }
                if (!fresh.sameChangesAs(preview)) {
                    monitor.recordStalePreview();
                    log.warn("Preview for task {} in project {} is stale: expected {}, now {}",
                            taskId, projectId, preview.summary(), fresh.summary());
                    return StoreUpdate.readOnly(new CascadeOutcome.StalePreview(mode, fresh));
                }

                ProjectSnapshot updated = applyChanges(snapshot, task, newStart, newEnd, fresh);
                log.info("Applied confirmed cascade from task {} in project {}: {}",
                        taskId, projectId, fresh.summary());
                return StoreUpdate.write(updated, new CascadeOutcome.Applied(mode, fresh));
            } catch (ValidationException e) {
                monitor.recordCascadeRejected();
                log.warn("Confirmed cascade on task {} in project {} rejected: {}", taskId, projectId, e.getMessage());
                return StoreUpdate.readOnly(new CascadeOutcome.Rejected(mode, taskId, e.getMessage()));
            }
        });
    }

    // ------------------------------------------------------------------ status

    /**
     * Store a status change and report the dependents it unblocked. When a
     * task is completed and cascading is not OFF, its Finish-to-Start
     * successors that no longer wait on anything are moved to start right
     * after it, in the same update.
     *
     * @param today the date a successor can start at the earliest
     * @throws ValidationException if the task is unknown or a moved successor ends up invalid
     */
    public StatusChange updateTaskStatus(String projectId, String taskId, TaskStatus status, LocalDate today) {
        Objects.requireNonNull(status, "Status cannot be null");
        Objects.requireNonNull(today, "Today cannot be null");

        return store.update(projectId, snapshot -> {
            ScheduleGraph before = ScheduleGraph.from(snapshot);
            ScheduledTask task = before.requireTask(taskId);
            ScheduledTask changedTask = task.withStatus(status);
            ProjectSnapshot updated = snapshot.withTask(changedTask);
            ScheduleGraph after = ScheduleGraph.from(updated);

            List<String> unblocked = new ArrayList<>();
            for (String dependentId : before.successors(taskId)) {
                if (cascadeEngine.isBlocked(before, dependentId) && !cascadeEngine.isBlocked(after, dependentId)) {
                    unblocked.add(dependentId);
                }
            }

            CascadeResult advanced = CascadeResult.none(taskId, null, null);
            if (status.isCompleted() && snapshot.dependencyMode() != DependencyMode.OFF) {
                advanced = cascadeEngine.advanceOnCompletion(after, taskId, today);
                if (!advanced.isEmpty()) {
                    updated = applyChanges(snapshot, changedTask, null, null, advanced);
                    log.info("Completion of task {} in project {} moved successors: {}",
                            taskId, projectId, advanced.summary());
                }
            }

            log.info("Task {} in project {}: {} -> {}{}", taskId, projectId, task.status(), status,
                    unblocked.isEmpty() ? "" : ", unblocked " + unblocked);
            return StoreUpdate.write(updated, new StatusChange(taskId, task.status(), status, unblocked, advanced));
        });
    }

    public StatusChange updateTaskStatus(String projectId, String taskId, TaskStatus status) {
        return updateTaskStatus(projectId, taskId, status, LocalDate.now());
    }

    public boolean isBlocked(String projectId, String taskId) {
        ScheduleGraph graph = ScheduleGraph.from(store.get(projectId));
        graph.requireTask(taskId);
        return cascadeEngine.isBlocked(graph, taskId);
    }

    public Set<String> blockedTasks(String projectId) {
        return cascadeEngine.blockedTasks(ScheduleGraph.from(store.get(projectId)));
    }

    // ---------------------------------------------------------------- ordering

    /**
     * Move a task or milestone between two neighbours on the chart.
     *
     * @throws ValidationException if an id is unknown or the neighbours are out of order
     */
    public ReorderResult reorder(String projectId, String itemId, String prevItemId, String nextItemId) {
        return store.update(projectId, snapshot -> {
            ReorderResult result = sequencer.reorder(snapshot.sequence(), itemId, prevItemId, nextItemId);
            monitor.recordReorder();
            if (result.wasRenormalized()) {
                monitor.recordRenormalization();
                log.info("Renumbered {} items of project {} while moving {}",
                        result.renormalized().size(), projectId, itemId);
            }

            Map<String, Double> keys = new HashMap<>(result.renormalized());
            keys.put(itemId, result.sortOrder());
            return StoreUpdate.write(snapshot.withSortOrders(keys), result);
        });
    }

    /**
     * Assign initial sort keys to a project whose items have none yet.
     *
     * @return the assigned keys, empty if the project was already ordered
     */
    public Map<String, Double> initializeSortOrders(String projectId) {
        return store.update(projectId, snapshot -> {
            Map<String, Double> keys = sequencer.initialize(snapshot.sequence());
            if (keys.isEmpty()) {
                return StoreUpdate.readOnly(keys);
            }
            log.info("Assigned initial sort keys to {} items of project {}", keys.size(), projectId);
            return StoreUpdate.write(snapshot.withSortOrders(keys), keys);
        });
    }

    // ----------------------------------------------------------------- helpers

    private StoreUpdate<CascadeOutcome> dispatch(
            DependencyMode mode,
            ProjectSnapshot snapshot,
            String taskId,
            LocalDate newStart,
            LocalDate newEnd
    ) {
        ScheduleGraph graph = ScheduleGraph.from(snapshot);
        ScheduledTask task = graph.requireTask(taskId);

        return switch (mode) {
            case OFF -> {
                ProjectSnapshot updated = applyChanges(snapshot, task, newStart, newEnd,
                        CascadeResult.none(taskId, newStart, newEnd));
                boolean blocked = cascadeEngine.isBlocked(graph, taskId);
                log.info("Moved task {} in project {} without cascading{}",
                        taskId, snapshot.projectId(), blocked ? " (task is blocked)" : "");
                yield StoreUpdate.write(updated, new CascadeOutcome.NotCascaded(taskId, blocked));
            }
            case STRICT -> {
                CascadeResult cascade = computeCascade(graph, taskId, newStart, newEnd);
                ProjectSnapshot updated = applyChanges(snapshot, task, newStart, newEnd, cascade);
                log.info("Moved task {} in project {}: {}", taskId, snapshot.projectId(), cascade.summary());
                yield StoreUpdate.write(updated, new CascadeOutcome.Applied(mode, cascade));
            }
            case FLEXIBLE -> {
                CascadeResult cascade = computeCascade(graph, taskId, newStart, newEnd);
                if (cascade.isEmpty()) {
                    ProjectSnapshot updated = applyChanges(snapshot, task, newStart, newEnd, cascade);
                    log.info("Moved task {} in project {}, no dependents affected", taskId, snapshot.projectId());
                    yield StoreUpdate.write(updated, new CascadeOutcome.Applied(mode, cascade));
                }
                log.debug("Task {} in project {} needs confirmation: {}",
                        taskId, snapshot.projectId(), cascade.summary());
                yield StoreUpdate.readOnly(new CascadeOutcome.Preview(cascade));
            }
        };
    }

    private CascadeResult computeCascade(ScheduleGraph graph, String taskId, LocalDate newStart, LocalDate newEnd) {
        SchedulingMonitor.Timer timer = monitor.startTimer("cascade");
        try {
            CascadeResult result = cascadeEngine.computeCascade(graph, taskId, newStart, newEnd);
            monitor.recordCascadeComputed();
            return result;
        } finally {
            timer.stop();
        }
    }

    /**
     * Write the moved task and every cascade entry into a new snapshot.
     * Every touched task is validated first, so a bad shift aborts the whole change.
     */
    private ProjectSnapshot applyChanges(
            ProjectSnapshot snapshot,
            ScheduledTask task,
            LocalDate newStart,
            LocalDate newEnd,
            CascadeResult cascade
    ) {
        Map<String, ScheduledTask> changed = new LinkedHashMap<>();
        changed.put(task.id(), task.withDates(
                newStart != null ? newStart : task.startDate(),
                newEnd != null ? newEnd : task.dueDate()
        ));

        for (CascadeEntry entry : cascade.entries()) {
            ScheduledTask current = changed.containsKey(entry.taskId())
                    ? changed.get(entry.taskId())
                    : requireTask(snapshot, entry.taskId());
            ScheduledTask moved = switch (entry.field()) {
                case START_DATE -> current.withDates(entry.newValue(), current.dueDate());
                case DUE_DATE -> current.withDates(current.startDate(), entry.newValue());
            };
            changed.put(entry.taskId(), moved);
        }

        for (ScheduledTask moved : changed.values()) {
            validator.validateTask(moved);
        }
        if (!cascade.isEmpty()) {
            monitor.recordCascadeApplied(cascade.totalAffected());
        }
        return snapshot.withTasks(changed.values());
    }

    private static ScheduledTask requireTask(ProjectSnapshot snapshot, String taskId) {
        return snapshot.findTask(taskId).orElseThrow(() ->
                new ValidationException("Task '" + taskId + "' not found in project '" + snapshot.projectId() + "'"));
    }

    private static boolean isAt(ScheduledTask task, LocalDate start, LocalDate end) {
        return (start == null || start.equals(task.startDate()))
                && (end == null || end.equals(task.dueDate()));
    }

    /**
     * True if every shift of the preview is already in the snapshot.
     */
    private static boolean isWritten(ProjectSnapshot snapshot, CascadeResult preview) {
        for (CascadeEntry entry : preview.entries()) {
            ScheduledTask stored = snapshot.findTask(entry.taskId()).orElse(null);
            if (stored == null) {
                return false;
            }
            LocalDate current = switch (entry.field()) {
                case START_DATE -> stored.startDate();
                case DUE_DATE -> stored.dueDate();
            };
            if (!entry.newValue().equals(current)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
