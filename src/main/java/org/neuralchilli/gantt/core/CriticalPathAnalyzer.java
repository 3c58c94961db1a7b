package org.neuralchilli.gantt.core;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.neuralchilli.gantt.config.SchedulingConfig;
import org.neuralchilli.gantt.domain.CriticalPathResult;
import org.neuralchilli.gantt.domain.ProjectSnapshot;
import org.neuralchilli.gantt.domain.ScheduleWarning;
import org.neuralchilli.gantt.domain.ScheduledTask;
import org.neuralchilli.gantt.domain.TaskSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Critical Path Method over a schedule graph.
 * <p>
 * Works in whole-day offsets from the project start. A task occupies the
 * half-open interval {@code [ES, EF)}, so a task dated Jan 1 to Jan 5 has a
 * duration of five days. Forward pass: a task starts no earlier than the
 * project start and no earlier than every dependency allows. Backward pass:
 * seeded from the latest earliest-finish in the project; a task finishes no
 * later than the project finish and no later than every dependent allows.
 * <p>
 * Pure function of the graph: no state, no side effects.
 */
@Singleton
public class CriticalPathAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(CriticalPathAnalyzer.class);

    private final int unscheduledDurationDays;

    @Inject
    public CriticalPathAnalyzer(SchedulingConfig config) {
        this(config.unscheduledDurationDays());
    }

    public CriticalPathAnalyzer(int unscheduledDurationDays) {
        if (unscheduledDurationDays < 1) {
            throw new IllegalArgumentException("Unscheduled duration must be at least one day");
        }
        this.unscheduledDurationDays = unscheduledDurationDays;
    }

    public CriticalPathResult analyze(ScheduleGraph graph) {
        List<ScheduledTask> order = graph.topologicalTasks();
        if (order.isEmpty()) {
            return CriticalPathResult.empty(List.of());
        }

        LocalDate projectStart = resolveProjectStart(graph.snapshot());
        if (projectStart == null) {
            log.debug("No anchor date for project {}", graph.projectId());
            return CriticalPathResult.empty(List.of(ScheduleWarning.noProjectStart(graph.projectId())));
        }

        List<ScheduleWarning> warnings = new ArrayList<>();
        Map<String, Long> duration = new HashMap<>();
        for (ScheduledTask task : order) {
            if (task.isScheduled()) {
                duration.put(task.id(), Math.max(1L, task.durationDays()));
            } else {
                duration.put(task.id(), (long) unscheduledDurationDays);
                warnings.add(ScheduleWarning.unscheduledTask(task.id(), unscheduledDurationDays));
            }
        }

        // Forward pass
        Map<String, Long> es = new HashMap<>();
        Map<String, Long> ef = new HashMap<>();
        for (ScheduledTask task : order) {
            String id = task.id();
            long dur = duration.get(id);
            long earliest = 0;
            for (DependencyEdge edge : graph.incomingEdges(id)) {
                String pred = edge.predecessorId();
                long lag = edge.lagDays();
                long bound = switch (edge.type()) {
                    case FINISH_TO_START -> ef.get(pred) + lag;
                    case START_TO_START -> es.get(pred) + lag;
                    case FINISH_TO_FINISH -> ef.get(pred) + lag - dur;
                    case START_TO_FINISH -> es.get(pred) + lag - dur;
                };
                earliest = Math.max(earliest, bound);
            }
            es.put(id, earliest);
            ef.put(id, earliest + dur);
        }

        long projectFinish = ef.values().stream().mapToLong(Long::longValue).max().orElse(0);

        // Backward pass
        Map<String, Long> ls = new HashMap<>();
        Map<String, Long> lf = new HashMap<>();
        for (int i = order.size() - 1; i >= 0; i--) {
            String id = order.get(i).id();
            long dur = duration.get(id);
            long latest = projectFinish;
            for (DependencyEdge edge : graph.outgoingEdges(id)) {
                String succ = edge.dependentId();
                long lag = edge.lagDays();
                long bound = switch (edge.type()) {
                    case FINISH_TO_START -> ls.get(succ) - lag;
                    case START_TO_START -> ls.get(succ) - lag + dur;
                    case FINISH_TO_FINISH -> lf.get(succ) - lag;
                    case START_TO_FINISH -> lf.get(succ) - lag + dur;
                };
                latest = Math.min(latest, bound);
            }
            lf.put(id, latest);
            ls.put(id, latest - dur);
        }

        Map<String, TaskSchedule> schedules = new LinkedHashMap<>();
        List<String> critical = new ArrayList<>();
        for (ScheduledTask task : order) {
            String id = task.id();
            long slack = ls.get(id) - es.get(id);
            boolean isCritical = slack == 0;
            schedules.put(id, new TaskSchedule(
                    id,
                    projectStart.plusDays(es.get(id)),
                    projectStart.plusDays(ef.get(id) - 1),
                    projectStart.plusDays(ls.get(id)),
                    projectStart.plusDays(lf.get(id) - 1),
                    slack,
                    isCritical
            ));
            if (isCritical) {
                critical.add(id);
            }
        }

        log.debug("Critical path for project {}: {} of {} tasks critical, finish offset {}",
                graph.projectId(), critical.size(), order.size(), projectFinish);

        return new CriticalPathResult(
                projectStart,
                projectStart.plusDays(projectFinish - 1),
                schedules,
                critical,
                warnings
        );
    }

    /**
     * Project start date, or the earliest task date when the project has none.
     */
    private LocalDate resolveProjectStart(ProjectSnapshot snapshot) {
        if (snapshot.startDate() != null) {
            return snapshot.startDate();
        }
        return snapshot.tasks().stream()
                .flatMap(t -> Stream.of(t.startDate(), t.dueDate()))
                .filter(Objects::nonNull)
                .min(LocalDate::compareTo)
                .orElse(null);
    }
}
