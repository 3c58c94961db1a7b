package org.neuralchilli.gantt.core;

import org.jgrapht.graph.DirectedAcyclicGraph;
import org.jgrapht.traverse.TopologicalOrderIterator;
import org.neuralchilli.gantt.domain.Dependency;
import org.neuralchilli.gantt.domain.Milestone;
import org.neuralchilli.gantt.domain.ProjectSnapshot;
import org.neuralchilli.gantt.domain.ScheduleNode;
import org.neuralchilli.gantt.domain.ScheduledTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory dependency graph of one project, built fresh from a snapshot for
 * every scheduling operation and never mutated afterwards.
 * <p>
 * Vertices are tasks and milestones; edges run from a predecessor to the task
 * that depends on it. Milestones carry no edges. Iteration orders are
 * deterministic: ties are broken by node id.
 */
public final class ScheduleGraph {

    private static final Logger log = LoggerFactory.getLogger(ScheduleGraph.class);

    private static final Comparator<ScheduleNode> BY_ID = Comparator.comparing(ScheduleNode::id);

    private final ProjectSnapshot snapshot;
    private final DirectedAcyclicGraph<ScheduleNode, DependencyEdge> dag;
    private final Map<String, ScheduledTask> tasks;
    private final Map<String, Milestone> milestones;
    private final List<ScheduleNode> topologicalOrder;
    private final Map<String, Integer> topologicalIndex;

    private ScheduleGraph(
            ProjectSnapshot snapshot,
            DirectedAcyclicGraph<ScheduleNode, DependencyEdge> dag,
            Map<String, ScheduledTask> tasks,
            Map<String, Milestone> milestones
    ) {
        this.snapshot = snapshot;
        this.dag = dag;
        this.tasks = Collections.unmodifiableMap(tasks);
        this.milestones = Collections.unmodifiableMap(milestones);

        List<ScheduleNode> order = new ArrayList<>(dag.vertexSet().size());
        Map<String, Integer> index = new HashMap<>();
        TopologicalOrderIterator<ScheduleNode, DependencyEdge> iterator =
                new TopologicalOrderIterator<>(dag, BY_ID);
        while (iterator.hasNext()) {
            ScheduleNode node = iterator.next();
            index.put(node.id(), order.size());
            order.add(node);
        }
        this.topologicalOrder = Collections.unmodifiableList(order);
        this.topologicalIndex = Collections.unmodifiableMap(index);
    }

    /**
     * Build the graph for a project snapshot.
     *
     * @throws ValidationException    if ids collide or an edge references an unknown task or a milestone
     * @throws CycleDetectedException if the stored edges already contain a cycle
     */
    public static ScheduleGraph from(ProjectSnapshot snapshot) {
        log.debug("Building schedule graph for project: {}", snapshot.projectId());

        DirectedAcyclicGraph<ScheduleNode, DependencyEdge> dag =
                new DirectedAcyclicGraph<>(null, null, false);

        // First pass: vertices
        Map<String, ScheduledTask> tasks = new LinkedHashMap<>();
        Map<String, Milestone> milestones = new LinkedHashMap<>();
        for (ScheduledTask task : snapshot.tasks()) {
            if (!dag.addVertex(ScheduleNode.task(task.id()))) {
                throw new ValidationException("Duplicate item id in project '"
                        + snapshot.projectId() + "': " + task.id());
            }
            tasks.put(task.id(), task);
        }
        for (Milestone milestone : snapshot.milestones()) {
            if (!dag.addVertex(ScheduleNode.milestone(milestone.id()))) {
                throw new ValidationException("Duplicate item id in project '"
                        + snapshot.projectId() + "': " + milestone.id());
            }
            milestones.put(milestone.id(), milestone);
        }

        // Second pass: dependency edges
        for (Dependency dependency : snapshot.dependencies()) {
            ScheduleNode target = taskNode(tasks, milestones, dependency.taskId(), dependency);
            ScheduleNode source = taskNode(tasks, milestones, dependency.dependsOnId(), dependency);

            if (dependency.isSelfLoop()) {
                throw new CycleDetectedException(
                        "Task '" + dependency.taskId() + "' cannot depend on itself",
                        List.of(dependency.taskId(), dependency.taskId())
                );
            }

            try {
                if (!dag.addEdge(source, target, new DependencyEdge(dependency))) {
                    throw new ValidationException("Duplicate dependency: " + dependency);
                }
                log.trace("Added edge: {}", dependency);
            } catch (IllegalArgumentException e) {
                // JGraphT rejects edges that would close a cycle
                throw new CycleDetectedException(
                        "Dependency '" + dependency.dependsOnId() + "' -> '" + dependency.taskId() +
                                "' would create a cycle in project '" + snapshot.projectId() + "'",
                        e
                );
            }
        }

        log.debug("Schedule graph built: {} vertices, {} edges",
                dag.vertexSet().size(),
                dag.edgeSet().size()
        );

        return new ScheduleGraph(snapshot, dag, tasks, milestones);
    }

    private static ScheduleNode taskNode(
            Map<String, ScheduledTask> tasks,
            Map<String, Milestone> milestones,
            String id,
            Dependency dependency
    ) {
        if (milestones.containsKey(id)) {
            throw new ValidationException("Milestone '" + id + "' cannot take part in dependency " + dependency);
        }
        if (!tasks.containsKey(id)) {
            throw new ValidationException("Dependency " + dependency + " references unknown task '" + id + "'");
        }
        return ScheduleNode.task(id);
    }

    public ProjectSnapshot snapshot() {
        return snapshot;
    }

    public String projectId() {
        return snapshot.projectId();
    }

    public boolean contains(String id) {
        return tasks.containsKey(id) || milestones.containsKey(id);
    }

    public Optional<ScheduledTask> task(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    /**
     * Look up a task that must exist.
     *
     * @throws ValidationException if the id is not a task of this project
     */
    public ScheduledTask requireTask(String taskId) {
        ScheduledTask task = tasks.get(taskId);
        if (task == null) {
            throw new ValidationException(
                    "Task '" + taskId + "' not found in project '" + snapshot.projectId() + "'"
            );
        }
        return task;
    }

    public Collection<ScheduledTask> tasks() {
        return tasks.values();
    }

    public Collection<Milestone> milestones() {
        return milestones.values();
    }

    public List<Dependency> dependencies() {
        return snapshot.dependencies();
    }

    /**
     * Edges into a task (its predecessors), ordered by predecessor id.
     */
    public List<DependencyEdge> incomingEdges(String taskId) {
        requireTask(taskId);
        return dag.incomingEdgesOf(ScheduleNode.task(taskId)).stream()
                .sorted(Comparator.comparing(DependencyEdge::predecessorId))
                .toList();
    }

    /**
     * Edges out of a task (its dependents), ordered by dependent id.
     */
    public List<DependencyEdge> outgoingEdges(String taskId) {
        requireTask(taskId);
        return dag.outgoingEdgesOf(ScheduleNode.task(taskId)).stream()
                .sorted(Comparator.comparing(DependencyEdge::dependentId))
                .toList();
    }

    public List<String> predecessors(String taskId) {
        return incomingEdges(taskId).stream().map(DependencyEdge::predecessorId).toList();
    }

    public List<String> successors(String taskId) {
        return outgoingEdges(taskId).stream().map(DependencyEdge::dependentId).toList();
    }

    /**
     * All nodes in dependency order; a predecessor always precedes its dependents.
     */
    public List<ScheduleNode> topologicalOrder() {
        return topologicalOrder;
    }

    /**
     * Tasks only, in dependency order.
     */
    public List<ScheduledTask> topologicalTasks() {
        return topologicalOrder.stream()
                .filter(ScheduleNode::isTask)
                .map(node -> tasks.get(node.id()))
                .toList();
    }

    public int topologicalIndex(String id) {
        Integer index = topologicalIndex.get(id);
        if (index == null) {
            throw new ValidationException("Item '" + id + "' not found in project '" + snapshot.projectId() + "'");
        }
        return index;
    }

    /**
     * Tasks with no predecessors.
     */
    public Set<String> rootTasks() {
        Set<String> roots = new LinkedHashSet<>();
        for (ScheduledTask task : topologicalTasks()) {
            if (dag.inDegreeOf(ScheduleNode.task(task.id())) == 0) {
                roots.add(task.id());
            }
        }
        return roots;
    }

    /**
     * Tasks with no dependents.
     */
    public Set<String> leafTasks() {
        Set<String> leaves = new LinkedHashSet<>();
        for (ScheduledTask task : topologicalTasks()) {
            if (dag.outDegreeOf(ScheduleNode.task(task.id())) == 0) {
                leaves.add(task.id());
            }
        }
        return leaves;
    }

    /**
     * A completed predecessor never blocks or constrains its dependent,
     * whatever its stored dates say.
     */
    public boolean isSatisfiedByCompletion(DependencyEdge edge) {
        return requireTask(edge.predecessorId()).isCompleted();
    }

    public int edgeCount() {
        return dag.edgeSet().size();
    }

    public int nodeCount() {
        return dag.vertexSet().size();
    }
}
