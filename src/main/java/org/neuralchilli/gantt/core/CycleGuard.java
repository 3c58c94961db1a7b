package org.neuralchilli.gantt.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.gantt.domain.Dependency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Gate for new dependency edges: rejects any edge that would close a cycle.
 * <p>
 * Runs a depth-first search from the candidate's {@code dependsOn} task along
 * existing "depends on" links. Reaching the candidate's own task means the new
 * edge would close a loop. The check must run against the edge set as it exists
 * immediately before the insertion, inside the same exclusive store update.
 */
@ApplicationScoped
public class CycleGuard {

    private static final Logger log = LoggerFactory.getLogger(CycleGuard.class);

    /**
     * Check whether adding {@code candidate} to {@code existingEdges} would create a cycle.
     */
    public boolean wouldCreateCycle(Dependency candidate, Collection<Dependency> existingEdges) {
        return findCycle(candidate, existingEdges).isPresent();
    }

    /**
     * Find the cycle the candidate would close.
     *
     * @return the path {@code dependsOn → ... → task → dependsOn}, or empty if the edge is safe
     */
    public Optional<List<String>> findCycle(Dependency candidate, Collection<Dependency> existingEdges) {
        String task = candidate.taskId();
        String dependsOn = candidate.dependsOnId();

        // Self-reference needs no search
        if (candidate.isSelfLoop()) {
            return Optional.of(List.of(task, task));
        }

        Map<String, Set<String>> dependsOnLinks = buildAdjacency(existingEdges);

        Deque<String> path = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        if (search(dependsOn, task, dependsOnLinks, visited, path)) {
            List<String> cycle = new ArrayList<>(path);
            cycle.add(dependsOn);
            log.debug("Dependency {} would close cycle {}", candidate, cycle);
            return Optional.of(cycle);
        }

        return Optional.empty();
    }

    /**
     * Validate a candidate edge.
     *
     * @throws CycleDetectedException naming the would-be cycle if the edge closes one
     */
    public void check(Dependency candidate, Collection<Dependency> existingEdges) {
        Optional<List<String>> cycle = findCycle(candidate, existingEdges);
        if (cycle.isPresent()) {
            List<String> path = cycle.get();
            String message = candidate.isSelfLoop()
                    ? "Task '" + candidate.taskId() + "' cannot depend on itself"
                    : "Adding this dependency would create a circular reference: "
                    + CycleDetectedException.describe(path);
            throw new CycleDetectedException(message, path);
        }
    }

    /**
     * task -> tasks it depends on, sorted so the search visits neighbours in id order
     */
    private Map<String, Set<String>> buildAdjacency(Collection<Dependency> edges) {
        Map<String, Set<String>> adjacency = new TreeMap<>();
        for (Dependency edge : edges) {
            adjacency.computeIfAbsent(edge.taskId(), k -> new TreeSet<>()).add(edge.dependsOnId());
        }
        return adjacency;
    }

    private boolean search(
            String current,
            String target,
            Map<String, Set<String>> dependsOnLinks,
            Set<String> visited,
            Deque<String> path
    ) {
        if (!visited.add(current)) {
            return false; // Already explored from another branch
        }
        path.addLast(current);

        if (current.equals(target)) {
            return true;
        }

        for (String next : dependsOnLinks.getOrDefault(current, Set.of())) {
            if (search(next, target, dependsOnLinks, visited, path)) {
                return true;
            }
        }

        path.removeLast();
        return false;
    }
}
