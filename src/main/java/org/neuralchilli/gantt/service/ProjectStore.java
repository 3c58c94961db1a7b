package org.neuralchilli.gantt.service;

import org.neuralchilli.gantt.domain.ProjectSnapshot;

import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.Function;

/**
 * Durable storage of project snapshots.
 * <p>
 * {@link #update} is the transactional boundary of the scheduling engine: the
 * operation runs while the project is held exclusively, against the snapshot
 * that is current at that moment, and its result is written back only if the
 * operation returns normally. A check made inside the operation (cycle guard,
 * cascade computation) therefore always sees the data it mutates.
 */
public interface ProjectStore {

    Optional<ProjectSnapshot> find(String projectId);

    /**
     * @throws NoSuchElementException if the project does not exist
     */
    default ProjectSnapshot get(String projectId) {
        return find(projectId).orElseThrow(() ->
                new NoSuchElementException("Project '" + projectId + "' not found"));
    }

    /**
     * Create or replace a project. Returns the stored snapshot with its new version.
     */
    ProjectSnapshot save(ProjectSnapshot snapshot);

    /**
     * Run an operation exclusively against the current snapshot of a project.
     * If the operation throws, nothing is written.
     *
     * @throws NoSuchElementException if the project does not exist
     */
    <T> T update(String projectId, Function<ProjectSnapshot, StoreUpdate<T>> operation);

    boolean delete(String projectId);
}
