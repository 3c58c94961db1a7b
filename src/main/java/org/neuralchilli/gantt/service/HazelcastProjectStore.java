package org.neuralchilli.gantt.service;

import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.map.IMap;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.gantt.domain.ProjectSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.Function;

/**
 * Project store backed by a Hazelcast map. Mutations hold the map's
 * per-key lock, so concurrent edge insertions or date changes on the same
 * project are serialized cluster-wide.
 */
@ApplicationScoped
public class HazelcastProjectStore implements ProjectStore {

    private static final Logger log = LoggerFactory.getLogger(HazelcastProjectStore.class);

    static final String MAP_NAME = "gantt-projects";

    @Inject
    HazelcastInstance hazelcast;

    private IMap<String, ProjectSnapshot> projects;

    @PostConstruct
    void init() {
        projects = hazelcast.getMap(MAP_NAME);
        log.info("Project store initialized on map '{}'", MAP_NAME);
    }

    @Override
    public Optional<ProjectSnapshot> find(String projectId) {
        return Optional.ofNullable(projects.get(projectId));
    }

    @Override
    public ProjectSnapshot save(ProjectSnapshot snapshot) {
        String projectId = snapshot.projectId();
        projects.lock(projectId);
        try {
            ProjectSnapshot current = projects.get(projectId);
            long version = current != null ? current.version() + 1 : 1;
            ProjectSnapshot stored = snapshot.withVersion(version);
            projects.set(projectId, stored);
            log.debug("Saved project {} at version {}", projectId, version);
            return stored;
        } finally {
            projects.unlock(projectId);
        }
    }

    @Override
    public <T> T update(String projectId, Function<ProjectSnapshot, StoreUpdate<T>> operation) {
        projects.lock(projectId);
        try {
            ProjectSnapshot current = projects.get(projectId);
            if (current == null) {
                throw new NoSuchElementException("Project '" + projectId + "' not found");
            }

            StoreUpdate<T> update = operation.apply(current);
            if (update.hasChanges()) {
                long version = current.version() + 1;
                projects.set(projectId, update.snapshot().withVersion(version));
                log.debug("Updated project {} to version {}", projectId, version);
            }
            return update.result();
        } finally {
            projects.unlock(projectId);
        }
    }

    @Override
    public boolean delete(String projectId) {
        return projects.remove(projectId) != null;
    }
}
