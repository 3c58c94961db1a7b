package org.neuralchilli.gantt.config;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.neuralchilli.gantt.domain.Dependency;
import org.neuralchilli.gantt.domain.DependencyMode;
import org.neuralchilli.gantt.domain.DependencyType;
import org.neuralchilli.gantt.domain.Milestone;
import org.neuralchilli.gantt.domain.ProjectSnapshot;
import org.neuralchilli.gantt.domain.ScheduledTask;
import org.neuralchilli.gantt.domain.TaskStatus;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * Parses a project schedule from YAML, as used by template import and test fixtures.
 * <pre>
 * project: web-relaunch
 * start_date: 2026-01-01
 * dependency_mode: Strict
 * tasks:
 *   - id: design
 *     start_date: 2026-01-01
 *     due_date: 2026-01-05
 *   - id: build
 *     start_date: 2026-01-06
 *     due_date: 2026-01-10
 *     depends_on:
 *       - task: design
 *         type: FS
 *         lag_days: 0
 * milestones:
 *   - id: launch
 *     due_date: 2026-01-20
 * </pre>
 * Tasks and milestones get their creation order from their position in the file.
 */
@Singleton
public class ProjectYamlParser {

    private final DependencyMode defaultMode;

    @Inject
    public ProjectYamlParser(SchedulingConfig config) {
        this(config.defaultMode());
    }

    public ProjectYamlParser(DependencyMode defaultMode) {
        this.defaultMode = defaultMode;
    }

    /**
     * Parse a project snapshot from YAML string
     */
    public ProjectSnapshot parseProject(String yamlContent) {
        return parseProjectFromMap(document(new Yaml().load(yamlContent)));
    }

    /**
     * Parse a project snapshot from InputStream
     */
    public ProjectSnapshot parseProject(InputStream inputStream) {
        // Yaml instances are not thread-safe
        return parseProjectFromMap(document(new Yaml().load(inputStream)));
    }

    private static Map<String, Object> document(Object loaded) {
        if (loaded == null) {
            throw new IllegalArgumentException("Project document is empty");
        }
        return asMap(loaded, "Project document");
    }

    private ProjectSnapshot parseProjectFromMap(Map<String, Object> data) {
        String projectId = getString(data, "project", true);
        LocalDate startDate = getDate(data, "start_date");
        String mode = getString(data, "dependency_mode", false);

        ProjectSnapshot.Builder builder = ProjectSnapshot.builder(projectId)
                .startDate(startDate)
                .dependencyMode(mode != null ? DependencyMode.fromString(mode) : defaultMode);

        long creationIndex = 0;
        for (Object item : getList(data, "tasks")) {
            Map<String, Object> taskData = asMap(item, "Task entry");
            ScheduledTask task = parseTask(taskData, creationIndex++);
            builder.task(task);
            builder.dependencies(parseDependencies(task.id(), taskData));
        }

        for (Object item : getList(data, "milestones")) {
            Map<String, Object> milestoneData = asMap(item, "Milestone entry");
            builder.milestone(new Milestone(
                    getString(milestoneData, "id", true),
                    getString(milestoneData, "name", false),
                    getDate(milestoneData, "due_date"),
                    getDouble(milestoneData, "sort_order", 0.0),
                    creationIndex++
            ));
        }

        return builder.build();
    }

    private ScheduledTask parseTask(Map<String, Object> data, long creationIndex) {
        String status = getString(data, "status", false);
        return ScheduledTask.builder(getString(data, "id", true))
                .name(getString(data, "name", false))
                .startDate(getDate(data, "start_date"))
                .dueDate(getDate(data, "due_date"))
                .status(status != null ? TaskStatus.fromString(status) : TaskStatus.OPEN)
                .sortOrder(getDouble(data, "sort_order", 0.0))
                .creationIndex(creationIndex)
                .build();
    }

    private List<Dependency> parseDependencies(String taskId, Map<String, Object> data) {
        List<Dependency> result = new ArrayList<>();
        for (Object item : getList(data, "depends_on")) {
            if (item instanceof String) {
                // Short form: just the predecessor id
                result.add(Dependency.finishToStart(taskId, (String) item));
            } else if (item instanceof Map) {
                Map<String, Object> dep = asMap(item, "Dependency entry");
                String type = getString(dep, "type", false);
                result.add(new Dependency(
                        taskId,
                        getString(dep, "task", true),
                        type != null ? DependencyType.fromString(type) : DependencyType.FINISH_TO_START,
                        getInt(dep, "lag_days", 0)
                ));
            } else {
                throw new IllegalArgumentException("Invalid dependency entry for task '" + taskId + "': " + item);
            }
        }
        return result;
    }

    // Helper methods for safe type extraction

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String what) {
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException(what + " must be a mapping, got: " + value);
        }
        return (Map<String, Object>) value;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> getList(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new IllegalArgumentException("Field '" + key + "' must be a list");
        }
        return (List<Object>) value;
    }

    private String getString(Map<String, Object> data, String key, boolean required) {
        Object value = data.get(key);
        if (value == null) {
            if (required) {
                throw new IllegalArgumentException("Required field '" + key + "' is missing");
            }
            return null;
        }
        return value.toString();
    }

    private int getInt(Map<String, Object> data, String key, int defaultValue) {
        Object value = data.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.parseInt(value.toString());
    }

    private double getDouble(Map<String, Object> data, String key, double defaultValue) {
        Object value = data.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return Double.parseDouble(value.toString());
    }

    /**
     * SnakeYAML reads unquoted ISO dates as {@link Date} at UTC midnight; quoted ones stay strings.
     */
    private LocalDate getDate(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant().atZone(ZoneOffset.UTC).toLocalDate();
        }
        try {
            return LocalDate.parse(value.toString());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Field '" + key + "' is not an ISO date: " + value, e);
        }
    }
}
