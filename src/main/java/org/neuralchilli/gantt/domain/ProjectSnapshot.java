package org.neuralchilli.gantt.domain;

import java.io.Serial;
import java.io.Serializable;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Immutable snapshot of one project's schedule: tasks, milestones, dependency
 * edges and the project's dependency mode. Every scheduling operation works
 * on a snapshot passed in explicitly; modifications return new snapshots.
 */
public final class ProjectSnapshot implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private final String projectId;
    private final LocalDate startDate;
    private final DependencyMode dependencyMode;
    private final List<ScheduledTask> tasks;
    private final List<Milestone> milestones;
    private final List<Dependency> dependencies;
    private final long version;

    public ProjectSnapshot(
            String projectId,
            LocalDate startDate,
            DependencyMode dependencyMode,
            List<ScheduledTask> tasks,
            List<Milestone> milestones,
            List<Dependency> dependencies,
            long version
    ) {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("Project id cannot be null or empty");
        }
        if (version < 0) {
            throw new IllegalArgumentException("Version cannot be negative");
        }

        this.projectId = projectId;
        this.startDate = startDate;
        this.dependencyMode = dependencyMode != null ? dependencyMode : DependencyMode.FLEXIBLE;
        this.tasks = tasks != null ? List.copyOf(tasks) : List.of();
        this.milestones = milestones != null ? List.copyOf(milestones) : List.of();
        this.dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        this.version = version;
    }

    public String projectId() {
        return projectId;
    }

    public LocalDate startDate() {
        return startDate;
    }

    public DependencyMode dependencyMode() {
        return dependencyMode;
    }

    public List<ScheduledTask> tasks() {
        return tasks;
    }

    public List<Milestone> milestones() {
        return milestones;
    }

    public List<Dependency> dependencies() {
        return dependencies;
    }

    public long version() {
        return version;
    }

    public Optional<ScheduledTask> findTask(String taskId) {
        return tasks.stream().filter(t -> t.id().equals(taskId)).findFirst();
    }

    public Optional<Milestone> findMilestone(String milestoneId) {
        return milestones.stream().filter(m -> m.id().equals(milestoneId)).findFirst();
    }

    public Optional<Dependency> findDependency(String taskId, String dependsOnId) {
        return dependencies.stream().filter(d -> d.connects(taskId, dependsOnId)).findFirst();
    }

    /**
     * All tasks and milestones in display order.
     */
    public List<SequencedItem> sequence() {
        return Stream.concat(
                        tasks.stream().map(SequencedItem::of),
                        milestones.stream().map(SequencedItem::of))
                .sorted(SequencedItem.DISPLAY_ORDER)
                .toList();
    }

    /**
     * Replace tasks by id; tasks not in the given collection are kept as they are.
     */
    public ProjectSnapshot withTasks(Collection<ScheduledTask> replacements) {
        Map<String, ScheduledTask> byId = replacements.stream()
                .collect(Collectors.toMap(ScheduledTask::id, Function.identity(), (a, b) -> b));
        List<ScheduledTask> updated = tasks.stream()
                .map(t -> byId.getOrDefault(t.id(), t))
                .toList();
        return new ProjectSnapshot(projectId, startDate, dependencyMode, updated, milestones, dependencies, version);
    }

    public ProjectSnapshot withTask(ScheduledTask replacement) {
        return withTasks(List.of(replacement));
    }

    public ProjectSnapshot withDependencies(List<Dependency> newDependencies) {
        return new ProjectSnapshot(projectId, startDate, dependencyMode, tasks, milestones, newDependencies, version);
    }

    public ProjectSnapshot withDependency(Dependency dependency) {
        List<Dependency> updated = new ArrayList<>(dependencies);
        updated.add(dependency);
        return withDependencies(updated);
    }

    public ProjectSnapshot withDependencyMode(DependencyMode mode) {
        return new ProjectSnapshot(projectId, startDate, mode, tasks, milestones, dependencies, version);
    }

    /**
     * Apply new sort keys to the tasks and milestones named in the map.
     */
    public ProjectSnapshot withSortOrders(Map<String, Double> sortOrders) {
        List<ScheduledTask> updatedTasks = tasks.stream()
                .map(t -> sortOrders.containsKey(t.id()) ? t.withSortOrder(sortOrders.get(t.id())) : t)
                .toList();
        List<Milestone> updatedMilestones = milestones.stream()
                .map(m -> sortOrders.containsKey(m.id()) ? m.withSortOrder(sortOrders.get(m.id())) : m)
                .toList();
        return new ProjectSnapshot(projectId, startDate, dependencyMode, updatedTasks, updatedMilestones,
                dependencies, version);
    }

    public ProjectSnapshot withVersion(long newVersion) {
        return new ProjectSnapshot(projectId, startDate, dependencyMode, tasks, milestones, dependencies, newVersion);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        ProjectSnapshot that = (ProjectSnapshot) obj;
        return this.version == that.version &&
                Objects.equals(this.projectId, that.projectId) &&
                Objects.equals(this.startDate, that.startDate) &&
                this.dependencyMode == that.dependencyMode &&
                Objects.equals(this.tasks, that.tasks) &&
                Objects.equals(this.milestones, that.milestones) &&
                Objects.equals(this.dependencies, that.dependencies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(projectId, startDate, dependencyMode, tasks, milestones, dependencies, version);
    }

    @Override
    public String toString() {
        return "ProjectSnapshot[" +
                "projectId=" + projectId + ", " +
                "startDate=" + startDate + ", " +
                "dependencyMode=" + dependencyMode + ", " +
                "tasks=" + tasks.size() + ", " +
                "milestones=" + milestones.size() + ", " +
                "dependencies=" + dependencies.size() + ", " +
                "version=" + version + ']';
    }

    /**
     * Builder for creating snapshots fluently
     */
    public static Builder builder(String projectId) {
        return new Builder(projectId);
    }

    public static class Builder {
        private final String projectId;
        private LocalDate startDate;
        private DependencyMode dependencyMode = DependencyMode.FLEXIBLE;
        private final List<ScheduledTask> tasks = new ArrayList<>();
        private final List<Milestone> milestones = new ArrayList<>();
        private final List<Dependency> dependencies = new ArrayList<>();
        private long version;

        public Builder(String projectId) {
            this.projectId = projectId;
        }

        public Builder startDate(LocalDate startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder dependencyMode(DependencyMode dependencyMode) {
            this.dependencyMode = dependencyMode;
            return this;
        }

        public Builder task(ScheduledTask task) {
            this.tasks.add(task);
            return this;
        }

        public Builder tasks(Collection<ScheduledTask> tasks) {
            this.tasks.addAll(tasks);
            return this;
        }

        public Builder milestone(Milestone milestone) {
            this.milestones.add(milestone);
            return this;
        }

        public Builder milestones(Collection<Milestone> milestones) {
            this.milestones.addAll(milestones);
            return this;
        }

        public Builder dependency(Dependency dependency) {
            this.dependencies.add(dependency);
            return this;
        }

        public Builder dependencies(Collection<Dependency> dependencies) {
            this.dependencies.addAll(dependencies);
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public ProjectSnapshot build() {
            return new ProjectSnapshot(projectId, startDate, dependencyMode, tasks, milestones, dependencies, version);
        }
    }
}
