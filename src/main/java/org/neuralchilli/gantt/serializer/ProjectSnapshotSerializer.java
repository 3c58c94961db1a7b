package org.neuralchilli.gantt.serializer;

import com.hazelcast.nio.ObjectDataInput;
import com.hazelcast.nio.ObjectDataOutput;
import com.hazelcast.nio.serialization.StreamSerializer;
import org.neuralchilli.gantt.domain.Dependency;
import org.neuralchilli.gantt.domain.DependencyMode;
import org.neuralchilli.gantt.domain.DependencyType;
import org.neuralchilli.gantt.domain.Milestone;
import org.neuralchilli.gantt.domain.ProjectSnapshot;
import org.neuralchilli.gantt.domain.ScheduledTask;
import org.neuralchilli.gantt.domain.TaskStatus;

import java.io.IOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Compact binary serializer for ProjectSnapshot.
 * Enums are written by ordinal and dates as epoch days.
 */
public class ProjectSnapshotSerializer implements StreamSerializer<ProjectSnapshot> {

    private static final int TYPE_ID = 2001;

    @Override
    public int getTypeId() {
        return TYPE_ID;
    }

    @Override
    public void write(ObjectDataOutput out, ProjectSnapshot snapshot) throws IOException {
        out.writeString(snapshot.projectId());
        writeDateOrNull(out, snapshot.startDate());
        out.writeInt(snapshot.dependencyMode().ordinal());
        out.writeLong(snapshot.version());

        out.writeInt(snapshot.tasks().size());
        for (ScheduledTask task : snapshot.tasks()) {
            out.writeString(task.id());
            out.writeString(task.name());
            writeDateOrNull(out, task.startDate());
            writeDateOrNull(out, task.dueDate());
            out.writeInt(task.status().ordinal());
            out.writeDouble(task.sortOrder());
            out.writeLong(task.creationIndex());
        }

        out.writeInt(snapshot.milestones().size());
        for (Milestone milestone : snapshot.milestones()) {
            out.writeString(milestone.id());
            out.writeString(milestone.name());
            writeDateOrNull(out, milestone.dueDate());
            out.writeDouble(milestone.sortOrder());
            out.writeLong(milestone.creationIndex());
        }

        out.writeInt(snapshot.dependencies().size());
        for (Dependency dependency : snapshot.dependencies()) {
            out.writeString(dependency.taskId());
            out.writeString(dependency.dependsOnId());
            out.writeInt(dependency.type().ordinal());
            out.writeInt(dependency.lagDays());
        }
    }

    @Override
    public ProjectSnapshot read(ObjectDataInput in) throws IOException {
        String projectId = in.readString();
        LocalDate startDate = readDateOrNull(in);
        DependencyMode mode = DependencyMode.values()[in.readInt()];
        long version = in.readLong();

        int taskCount = in.readInt();
        List<ScheduledTask> tasks = new ArrayList<>(taskCount);
        for (int i = 0; i < taskCount; i++) {
            tasks.add(new ScheduledTask(
                    in.readString(),
                    in.readString(),
                    readDateOrNull(in),
                    readDateOrNull(in),
                    TaskStatus.values()[in.readInt()],
                    in.readDouble(),
                    in.readLong()
            ));
        }

        int milestoneCount = in.readInt();
        List<Milestone> milestones = new ArrayList<>(milestoneCount);
        for (int i = 0; i < milestoneCount; i++) {
            milestones.add(new Milestone(
                    in.readString(),
                    in.readString(),
                    readDateOrNull(in),
                    in.readDouble(),
                    in.readLong()
            ));
        }

        int dependencyCount = in.readInt();
        List<Dependency> dependencies = new ArrayList<>(dependencyCount);
        for (int i = 0; i < dependencyCount; i++) {
            dependencies.add(new Dependency(
                    in.readString(),
                    in.readString(),
                    DependencyType.values()[in.readInt()],
                    in.readInt()
            ));
        }

        return new ProjectSnapshot(projectId, startDate, mode, tasks, milestones, dependencies, version);
    }

    private void writeDateOrNull(ObjectDataOutput out, LocalDate value) throws IOException {
        if (value == null) {
            out.writeBoolean(false);
        } else {
            out.writeBoolean(true);
            out.writeLong(value.toEpochDay());
        }
    }

    private LocalDate readDateOrNull(ObjectDataInput in) throws IOException {
        boolean hasValue = in.readBoolean();
        return hasValue ? LocalDate.ofEpochDay(in.readLong()) : null;
    }

    @Override
    public void destroy() {
        // No resources to clean up
    }
}
