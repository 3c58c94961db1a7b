package org.neuralchilli.gantt.serializer;

import com.hazelcast.config.Config;
import com.hazelcast.config.SerializerConfig;
import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.map.IMap;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.neuralchilli.gantt.domain.Dependency;
import org.neuralchilli.gantt.domain.DependencyMode;
import org.neuralchilli.gantt.domain.DependencyType;
import org.neuralchilli.gantt.domain.Milestone;
import org.neuralchilli.gantt.domain.ProjectSnapshot;
import org.neuralchilli.gantt.domain.ScheduledTask;
import org.neuralchilli.gantt.domain.TaskStatus;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for ProjectSnapshotSerializer.
 * Uses a shared, minimal Hazelcast instance for fast testing.
 */
class ProjectSnapshotSerializerTest {

    private static HazelcastInstance hazelcast;
    private static IMap<String, ProjectSnapshot> testMap;

    @BeforeAll
    static void setupClass() {
        Config config = new Config();
        config.setClusterName("test-snapshot-serializer-" + System.currentTimeMillis());
        config.getNetworkConfig().getJoin().getMulticastConfig().setEnabled(false);
        config.getNetworkConfig().getJoin().getTcpIpConfig().setEnabled(false);
        config.setProperty("hazelcast.phone.home.enabled", "false");

        config.getSerializationConfig()
                .addSerializerConfig(new SerializerConfig()
                        .setTypeClass(ProjectSnapshot.class)
                        .setImplementation(new ProjectSnapshotSerializer()));

        hazelcast = Hazelcast.newHazelcastInstance(config);
        testMap = hazelcast.getMap("test-projects");
    }

    @AfterAll
    static void teardownClass() {
        if (hazelcast != null) {
            hazelcast.shutdown();
        }
    }

    @Test
    void shouldSerializeFullSnapshot() {
        // Given
        LocalDate jan1 = LocalDate.of(2025, 1, 1);
        ProjectSnapshot original = ProjectSnapshot.builder("full")
                .startDate(jan1)
                .dependencyMode(DependencyMode.STRICT)
                .task(ScheduledTask.builder("a").name("Design").dates(jan1, jan1.plusDays(4))
                        .status(TaskStatus.COMPLETED).sortOrder(1.25).creationIndex(0).build())
                .task(ScheduledTask.builder("b").dates(jan1.plusDays(5), jan1.plusDays(9))
                        .sortOrder(2.5).creationIndex(1).build())
                .milestone(new Milestone("m", "Go live", jan1.plusDays(10), 3.0, 2))
                .dependency(new Dependency("b", "a", DependencyType.START_TO_FINISH, -2))
                .version(7)
                .build();

        // When
        testMap.put(original.projectId(), original);
        ProjectSnapshot retrieved = testMap.get(original.projectId());

        // Then
        assertThat(retrieved).isNotNull();
        assertThat(retrieved).isEqualTo(original);
        assertThat(retrieved.version()).isEqualTo(7);
        assertThat(retrieved.dependencyMode()).isEqualTo(DependencyMode.STRICT);
        assertThat(retrieved.tasks()).containsExactlyElementsOf(original.tasks());
        assertThat(retrieved.milestones()).containsExactlyElementsOf(original.milestones());
        assertThat(retrieved.dependencies()).containsExactly(
                new Dependency("b", "a", DependencyType.START_TO_FINISH, -2));
    }

    @Test
    void shouldSerializeUnscheduledTasksAndMissingStart() {
        // Given
        ProjectSnapshot original = ProjectSnapshot.builder("sparse")
                .task(ScheduledTask.builder("undated").build())
                .task(ScheduledTask.builder("half").startDate(LocalDate.of(2025, 3, 1)).build())
                .build();

        // When
        testMap.put(original.projectId(), original);
        ProjectSnapshot retrieved = testMap.get(original.projectId());

        // Then
        assertThat(retrieved.startDate()).isNull();
        assertThat(retrieved.findTask("undated").orElseThrow().startDate()).isNull();
        assertThat(retrieved.findTask("half").orElseThrow().dueDate()).isNull();
        assertThat(retrieved.findTask("half").orElseThrow().startDate()).isEqualTo(LocalDate.of(2025, 3, 1));
        assertThat(retrieved.dependencies()).isEmpty();
    }
}
