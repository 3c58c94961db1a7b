package org.neuralchilli.gantt.service;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.gantt.domain.CascadeResult;
import org.neuralchilli.gantt.domain.Dependency;
import org.neuralchilli.gantt.domain.DependencyMode;
import org.neuralchilli.gantt.domain.ProjectSnapshot;
import org.neuralchilli.gantt.domain.ScheduledTask;
import org.neuralchilli.gantt.monitoring.SchedulingMonitor;

import java.io.InputStream;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Wired service against the embedded Hazelcast store.
 */
@QuarkusTest
class SchedulingServiceQuarkusTest {

    @Inject
    SchedulingService service;

    @Inject
    ProjectStore store;

    @Inject
    SchedulingMonitor monitor;

    @BeforeEach
    void setUp() {
        monitor.reset();
    }

    @Test
    void shouldWireHazelcastStore() {
        assertThat(store).isInstanceOf(HazelcastProjectStore.class);
    }

    @Test
    void shouldCascadeImportedProjectInStrictMode() throws Exception {
        // Given
        String projectId;
        try (InputStream in = getClass().getResourceAsStream("/fixtures/chain-project.yaml")) {
            projectId = service.importProject(in).projectId();
        }

        // When
        CascadeOutcome outcome = service.updateTaskDates(projectId, "A", null, LocalDate.of(2025, 1, 8));

        // Then
        assertThat(outcome).isInstanceOf(CascadeOutcome.Applied.class);
        assertThat(outcome.totalAffected()).isEqualTo(2);
        ScheduledTask c = service.project(projectId).findTask("C").orElseThrow();
        assertThat(c.startDate()).isEqualTo(LocalDate.of(2025, 1, 14));
        assertThat(c.dueDate()).isEqualTo(LocalDate.of(2025, 1, 18));
        assertThat(service.criticalPath(projectId).projectFinish()).isEqualTo(LocalDate.of(2025, 1, 18));
    }

    @Test
    void shouldConfirmFlexiblePreviewThroughStore() {
        // Given
        String projectId = newProject(DependencyMode.FLEXIBLE);
        CascadeResult preview = service.previewCascade(projectId, "a", null, LocalDate.of(2025, 1, 7));

        // When
        CascadeOutcome outcome = service.applyCascade(projectId, "a", null, LocalDate.of(2025, 1, 7), preview);

        // Then
        assertThat(outcome.isApplied()).isTrue();
        assertThat(service.project(projectId).findTask("b").orElseThrow().startDate())
                .isEqualTo(LocalDate.of(2025, 1, 8));
        assertThat(monitor.getReport().cascadesApplied()).isEqualTo(1);
    }

    @Test
    void shouldAcceptOnlyOneOfTwoConcurrentOppositeEdges() throws Exception {
        // Given: two unrelated tasks
        String projectId = service.createProject(ProjectSnapshot.builder("race-" + UUID.randomUUID())
                .task(ScheduledTask.builder("x").build())
                .task(ScheduledTask.builder("y").build())
                .build()).projectId();

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            // When: x->y and y->x are requested at the same time
            Future<DependencyResult> first = executor.submit(() -> {
                start.await();
                return service.addDependency(projectId, "x", "y");
            });
            Future<DependencyResult> second = executor.submit(() -> {
                start.await();
                return service.addDependency(projectId, "y", "x");
            });
            start.countDown();

            List<DependencyResult> results = List.of(first.get(10, TimeUnit.SECONDS), second.get(10, TimeUnit.SECONDS));

            // Then
            assertThat(results).filteredOn(DependencyResult::isSuccess).hasSize(1);
            assertThat(results).filteredOn(r -> r instanceof DependencyResult.CycleDetected).hasSize(1);
            assertThat(service.project(projectId).dependencies()).hasSize(1);
        } finally {
            executor.shutdownNow();
        }
    }

    private String newProject(DependencyMode mode) {
        return service.createProject(ProjectSnapshot.builder("project-" + UUID.randomUUID())
                .dependencyMode(mode)
                .task(ScheduledTask.builder("a").dates(LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 5)).build())
                .task(ScheduledTask.builder("b").dates(LocalDate.of(2025, 1, 6), LocalDate.of(2025, 1, 8)).build())
                .dependencies(List.of(Dependency.finishToStart("b", "a")))
                .build()).projectId();
    }
}
