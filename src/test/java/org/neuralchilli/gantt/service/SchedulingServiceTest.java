package org.neuralchilli.gantt.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.gantt.config.ProjectYamlParser;
import org.neuralchilli.gantt.core.CascadeEngine;
import org.neuralchilli.gantt.core.CriticalPathAnalyzer;
import org.neuralchilli.gantt.core.CycleGuard;
import org.neuralchilli.gantt.core.Sequencer;
import org.neuralchilli.gantt.core.ValidationException;
import org.neuralchilli.gantt.domain.CascadeResult;
import org.neuralchilli.gantt.domain.CriticalPathResult;
import org.neuralchilli.gantt.domain.Dependency;
import org.neuralchilli.gantt.domain.DependencyMode;
import org.neuralchilli.gantt.domain.DependencyType;
import org.neuralchilli.gantt.domain.Milestone;
import org.neuralchilli.gantt.domain.ProjectSnapshot;
import org.neuralchilli.gantt.domain.ReorderResult;
import org.neuralchilli.gantt.domain.ScheduledTask;
import org.neuralchilli.gantt.domain.SequencedItem;
import org.neuralchilli.gantt.domain.TaskStatus;
import org.neuralchilli.gantt.monitoring.SchedulingMonitor;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

class SchedulingServiceTest {

    private ProjectStore store;
    private SchedulingMonitor monitor;
    private SchedulingService service;

    @BeforeEach
    void setUp() {
        store = spy(new InMemoryProjectStore());
        monitor = new SchedulingMonitor();
        service = new SchedulingService(
                store,
                new CycleGuard(),
                new CriticalPathAnalyzer(1),
                new CascadeEngine(false),
                new Sequencer(1, 6),
                new ScheduleValidator(new CycleGuard()),
                new ProjectYamlParser(DependencyMode.FLEXIBLE),
                monitor
        );
    }

    // ------------------------------------------------------------ dependencies

    @Test
    void shouldAddDependency() {
        // Given
        service.createProject(ProjectSnapshot.builder("p").task(task("A", 1, 5)).task(task("B", 6, 10)).build());

        // When
        DependencyResult result = service.addDependency("p", "B", "A", DependencyType.START_TO_START, 1);

        // Then
        assertThat(result).isInstanceOf(DependencyResult.Added.class);
        assertThat(result.isSuccess()).isTrue();
        assertThat(service.project("p").dependencies())
                .containsExactly(new Dependency("B", "A", DependencyType.START_TO_START, 1));
        assertThat(monitor.getReport().dependenciesAdded()).isEqualTo(1);
    }

    @Test
    void shouldRefuseCycleAndLeaveStoreUntouched() {
        // Given: A depends on C
        ProjectSnapshot stored = service.createProject(ProjectSnapshot.builder("p")
                .task(task("A", 1, 5))
                .task(task("C", 6, 10))
                .dependency(Dependency.finishToStart("A", "C"))
                .build());

        // When: C depends on A
        DependencyResult result = service.addDependency("p", "C", "A");

        // Then
        assertThat(result).isInstanceOf(DependencyResult.CycleDetected.class);
        DependencyResult.CycleDetected cycle = (DependencyResult.CycleDetected) result;
        assertThat(cycle.cyclePath()).containsExactly("A", "C", "A");
        assertThat(cycle.error()).contains("Adding this dependency would create a circular reference: A → C → A");
        assertThat(service.project("p")).isEqualTo(stored);
        assertThat(monitor.getReport().cycleRejections()).isEqualTo(1);
    }

    @Test
    void shouldRefuseSelfDependency() {
        service.createProject(ProjectSnapshot.builder("p").task(task("A", 1, 5)).build());

        DependencyResult result = service.addDependency("p", "A", "A");

        assertThat(result).isInstanceOf(DependencyResult.CycleDetected.class);
        assertThat(result.error()).contains("Task 'A' cannot depend on itself");
    }

    @Test
    void shouldRejectUnknownDuplicateAndBlankEdges() {
        service.createProject(ProjectSnapshot.builder("p")
                .task(task("A", 1, 5))
                .task(task("B", 6, 10))
                .dependency(Dependency.finishToStart("B", "A"))
                .build());

        assertThat(service.addDependency("p", "B", "ghost")).isInstanceOf(DependencyResult.Rejected.class);
        assertThat(service.addDependency("p", "B", "A").error()).get().asString().contains("already depends on");
        assertThat(service.addDependency("p", " ", "A").isSuccess()).isFalse();
        assertThat(service.project("p").dependencies()).hasSize(1);
    }

    @Test
    void shouldCheckForCycleWithoutWriting() {
        service.createProject(ProjectSnapshot.builder("p")
                .task(task("A", 1, 5))
                .task(task("C", 6, 10))
                .dependency(Dependency.finishToStart("A", "C"))
                .build());

        assertThat(service.checkCircularDependency("p", "C", "A")).containsExactly("A", "C", "A");
        assertThat(service.checkCircularDependency("p", "A", "C")).isEmpty();
        verify(store, never()).update(anyString(), any());
    }

    @Test
    void shouldUpdateAndRemoveDependency() {
        service.createProject(chain(DependencyMode.STRICT));

        DependencyResult updated = service.updateDependency("p", "B", "A", DependencyType.FINISH_TO_FINISH, 2);
        assertThat(updated).isEqualTo(DependencyResult.updated(
                new Dependency("B", "A", DependencyType.FINISH_TO_FINISH, 2)));
        assertThat(service.updateDependency("p", "A", "B", DependencyType.FINISH_TO_FINISH, 0))
                .isInstanceOf(DependencyResult.Rejected.class);

        assertThat(service.removeDependency("p", "B", "A")).isTrue();
        assertThat(service.removeDependency("p", "B", "A")).isFalse();
        assertThat(service.project("p").dependencies()).containsExactly(Dependency.finishToStart("C", "B"));
    }

    // ----------------------------------------------------------------- cascade

    @Test
    void shouldApplyStrictCascadeAtomically() {
        // Given
        long version = service.createProject(chain(DependencyMode.STRICT)).version();

        // When: A now ends Jan 8
        CascadeOutcome outcome = service.updateTaskDates("p", "A", null, jan(8));

        // Then
        assertThat(outcome).isInstanceOf(CascadeOutcome.Applied.class);
        assertThat(outcome.totalAffected()).isEqualTo(2);
        ProjectSnapshot stored = service.project("p");
        assertThat(stored.version()).isEqualTo(version + 1);
        assertDates(stored, "A", 1, 8);
        assertDates(stored, "B", 9, 13);
        assertDates(stored, "C", 14, 18);
        assertThat(monitor.getReport().cascadesApplied()).isEqualTo(1);
    }

    @Test
    void shouldBeIdempotentInStrictMode() {
        service.createProject(chain(DependencyMode.STRICT));
        service.updateTaskDates("p", "A", null, jan(8));

        CascadeOutcome again = service.updateTaskDates("p", "A", null, jan(8));

        assertThat(again.isApplied()).isTrue();
        assertThat(again.totalAffected()).isZero();
        assertDates(service.project("p"), "C", 14, 18);
    }

    @Test
    void shouldRejectInvalidDatesWithoutWriting() {
        ProjectSnapshot stored = service.createProject(chain(DependencyMode.STRICT));

        CascadeOutcome outcome = service.updateTaskDates("p", "A", jan(10), jan(8));

        assertThat(outcome).isInstanceOf(CascadeOutcome.Rejected.class);
        assertThat(outcome.error()).get().asString().contains("cannot be before start date");
        assertThat(service.project("p")).isEqualTo(stored);
        assertThat(service.updateTaskDates("p", "ghost", null, jan(8)))
                .isInstanceOf(CascadeOutcome.Rejected.class);
    }

    @Test
    void shouldOnlyPreviewInFlexibleMode() {
        // Given
        ProjectSnapshot stored = service.createProject(chain(DependencyMode.FLEXIBLE));

        // When
        CascadeOutcome outcome = service.updateTaskDates("p", "A", null, jan(8));

        // Then: nothing written
        assertThat(outcome).isInstanceOf(CascadeOutcome.Preview.class);
        assertThat(outcome.isApplied()).isFalse();
        assertThat(outcome.totalAffected()).isEqualTo(2);
        assertThat(service.project("p")).isEqualTo(stored);
    }

    @Test
    void shouldApplyConfirmedPreview() {
        // Given
        service.createProject(chain(DependencyMode.FLEXIBLE));
        CascadeResult preview = ((CascadeOutcome.Preview) service.updateTaskDates("p", "A", null, jan(8))).cascade();

        // When
        CascadeOutcome outcome = service.applyCascade("p", "A", null, jan(8), preview);

        // Then
        assertThat(outcome).isInstanceOf(CascadeOutcome.Applied.class);
        ProjectSnapshot stored = service.project("p");
        assertDates(stored, "A", 1, 8);
        assertDates(stored, "B", 9, 13);
        assertDates(stored, "C", 14, 18);

        // And a replayed confirmation writes nothing
        CascadeOutcome replay = service.applyCascade("p", "A", null, jan(8), preview);
        assertThat(replay).isInstanceOf(CascadeOutcome.Applied.class);
        assertThat(service.project("p").version()).isEqualTo(stored.version());
    }

    @Test
    void shouldDetectStalePreview() {
        // Given: a preview, then C moves on its own
        service.createProject(chain(DependencyMode.FLEXIBLE));
        CascadeResult preview = service.previewCascade("p", "A", null, jan(8));
        assertThat(service.updateTaskDates("p", "C", jan(12), jan(16)).isApplied()).isTrue();
        ProjectSnapshot beforeConfirm = service.project("p");

        // When
        CascadeOutcome outcome = service.applyCascade("p", "A", null, jan(8), preview);

        // Then
        assertThat(outcome).isInstanceOf(CascadeOutcome.StalePreview.class);
        CascadeResult fresh = ((CascadeOutcome.StalePreview) outcome).current();
        assertThat(fresh.sameChangesAs(preview)).isFalse();
        assertThat(fresh.totalAffected()).isEqualTo(2);
        assertThat(service.project("p")).isEqualTo(beforeConfirm);
        assertThat(monitor.getReport().stalePreviews()).isEqualTo(1);
    }

    @Test
    void shouldNotReportPreviewAsAppliedWhenOnlyTheTaskMoved() {
        // Given: a preview, then A alone is moved to the same dates with cascading off
        service.createProject(chain(DependencyMode.FLEXIBLE));
        CascadeResult preview = service.previewCascade("p", "A", null, jan(8));
        service.setDependencyMode("p", DependencyMode.OFF);
        service.updateTaskDates("p", "A", null, jan(8));
        service.setDependencyMode("p", DependencyMode.FLEXIBLE);
        ProjectSnapshot beforeConfirm = service.project("p");

        // When
        CascadeOutcome outcome = service.applyCascade("p", "A", null, jan(8), preview);

        // Then: B and C never moved, so the preview is stale
        assertThat(outcome).isInstanceOf(CascadeOutcome.StalePreview.class);
        assertThat(outcome.isApplied()).isFalse();
        assertThat(((CascadeOutcome.StalePreview) outcome).current().isEmpty()).isTrue();
        assertDates(service.project("p"), "B", 6, 10);
        assertDates(service.project("p"), "C", 11, 15);
        assertThat(service.project("p").version()).isEqualTo(beforeConfirm.version());
        assertThat(monitor.getReport().stalePreviews()).isEqualTo(1);
    }

    @Test
    void shouldWriteDirectlyInFlexibleModeWhenNoDependentMoves() {
        service.createProject(chain(DependencyMode.FLEXIBLE));

        CascadeOutcome outcome = service.updateTaskDates("p", "A", null, jan(3));

        assertThat(outcome).isInstanceOf(CascadeOutcome.Applied.class);
        assertDates(service.project("p"), "A", 1, 3);
        assertDates(service.project("p"), "B", 6, 10);
    }

    @Test
    void shouldPreviewWithoutWritingWhateverTheMode() {
        ProjectSnapshot stored = service.createProject(chain(DependencyMode.STRICT));

        CascadeResult preview = service.previewCascade("p", "A", null, jan(8));

        assertThat(preview.totalAffected()).isEqualTo(2);
        assertThat(service.project("p")).isEqualTo(stored);
    }

    @Test
    void shouldMoveOnlyTheTaskWhenCascadingIsOff() {
        // Given
        service.createProject(chain(DependencyMode.OFF));

        // When: B moves earlier than its predecessor allows
        CascadeOutcome outcome = service.updateTaskDates("p", "B", jan(3), jan(7));

        // Then
        assertThat(outcome).isEqualTo(new CascadeOutcome.NotCascaded("B", true));
        assertDates(service.project("p"), "B", 3, 7);
        assertDates(service.project("p"), "C", 11, 15);
        assertThat(service.applyCascade("p", "B", jan(3), jan(7), CascadeResult.none("B", jan(3), jan(7))))
                .isInstanceOf(CascadeOutcome.Rejected.class);
    }

    // ------------------------------------------------------------------ status

    @Test
    void shouldReportUnblockedDependents() {
        service.createProject(chain(DependencyMode.STRICT));
        assertThat(service.blockedTasks("p")).containsExactly("B", "C");

        StatusChange change = service.updateTaskStatus("p", "A", TaskStatus.COMPLETED, jan(3));

        assertThat(change.previousStatus()).isEqualTo(TaskStatus.OPEN);
        assertThat(change.unblocked()).containsExactly("B");
        assertThat(change.advanced().isEmpty()).isTrue();
        assertThat(service.isBlocked("p", "B")).isFalse();
        assertThat(service.isBlocked("p", "C")).isTrue();
        assertDates(service.project("p"), "B", 6, 10);
    }

    @Test
    void shouldMoveSuccessorUpWhenPredecessorCompletesLate() {
        // Given
        ProjectSnapshot stored = service.createProject(chain(DependencyMode.STRICT));

        // When: A is marked done on Jan 9, after its due date
        StatusChange change = service.updateTaskStatus("p", "A", TaskStatus.COMPLETED, jan(9));

        // Then: B starts on Jan 9 with the same duration, in the same write
        assertThat(change.advanced().affectedTaskIds()).containsExactly("B");
        ProjectSnapshot updated = service.project("p");
        assertThat(updated.version()).isEqualTo(stored.version() + 1);
        assertThat(updated.findTask("A").orElseThrow().status()).isEqualTo(TaskStatus.COMPLETED);
        assertDates(updated, "A", 1, 5);
        assertDates(updated, "B", 9, 13);
        assertDates(updated, "C", 11, 15);
    }

    @Test
    void shouldNotMoveSuccessorsOnCompletionWhenCascadingIsOff() {
        service.createProject(chain(DependencyMode.OFF));

        StatusChange change = service.updateTaskStatus("p", "A", TaskStatus.COMPLETED, jan(9));

        assertThat(change.advanced().isEmpty()).isTrue();
        assertThat(change.unblocked()).containsExactly("B");
        assertDates(service.project("p"), "B", 6, 10);
    }

    // --------------------------------------------------------------- analysis

    @Test
    void shouldComputeCriticalPath() {
        service.createProject(chain(DependencyMode.STRICT));

        CriticalPathResult result = service.criticalPath("p");

        assertThat(result.criticalTasks()).containsExactly("A", "B", "C");
        assertThat(monitor.getTimingStats("critical-path").getCount()).isEqualTo(1);
    }

    // ---------------------------------------------------------------- ordering

    @Test
    void shouldReorderAndRenormalize() {
        // Given
        service.createProject(ProjectSnapshot.builder("p")
                .task(ScheduledTask.builder("a").sortOrder(1.0).creationIndex(0).build())
                .task(ScheduledTask.builder("b").sortOrder(1.0000000001).creationIndex(1).build())
                .milestone(new Milestone("m", "Launch", jan(20), 3.0, 2))
                .build());

        // When
        ReorderResult result = service.reorder("p", "m", "a", "b");

        // Then
        assertThat(result.wasRenormalized()).isTrue();
        assertThat(service.project("p").sequence()).extracting(SequencedItem::id)
                .containsExactly("a", "m", "b");
        assertThat(service.project("p").findTask("b").orElseThrow().sortOrder()).isEqualTo(2.0);
        assertThat(monitor.getReport().renormalizations()).isEqualTo(1);
    }

    @Test
    void shouldInitializeSortOrdersOnce() {
        service.createProject(ProjectSnapshot.builder("p")
                .task(ScheduledTask.builder("late").dates(jan(10), jan(12)).creationIndex(0).build())
                .task(ScheduledTask.builder("early").dates(jan(1), jan(2)).creationIndex(1).build())
                .build());

        Map<String, Double> keys = service.initializeSortOrders("p");

        assertThat(keys).containsEntry("early", 1.0).containsEntry("late", 2.0);
        assertThat(service.initializeSortOrders("p")).isEmpty();
    }

    // ---------------------------------------------------------------- projects

    @Test
    void shouldImportProjectFromYaml() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/fixtures/chain-project.yaml")) {
            ProjectSnapshot stored = service.importProject(in);

            assertThat(stored.projectId()).isEqualTo("website-relaunch");
            assertThat(stored.version()).isEqualTo(1);
            assertThat(service.dependencyMode("website-relaunch")).isEqualTo(DependencyMode.STRICT);
        }
    }

    @Test
    void shouldRejectInvalidProjects() {
        InputStream cyclic = new ByteArrayInputStream("""
                project: cyclic
                tasks:
                  - id: a
                    depends_on: [b]
                  - id: b
                    depends_on: [a]
                """.getBytes(StandardCharsets.UTF_8));
        InputStream malformed = new ByteArrayInputStream("tasks: [".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> service.importProject(cyclic))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Circular dependency");
        assertThatThrownBy(() -> service.importProject(malformed))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Invalid project document");
        verify(store, never()).save(any());
    }

    @Test
    void shouldTurnBadDatesAndShapesIntoValidationErrors() {
        InputStream badDate = new ByteArrayInputStream("""
                project: bad-date
                start_date: "2025-13-01"
                """.getBytes(StandardCharsets.UTF_8));
        InputStream badTask = new ByteArrayInputStream("""
                project: bad-task
                tasks: [just-a-string]
                """.getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> service.importProject(badDate))
                .isInstanceOf(ValidationException.class)
                .hasMessageStartingWith("Invalid project document: ")
                .hasMessageContaining("start_date");
        assertThatThrownBy(() -> service.importProject(badTask))
                .isInstanceOf(ValidationException.class)
                .hasMessageStartingWith("Invalid project document: ")
                .hasMessageContaining("Task entry must be a mapping");
        verify(store, never()).save(any());
    }

    @Test
    void shouldSwitchDependencyMode() {
        service.createProject(chain(DependencyMode.STRICT));

        service.setDependencyMode("p", DependencyMode.OFF);

        assertThat(service.dependencyMode("p")).isEqualTo(DependencyMode.OFF);
    }

    @Test
    void shouldDeleteProject() {
        service.createProject(chain(DependencyMode.STRICT));

        assertThat(service.deleteProject("p")).isTrue();
        assertThat(service.deleteProject("p")).isFalse();
        assertThatThrownBy(() -> service.project("p")).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void shouldFailForUnknownProject() {
        assertThatThrownBy(() -> service.criticalPath("missing")).isInstanceOf(NoSuchElementException.class);
        assertThatThrownBy(() -> service.updateTaskDates("missing", "A", null, jan(2)))
                .isInstanceOf(NoSuchElementException.class);
    }

    private static ProjectSnapshot chain(DependencyMode mode) {
        return ProjectSnapshot.builder("p")
                .dependencyMode(mode)
                .task(task("A", 1, 5))
                .task(task("B", 6, 10))
                .task(task("C", 11, 15))
                .dependencies(List.of(
                        Dependency.finishToStart("B", "A"),
                        Dependency.finishToStart("C", "B")
                ))
                .build();
    }

    private static void assertDates(ProjectSnapshot snapshot, String taskId, int startDay, int dueDay) {
        ScheduledTask task = snapshot.findTask(taskId).orElseThrow();
        assertThat(task.startDate()).as("%s start", taskId).isEqualTo(jan(startDay));
        assertThat(task.dueDate()).as("%s due", taskId).isEqualTo(jan(dueDay));
    }

    private static ScheduledTask task(String id, int startDay, int dueDay) {
        return ScheduledTask.builder(id).dates(jan(startDay), jan(dueDay)).build();
    }

    private static LocalDate jan(int day) {
        return LocalDate.of(2025, 1, day);
    }
}
