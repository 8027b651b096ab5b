package com.taskrelay.engine.fanin;

import com.taskrelay.core.model.Event;
import com.taskrelay.core.model.EventType;
import com.taskrelay.core.model.NewSubtask;
import com.taskrelay.core.model.Project;
import com.taskrelay.core.model.Task;
import com.taskrelay.core.model.WorkflowStep;
import com.taskrelay.engine.metrics.RelayMetrics;
import com.taskrelay.engine.test.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.*;

class FanInSynchronizerTest {

    private EngineFixture fixture;
    private Project project;
    private Task parent;
    private List<Task> children;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        project = fixture.createStandardProject();
        parent = fixture.createTask(project.projectId(), "Parent");
        children = fixture.board.createSubtasks(parent.taskId(), List.of(
            NewSubtask.of("A", "a"),
            NewSubtask.of("B", "b"),
            NewSubtask.of("C", "c")));
    }

    private List<Task> synchronizationTasks() {
        return fixture.board.listChildren(parent.taskId()).stream()
            .filter(Task::isSynchronization)
            .toList();
    }

    @Test
    @DisplayName("Completing two of three siblings creates nothing; the third creates exactly one")
    void shouldCreateOneTaskWhenLastSiblingCompletes() {
        fixture.board.completeTask(children.get(0).taskId());
        fixture.board.completeTask(children.get(1).taskId());
        assertThat(synchronizationTasks()).isEmpty();

        fixture.board.completeTask(children.get(2).taskId());

        List<Task> sync = synchronizationTasks();
        assertThat(sync).hasSize(1);
        Task task = sync.get(0);
        assertEquals("Synchronize: Parent", task.title());
        assertEquals(parent.taskId(), task.parentTaskId());
        assertEquals(parent.taskId(), task.fanInParentId());

        WorkflowStep build = fixture.workflowCatalog.get(project.projectId()).findByName("Build").orElseThrow();
        assertEquals(build.stepId(), task.stepId());
        assertThat(task.description()).contains("A (done)", "B (done)", "C (done)");

        Event created = fixture.events(task.taskId(), EventType.TASK_CREATED).get(0);
        assertThat(created.payload().path("synchronizes")).hasSize(3);
        assertEquals(build.stepId(), created.enteredStepId().orElseThrow());
        assertEquals(1.0, fixture.meterRegistry.counter(RelayMetrics.FAN_IN_CREATED).count());
    }

    @Test
    @DisplayName("Processing the last completion twice still yields one synchronization task")
    void shouldBeIdempotentWhenCompletionProcessedTwice() {
        children.forEach(c -> fixture.board.completeTask(c.taskId()));

        fixture.board.synchronizeFanIn(children.get(2).taskId());
        Optional<Task> again = fixture.transactionTemplate.execute(status ->
            fixture.fanInSynchronizer.onChildSettled(fixture.reload(children.get(2).taskId())));

        assertThat(again).isEmpty();
        assertThat(synchronizationTasks()).hasSize(1);
    }

    @Test
    void cancelledSiblingsShouldCountAsSettled() {
        fixture.board.cancelTask(children.get(0).taskId());
        fixture.board.completeTask(children.get(1).taskId());
        assertThat(synchronizationTasks()).isEmpty();

        fixture.board.cancelTask(children.get(2).taskId());

        List<Task> sync = synchronizationTasks();
        assertThat(sync).hasSize(1);
        assertThat(sync.get(0).description()).contains("A (cancelled)", "B (done)", "C (cancelled)");
    }

    @Test
    void allCancelledShouldNotSynchronize() {
        children.forEach(c -> fixture.board.cancelTask(c.taskId()));

        assertThat(synchronizationTasks()).isEmpty();
    }

    @Test
    void synchronizationTaskCompletionShouldNotTriggerAnotherFanIn() {
        children.forEach(c -> fixture.board.completeTask(c.taskId()));
        Task sync = synchronizationTasks().get(0);

        fixture.board.completeTask(sync.taskId());

        assertThat(synchronizationTasks()).hasSize(1);
    }

    @Test
    void taskWithoutParentShouldBeNoOp() {
        Task orphan = fixture.createTask(project.projectId(), "Lonely");
        int before = fixture.countTasks(project.projectId());

        fixture.board.completeTask(orphan.taskId());

        assertEquals(before, fixture.countTasks(project.projectId()));
    }

    @Test
    @DisplayName("Siblings completing concurrently create exactly one synchronization task")
    void concurrentCompletionShouldCreateExactlyOne() throws Exception {
        fixture.board.completeTask(children.get(0).taskId());

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Task>> futures = new ArrayList<>();
            for (UUID id : List.of(children.get(1).taskId(), children.get(2).taskId())) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return fixture.board.completeTask(id);
                }));
            }
            start.countDown();
            for (Future<Task> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(synchronizationTasks()).hasSize(1);
    }
}
