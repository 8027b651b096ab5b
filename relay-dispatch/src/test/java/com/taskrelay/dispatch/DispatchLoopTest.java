package com.taskrelay.dispatch;

import com.taskrelay.core.exception.WorkerLaunchException;
import com.taskrelay.core.model.AgentRun;
import com.taskrelay.core.model.ConsumerClass;
import com.taskrelay.core.model.Event;
import com.taskrelay.core.model.EventType;
import com.taskrelay.core.model.NewSubtask;
import com.taskrelay.core.model.NewTask;
import com.taskrelay.core.model.Project;
import com.taskrelay.core.model.StepDefinition;
import com.taskrelay.core.model.Task;
import com.taskrelay.core.model.TaskKind;
import com.taskrelay.core.model.WorkerRole;
import com.taskrelay.dispatch.test.DispatchFixture;
import com.taskrelay.dispatch.test.FakeWorkerLauncher;
import com.taskrelay.dispatch.test.FakeWorkerLauncher.FakeWorker;
import com.taskrelay.engine.metrics.RelayMetrics;
import com.taskrelay.engine.test.EngineFixture;
import com.taskrelay.worker.WorkerInvocation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.*;

class DispatchLoopTest {

    private DispatchFixture fixture;
    private EngineFixture engine;
    private FakeWorkerLauncher launcher;
    private Project project;

    @BeforeEach
    void setUp() {
        fixture = new DispatchFixture();
        engine = fixture.engine;
        launcher = fixture.launcher;
        project = engine.createStandardProject();
    }

    private AgentRun activeRun(UUID taskId) {
        return engine.runRecorder.activeRun(taskId).orElseThrow();
    }

    private FakeWorker workerFor(UUID taskId) {
        return launcher.worker(activeRun(taskId).runId());
    }

    /**
     * Undispatched events that could still launch a worker.
     */
    private List<Event> pendingDispatch() {
        return engine.unconsumed(ConsumerClass.DISPATCH).stream()
            .filter(e -> e.type().isDispatchCandidate())
            .toList();
    }

    private double decisions(DispatchDecision decision) {
        return engine.meterRegistry.counter(RelayMetrics.DISPATCH_DECISIONS, "decision", decision.metricName()).count();
    }

    @Nested
    class Launching {

        @Test
        void taskEnteringDispatchableStep_shouldLaunchOneWorker() {
            Task task = engine.createTaskAt(project.projectId(), "Add login", "Build");

            fixture.cycle();

            assertThat(launcher.invocations()).hasSize(1);
            WorkerInvocation invocation = launcher.lastInvocation();
            assertEquals(task.taskId(), invocation.taskId());
            assertEquals(WorkerRole.CODER, invocation.role());
            assertEquals(DispatchFixture.DEFAULT_MODEL, invocation.model());
            assertNull(invocation.sessionId());
            assertThat(invocation.prompt()).contains("Title: Add login", "Step: Build");

            Task stored = engine.reload(task.taskId());
            assertEquals(stored.workspacePath(), invocation.workspacePath().toString());
            assertThat(stored.branch()).startsWith("task-");

            assertThat(engine.events(task.taskId(), EventType.RUN_STARTED)).hasSize(1);
            assertThat(pendingDispatch()).isEmpty();
            assertEquals(1, fixture.shutdownHandler.getActiveRunCount());
            assertTrue(fixture.registry.isLive(activeRun(task.taskId()).runId()));
        }

        @Test
        void taskAtManualStep_shouldNotLaunch() {
            engine.createTaskAt(project.projectId(), "Plan me", "Plan");

            fixture.cycle();

            assertThat(launcher.invocations()).isEmpty();
            assertEquals(1.0, decisions(DispatchDecision.NOT_DISPATCHABLE));
        }

        @Test
        void reannouncedTaskWithActiveRun_shouldNotLaunchTwice() {
            Task task = engine.createTaskAt(project.projectId(), "T", "Build");
            fixture.cycle();

            engine.board.moveTask(task.taskId(), "Plan");
            engine.board.moveTask(task.taskId(), "Build");
            fixture.cycle();

            assertThat(launcher.invocations()).hasSize(1);
            assertThat(engine.board.getRuns(task.taskId())).hasSize(1);
            assertEquals(1.0, decisions(DispatchDecision.ALREADY_ACTIVE));
        }

        @Test
        void staleEvent_shouldBeConsumedWithoutLaunch() {
            Task task = engine.createTaskAt(project.projectId(), "T", "Build");
            engine.board.moveTask(task.taskId(), "Review");

            fixture.cycle();

            assertThat(launcher.invocations()).isEmpty();
            assertThat(pendingDispatch()).isEmpty();
            assertEquals(1.0, decisions(DispatchDecision.STALE));
        }

        @Test
        void cancelledTask_shouldNotLaunch() {
            Task task = engine.createTaskAt(project.projectId(), "T", "Build");
            engine.board.cancelTask(task.taskId());

            fixture.cycle();

            assertThat(launcher.invocations()).isEmpty();
            assertEquals(1.0, decisions(DispatchDecision.CANCELLED));
        }

        @Test
        void uncancelledTask_shouldLaunch() {
            Task task = engine.createTaskAt(project.projectId(), "T", "Build");
            engine.board.cancelTask(task.taskId());
            fixture.cycle();

            engine.board.uncancelTask(task.taskId());
            fixture.cycle();

            assertThat(launcher.invocations()).hasSize(1);
        }

        @Test
        void stepModel_shouldOverrideDefault() {
            Project custom = engine.createProject(List.of(
                StepDefinition.dispatch("Research", WorkerRole.PLANNER).withModel("big-model")
                    .withInstructions("Investigate and report."),
                StepDefinition.manual("Done")));
            engine.createTask(custom.projectId(), "Survey options");

            fixture.cycle();

            assertEquals("big-model", launcher.lastInvocation().model());
            assertEquals(WorkerRole.PLANNER, launcher.lastInvocation().role());
            assertThat(launcher.lastInvocation().prompt()).startsWith("<system_prompt>\nInvestigate and report.\n</system_prompt>");
        }
    }

    @Nested
    class Gates {

        @Test
        void capacity_shouldDeferAndRetryWhenRunFinishes() {
            fixture = new DispatchFixture(engine, 2);
            launcher = fixture.launcher;
            Task first = engine.createTaskAt(project.projectId(), "A", "Build");
            engine.createTaskAt(project.projectId(), "B", "Build");
            Task third = engine.createTaskAt(project.projectId(), "C", "Build");

            fixture.cycle();

            assertThat(launcher.invocations()).hasSize(2);
            assertEquals(2, engine.runRecorder.countActive());
            assertThat(pendingDispatch()).extracting(Event::taskId).containsExactly(third.taskId());

            fixture.cycle();
            assertThat(launcher.invocations()).hasSize(2);

            workerFor(first.taskId()).succeed();
            fixture.cycle();

            assertThat(launcher.invocations()).hasSize(3);
            assertEquals(third.taskId(), launcher.lastInvocation().taskId());
            assertThat(pendingDispatch()).isEmpty();
            assertThat(decisions(DispatchDecision.DEFERRED_CAPACITY)).isGreaterThanOrEqualTo(2.0);
        }

        @Test
        void deferredBacklogLargerThanBatch_shouldNotHideLaterCleanup() {
            fixture = new DispatchFixture(engine, 1, 5);
            launcher = fixture.launcher;
            Task finished = engine.createTaskAt(project.projectId(), "W", "Build");
            fixture.cycle();
            workerFor(finished.taskId()).succeed();

            for (int i = 0; i < 8; i++) {
                engine.createTaskAt(project.projectId(), "Queued " + i, "Build");
            }
            fixture.cycle();
            assertEquals(1, engine.runRecorder.countActive());
            assertThat(pendingDispatch()).hasSize(7);

            engine.board.completeTask(finished.taskId());
            fixture.cycle();

            assertFalse(engine.reload(finished.taskId()).hasWorkspace());
            assertThat(pendingDispatch()).hasSize(7);
            assertThat(launcher.invocations()).hasSize(2);
        }

        @Test
        void blockedTask_shouldLaunchOncePredecessorFinishes() {
            Task predecessor = engine.createTaskAt(project.projectId(), "Schema", "Review");
            Task successor = engine.createTaskAt(project.projectId(), "API", "Build");
            engine.board.addDependency(predecessor.taskId(), successor.taskId());

            fixture.cycle();
            assertThat(launcher.invocations()).isEmpty();
            assertEquals(1.0, decisions(DispatchDecision.BLOCKED));

            engine.board.moveTask(predecessor.taskId(), "Done");
            fixture.cycle();

            assertThat(launcher.invocations()).extracting(WorkerInvocation::taskId)
                .containsExactly(successor.taskId());
        }

        @Test
        void milestoneChildren_shouldWaitForPlanApproval() {
            Task milestone = engine.board.createTask(project.projectId(),
                NewTask.of("Auth epic", "All auth work").ofKind(TaskKind.MILESTONE));
            List<Task> children = engine.board.createSubtasks(milestone.taskId(), List.of(
                NewSubtask.of("Login", "login form"),
                NewSubtask.of("Logout", "logout button")));
            assertThat(children).allSatisfy(child ->
                assertEquals("Build", engine.workflowCatalog.step(project.projectId(), child.stepId()).name()));

            fixture.cycle();
            assertThat(launcher.invocations()).isEmpty();
            assertEquals(2.0, decisions(DispatchDecision.AWAITING_PLAN_APPROVAL));

            engine.board.approvePlan(milestone.taskId());
            fixture.cycle();

            assertThat(launcher.invocations()).extracting(WorkerInvocation::taskId)
                .containsExactlyInAnyOrder(children.get(0).taskId(), children.get(1).taskId());
        }

        @Test
        void shuttingDown_shouldStopAdmitting() {
            engine.createTaskAt(project.projectId(), "T", "Build");
            fixture.shutdownHandler.shutdown();

            assertEquals(0, fixture.cycle());
            assertThat(launcher.invocations()).isEmpty();
            assertThat(pendingDispatch()).isNotEmpty();
        }
    }

    @Nested
    class Supervision {

        @Test
        void fullLifecycle_planBuildReviewDone() {
            Task task = engine.createTaskAt(project.projectId(), "Feature", "Plan");
            fixture.cycle();
            assertThat(launcher.invocations()).isEmpty();

            engine.board.moveTask(task.taskId(), "Build");
            fixture.cycle();
            FakeWorker worker = workerFor(task.taskId());
            Path workspace = launcher.lastInvocation().workspacePath();

            worker.reportSession("sess-1");
            assertEquals("sess-1", engine.reload(task.taskId()).sessionId());
            assertTrue(activeRun(task.taskId()).isActive());

            engine.board.moveTask(task.taskId(), "Review");
            worker.succeed();

            List<AgentRun> runs = engine.board.getRuns(task.taskId());
            assertThat(runs).hasSize(1);
            assertEquals(0, runs.get(0).exitCode());
            assertThat(engine.events(task.taskId(), EventType.RUN_COMPLETED)).hasSize(1);
            assertEquals(workspace.toString(), engine.reload(task.taskId()).workspacePath());
            assertEquals(0, fixture.shutdownHandler.getActiveRunCount());

            fixture.cycle();
            engine.board.moveTask(task.taskId(), "Done");
            fixture.cycle();

            Task done = engine.reload(task.taskId());
            assertFalse(done.hasWorkspace());
            assertNull(done.sessionId());
            assertThat(engine.worktrees.worktrees()).doesNotContainKey(workspace);
            assertThat(engine.worktrees.deletedBranches()).hasSize(1);
        }

        @Test
        void workerCompletingTask_shouldTearDownOnExit() {
            Task task = engine.createTaskAt(project.projectId(), "T", "Build");
            fixture.cycle();
            FakeWorker worker = workerFor(task.taskId());

            engine.board.completeTask(task.taskId());
            fixture.cycle();
            assertTrue(engine.reload(task.taskId()).hasWorkspace(), "teardown waits for the worker");

            worker.succeed();

            assertFalse(engine.reload(task.taskId()).hasWorkspace());
        }

        @Test
        void cancelWhileRunning_shouldDeferTeardownToExit() {
            Task task = engine.createTaskAt(project.projectId(), "T", "Build");
            fixture.cycle();
            FakeWorker worker = workerFor(task.taskId());

            engine.board.cancelTask(task.taskId());
            fixture.cycle();
            assertTrue(engine.reload(task.taskId()).hasWorkspace());
            assertEquals(1.0, decisions(DispatchDecision.CLEANUP));

            worker.finish(143, "terminated");

            assertFalse(engine.reload(task.taskId()).hasWorkspace());
            AgentRun run = engine.board.getRuns(task.taskId()).get(0);
            assertEquals(143, run.exitCode());
        }

        @Test
        void redispatch_shouldResumeStoredSession() {
            Task task = engine.createTaskAt(project.projectId(), "T", "Build");
            fixture.cycle();
            FakeWorker first = workerFor(task.taskId());
            first.reportSession("sess-9");
            first.finish(1, "tests failed");

            engine.board.moveTask(task.taskId(), "Plan");
            engine.board.moveTask(task.taskId(), "Build");
            fixture.cycle();

            assertThat(launcher.invocations()).hasSize(2);
            assertEquals("sess-9", launcher.lastInvocation().sessionId());
            assertEquals(launcher.invocations().get(0).workspacePath(), launcher.lastInvocation().workspacePath());
        }

        @Test
        void launchFailure_shouldFailRunWithMinusOne() {
            launcher.failWith(new WorkerLaunchException(UUID.randomUUID(), "cannot start 'claude'"));
            Task task = engine.createTaskAt(project.projectId(), "T", "Build");

            fixture.cycle();

            AgentRun run = engine.board.getRuns(task.taskId()).get(0);
            assertFalse(run.isActive());
            assertEquals(AgentRun.LAUNCH_FAILURE_EXIT_CODE, run.exitCode());
            assertThat(run.error()).contains("cannot start");
            assertEquals("Build", engine.workflowCatalog.step(project.projectId(),
                engine.reload(task.taskId()).stepId()).name());
            assertEquals(0, fixture.shutdownHandler.getActiveRunCount());
        }

        @Test
        void launchFailureAfterTaskCompleted_shouldStillTearDown() {
            Task task = engine.createTaskAt(project.projectId(), "T", "Build");
            launcher.beforeLaunch(invocation -> engine.board.completeTask(invocation.taskId()));
            launcher.failWith(new WorkerLaunchException(UUID.randomUUID(), "cannot start 'claude'"));

            fixture.cycle();

            AgentRun run = engine.board.getRuns(task.taskId()).get(0);
            assertEquals(AgentRun.LAUNCH_FAILURE_EXIT_CODE, run.exitCode());
            Task stored = engine.reload(task.taskId());
            assertEquals("Done", engine.workflowCatalog.step(project.projectId(), stored.stepId()).name());
            assertFalse(stored.hasWorkspace());
            assertThat(engine.worktrees.worktrees()).isEmpty();
            assertEquals(0, fixture.shutdownHandler.getActiveRunCount());
        }

        @Test
        void workspaceFailure_shouldFailRun() {
            engine.worktrees.failCreateWith("fatal: invalid reference: main");
            Task task = engine.createTaskAt(project.projectId(), "T", "Build");

            fixture.cycle();

            assertThat(launcher.invocations()).isEmpty();
            AgentRun run = engine.board.getRuns(task.taskId()).get(0);
            assertEquals(AgentRun.LAUNCH_FAILURE_EXIT_CODE, run.exitCode());
            assertThat(run.error()).contains("invalid reference");
        }

        @Test
        void lastChildFinishing_shouldCreateSynchronizationTask() {
            Task parent = engine.createTaskAt(project.projectId(), "Parent", "Build");
            fixture.cycle();
            workerFor(parent.taskId()).succeed();

            List<Task> children = engine.board.createSubtasks(parent.taskId(), List.of(
                new NewSubtask("One", "first", TaskKind.UNIT, "Build", List.of()),
                new NewSubtask("Two", "second", TaskKind.UNIT, "Build", List.of())));
            fixture.cycle();

            for (Task child : children) {
                FakeWorker worker = workerFor(child.taskId());
                engine.board.completeTask(child.taskId());
                worker.succeed();
            }

            assertThat(engine.taskRepository.findSynchronizationTask(parent.taskId())).isPresent();
            fixture.cycle();
            Task sync = engine.taskRepository.findSynchronizationTask(parent.taskId()).orElseThrow();
            assertThat(launcher.invocations()).extracting(WorkerInvocation::taskId).contains(sync.taskId());
        }
    }
}
