package com.taskrelay.engine.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskrelay.core.model.ConsumerClass;
import com.taskrelay.core.model.Event;
import com.taskrelay.core.model.EventType;
import com.taskrelay.core.model.NewTask;
import com.taskrelay.core.model.Project;
import com.taskrelay.core.model.StepDefinition;
import com.taskrelay.core.model.Task;
import com.taskrelay.core.model.WorkerRole;
import com.taskrelay.engine.coordinator.BoardCoordinator;
import com.taskrelay.engine.fanin.FanInSynchronizer;
import com.taskrelay.engine.graph.DependencyGraph;
import com.taskrelay.engine.metrics.RelayMetrics;
import com.taskrelay.engine.outbox.EventOutbox;
import com.taskrelay.engine.outbox.EventPayloads;
import com.taskrelay.engine.persistence.jdbc.JdbcAgentRunRepository;
import com.taskrelay.engine.persistence.jdbc.JdbcCommentRepository;
import com.taskrelay.engine.persistence.jdbc.JdbcDependencyRepository;
import com.taskrelay.engine.persistence.jdbc.JdbcEventRepository;
import com.taskrelay.engine.persistence.jdbc.JdbcProjectRepository;
import com.taskrelay.engine.persistence.jdbc.JdbcTaskRepository;
import com.taskrelay.engine.persistence.jdbc.JdbcWorkflowStepRepository;
import com.taskrelay.engine.run.RunRecorder;
import com.taskrelay.engine.workflow.WorkflowCatalog;
import com.taskrelay.engine.workspace.WorkspaceManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

/**
 * The engine wired by hand over a fresh H2 store, without a Spring context.
 * Worktree operations are faked; time is controlled.
 */
public class EngineFixture {

    public static final List<StepDefinition> PLAN_BUILD_REVIEW_DONE = List.of(
        StepDefinition.manual("Plan"),
        StepDefinition.dispatch("Build", WorkerRole.CODER),
        StepDefinition.manual("Review"),
        StepDefinition.manual("Done")
    );

    public final DataSource dataSource;
    public final JdbcTemplate jdbcTemplate;
    public final TransactionTemplate transactionTemplate;
    public final ObjectMapper objectMapper = new ObjectMapper();
    public final TimeController clock;
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final RelayMetrics metrics = new RelayMetrics();

    public final JdbcProjectRepository projectRepository;
    public final JdbcWorkflowStepRepository stepRepository;
    public final JdbcTaskRepository taskRepository;
    public final JdbcDependencyRepository dependencyRepository;
    public final JdbcCommentRepository commentRepository;
    public final JdbcAgentRunRepository runRepository;
    public final JdbcEventRepository eventRepository;

    public final WorkflowCatalog workflowCatalog;
    public final DependencyGraph dependencyGraph;
    public final EventOutbox outbox;
    public final EventPayloads payloads;
    public final FanInSynchronizer fanInSynchronizer;
    public final BoardCoordinator board;
    public final RunRecorder runRecorder;

    public final Path repoPath;
    public final Path worktreesPath;
    public final FakeWorktreeOperations worktrees = new FakeWorktreeOperations();
    public final WorkspaceManager workspaceManager;

    public EngineFixture() {
        this(TimeController.frozen());
    }

    public EngineFixture(TimeController clock) {
        this.clock = clock;
        this.dataSource = TestDatabase.create();
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        metrics.bindTo(meterRegistry);

        projectRepository = new JdbcProjectRepository(jdbcTemplate);
        stepRepository = new JdbcWorkflowStepRepository(jdbcTemplate);
        taskRepository = new JdbcTaskRepository(jdbcTemplate);
        dependencyRepository = new JdbcDependencyRepository(jdbcTemplate);
        commentRepository = new JdbcCommentRepository(jdbcTemplate);
        runRepository = new JdbcAgentRunRepository(jdbcTemplate);
        eventRepository = new JdbcEventRepository(jdbcTemplate, objectMapper);

        workflowCatalog = new WorkflowCatalog(stepRepository);
        dependencyGraph = new DependencyGraph(dependencyRepository, taskRepository, workflowCatalog);
        outbox = new EventOutbox(eventRepository);
        payloads = new EventPayloads(objectMapper);
        fanInSynchronizer = new FanInSynchronizer(taskRepository, workflowCatalog, outbox, payloads, metrics);
        board = new BoardCoordinator(projectRepository, stepRepository, taskRepository, dependencyRepository,
            commentRepository, runRepository, workflowCatalog, dependencyGraph, fanInSynchronizer,
            outbox, payloads, transactionTemplate);
        runRecorder = new RunRecorder(runRepository, taskRepository, workflowCatalog, outbox, payloads,
            metrics, transactionTemplate, clock);

        try {
            repoPath = Files.createTempDirectory("relay-repo");
            worktreesPath = Files.createTempDirectory("relay-worktrees");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        workspaceManager = new WorkspaceManager(worktrees, board, workflowCatalog, metrics, clock,
            repoPath, worktreesPath, "main");
    }

    // ========== Board helpers ==========

    public Project createProject(List<StepDefinition> steps) {
        return board.createProject("Project " + UUID.randomUUID().toString().substring(0, 6), "test project", steps);
    }

    /**
     * Project with steps [Plan, Build (coder), Review, Done].
     */
    public Project createStandardProject() {
        return createProject(PLAN_BUILD_REVIEW_DONE);
    }

    public Task createTask(UUID projectId, String title) {
        return board.createTask(projectId, NewTask.of(title, "Description of " + title));
    }

    public Task createTaskAt(UUID projectId, String title, String stepName) {
        return board.createTask(projectId, NewTask.of(title, "Description of " + title).atStep(stepName));
    }

    public Task reload(UUID taskId) {
        return board.getTask(taskId);
    }

    // ========== Outbox helpers ==========

    public List<Event> unconsumed(ConsumerClass consumer) {
        return outbox.pollUnconsumed(consumer, 1000);
    }

    public List<Event> events(UUID taskId, EventType type) {
        return outbox.history(taskId).stream()
            .filter(e -> e.type() == type)
            .toList();
    }

    /**
     * Mark everything recorded so far as consumed by the given consumer.
     */
    public void consumeAll(ConsumerClass consumer) {
        for (Event event : unconsumed(consumer)) {
            outbox.markConsumed(event.eventId(), consumer);
        }
    }

    public int countTasks(UUID projectId) {
        return board.listTasks(projectId).size();
    }
}
