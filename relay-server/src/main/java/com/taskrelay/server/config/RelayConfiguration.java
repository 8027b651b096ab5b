package com.taskrelay.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskrelay.core.model.WorkerRole;
import com.taskrelay.core.repository.AgentRunRepository;
import com.taskrelay.core.repository.TaskRepository;
import com.taskrelay.dispatch.DispatchAdmission;
import com.taskrelay.dispatch.DispatchLoop;
import com.taskrelay.dispatch.WorkerSupervisor;
import com.taskrelay.engine.graph.DependencyGraph;
import com.taskrelay.engine.lifecycle.GracefulShutdownHandler;
import com.taskrelay.engine.metrics.RelayMetrics;
import com.taskrelay.engine.outbox.BoardBroadcaster;
import com.taskrelay.engine.outbox.BroadcastRelay;
import com.taskrelay.engine.outbox.EventOutbox;
import com.taskrelay.engine.outbox.LoggingBoardBroadcaster;
import com.taskrelay.engine.run.RunRecorder;
import com.taskrelay.engine.service.BoardService;
import com.taskrelay.engine.workflow.WorkflowCatalog;
import com.taskrelay.engine.workspace.GitWorktreeOperations;
import com.taskrelay.engine.workspace.WorkspaceManager;
import com.taskrelay.engine.workspace.WorktreeOperations;
import com.taskrelay.recovery.RecoveryEngine;
import com.taskrelay.worker.WorkerLauncher;
import com.taskrelay.worker.WorkerModels;
import com.taskrelay.worker.WorkerProcessRegistry;
import com.taskrelay.worker.context.ContextAssembler;
import com.taskrelay.worker.process.ProcessWorkerLauncher;
import com.taskrelay.worker.process.StreamMessages;
import com.taskrelay.worker.process.WorkerCommand;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the workspace, worker, dispatch and recovery components from {@link RelayProperties}.
 * Starting and stopping the loops is left to {@link RelayLifecycle}.
 */
@Configuration
public class RelayConfiguration {

    // ========== Workspace ==========

    @Bean
    @ConditionalOnMissingBean
    public WorktreeOperations worktreeOperations(RelayProperties properties) {
        return new GitWorktreeOperations(properties.getWorkspace().getGitExecutable());
    }

    @Bean
    public WorkspaceManager workspaceManager(
            WorktreeOperations worktreeOperations,
            BoardService boardService,
            WorkflowCatalog workflowCatalog,
            RelayMetrics metrics,
            Clock clock,
            RelayProperties properties) {
        RelayProperties.Workspace workspace = properties.getWorkspace();
        return new WorkspaceManager(worktreeOperations, boardService, workflowCatalog, metrics, clock,
            workspace.getRepoPath().toAbsolutePath().normalize(),
            workspace.getWorktreesPath().toAbsolutePath().normalize(),
            workspace.getBaseBranch());
    }

    // ========== Broadcast ==========

    @Bean
    @ConditionalOnMissingBean
    public BoardBroadcaster boardBroadcaster() {
        return new LoggingBoardBroadcaster();
    }

    @Bean
    public BroadcastRelay broadcastRelay(
            EventOutbox outbox,
            BoardBroadcaster broadcaster,
            RelayMetrics metrics,
            RelayProperties properties) {
        RelayProperties.Broadcast broadcast = properties.getBroadcast();
        return new BroadcastRelay(outbox, broadcaster, metrics, broadcast.getInterval(), broadcast.getBatchSize());
    }

    // ========== Workers ==========

    @Bean
    @ConditionalOnMissingBean
    public WorkerLauncher workerLauncher(ObjectMapper objectMapper, RelayProperties properties) {
        RelayProperties.Worker worker = properties.getWorker();
        return new ProcessWorkerLauncher(
            new WorkerCommand(worker.getExecutable(), worker.getExtraArgs()),
            new StreamMessages(objectMapper));
    }

    @Bean
    public WorkerProcessRegistry workerProcessRegistry() {
        return new WorkerProcessRegistry();
    }

    @Bean
    public ContextAssembler contextAssembler() {
        return new ContextAssembler();
    }

    @Bean
    public WorkerModels workerModels(RelayProperties properties) {
        RelayProperties.Worker worker = properties.getWorker();
        Map<WorkerRole, String> roleModels = new EnumMap<>(WorkerRole.class);
        worker.getRoles().forEach((role, settings) -> {
            if (settings.getModel() != null && !settings.getModel().isBlank()) {
                roleModels.put(WorkerRole.fromWireName(role), settings.getModel());
            }
        });
        return new WorkerModels(worker.getDefaultModel(), roleModels);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService supervisorExecutor(RelayProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.getWorker().getSupervisorThreads(), runnable -> {
            Thread thread = new Thread(runnable, "worker-supervisor-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public WorkerSupervisor workerSupervisor(
            BoardService boardService,
            WorkflowCatalog workflowCatalog,
            RunRecorder runRecorder,
            WorkspaceManager workspaceManager,
            ContextAssembler contextAssembler,
            WorkerLauncher workerLauncher,
            WorkerModels workerModels,
            WorkerProcessRegistry registry,
            GracefulShutdownHandler shutdownHandler,
            ExecutorService supervisorExecutor) {
        return new WorkerSupervisor(boardService, workflowCatalog, runRecorder, workspaceManager,
            contextAssembler, workerLauncher, workerModels, registry, shutdownHandler, supervisorExecutor);
    }

    // ========== Dispatch ==========

    @Bean
    public DispatchAdmission dispatchAdmission(
            TaskRepository taskRepository,
            AgentRunRepository runRepository,
            WorkflowCatalog workflowCatalog,
            DependencyGraph dependencyGraph,
            RunRecorder runRecorder,
            EventOutbox outbox,
            TransactionTemplate transactionTemplate,
            RelayProperties properties) {
        return new DispatchAdmission(taskRepository, runRepository, workflowCatalog, dependencyGraph,
            runRecorder, outbox, transactionTemplate, properties.getDispatch().getMaxParallelAgents());
    }

    @Bean
    public DispatchLoop dispatchLoop(
            EventOutbox outbox,
            DispatchAdmission admission,
            WorkerSupervisor supervisor,
            RunRecorder runRecorder,
            GracefulShutdownHandler shutdownHandler,
            RelayMetrics metrics,
            RelayProperties properties) {
        RelayProperties.Dispatch dispatch = properties.getDispatch();
        return new DispatchLoop(outbox, admission, supervisor, runRecorder, shutdownHandler, metrics,
            dispatch.getInterval(), dispatch.getBatchSize());
    }

    // ========== Recovery ==========

    @Bean
    public RecoveryEngine recoveryEngine(
            RunRecorder runRecorder,
            TaskRepository taskRepository,
            WorkflowCatalog workflowCatalog,
            WorkspaceManager workspaceManager,
            WorkerProcessRegistry registry,
            Clock clock,
            RelayProperties properties) {
        RelayProperties.Watchdog watchdog = properties.getWatchdog();
        return new RecoveryEngine(runRecorder, taskRepository, workflowCatalog, workspaceManager, registry, clock,
            watchdog.isEnabled(), watchdog.getRunTimeout(), watchdog.getCheckInterval());
    }
}
