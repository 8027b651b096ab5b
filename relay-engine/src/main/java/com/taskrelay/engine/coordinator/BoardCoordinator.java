package com.taskrelay.engine.coordinator;

import com.taskrelay.core.exception.BoardValidationException;
import com.taskrelay.core.exception.CycleDetectedException;
import com.taskrelay.core.exception.DuplicateDependencyException;
import com.taskrelay.core.exception.InvalidTransitionException;
import com.taskrelay.core.exception.NotFoundException;
import com.taskrelay.core.exception.SelfDependencyException;
import com.taskrelay.core.model.AgentRun;
import com.taskrelay.core.model.AuthorRole;
import com.taskrelay.core.model.Comment;
import com.taskrelay.core.model.Dependency;
import com.taskrelay.core.model.EventType;
import com.taskrelay.core.model.NewSubtask;
import com.taskrelay.core.model.NewTask;
import com.taskrelay.core.model.Project;
import com.taskrelay.core.model.ProjectStatus;
import com.taskrelay.core.model.StepDefinition;
import com.taskrelay.core.model.Task;
import com.taskrelay.core.model.Workflow;
import com.taskrelay.core.model.WorkflowStep;
import com.taskrelay.core.repository.AgentRunRepository;
import com.taskrelay.core.repository.CommentRepository;
import com.taskrelay.core.repository.DependencyRepository;
import com.taskrelay.core.repository.ProjectRepository;
import com.taskrelay.core.repository.TaskRepository;
import com.taskrelay.core.repository.WorkflowStepRepository;
import com.taskrelay.engine.fanin.FanInSynchronizer;
import com.taskrelay.engine.graph.DependencyGraph;
import com.taskrelay.engine.outbox.EventOutbox;
import com.taskrelay.engine.outbox.EventPayloads;
import com.taskrelay.engine.service.BoardService;
import com.taskrelay.engine.workflow.WorkflowCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Coordinator for all board mutations.
 *
 * Each public mutation runs in one transaction that also appends its events to the
 * outbox. Task rows are locked before they are changed, so concurrent writers on the
 * same task serialize. Reaching the terminal step (or being cancelled) settles a task:
 * ready successors get a task_ready event and the parent's fan-in check runs, all in
 * the same transaction.
 */
@Service
public class BoardCoordinator implements BoardService {

    private static final Logger log = LoggerFactory.getLogger(BoardCoordinator.class);

    private final ProjectRepository projectRepository;
    private final WorkflowStepRepository stepRepository;
    private final TaskRepository taskRepository;
    private final DependencyRepository dependencyRepository;
    private final CommentRepository commentRepository;
    private final AgentRunRepository runRepository;
    private final WorkflowCatalog workflowCatalog;
    private final DependencyGraph dependencyGraph;
    private final FanInSynchronizer fanInSynchronizer;
    private final EventOutbox outbox;
    private final EventPayloads payloads;
    private final TransactionTemplate transactionTemplate;

    public BoardCoordinator(
            ProjectRepository projectRepository,
            WorkflowStepRepository stepRepository,
            TaskRepository taskRepository,
            DependencyRepository dependencyRepository,
            CommentRepository commentRepository,
            AgentRunRepository runRepository,
            WorkflowCatalog workflowCatalog,
            DependencyGraph dependencyGraph,
            FanInSynchronizer fanInSynchronizer,
            EventOutbox outbox,
            EventPayloads payloads,
            TransactionTemplate transactionTemplate) {
        this.projectRepository = projectRepository;
        this.stepRepository = stepRepository;
        this.taskRepository = taskRepository;
        this.dependencyRepository = dependencyRepository;
        this.commentRepository = commentRepository;
        this.runRepository = runRepository;
        this.workflowCatalog = workflowCatalog;
        this.dependencyGraph = dependencyGraph;
        this.fanInSynchronizer = fanInSynchronizer;
        this.outbox = outbox;
        this.payloads = payloads;
        this.transactionTemplate = transactionTemplate;
    }

    // ========== Projects ==========

    @Override
    public Project createProject(String title, String description, List<StepDefinition> steps) {
        validateProject(title, steps);

        return inTransaction(() -> {
            Project project = Project.create(title, description);
            projectRepository.save(project);

            List<WorkflowStep> workflowSteps = new ArrayList<>();
            for (int i = 0; i < steps.size(); i++) {
                workflowSteps.add(WorkflowStep.create(project.projectId(), i, steps.get(i)));
            }
            stepRepository.saveAll(workflowSteps);

            Workflow workflow = new Workflow(project.projectId(), workflowSteps);
            outbox.record(EventType.PROJECT_CREATED, project.projectId(), null,
                payloads.project(project, workflow));

            log.info("Created project {} '{}' with {} steps", project.projectId(), title, steps.size());
            return project;
        });
    }

    @Override
    public Project cancelProject(UUID projectId) {
        return inTransaction(() -> {
            Project project = requireProject(projectId);
            if (!project.status().canTransitionTo(ProjectStatus.CANCELLED)) {
                throw new BoardValidationException("Project " + projectId + " is already cancelled");
            }
            Project cancelled = project.withStatus(ProjectStatus.CANCELLED);
            projectRepository.update(cancelled);
            outbox.record(EventType.PROJECT_CANCELLED, projectId, null, payloads.project(cancelled, null));

            log.info("Cancelled project {}", projectId);
            return cancelled;
        });
    }

    @Override
    public Project getProject(UUID projectId) {
        return requireProject(projectId);
    }

    @Override
    public List<Project> listProjects() {
        return projectRepository.findAll();
    }

    @Override
    public Workflow getWorkflow(UUID projectId) {
        requireProject(projectId);
        return workflowCatalog.get(projectId);
    }

    // ========== Tasks ==========

    @Override
    public Task createTask(UUID projectId, NewTask request) {
        requireTitle(request.title());

        return inTransaction(() -> {
            requireActiveProject(projectId);
            Workflow workflow = workflowCatalog.get(projectId);
            WorkflowStep step = request.stepName() != null
                ? requireStep(workflow, request.stepName())
                : workflow.first();

            if (request.parentTaskId() != null) {
                Task parent = requireTask(request.parentTaskId());
                if (!parent.projectId().equals(projectId)) {
                    throw new BoardValidationException(
                        "Parent task " + parent.taskId() + " belongs to another project");
                }
            }

            Task task = Task.create(projectId, request.parentTaskId(), request.title(),
                request.description(), request.kind(), step.stepId());
            taskRepository.save(task);
            outbox.record(EventType.TASK_CREATED, projectId, task.taskId(), payloads.task(task, step));

            log.info("Created task {} '{}' at step {}", task.taskId(), task.title(), step.name());
            return task;
        });
    }

    @Override
    public List<Task> createSubtasks(UUID parentTaskId, List<NewSubtask> subtasks) {
        validateSubtasks(subtasks);

        return inTransaction(() -> {
            Task parent = requireTask(parentTaskId);
            requireActiveProject(parent.projectId());
            Workflow workflow = workflowCatalog.get(parent.projectId());
            WorkflowStep defaultStep = defaultSubtaskStep(workflow, parent);

            List<Task> created = new ArrayList<>();
            List<WorkflowStep> createdSteps = new ArrayList<>();
            for (NewSubtask subtask : subtasks) {
                WorkflowStep step = subtask.stepName() != null
                    ? requireStep(workflow, subtask.stepName())
                    : defaultStep;
                Task task = Task.create(parent.projectId(), parentTaskId, subtask.title(),
                    subtask.description(), subtask.kind(), step.stepId());
                taskRepository.save(task);
                created.add(task);
                createdSteps.add(step);
            }

            // Edges go in before the creation events so the dispatcher already sees them blocked
            for (int i = 0; i < subtasks.size(); i++) {
                Task successor = created.get(i);
                for (int index : new LinkedHashSet<>(subtasks.get(i).dependsOn())) {
                    Task predecessor = created.get(index);
                    if (dependencyGraph.wouldCreateCycle(predecessor.taskId(), successor.taskId())) {
                        throw new CycleDetectedException(predecessor.taskId(), successor.taskId());
                    }
                    dependencyRepository.save(Dependency.create(predecessor.taskId(), successor.taskId()));
                    outbox.record(EventType.DEPENDENCY_CREATED, parent.projectId(), successor.taskId(),
                        payloads.dependency(predecessor, successor));
                }
            }

            for (int i = 0; i < created.size(); i++) {
                Task task = created.get(i);
                outbox.record(EventType.TASK_CREATED, task.projectId(), task.taskId(),
                    payloads.task(task, createdSteps.get(i)));
            }

            log.info("Created {} subtasks under task {}", created.size(), parentTaskId);
            return created;
        });
    }

    @Override
    public Task moveTask(UUID taskId, String targetStepName) {
        return inTransaction(() -> {
            Task task = lockTask(taskId);
            Workflow workflow = workflowCatalog.get(task.projectId());
            WorkflowStep from = stepOf(workflow, task);
            WorkflowStep to = requireStep(workflow, targetStepName);

            if (task.cancelled()) {
                throw new InvalidTransitionException(taskId.toString(), from.name(), "task is cancelled");
            }
            if (!workflow.canTransition(from, to)) {
                throw new InvalidTransitionException(taskId.toString(), from.name(), to.name(),
                    workflow.validTargets(from).stream().map(WorkflowStep::name).toList());
            }

            return applyMove(task, workflow, from, to);
        });
    }

    @Override
    public Task completeTask(UUID taskId) {
        return inTransaction(() -> {
            Task task = lockTask(taskId);
            Workflow workflow = workflowCatalog.get(task.projectId());
            WorkflowStep from = stepOf(workflow, task);

            if (task.cancelled()) {
                throw new InvalidTransitionException(taskId.toString(), from.name(), "task is cancelled");
            }
            if (workflow.isTerminal(from.stepId())) {
                throw new InvalidTransitionException(taskId.toString(), from.name(),
                    "task is already at the terminal step");
            }

            return applyMove(task, workflow, from, workflow.terminal());
        });
    }

    @Override
    public Task cancelTask(UUID taskId) {
        return inTransaction(() -> {
            Task task = lockTask(taskId);
            Workflow workflow = workflowCatalog.get(task.projectId());
            WorkflowStep step = stepOf(workflow, task);

            if (task.cancelled()) {
                throw new InvalidTransitionException(taskId.toString(), step.name(), "task is already cancelled");
            }
            if (workflow.isTerminal(step.stepId())) {
                throw new InvalidTransitionException(taskId.toString(), step.name(),
                    "a task at the terminal step cannot be cancelled");
            }

            Task cancelled = task.withCancelled(true);
            taskRepository.update(cancelled);
            outbox.record(EventType.TASK_CANCELLED, cancelled.projectId(), taskId, payloads.task(cancelled, step));
            log.info("Cancelled task {} at step {}", taskId, step.name());

            onSettled(cancelled);
            return cancelled;
        });
    }

    @Override
    public Task uncancelTask(UUID taskId) {
        return inTransaction(() -> {
            Task task = lockTask(taskId);
            WorkflowStep step = workflowCatalog.step(task.projectId(), task.stepId());

            if (!task.cancelled()) {
                throw new InvalidTransitionException(taskId.toString(), step.name(), "task is not cancelled");
            }

            Task restored = task.withCancelled(false);
            taskRepository.update(restored);
            outbox.record(EventType.TASK_UNCANCELLED, restored.projectId(), taskId, payloads.task(restored, step));

            log.info("Restored task {} at step {}", taskId, step.name());
            return restored;
        });
    }

    @Override
    public Task approvePlan(UUID milestoneTaskId) {
        return inTransaction(() -> {
            Task milestone = lockTask(milestoneTaskId);
            if (!milestone.isMilestone()) {
                throw new BoardValidationException("Task " + milestoneTaskId + " is not a milestone");
            }
            if (milestone.planApproved()) {
                throw new BoardValidationException("Plan of task " + milestoneTaskId + " is already approved");
            }
            List<Task> children = taskRepository.findChildren(milestoneTaskId).stream()
                .filter(t -> !t.cancelled() && !t.isSynchronization())
                .toList();
            if (children.isEmpty()) {
                throw new BoardValidationException("Milestone " + milestoneTaskId + " has no subtasks to approve");
            }

            Task approved = milestone.withPlanApproved();
            taskRepository.update(approved);
            WorkflowStep step = workflowCatalog.step(approved.projectId(), approved.stepId());
            outbox.record(EventType.PLAN_APPROVED, approved.projectId(), milestoneTaskId,
                payloads.task(approved, step));

            int ready = 0;
            for (Task child : children) {
                if (dependencyGraph.isReady(child)) {
                    emitReady(child);
                    ready++;
                }
            }

            log.info("Approved plan of milestone {}: {} of {} children ready", milestoneTaskId, ready, children.size());
            return approved;
        });
    }

    @Override
    public Task setTaskOutput(UUID taskId, String output) {
        return inTransaction(() -> {
            Task task = lockTask(taskId).withOutput(output);
            taskRepository.update(task);
            emitUpdated(task);
            return task;
        });
    }

    @Override
    public Task getTask(UUID taskId) {
        return requireTask(taskId);
    }

    @Override
    public List<Task> listTasks(UUID projectId) {
        requireProject(projectId);
        return taskRepository.findByProject(projectId);
    }

    @Override
    public List<Task> listChildren(UUID parentTaskId) {
        requireTask(parentTaskId);
        return taskRepository.findChildren(parentTaskId);
    }

    // ========== Comments ==========

    @Override
    public Comment addComment(UUID taskId, AuthorRole authorRole, String content) {
        if (authorRole == null) {
            throw new BoardValidationException("Comment author role is required");
        }
        if (content == null || content.isBlank()) {
            throw new BoardValidationException("Comment content must not be empty");
        }

        return inTransaction(() -> {
            Task task = requireTask(taskId);
            Comment comment = Comment.create(taskId, authorRole, content);
            commentRepository.append(comment);
            outbox.record(EventType.COMMENT_ADDED, task.projectId(), taskId, payloads.comment(comment));

            log.debug("Comment {} added to task {} by {}", comment.commentId(), taskId, authorRole.wireName());
            return comment;
        });
    }

    @Override
    public List<Comment> getComments(UUID taskId) {
        requireTask(taskId);
        return commentRepository.findByTask(taskId);
    }

    // ========== Dependencies ==========

    @Override
    public void addDependency(UUID predecessorId, UUID successorId) {
        if (predecessorId.equals(successorId)) {
            throw new SelfDependencyException(predecessorId);
        }

        inTransaction(() -> {
            Task predecessor = requireTask(predecessorId);
            Task successor = requireTask(successorId);
            if (!predecessor.projectId().equals(successor.projectId())) {
                throw new BoardValidationException("Dependencies must stay within one project");
            }
            if (dependencyRepository.exists(predecessorId, successorId)) {
                throw new DuplicateDependencyException(predecessorId, successorId);
            }
            if (dependencyGraph.wouldCreateCycle(predecessorId, successorId)) {
                throw new CycleDetectedException(predecessorId, successorId);
            }

            dependencyRepository.save(Dependency.create(predecessorId, successorId));
            outbox.record(EventType.DEPENDENCY_CREATED, successor.projectId(), successorId,
                payloads.dependency(predecessor, successor));

            log.info("Task {} now depends on {}", successorId, predecessorId);
            return null;
        });
    }

    @Override
    public void removeDependency(UUID predecessorId, UUID successorId) {
        inTransaction(() -> {
            if (!dependencyRepository.delete(predecessorId, successorId)) {
                return null;
            }
            Task predecessor = requireTask(predecessorId);
            Task successor = requireTask(successorId);
            outbox.record(EventType.DEPENDENCY_REMOVED, successor.projectId(), successorId,
                payloads.dependency(predecessor, successor));
            if (dependencyGraph.isReady(successor)) {
                emitReady(successor);
            }

            log.info("Removed dependency {} -> {}", predecessorId, successorId);
            return null;
        });
    }

    @Override
    public List<Task> getPredecessors(UUID taskId) {
        requireTask(taskId);
        return dependencyRepository.findPredecessorIds(taskId).stream()
            .map(this::requireTask)
            .toList();
    }

    @Override
    public List<Task> getSuccessors(UUID taskId) {
        requireTask(taskId);
        return dependencyRepository.findSuccessorIds(taskId).stream()
            .map(this::requireTask)
            .toList();
    }

    @Override
    public boolean isBlocked(UUID taskId) {
        requireTask(taskId);
        return dependencyGraph.isBlocked(taskId);
    }

    // ========== Workspace and runs ==========

    @Override
    public Task attachWorkspace(UUID taskId, String workspacePath, String branch) {
        return inTransaction(() -> {
            Task task = lockTask(taskId).withWorkspace(workspacePath, branch);
            taskRepository.update(task);
            emitUpdated(task);
            return task;
        });
    }

    @Override
    public Task detachWorkspace(UUID taskId) {
        return inTransaction(() -> {
            Task task = lockTask(taskId).withoutWorkspace();
            taskRepository.update(task);
            emitUpdated(task);
            return task;
        });
    }

    @Override
    public void recordSession(UUID taskId, String sessionId) {
        inTransaction(() -> {
            Task task = lockTask(taskId);
            if (sessionId == null || sessionId.equals(task.sessionId())) {
                return null;
            }
            Task updated = task.withSessionId(sessionId);
            taskRepository.update(updated);
            emitUpdated(updated);
            log.info("Captured session {} for task {}", sessionId, taskId);
            return null;
        });
    }

    @Override
    public List<AgentRun> getRuns(UUID taskId) {
        requireTask(taskId);
        return runRepository.findByTask(taskId);
    }

    @Override
    public void synchronizeFanIn(UUID taskId) {
        inTransaction(() -> {
            Task task = requireTask(taskId);
            Workflow workflow = workflowCatalog.get(task.projectId());
            if (task.cancelled() || workflow.isTerminal(task.stepId())) {
                fanInSynchronizer.onChildSettled(task);
            }
            return null;
        });
    }

    // ========== Internal Methods ==========

    private Task applyMove(Task task, Workflow workflow, WorkflowStep from, WorkflowStep to) {
        Task moved = task.withStep(to.stepId());
        taskRepository.update(moved);
        outbox.record(EventType.TASK_MOVED, moved.projectId(), moved.taskId(), payloads.move(moved, from, to));
        log.info("Task {} moved from {} to {}", moved.taskId(), from.name(), to.name());

        if (workflow.isTerminal(to.stepId())) {
            onSettled(moved);
        }
        return moved;
    }

    /**
     * Side effects of a task finishing or being cancelled.
     */
    private void onSettled(Task task) {
        for (Task successor : dependencyGraph.readySuccessors(task.taskId())) {
            emitReady(successor);
        }
        fanInSynchronizer.onChildSettled(task);
    }

    private void emitReady(Task task) {
        WorkflowStep step = workflowCatalog.step(task.projectId(), task.stepId());
        outbox.record(EventType.TASK_READY, task.projectId(), task.taskId(), payloads.task(task, step));
        log.debug("Task {} is ready at step {}", task.taskId(), step.name());
    }

    private void emitUpdated(Task task) {
        WorkflowStep step = workflowCatalog.step(task.projectId(), task.stepId());
        outbox.record(EventType.TASK_UPDATED, task.projectId(), task.taskId(), payloads.task(task, step));
    }

    private WorkflowStep defaultSubtaskStep(Workflow workflow, Task parent) {
        WorkflowStep parentStep = stepOf(workflow, parent);
        if (!workflow.isTerminal(parentStep.stepId())) {
            return workflow.next(parentStep).orElseThrow();
        }
        return workflow.firstDispatchable().orElse(workflow.first());
    }

    private <T> T inTransaction(Supplier<T> work) {
        return transactionTemplate.execute(status -> work.get());
    }

    private Project requireProject(UUID projectId) {
        return projectRepository.findById(projectId)
            .orElseThrow(() -> new NotFoundException("Project", projectId.toString()));
    }

    private void requireActiveProject(UUID projectId) {
        if (!requireProject(projectId).isActive()) {
            throw new BoardValidationException("Project " + projectId + " is cancelled");
        }
    }

    private Task requireTask(UUID taskId) {
        return taskRepository.findById(taskId)
            .orElseThrow(() -> new NotFoundException("Task", taskId.toString()));
    }

    private Task lockTask(UUID taskId) {
        return taskRepository.findByIdForUpdate(taskId)
            .orElseThrow(() -> new NotFoundException("Task", taskId.toString()));
    }

    private WorkflowStep stepOf(Workflow workflow, Task task) {
        return workflow.findById(task.stepId())
            .orElseThrow(() -> new NotFoundException("WorkflowStep", task.stepId().toString()));
    }

    private static WorkflowStep requireStep(Workflow workflow, String name) {
        return workflow.findByName(name)
            .orElseThrow(() -> new NotFoundException("WorkflowStep", name));
    }

    private static void requireTitle(String title) {
        if (title == null || title.isBlank()) {
            throw new BoardValidationException("Task title must not be empty");
        }
    }

    private static void validateProject(String title, List<StepDefinition> steps) {
        List<String> errors = new ArrayList<>();
        if (title == null || title.isBlank()) {
            errors.add("project title must not be empty");
        }
        if (steps == null || steps.isEmpty()) {
            errors.add("a project needs at least one workflow step");
        } else {
            Set<String> names = new HashSet<>();
            for (StepDefinition step : steps) {
                if (step.name() == null || step.name().isBlank()) {
                    errors.add("step names must not be empty");
                } else if (!names.add(step.name())) {
                    errors.add("duplicate step name '" + step.name() + "'");
                }
                if (step.dispatchable() && step.role() == null) {
                    errors.add("dispatchable step '" + step.name() + "' must declare a worker role");
                }
            }
        }
        if (!errors.isEmpty()) {
            throw new BoardValidationException(errors);
        }
    }

    private static void validateSubtasks(List<NewSubtask> subtasks) {
        if (subtasks == null || subtasks.isEmpty()) {
            throw new BoardValidationException("At least one subtask is required");
        }
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < subtasks.size(); i++) {
            NewSubtask subtask = subtasks.get(i);
            if (subtask.title() == null || subtask.title().isBlank()) {
                errors.add("subtask " + i + " has no title");
            }
            for (int index : subtask.dependsOn()) {
                if (index == i) {
                    errors.add("subtask " + i + " depends on itself");
                } else if (index < 0 || index >= subtasks.size()) {
                    errors.add("subtask " + i + " depends on unknown index " + index);
                }
            }
        }
        if (!errors.isEmpty()) {
            throw new BoardValidationException(errors);
        }
    }
}
