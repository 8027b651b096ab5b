package com.taskrelay.engine.service;

import com.taskrelay.core.model.AgentRun;
import com.taskrelay.core.model.AuthorRole;
import com.taskrelay.core.model.Comment;
import com.taskrelay.core.model.NewSubtask;
import com.taskrelay.core.model.NewTask;
import com.taskrelay.core.model.Project;
import com.taskrelay.core.model.StepDefinition;
import com.taskrelay.core.model.Task;
import com.taskrelay.core.model.Workflow;

import java.util.List;
import java.util.UUID;

/**
 * Board operations for humans, workers and the transport layer.
 *
 * Every mutation commits together with the event(s) describing it, or not at all.
 */
public interface BoardService {

    // ========== Projects ==========

    /**
     * Create a project with its ordered workflow.
     *
     * @param title Project title
     * @param description Free text
     * @param steps Steps in position order
     * @return The created project
     * @throws com.taskrelay.core.exception.BoardValidationException if the steps are invalid
     */
    Project createProject(String title, String description, List<StepDefinition> steps);

    /**
     * Cancel a project. New tasks are rejected afterwards.
     */
    Project cancelProject(UUID projectId);

    Project getProject(UUID projectId);

    List<Project> listProjects();

    Workflow getWorkflow(UUID projectId);

    // ========== Tasks ==========

    Task createTask(UUID projectId, NewTask request);

    /**
     * Create a batch of children under a parent, with dependencies between them.
     *
     * @return The created tasks in request order
     */
    List<Task> createSubtasks(UUID parentTaskId, List<NewSubtask> subtasks);

    /**
     * Move a task one step forward or to any earlier step.
     *
     * @throws com.taskrelay.core.exception.InvalidTransitionException for any other target
     */
    Task moveTask(UUID taskId, String targetStepName);

    /**
     * Move a task straight to the terminal step. Used by workers to finish their task.
     */
    Task completeTask(UUID taskId);

    Task cancelTask(UUID taskId);

    Task uncancelTask(UUID taskId);

    /**
     * Approve a milestone's plan so its children may dispatch.
     */
    Task approvePlan(UUID milestoneTaskId);

    Task setTaskOutput(UUID taskId, String output);

    Task getTask(UUID taskId);

    List<Task> listTasks(UUID projectId);

    List<Task> listChildren(UUID parentTaskId);

    // ========== Comments ==========

    Comment addComment(UUID taskId, AuthorRole authorRole, String content);

    List<Comment> getComments(UUID taskId);

    // ========== Dependencies ==========

    /**
     * Add an edge: the successor waits for the predecessor.
     *
     * @throws com.taskrelay.core.exception.SelfDependencyException if both ids are equal
     * @throws com.taskrelay.core.exception.CycleDetectedException if the edge would close a cycle
     */
    void addDependency(UUID predecessorId, UUID successorId);

    /**
     * Remove an edge. Never fails.
     */
    void removeDependency(UUID predecessorId, UUID successorId);

    List<Task> getPredecessors(UUID taskId);

    List<Task> getSuccessors(UUID taskId);

    boolean isBlocked(UUID taskId);

    // ========== Workspace and runs ==========

    /**
     * Record the workspace created for a task.
     */
    Task attachWorkspace(UUID taskId, String workspacePath, String branch);

    /**
     * Clear workspace, branch and session after teardown.
     */
    Task detachWorkspace(UUID taskId);

    /**
     * Persist the worker's session handle. Called as soon as the worker reports it.
     */
    void recordSession(UUID taskId, String sessionId);

    List<AgentRun> getRuns(UUID taskId);

    /**
     * Run the fan-in check for a task at the terminal step. Idempotent.
     */
    void synchronizeFanIn(UUID taskId);
}
