package com.taskrelay.engine.outbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskrelay.core.model.AgentRun;
import com.taskrelay.core.model.Comment;
import com.taskrelay.core.model.Project;
import com.taskrelay.core.model.Task;
import com.taskrelay.core.model.Workflow;
import com.taskrelay.core.model.WorkflowStep;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * Builds fully resolved event payloads, so a consumer never needs a second read
 * to render the entity an event is about.
 */
@Component
public class EventPayloads {

    private final ObjectMapper objectMapper;

    public EventPayloads(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode empty() {
        return objectMapper.createObjectNode();
    }

    /**
     * Payload for a project event: the project and its whole workflow.
     */
    public ObjectNode project(Project project, Workflow workflow) {
        ObjectNode payload = objectMapper.createObjectNode();
        ObjectNode node = payload.putObject("project");
        node.put("id", project.projectId().toString());
        node.put("title", project.title());
        node.put("description", project.description());
        node.put("status", project.status().name().toLowerCase(Locale.ROOT));
        putInstant(node, "createdAt", project.createdAt());
        putInstant(node, "updatedAt", project.updatedAt());
        if (workflow != null) {
            ArrayNode steps = node.putArray("steps");
            for (WorkflowStep step : workflow.steps()) {
                steps.add(step(step));
            }
        }
        return payload;
    }

    /**
     * Payload for a task event: the whole task with its step resolved.
     */
    public ObjectNode task(Task task, WorkflowStep step) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.set("task", taskNode(task, step));
        return payload;
    }

    /**
     * Payload for a move: the task plus the step it left.
     */
    public ObjectNode move(Task task, WorkflowStep from, WorkflowStep to) {
        ObjectNode payload = task(task, to);
        payload.set("fromStep", step(from));
        return payload;
    }

    public ObjectNode comment(Comment comment) {
        ObjectNode payload = objectMapper.createObjectNode();
        ObjectNode node = payload.putObject("comment");
        node.put("id", comment.commentId().toString());
        node.put("taskId", comment.taskId().toString());
        node.put("authorRole", comment.authorRole().wireName());
        node.put("content", comment.content());
        putInstant(node, "createdAt", comment.createdAt());
        return payload;
    }

    public ObjectNode dependency(Task predecessor, Task successor) {
        ObjectNode payload = objectMapper.createObjectNode();
        ObjectNode node = payload.putObject("dependency");
        node.put("predecessorId", predecessor.taskId().toString());
        node.put("predecessorTitle", predecessor.title());
        node.put("successorId", successor.taskId().toString());
        node.put("successorTitle", successor.title());
        return payload;
    }

    public ObjectNode run(AgentRun run, WorkflowStep step) {
        ObjectNode payload = objectMapper.createObjectNode();
        ObjectNode node = payload.putObject("run");
        node.put("id", run.runId().toString());
        node.put("taskId", run.taskId().toString());
        node.put("stepId", run.stepId().toString());
        node.put("stepName", step != null ? step.name() : null);
        putInstant(node, "startedAt", run.startedAt());
        putInstant(node, "completedAt", run.completedAt());
        if (run.exitCode() != null) {
            node.put("exitCode", run.exitCode());
        } else {
            node.putNull("exitCode");
        }
        node.put("error", run.error());
        return payload;
    }

    public ObjectNode step(WorkflowStep step) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("id", step.stepId().toString());
        node.put("name", step.name());
        node.put("position", step.position());
        node.put("dispatchable", step.dispatchable());
        node.put("role", step.role() != null ? step.role().wireName() : null);
        node.put("model", step.model());
        return node;
    }

    private ObjectNode taskNode(Task task, WorkflowStep step) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("id", task.taskId().toString());
        node.put("projectId", task.projectId().toString());
        putUuid(node, "parentTaskId", task.parentTaskId());
        node.put("title", task.title());
        node.put("description", task.description());
        node.put("kind", task.kind().wireName());
        node.put("stepId", task.stepId().toString());
        node.put("stepName", step.name());
        node.put("stepPosition", step.position());
        node.put("cancelled", task.cancelled());
        node.put("planApproved", task.planApproved());
        node.put("output", task.output());
        node.put("workspacePath", task.workspacePath());
        node.put("branch", task.branch());
        node.put("sessionId", task.sessionId());
        putUuid(node, "fanInParentId", task.fanInParentId());
        putInstant(node, "createdAt", task.createdAt());
        putInstant(node, "updatedAt", task.updatedAt());
        return node;
    }

    private static void putUuid(ObjectNode node, String field, UUID value) {
        if (value != null) {
            node.put(field, value.toString());
        } else {
            node.putNull(field);
        }
    }

    private static void putInstant(ObjectNode node, String field, Instant value) {
        if (value != null) {
            node.put(field, value.toString());
        } else {
            node.putNull(field);
        }
    }
}
