package com.taskrelay.worker.context;

import com.taskrelay.core.model.Comment;
import com.taskrelay.core.model.Task;
import com.taskrelay.core.model.WorkflowStep;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds the prompt handed to a worker.
 *
 * <pre>
 * &lt;system_prompt&gt;
 * {step instructions}
 * &lt;/system_prompt&gt;
 *
 * &lt;issue&gt;
 * Task ID: ...
 * ...
 * &lt;/issue&gt;
 *
 * &lt;comments&gt;
 * [role] timestamp: content
 * &lt;/comments&gt;
 * </pre>
 *
 * Step instructions are opaque. The comments block is left out when there are no comments.
 */
public class ContextAssembler {

    private static final String SECTION_SEPARATOR = "\n\n";

    public String assemble(Task task, WorkflowStep step, List<Comment> comments) {
        StringBuilder prompt = new StringBuilder();
        prompt.append(block("system_prompt", Objects.toString(step.instructions(), "")));

        prompt.append(SECTION_SEPARATOR).append(block("issue", String.join("\n",
            "Task ID: " + task.taskId(),
            "Project ID: " + task.projectId(),
            "Parent Task ID: " + orEmpty(task.parentTaskId()),
            "Title: " + orEmpty(task.title()),
            "Description: " + orEmpty(task.description()),
            "Step: " + step.name(),
            "Branch: " + orEmpty(task.branch()),
            "Worktree: " + orEmpty(task.workspacePath())
        )));

        if (!comments.isEmpty()) {
            String lines = comments.stream()
                .map(c -> "[" + c.authorRole().wireName() + "] " + c.createdAt() + ": " + c.content())
                .collect(Collectors.joining("\n"));
            prompt.append(SECTION_SEPARATOR).append(block("comments", lines));
        }
        return prompt.toString();
    }

    private static String block(String tag, String body) {
        return "<" + tag + ">\n" + body + "\n</" + tag + ">";
    }

    private static String orEmpty(Object value) {
        return value != null ? value.toString() : "";
    }
}
