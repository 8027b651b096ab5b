package com.taskrelay.core.repository;

import com.taskrelay.core.model.Comment;
import java.util.List;
import java.util.UUID;

/**
 * Repository for comments. Append-only.
 */
public interface CommentRepository {

    void append(Comment comment);

    /**
     * Get the comment thread of a task, oldest first.
     */
    List<Comment> findByTask(UUID taskId);
}
