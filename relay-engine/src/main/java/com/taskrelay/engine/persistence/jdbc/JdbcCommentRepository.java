package com.taskrelay.engine.persistence.jdbc;

import com.taskrelay.core.model.AuthorRole;
import com.taskrelay.core.model.Comment;
import com.taskrelay.core.repository.CommentRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

/**
 * JDBC-backed implementation of CommentRepository.
 */
@Repository
public class JdbcCommentRepository implements CommentRepository {

    private static final RowMapper<Comment> ROW_MAPPER = (rs, rowNum) -> new Comment(
        UUID.fromString(rs.getString("comment_id")),
        UUID.fromString(rs.getString("task_id")),
        AuthorRole.valueOf(rs.getString("author_role")),
        rs.getString("content"),
        rs.getTimestamp("created_at").toInstant()
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcCommentRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void append(Comment comment) {
        String sql = """
            INSERT INTO comments (comment_id, task_id, author_role, content, created_at)
            VALUES (?, ?, ?, ?, ?)
            """;
        jdbcTemplate.update(sql,
            comment.commentId(),
            comment.taskId(),
            comment.authorRole().name(),
            comment.content(),
            Timestamp.from(comment.createdAt())
        );
    }

    @Override
    public List<Comment> findByTask(UUID taskId) {
        String sql = """
            SELECT * FROM comments
            WHERE task_id = ?
            ORDER BY created_at ASC
            """;
        return jdbcTemplate.query(sql, ROW_MAPPER, taskId);
    }
}
