package com.taskrelay.engine.persistence.jdbc;

import com.taskrelay.core.model.Task;
import com.taskrelay.core.model.TaskKind;
import com.taskrelay.core.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC-backed implementation of TaskRepository.
 *
 * The UNIQUE constraint on fan_in_parent_id keeps at most one synchronization
 * task per parent even if two writers get past the application-level check.
 */
@Repository
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    private static final RowMapper<Task> ROW_MAPPER = new TaskRowMapper();

    private final JdbcTemplate jdbcTemplate;

    public JdbcTaskRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void save(Task task) {
        String sql = """
            INSERT INTO tasks (
                task_id, project_id, parent_task_id,
                title, description, kind,
                step_id, cancelled, plan_approved, output,
                workspace_path, branch, session_id,
                fan_in_parent_id, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.update(sql,
            task.taskId(),
            task.projectId(),
            task.parentTaskId(),
            task.title(),
            task.description(),
            task.kind().name(),
            task.stepId(),
            task.cancelled(),
            task.planApproved(),
            task.output(),
            task.workspacePath(),
            task.branch(),
            task.sessionId(),
            task.fanInParentId(),
            Timestamp.from(task.createdAt()),
            Timestamp.from(task.updatedAt())
        );

        log.debug("Inserted task {} in project {}", task.taskId(), task.projectId());
    }

    @Override
    public void update(Task task) {
        String sql = """
            UPDATE tasks SET
                title = ?,
                description = ?,
                step_id = ?,
                cancelled = ?,
                plan_approved = ?,
                output = ?,
                workspace_path = ?,
                branch = ?,
                session_id = ?,
                updated_at = ?
            WHERE task_id = ?
            """;

        jdbcTemplate.update(sql,
            task.title(),
            task.description(),
            task.stepId(),
            task.cancelled(),
            task.planApproved(),
            task.output(),
            task.workspacePath(),
            task.branch(),
            task.sessionId(),
            Timestamp.from(task.updatedAt()),
            task.taskId()
        );
    }

    @Override
    public Optional<Task> findById(UUID taskId) {
        String sql = "SELECT * FROM tasks WHERE task_id = ?";
        List<Task> results = jdbcTemplate.query(sql, ROW_MAPPER, taskId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<Task> findByIdForUpdate(UUID taskId) {
        String sql = "SELECT * FROM tasks WHERE task_id = ? FOR UPDATE";
        List<Task> results = jdbcTemplate.query(sql, ROW_MAPPER, taskId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<Task> findByProject(UUID projectId) {
        String sql = """
            SELECT * FROM tasks
            WHERE project_id = ?
            ORDER BY created_at ASC
            """;
        return jdbcTemplate.query(sql, ROW_MAPPER, projectId);
    }

    @Override
    public List<Task> findChildren(UUID parentTaskId) {
        String sql = """
            SELECT * FROM tasks
            WHERE parent_task_id = ?
            ORDER BY created_at ASC
            """;
        return jdbcTemplate.query(sql, ROW_MAPPER, parentTaskId);
    }

    @Override
    public Optional<Task> findSynchronizationTask(UUID parentTaskId) {
        String sql = "SELECT * FROM tasks WHERE fan_in_parent_id = ?";
        List<Task> results = jdbcTemplate.query(sql, ROW_MAPPER, parentTaskId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<Task> findWithWorkspace() {
        String sql = """
            SELECT * FROM tasks
            WHERE workspace_path IS NOT NULL
            ORDER BY created_at ASC
            """;
        return jdbcTemplate.query(sql, ROW_MAPPER);
    }

    private static UUID toUuid(String value) {
        return value != null ? UUID.fromString(value) : null;
    }

    private static class TaskRowMapper implements RowMapper<Task> {
        @Override
        public Task mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new Task(
                UUID.fromString(rs.getString("task_id")),
                UUID.fromString(rs.getString("project_id")),
                toUuid(rs.getString("parent_task_id")),
                rs.getString("title"),
                rs.getString("description"),
                TaskKind.valueOf(rs.getString("kind")),
                UUID.fromString(rs.getString("step_id")),
                rs.getBoolean("cancelled"),
                rs.getBoolean("plan_approved"),
                rs.getString("output"),
                rs.getString("workspace_path"),
                rs.getString("branch"),
                rs.getString("session_id"),
                toUuid(rs.getString("fan_in_parent_id")),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("updated_at").toInstant()
            );
        }
    }
}
