package com.taskrelay.engine.persistence.jdbc;

import com.taskrelay.core.model.Dependency;
import com.taskrelay.core.repository.DependencyRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

/**
 * JDBC-backed implementation of DependencyRepository.
 */
@Repository
public class JdbcDependencyRepository implements DependencyRepository {

    private final JdbcTemplate jdbcTemplate;

    public JdbcDependencyRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void save(Dependency dependency) {
        String sql = """
            INSERT INTO task_dependencies (predecessor_id, successor_id, created_at)
            VALUES (?, ?, ?)
            """;
        jdbcTemplate.update(sql,
            dependency.predecessorId(),
            dependency.successorId(),
            Timestamp.from(dependency.createdAt())
        );
    }

    @Override
    public boolean delete(UUID predecessorId, UUID successorId) {
        String sql = "DELETE FROM task_dependencies WHERE predecessor_id = ? AND successor_id = ?";
        return jdbcTemplate.update(sql, predecessorId, successorId) > 0;
    }

    @Override
    public boolean exists(UUID predecessorId, UUID successorId) {
        String sql = """
            SELECT COUNT(*) FROM task_dependencies
            WHERE predecessor_id = ? AND successor_id = ?
            """;
        Integer count = jdbcTemplate.queryForObject(sql, Integer.class, predecessorId, successorId);
        return count != null && count > 0;
    }

    @Override
    public List<UUID> findPredecessorIds(UUID taskId) {
        String sql = """
            SELECT predecessor_id FROM task_dependencies
            WHERE successor_id = ?
            ORDER BY created_at ASC
            """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> UUID.fromString(rs.getString("predecessor_id")), taskId);
    }

    @Override
    public List<UUID> findSuccessorIds(UUID taskId) {
        String sql = """
            SELECT successor_id FROM task_dependencies
            WHERE predecessor_id = ?
            ORDER BY created_at ASC
            """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> UUID.fromString(rs.getString("successor_id")), taskId);
    }

    @Override
    public List<Dependency> findByProject(UUID projectId) {
        String sql = """
            SELECT d.* FROM task_dependencies d
            JOIN tasks t ON t.task_id = d.successor_id
            WHERE t.project_id = ?
            ORDER BY d.created_at ASC
            """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> new Dependency(
            UUID.fromString(rs.getString("predecessor_id")),
            UUID.fromString(rs.getString("successor_id")),
            rs.getTimestamp("created_at").toInstant()
        ), projectId);
    }
}
