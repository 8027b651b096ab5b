package com.taskrelay.engine.persistence.jdbc;

import com.taskrelay.core.model.Project;
import com.taskrelay.core.model.ProjectStatus;
import com.taskrelay.core.repository.ProjectRepository;
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
 * JDBC-backed implementation of ProjectRepository.
 */
@Repository
public class JdbcProjectRepository implements ProjectRepository {

    private static final RowMapper<Project> ROW_MAPPER = new ProjectRowMapper();

    private final JdbcTemplate jdbcTemplate;

    public JdbcProjectRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void save(Project project) {
        String sql = """
            INSERT INTO projects (
                project_id, title, description, status, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.update(sql,
            project.projectId(),
            project.title(),
            project.description(),
            project.status().name(),
            Timestamp.from(project.createdAt()),
            Timestamp.from(project.updatedAt())
        );
    }

    @Override
    public void update(Project project) {
        String sql = """
            UPDATE projects SET
                title = ?,
                description = ?,
                status = ?,
                updated_at = ?
            WHERE project_id = ?
            """;

        jdbcTemplate.update(sql,
            project.title(),
            project.description(),
            project.status().name(),
            Timestamp.from(project.updatedAt()),
            project.projectId()
        );
    }

    @Override
    public Optional<Project> findById(UUID projectId) {
        String sql = "SELECT * FROM projects WHERE project_id = ?";
        List<Project> results = jdbcTemplate.query(sql, ROW_MAPPER, projectId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<Project> findAll() {
        return jdbcTemplate.query("SELECT * FROM projects ORDER BY created_at ASC", ROW_MAPPER);
    }

    private static class ProjectRowMapper implements RowMapper<Project> {
        @Override
        public Project mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new Project(
                UUID.fromString(rs.getString("project_id")),
                rs.getString("title"),
                rs.getString("description"),
                ProjectStatus.valueOf(rs.getString("status")),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("updated_at").toInstant()
            );
        }
    }
}
