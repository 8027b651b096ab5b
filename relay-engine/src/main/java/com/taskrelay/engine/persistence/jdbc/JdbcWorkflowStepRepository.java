package com.taskrelay.engine.persistence.jdbc;

import com.taskrelay.core.model.WorkerRole;
import com.taskrelay.core.model.WorkflowStep;
import com.taskrelay.core.repository.WorkflowStepRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC-backed implementation of WorkflowStepRepository.
 * Worker roles are stored by enum name and parsed back strictly, so an unknown
 * role in the table fails loudly instead of never dispatching.
 */
@Repository
public class JdbcWorkflowStepRepository implements WorkflowStepRepository {

    private static final RowMapper<WorkflowStep> ROW_MAPPER = new WorkflowStepRowMapper();

    private final JdbcTemplate jdbcTemplate;

    public JdbcWorkflowStepRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void saveAll(List<WorkflowStep> steps) {
        String sql = """
            INSERT INTO workflow_steps (
                step_id, project_id, step_position, name,
                dispatchable, worker_role, model, instructions
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.batchUpdate(sql, steps, steps.size(), (ps, step) -> {
            ps.setObject(1, step.stepId());
            ps.setObject(2, step.projectId());
            ps.setInt(3, step.position());
            ps.setString(4, step.name());
            ps.setBoolean(5, step.dispatchable());
            if (step.role() != null) {
                ps.setString(6, step.role().name());
            } else {
                ps.setNull(6, Types.VARCHAR);
            }
            ps.setString(7, step.model());
            ps.setString(8, step.instructions());
        });
    }

    @Override
    public List<WorkflowStep> findByProject(UUID projectId) {
        String sql = """
            SELECT * FROM workflow_steps
            WHERE project_id = ?
            ORDER BY step_position ASC
            """;
        return jdbcTemplate.query(sql, ROW_MAPPER, projectId);
    }

    @Override
    public Optional<WorkflowStep> findById(UUID stepId) {
        String sql = "SELECT * FROM workflow_steps WHERE step_id = ?";
        List<WorkflowStep> results = jdbcTemplate.query(sql, ROW_MAPPER, stepId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    private static class WorkflowStepRowMapper implements RowMapper<WorkflowStep> {
        @Override
        public WorkflowStep mapRow(ResultSet rs, int rowNum) throws SQLException {
            String role = rs.getString("worker_role");
            return new WorkflowStep(
                UUID.fromString(rs.getString("step_id")),
                UUID.fromString(rs.getString("project_id")),
                rs.getInt("step_position"),
                rs.getString("name"),
                rs.getBoolean("dispatchable"),
                role != null ? WorkerRole.valueOf(role) : null,
                rs.getString("model"),
                rs.getString("instructions")
            );
        }
    }
}
