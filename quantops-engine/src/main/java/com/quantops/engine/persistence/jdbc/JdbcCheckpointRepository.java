package com.quantops.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantops.core.model.Checkpoint;
import com.quantops.core.model.CheckpointType;
import com.quantops.core.repository.CheckpointRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of CheckpointRepository.
 * One row per operation, overwritten with an upsert on every save.
 */
public class JdbcCheckpointRepository implements CheckpointRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final CheckpointRowMapper rowMapper = new CheckpointRowMapper();

    public JdbcCheckpointRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public void upsert(Checkpoint checkpoint) {
        String sql = """
            INSERT INTO operation_checkpoints (
                operation_id, checkpoint_type, created_at, state_json,
                artifacts_path, state_size_bytes, artifacts_size_bytes
            ) VALUES (?, ?, ?, ?::jsonb, ?, ?, ?)
            ON CONFLICT (operation_id) DO UPDATE SET
                checkpoint_type = EXCLUDED.checkpoint_type,
                created_at = EXCLUDED.created_at,
                state_json = EXCLUDED.state_json,
                artifacts_path = EXCLUDED.artifacts_path,
                state_size_bytes = EXCLUDED.state_size_bytes,
                artifacts_size_bytes = EXCLUDED.artifacts_size_bytes
            """;

        jdbcTemplate.update(sql,
            checkpoint.operationId(),
            checkpoint.checkpointType().wireName(),
            Timestamp.from(checkpoint.createdAt()),
            toJson(checkpoint),
            checkpoint.artifactsPath(),
            checkpoint.stateSizeBytes(),
            checkpoint.artifactsSizeBytes()
        );
    }

    @Override
    public Optional<Checkpoint> findById(String operationId) {
        String sql = "SELECT * FROM operation_checkpoints WHERE operation_id = ?";
        List<Checkpoint> results = jdbcTemplate.query(sql, rowMapper, operationId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    @Transactional
    public boolean delete(String operationId) {
        return jdbcTemplate.update(
            "DELETE FROM operation_checkpoints WHERE operation_id = ?", operationId) > 0;
    }

    @Override
    public boolean exists(String operationId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM operation_checkpoints WHERE operation_id = ?",
            Integer.class, operationId);
        return count != null && count > 0;
    }

    private String toJson(Checkpoint checkpoint) {
        try {
            return objectMapper.writeValueAsString(checkpoint.state());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize checkpoint state for " + checkpoint.operationId(), e);
        }
    }

    private class CheckpointRowMapper implements RowMapper<Checkpoint> {
        @Override
        public Checkpoint mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                String state = rs.getString("state_json");
                return new Checkpoint(
                    rs.getString("operation_id"),
                    CheckpointType.fromWireName(rs.getString("checkpoint_type")),
                    rs.getTimestamp("created_at").toInstant(),
                    state != null ? objectMapper.readTree(state) : objectMapper.createObjectNode(),
                    rs.getString("artifacts_path"),
                    rs.getLong("state_size_bytes"),
                    rs.getLong("artifacts_size_bytes"),
                    Map.of()
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map checkpoint row", e);
            }
        }
    }
}
