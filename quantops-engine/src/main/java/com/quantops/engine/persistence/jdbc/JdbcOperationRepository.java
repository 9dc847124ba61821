package com.quantops.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantops.core.exception.OperationConflictException;
import com.quantops.core.exception.OptimisticLockException;
import com.quantops.core.model.Operation;
import com.quantops.core.model.OperationProgress;
import com.quantops.core.model.OperationStatus;
import com.quantops.core.model.OperationType;
import com.quantops.core.repository.OperationFilter;
import com.quantops.core.repository.OperationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of OperationRepository.
 * Status writes use the version column for optimistic locking; resume uses a
 * single conditional UPDATE so the database arbitrates concurrent callers.
 */
public class JdbcOperationRepository implements OperationRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcOperationRepository.class);

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final OperationRowMapper rowMapper;

    public JdbcOperationRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new OperationRowMapper();
    }

    @Override
    @Transactional
    public void save(Operation operation) {
        String sql = """
            INSERT INTO operations (
                operation_id, operation_type, parent_operation_id, status,
                metadata_json, progress_json, result_json, error_message,
                created_at, started_at, completed_at, version
            ) VALUES (?, ?, ?, ?, ?::jsonb, ?::jsonb, ?::jsonb, ?, ?, ?, ?, ?)
            ON CONFLICT (operation_id) DO NOTHING
            """;

        int rows = jdbcTemplate.update(sql,
            operation.operationId(),
            operation.operationType().name(),
            operation.parentOperationId(),
            operation.status().name(),
            toJson(operation.metadata()),
            toJson(operation.progress()),
            toJson(operation.resultSummary()),
            operation.errorMessage(),
            toTimestamp(operation.createdAt()),
            toTimestamp(operation.startedAt()),
            toTimestamp(operation.completedAt()),
            operation.version()
        );

        if (rows == 0) {
            throw new OperationConflictException("Operation already exists: " + operation.operationId());
        }
    }

    @Override
    @Transactional
    public void update(Operation operation) {
        String sql = """
            UPDATE operations SET
                status = ?,
                metadata_json = ?::jsonb,
                progress_json = ?::jsonb,
                result_json = ?::jsonb,
                error_message = ?,
                started_at = ?,
                completed_at = ?,
                version = ?
            WHERE operation_id = ? AND version = ?
            """;

        int rows = jdbcTemplate.update(sql,
            operation.status().name(),
            toJson(operation.metadata()),
            toJson(operation.progress()),
            toJson(operation.resultSummary()),
            operation.errorMessage(),
            toTimestamp(operation.startedAt()),
            toTimestamp(operation.completedAt()),
            operation.version(),
            operation.operationId(),
            operation.version() - 1  // Expected previous version
        );

        if (rows == 0) {
            throw new OptimisticLockException("Operation", operation.operationId());
        }
    }

    @Override
    public Optional<Operation> findById(String operationId) {
        String sql = "SELECT * FROM operations WHERE operation_id = ?";
        List<Operation> results = jdbcTemplate.query(sql, rowMapper, operationId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<Operation> find(OperationFilter filter) {
        List<Object> args = new ArrayList<>();
        String sql = "SELECT * FROM operations" + whereClause(filter, args)
            + " ORDER BY created_at DESC, operation_id DESC LIMIT ? OFFSET ?";
        args.add(filter.limit());
        args.add(filter.offset());
        return jdbcTemplate.query(sql, rowMapper, args.toArray());
    }

    @Override
    public long count(OperationFilter filter) {
        List<Object> args = new ArrayList<>();
        String sql = "SELECT COUNT(*) FROM operations" + whereClause(filter, args);
        Long count = jdbcTemplate.queryForObject(sql, Long.class, args.toArray());
        return count != null ? count : 0L;
    }

    @Override
    public long countActive() {
        String sql = "SELECT COUNT(*) FROM operations WHERE status IN ('PENDING', 'RUNNING', 'RESUMING')";
        Long count = jdbcTemplate.queryForObject(sql, Long.class);
        return count != null ? count : 0L;
    }

    @Override
    public List<Operation> findByParent(String parentOperationId) {
        String sql = """
            SELECT * FROM operations
            WHERE parent_operation_id = ?
            ORDER BY created_at, operation_id
            """;
        return jdbcTemplate.query(sql, rowMapper, parentOperationId);
    }

    @Override
    public List<Operation> findByStatus(OperationStatus status, int limit) {
        String sql = "SELECT * FROM operations WHERE status = ? ORDER BY created_at LIMIT ?";
        return jdbcTemplate.query(sql, rowMapper, status.name(), limit);
    }

    @Override
    public Map<OperationStatus, Long> countByStatus() {
        String sql = "SELECT status, COUNT(*) AS count FROM operations GROUP BY status";

        Map<OperationStatus, Long> counts = new EnumMap<>(OperationStatus.class);
        jdbcTemplate.query(sql, rs -> {
            counts.put(OperationStatus.valueOf(rs.getString("status")), rs.getLong("count"));
        });
        return counts;
    }

    @Override
    @Transactional
    public boolean tryResume(String operationId, Instant resumedAt) {
        String sql = """
            UPDATE operations SET
                status = 'RESUMING',
                started_at = ?,
                completed_at = NULL,
                error_message = NULL,
                result_json = NULL,
                version = version + 1
            WHERE operation_id = ? AND status IN ('CANCELLED', 'FAILED')
            """;

        int rows = jdbcTemplate.update(sql, Timestamp.from(resumedAt), operationId);
        if (rows == 0) {
            log.debug("Resume not applied for operation {}", operationId);
        }
        return rows == 1;
    }

    @Override
    public List<Operation> findFinishedBefore(Instant completedBefore, int limit) {
        String sql = """
            SELECT * FROM operations
            WHERE status IN ('COMPLETED', 'FAILED', 'CANCELLED')
              AND completed_at < ?
            ORDER BY completed_at
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, Timestamp.from(completedBefore), limit);
    }

    @Override
    @Transactional
    public boolean delete(String operationId) {
        return jdbcTemplate.update("DELETE FROM operations WHERE operation_id = ?", operationId) > 0;
    }

    // ========== Helper Methods ==========

    private String whereClause(OperationFilter filter, List<Object> args) {
        List<String> conditions = new ArrayList<>();
        if (filter.status() != null) {
            conditions.add("status = ?");
            args.add(filter.status().name());
        }
        if (filter.operationType() != null) {
            conditions.add("operation_type = ?");
            args.add(filter.operationType().name());
        }
        if (filter.parentOperationId() != null) {
            conditions.add("parent_operation_id = ?");
            args.add(filter.parentOperationId());
        }
        return conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
    }

    private String toJson(Object obj) {
        if (obj == null) return null;
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize to JSON", e);
        }
    }

    private Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private class OperationRowMapper implements RowMapper<Operation> {
        @Override
        public Operation mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                return new Operation(
                    rs.getString("operation_id"),
                    OperationType.valueOf(rs.getString("operation_type")),
                    rs.getString("parent_operation_id"),
                    OperationStatus.valueOf(rs.getString("status")),
                    parseMetadata(rs.getString("metadata_json")),
                    parseProgress(rs.getString("progress_json")),
                    parseJsonNode(rs.getString("result_json")),
                    rs.getString("error_message"),
                    toInstant(rs.getTimestamp("created_at")),
                    toInstant(rs.getTimestamp("started_at")),
                    toInstant(rs.getTimestamp("completed_at")),
                    rs.getLong("version")
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map operation row", e);
            }
        }

        private Map<String, Object> parseMetadata(String json) throws JsonProcessingException {
            if (json == null || json.isEmpty()) return Map.of();
            return objectMapper.readValue(json, METADATA_TYPE);
        }

        private OperationProgress parseProgress(String json) throws JsonProcessingException {
            if (json == null || json.isEmpty()) return OperationProgress.empty();
            return objectMapper.readValue(json, OperationProgress.class);
        }

        private JsonNode parseJsonNode(String json) throws JsonProcessingException {
            if (json == null || json.isEmpty()) return null;
            return objectMapper.readTree(json);
        }

        private Instant toInstant(Timestamp ts) {
            return ts != null ? ts.toInstant() : null;
        }
    }
}
