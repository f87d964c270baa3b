package com.reelpilot.session.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reelpilot.session.model.WorkflowSessionView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Repository
public class SessionRunRepository {
    private static final Logger log = LoggerFactory.getLogger(SessionRunRepository.class);
    private static final TypeReference<Map<String, Object>> STATS_MAP = new TypeReference<>() {};

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public SessionRunRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public long insertSession(String accountId, String workflowType, String scope, String configJson, Instant startedAt) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO workflow_sessions (account_id, workflow_type, scope, status, config_json, started_at)
                VALUES (:accountId, :workflowType, :scope, 'RUNNING', :configJson, :startedAt)
                """,
            new MapSqlParameterSource()
                .addValue("accountId", accountId)
                .addValue("workflowType", workflowType)
                .addValue("scope", scope == null ? null : scope.trim().toLowerCase(Locale.ROOT))
                .addValue("configJson", configJson)
                .addValue("startedAt", Timestamp.from(startedAt)),
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("No id generated for workflow session");
        }
        return key.longValue();
    }

    public void completeSession(long sessionId, String status, String completionReason, String statsJson, Instant finishedAt) {
        jdbc.update(
            """
                UPDATE workflow_sessions
                SET status = :status,
                    completion_reason = :completionReason,
                    stats_json = :statsJson,
                    finished_at = :finishedAt
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", sessionId)
                .addValue("status", status)
                .addValue("completionReason", completionReason)
                .addValue("statsJson", statsJson)
                .addValue("finishedAt", Timestamp.from(finishedAt))
        );
    }

    public List<WorkflowSessionView> findRecentSessions(int limit) {
        int safeLimit = Math.max(1, Math.min(limit, 200));
        return jdbc.query(
            """
                SELECT id, account_id, workflow_type, scope, status, completion_reason, started_at, finished_at, stats_json
                FROM workflow_sessions
                ORDER BY started_at DESC, id DESC
                LIMIT :limit
                """,
            new MapSqlParameterSource("limit", safeLimit),
            sessionViewMapper()
        );
    }

    public WorkflowSessionView findSession(long sessionId) {
        List<WorkflowSessionView> rows = jdbc.query(
            """
                SELECT id, account_id, workflow_type, scope, status, completion_reason, started_at, finished_at, stats_json
                FROM workflow_sessions
                WHERE id = :id
                """,
            new MapSqlParameterSource("id", sessionId),
            sessionViewMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    private RowMapper<WorkflowSessionView> sessionViewMapper() {
        return (rs, rowNum) -> {
            Timestamp startedAt = rs.getTimestamp("started_at");
            Timestamp finishedAt = rs.getTimestamp("finished_at");
            return new WorkflowSessionView(
                rs.getLong("id"),
                rs.getString("account_id"),
                rs.getString("workflow_type"),
                rs.getString("scope"),
                rs.getString("status"),
                rs.getString("completion_reason"),
                startedAt == null ? null : startedAt.toInstant(),
                finishedAt == null ? null : finishedAt.toInstant(),
                parseStats(rs.getString("stats_json"))
            );
        };
    }

    private Map<String, Object> parseStats(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, STATS_MAP);
        } catch (Exception e) {
            log.warn("Unreadable stats_json ignored", e);
            return Map.of();
        }
    }
}
