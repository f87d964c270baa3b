package com.reelpilot.session.persistence;

import com.reelpilot.session.model.InteractionKind;
import com.reelpilot.session.model.InteractionRecord;
import com.reelpilot.session.util.ErrorKind;
import com.reelpilot.session.util.Result;
import com.reelpilot.session.util.UsernameRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

@Repository
public class JdbcInteractionLedger implements InteractionLedger {
    private static final Logger log = LoggerFactory.getLogger(JdbcInteractionLedger.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public JdbcInteractionLedger(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = DatabaseDialect.isPostgres(jdbc);
    }

    @Override
    public Result<Boolean> hasRecentInteraction(
        String accountId,
        String targetIdentifier,
        InteractionKind kind,
        Duration window
    ) {
        String target = UsernameRules.normalize(targetIdentifier);
        if (target == null) {
            return Result.ok(false);
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("accountId", accountId)
            .addValue("target", target)
            .addValue("since", since(window));
        String kindFilter = "";
        if (kind != null) {
            kindFilter = " AND kind = :kind";
            params.addValue("kind", kind.code());
        }
        try {
            Integer count = jdbc.queryForObject(
                """
                    SELECT COUNT(*)
                    FROM interaction_history
                    WHERE account_id = :accountId
                      AND target_identifier = :target
                      AND success = TRUE
                      AND created_at >= :since
                    """ + kindFilter,
                params,
                Integer.class
            );
            return Result.ok(count != null && count > 0);
        } catch (DataAccessException e) {
            log.debug("Ledger lookup failed for {}", target, e);
            return Result.transientFailure(e.getMessage());
        }
    }

    @Override
    public Result<Void> recordInteraction(
        String accountId,
        String targetIdentifier,
        InteractionKind kind,
        boolean success,
        Long sessionId
    ) {
        String target = UsernameRules.normalize(targetIdentifier);
        if (target == null || kind == null) {
            return Result.err(ErrorKind.FATAL, "target and kind are required");
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("accountId", accountId)
            .addValue("target", target)
            .addValue("kind", kind.code())
            .addValue("success", success)
            .addValue("sessionId", sessionId)
            .addValue("createdAt", Timestamp.from(Instant.now()));
        try {
            if (postgres) {
                jdbc.update(
                    """
                        INSERT INTO interaction_history (
                            account_id,
                            target_identifier,
                            kind,
                            success,
                            session_id,
                            created_at
                        )
                        VALUES (
                            :accountId,
                            :target,
                            :kind,
                            :success,
                            :sessionId,
                            :createdAt
                        )
                        ON CONFLICT (account_id, target_identifier, kind)
                        DO UPDATE SET
                            success = EXCLUDED.success OR interaction_history.success,
                            session_id = COALESCE(EXCLUDED.session_id, interaction_history.session_id),
                            created_at = EXCLUDED.created_at
                        """,
                    params
                );
            } else {
                int updated = jdbc.update(
                    """
                        UPDATE interaction_history
                        SET success = success OR :success,
                            session_id = COALESCE(:sessionId, session_id),
                            created_at = :createdAt
                        WHERE account_id = :accountId
                          AND target_identifier = :target
                          AND kind = :kind
                        """,
                    params
                );
                if (updated == 0) {
                    jdbc.update(
                        """
                            INSERT INTO interaction_history (account_id, target_identifier, kind, success, session_id, created_at)
                            VALUES (:accountId, :target, :kind, :success, :sessionId, :createdAt)
                            """,
                        params
                    );
                }
            }
            return Result.done();
        } catch (DataAccessException e) {
            log.debug("Ledger write failed for {} {}", kind, target, e);
            return Result.transientFailure(e.getMessage());
        }
    }

    @Override
    public Result<Integer> countInteractionsForScope(String accountId, String scope, Duration window) {
        if (scope == null || scope.isBlank()) {
            return Result.ok(0);
        }
        try {
            Integer count = jdbc.queryForObject(
                """
                    SELECT COUNT(DISTINCT ih.target_identifier)
                    FROM interaction_history ih
                    JOIN workflow_sessions ws ON ws.id = ih.session_id
                    WHERE ih.account_id = :accountId
                      AND ws.scope = :scope
                      AND ih.created_at >= :since
                    """,
                new MapSqlParameterSource()
                    .addValue("accountId", accountId)
                    .addValue("scope", scope.trim().toLowerCase(Locale.ROOT))
                    .addValue("since", since(window)),
                Integer.class
            );
            return Result.ok(count == null ? 0 : count);
        } catch (DataAccessException e) {
            log.debug("Ledger scope count failed for {}", scope, e);
            return Result.transientFailure(e.getMessage());
        }
    }

    public List<InteractionRecord> findRecentInteractions(String accountId, int limit) {
        int safeLimit = Math.max(1, Math.min(limit, 500));
        return jdbc.query(
            """
                SELECT account_id, target_identifier, kind, success, created_at, session_id
                FROM interaction_history
                WHERE account_id = :accountId
                ORDER BY created_at DESC, id DESC
                LIMIT :limit
                """,
            new MapSqlParameterSource()
                .addValue("accountId", accountId)
                .addValue("limit", safeLimit),
            (rs, rowNum) -> {
                Timestamp createdAt = rs.getTimestamp("created_at");
                return new InteractionRecord(
                    rs.getString("account_id"),
                    rs.getString("target_identifier"),
                    InteractionKind.valueOf(rs.getString("kind").toUpperCase(Locale.ROOT)),
                    rs.getBoolean("success"),
                    createdAt == null ? null : createdAt.toInstant(),
                    rs.getObject("session_id", Long.class)
                );
            }
        );
    }

    private static Timestamp since(Duration window) {
        Duration safeWindow = window == null || window.isNegative() ? Duration.ZERO : window;
        return Timestamp.from(Instant.now().minus(safeWindow));
    }
}
