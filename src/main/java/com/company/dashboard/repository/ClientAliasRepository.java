package com.company.dashboard.repository;

import com.company.dashboard.exception.SourceUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.company.dashboard.util.NumericCoercion.readInt;

/**
 * Display aliases for client ids (app.client_alias).
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class ClientAliasRepository {

    public static final String SOURCE = "client_alias";

    private final JdbcTemplate jdbcTemplate;

    public Map<Integer, String> findAll() {
        String sql = """
            SELECT client_id, alias
            FROM app.client_alias
            ORDER BY client_id
            """;

        try {
            Map<Integer, String> aliases = new LinkedHashMap<>();
            jdbcTemplate.query(sql, rs -> {
                aliases.put(readInt(rs, "client_id"), rs.getString("alias"));
            });
            return aliases;
        } catch (DataAccessException e) {
            throw new SourceUnavailableException(SOURCE, e);
        }
    }

    /**
     * @return number of rows changed, 0 when the client has no alias yet
     */
    public int update(int clientId, String alias) {
        String sql = """
            UPDATE app.client_alias
            SET alias = ?
            WHERE client_id = ?
            """;

        try {
            int updated = jdbcTemplate.update(sql, alias, clientId);
            log.debug("Updated alias of client {}: {} rows", clientId, updated);
            return updated;
        } catch (DataAccessException e) {
            throw new SourceUnavailableException(SOURCE, e);
        }
    }

    public void insert(int clientId, String alias) {
        String sql = """
            INSERT INTO app.client_alias (client_id, alias)
            VALUES (?, ?)
            """;

        try {
            jdbcTemplate.update(sql, clientId, alias);
            log.debug("Inserted alias of client {}", clientId);
        } catch (DataAccessException e) {
            throw new SourceUnavailableException(SOURCE, e);
        }
    }

    public int delete(int clientId) {
        String sql = """
            DELETE FROM app.client_alias
            WHERE client_id = ?
            """;

        try {
            int deleted = jdbcTemplate.update(sql, clientId);
            log.debug("Deleted alias of client {}: {} rows", clientId, deleted);
            return deleted;
        } catch (DataAccessException e) {
            throw new SourceUnavailableException(SOURCE, e);
        }
    }

    /**
     * Every client id that appears in the load ledger, ascending.
     */
    public List<Integer> findDistinctLoadClientIds() {
        String sql = """
            SELECT DISTINCT "C1" AS client_id
            FROM "Rel_Carga"
            WHERE "C1" IS NOT NULL
            ORDER BY client_id
            """;

        try {
            return jdbcTemplate.query(sql, (rs, rowNum) -> readInt(rs, "client_id"));
        } catch (DataAccessException e) {
            throw new SourceUnavailableException(LoadRecordRepository.SOURCE, e);
        }
    }
}
