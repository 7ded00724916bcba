package com.company.dashboard.repository;

import com.company.dashboard.domain.StatusSnapshot;
import com.company.dashboard.domain.TimeWindow;
import com.company.dashboard.exception.SourceUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static com.company.dashboard.util.NumericCoercion.readDouble;
import static com.company.dashboard.util.NumericCoercion.readLong;

/**
 * Cumulative machine status polls ("Sts_Dados"). Values grow during the day, so
 * reads always take the last row instead of summing.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class StatusRecordRepository {

    public static final String SOURCE = "status";

    private final JdbcTemplate jdbcTemplate;

    public boolean existsWithin(TimeWindow window) {
        String sql = """
            SELECT COUNT(*)
            FROM "Sts_Dados"
            WHERE "Time_Stamp" >= ? AND "Time_Stamp" < ?
            """;

        try {
            Long rows = jdbcTemplate.queryForObject(sql, Long.class,
                    JdbcValues.start(window), JdbcValues.endExclusive(window));
            return rows != null && rows > 0;
        } catch (DataAccessException e) {
            throw new SourceUnavailableException(SOURCE, e);
        }
    }

    /**
     * Most recent day with any status row, regardless of window.
     */
    public Optional<LocalDate> findLatestDate() {
        String sql = """
            SELECT MAX("Time_Stamp")
            FROM "Sts_Dados"
            """;

        try {
            Timestamp latest = jdbcTemplate.queryForObject(sql, Timestamp.class);
            return Optional.ofNullable(latest).map(ts -> ts.toLocalDateTime().toLocalDate());
        } catch (DataAccessException e) {
            throw new SourceUnavailableException(SOURCE, e);
        }
    }

    public Optional<StatusSnapshot> findLastWithin(TimeWindow window) {
        String sql = """
            SELECT "Time_Stamp", "D1", "D2", "D3", "D5"
            FROM "Sts_Dados"
            WHERE "Time_Stamp" >= ? AND "Time_Stamp" < ?
            ORDER BY "Time_Stamp" DESC
            LIMIT 1
            """;

        try {
            List<StatusSnapshot> rows = jdbcTemplate.query(sql, new StatusSnapshotRowMapper(),
                    JdbcValues.start(window), JdbcValues.endExclusive(window));
            log.debug("Status lookup in {} returned {} row(s)", window, rows.size());
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            throw new SourceUnavailableException(SOURCE, e);
        }
    }

    private static class StatusSnapshotRowMapper implements RowMapper<StatusSnapshot> {
        @Override
        public StatusSnapshot mapRow(ResultSet rs, int rowNum) throws SQLException {
            return StatusSnapshot.builder()
                    .recordedAt(JdbcValues.readDateTime(rs, "Time_Stamp"))
                    .waterM3(readDouble(rs, "D1"))
                    .cycles(readLong(rs, "D2"))
                    .kgWashed(readDouble(rs, "D3"))
                    .clientId(JdbcValues.readNullableInt(rs, "D5"))
                    .build();
        }
    }
}
