package com.company.dashboard.repository;

import com.company.dashboard.domain.ActiveAlarm;
import com.company.dashboard.domain.AlarmDayCount;
import com.company.dashboard.domain.AlarmOccurrenceSummary;
import com.company.dashboard.domain.TimeWindow;
import com.company.dashboard.domain.enums.AlarmPriority;
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
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.company.dashboard.util.NumericCoercion.readInt;
import static com.company.dashboard.util.NumericCoercion.readLong;

/**
 * Alarm history ("ALARMHISTORY"). An alarm with no normalization time is still active;
 * a missing priority counts as 5 (informational).
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class AlarmHistoryRepository {

    public static final String SOURCE = "alarms";

    private final JdbcTemplate jdbcTemplate;

    public long countActiveStartedWithin(TimeWindow window) {
        String sql = """
            SELECT COUNT(*)
            FROM "ALARMHISTORY"
            WHERE "Al_Start_Time" >= ? AND "Al_Start_Time" < ?
            AND "Al_Norm_Time" IS NULL
            """;

        return count(sql, JdbcValues.start(window), JdbcValues.endExclusive(window));
    }

    public long countStartedWithin(TimeWindow window) {
        String sql = """
            SELECT COUNT(*)
            FROM "ALARMHISTORY"
            WHERE "Al_Start_Time" >= ? AND "Al_Start_Time" < ?
            """;

        return count(sql, JdbcValues.start(window), JdbcValues.endExclusive(window));
    }

    public long countAllActive() {
        String sql = """
            SELECT COUNT(*)
            FROM "ALARMHISTORY"
            WHERE "Al_Norm_Time" IS NULL
            """;

        return count(sql);
    }

    /**
     * Most frequent closed alarms whose start and normalization both fall inside the window.
     */
    public List<AlarmOccurrenceSummary> findTopClosedWithin(TimeWindow window, int limit) {
        String sql = """
            SELECT "Al_Tag" AS alarm_tag, "Al_Message" AS alarm_message,
                   COUNT(*) AS occurrences, MAX("Al_Start_Time") AS last_occurrence
            FROM "ALARMHISTORY"
            WHERE "Al_Start_Time" >= ? AND "Al_Start_Time" < ?
            AND "Al_Norm_Time" >= ? AND "Al_Norm_Time" < ?
            GROUP BY "Al_Tag", "Al_Message"
            ORDER BY occurrences DESC, alarm_tag, alarm_message
            LIMIT ?
            """;

        Timestamp start = JdbcValues.start(window);
        Timestamp end = JdbcValues.endExclusive(window);
        try {
            return jdbcTemplate.query(sql, new OccurrenceRowMapper(), start, end, start, end, limit);
        } catch (DataAccessException e) {
            throw new SourceUnavailableException(SOURCE, e);
        }
    }

    /**
     * Closed alarms that both started and normalized strictly after {@code since}. No upper bound.
     */
    public List<AlarmOccurrenceSummary> findTopClosedAfter(LocalDateTime since, int limit) {
        String sql = """
            SELECT "Al_Tag" AS alarm_tag, "Al_Message" AS alarm_message,
                   COUNT(*) AS occurrences, MAX("Al_Start_Time") AS last_occurrence
            FROM "ALARMHISTORY"
            WHERE "Al_Start_Time" > ?
            AND "Al_Norm_Time" > ?
            GROUP BY "Al_Tag", "Al_Message"
            ORDER BY occurrences DESC, alarm_tag, alarm_message
            LIMIT ?
            """;

        Timestamp threshold = Timestamp.valueOf(since);
        try {
            return jdbcTemplate.query(sql, new OccurrenceRowMapper(), threshold, threshold, limit);
        } catch (DataAccessException e) {
            throw new SourceUnavailableException(SOURCE, e);
        }
    }

    /**
     * Alarms started in the window keyed by priority level. Levels without alarms are absent.
     */
    public Map<Integer, Long> countByPriority(TimeWindow window) {
        String sql = """
            SELECT COALESCE("Al_Priority", 5) AS priority_level, COUNT(*) AS alarms
            FROM "ALARMHISTORY"
            WHERE "Al_Start_Time" >= ? AND "Al_Start_Time" < ?
            GROUP BY COALESCE("Al_Priority", 5)
            ORDER BY priority_level
            """;

        try {
            Map<Integer, Long> result = new LinkedHashMap<>();
            jdbcTemplate.query(sql, rs -> {
                result.put(readInt(rs, "priority_level"), readLong(rs, "alarms"));
            }, JdbcValues.start(window), JdbcValues.endExclusive(window));
            return result;
        } catch (DataAccessException e) {
            throw new SourceUnavailableException(SOURCE, e);
        }
    }

    public List<AlarmDayCount> countByDay(TimeWindow window) {
        String sql = """
            SELECT CAST("Al_Start_Time" AS DATE) AS report_day,
                   COUNT(*) AS alarms,
                   COUNT(CASE WHEN COALESCE("Al_Priority", 5) = 1 THEN 1 END) AS critical_alarms
            FROM "ALARMHISTORY"
            WHERE "Al_Start_Time" >= ? AND "Al_Start_Time" < ?
            GROUP BY CAST("Al_Start_Time" AS DATE)
            ORDER BY report_day
            """;

        try {
            return jdbcTemplate.query(sql, (rs, rowNum) -> new AlarmDayCount(
                    JdbcValues.readDate(rs, "report_day"),
                    readLong(rs, "alarms"),
                    readLong(rs, "critical_alarms")
            ), JdbcValues.start(window), JdbcValues.endExclusive(window));
        } catch (DataAccessException e) {
            throw new SourceUnavailableException(SOURCE, e);
        }
    }

    /**
     * Open alarms started at or after {@code since}, most severe first, then newest first.
     */
    public List<ActiveAlarm> findActive(LocalDateTime since, int limit) {
        String sql = """
            SELECT "Al_ID", "Al_Tag", "Al_Message", "Al_Start_Time", "Al_Priority", "Al_Selection"
            FROM "ALARMHISTORY"
            WHERE "Al_Norm_Time" IS NULL
            AND "Al_Start_Time" >= ?
            ORDER BY COALESCE("Al_Priority", 5), "Al_Start_Time" DESC
            LIMIT ?
            """;

        try {
            List<ActiveAlarm> alarms = jdbcTemplate.query(sql, new ActiveAlarmRowMapper(),
                    Timestamp.valueOf(since), limit);
            log.debug("{} active alarms since {}", alarms.size(), since);
            return alarms;
        } catch (DataAccessException e) {
            throw new SourceUnavailableException(SOURCE, e);
        }
    }

    private long count(String sql, Object... params) {
        try {
            Long rows = jdbcTemplate.queryForObject(sql, Long.class, params);
            return rows != null ? rows : 0L;
        } catch (DataAccessException e) {
            throw new SourceUnavailableException(SOURCE, e);
        }
    }

    private static class OccurrenceRowMapper implements RowMapper<AlarmOccurrenceSummary> {
        @Override
        public AlarmOccurrenceSummary mapRow(ResultSet rs, int rowNum) throws SQLException {
            return AlarmOccurrenceSummary.builder()
                    .tag(rs.getString("alarm_tag"))
                    .message(rs.getString("alarm_message"))
                    .occurrences(readLong(rs, "occurrences"))
                    .lastOccurrence(JdbcValues.readDateTime(rs, "last_occurrence"))
                    .build();
        }
    }

    private static class ActiveAlarmRowMapper implements RowMapper<ActiveAlarm> {
        @Override
        public ActiveAlarm mapRow(ResultSet rs, int rowNum) throws SQLException {
            return ActiveAlarm.builder()
                    .alarmId(readLong(rs, "Al_ID"))
                    .tag(rs.getString("Al_Tag"))
                    .message(rs.getString("Al_Message"))
                    .startTime(JdbcValues.readDateTime(rs, "Al_Start_Time"))
                    .priority(AlarmPriority.fromLevel(JdbcValues.readNullableInt(rs, "Al_Priority")))
                    .section(rs.getString("Al_Selection"))
                    .build();
        }
    }
}
