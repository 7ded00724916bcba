package com.company.dashboard.repository;

import com.company.dashboard.domain.TimeWindow;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Parameter binding and column decoding shared by the record source repositories.
 */
final class JdbcValues {

    private JdbcValues() {
    }

    static Timestamp start(TimeWindow window) {
        return Timestamp.valueOf(window.getStart());
    }

    static Timestamp endExclusive(TimeWindow window) {
        return Timestamp.valueOf(window.getEndExclusive());
    }

    static LocalDateTime readDateTime(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toLocalDateTime() : null;
    }

    static LocalDate readDate(ResultSet rs, String column) throws SQLException {
        Date date = rs.getDate(column);
        return date != null ? date.toLocalDate() : null;
    }

    static Integer readNullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }
}
