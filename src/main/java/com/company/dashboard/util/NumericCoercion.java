package com.company.dashboard.util;

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Lenient numeric decoding for raw record columns. Anything that is not a finite number reads as zero.
 */
public final class NumericCoercion {

    private NumericCoercion() {
    }

    public static double toDouble(Object value) {
        if (value == null) return 0.0;
        if (value instanceof Number) {
            double number = ((Number) value).doubleValue();
            return Double.isFinite(number) ? number : 0.0;
        }
        if (value instanceof CharSequence) {
            String text = value.toString().trim();
            if (text.isEmpty()) return 0.0;
            try {
                double parsed = Double.parseDouble(text);
                return Double.isFinite(parsed) ? parsed : 0.0;
            } catch (NumberFormatException e) {
                return 0.0;
            }
        }
        return 0.0;
    }

    public static long toLong(Object value) {
        if (value instanceof Long || value instanceof Integer || value instanceof Short) {
            return ((Number) value).longValue();
        }
        return (long) toDouble(value);
    }

    public static int toInt(Object value) {
        return (int) toLong(value);
    }

    public static double readDouble(ResultSet rs, String column) throws SQLException {
        return toDouble(rs.getObject(column));
    }

    public static long readLong(ResultSet rs, String column) throws SQLException {
        return toLong(rs.getObject(column));
    }

    public static int readInt(ResultSet rs, String column) throws SQLException {
        return toInt(rs.getObject(column));
    }
}
