package com.company.dashboard.util;

import com.company.dashboard.domain.TimeWindow;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Display scales and formatting shared by the KPI bundles and the report summary.
 */
public final class KpiFormatUtils {

    public static final int KG_SCALE = 0;
    public static final int LITERS_SCALE = 0;
    public static final int CHEMICALS_SCALE = 0;
    public static final int WEIGHT_PER_CYCLE_SCALE = 2;
    public static final int WATER_PER_KG_SCALE = 2;
    public static final int CHEMICAL_PER_KG_SCALE = 3;
    public static final int EFFICIENCY_SCALE = 1;
    public static final int MINUTES_SCALE = 0;

    private static final double ABBREVIATE_LITERS_FROM = 1_000_000;

    private static final DateTimeFormatter DAY_MONTH = DateTimeFormatter.ofPattern("dd/MM");
    private static final DateTimeFormatter DAY_MONTH_YEAR = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    private KpiFormatUtils() {
    }

    /**
     * Whole number with thousands grouping, e.g. 12,345
     */
    public static String formatWhole(BigDecimal value) {
        if (value == null) return "0";
        return String.format(Locale.US, "%,d", value.setScale(0, RoundingMode.HALF_UP).longValue());
    }

    public static String formatWhole(long value) {
        return String.format(Locale.US, "%,d", value);
    }

    public static String formatDecimal(BigDecimal value, int scale) {
        if (value == null) value = BigDecimal.ZERO;
        return value.setScale(scale, RoundingMode.HALF_UP).toPlainString();
    }

    /**
     * Liter totals switch to k/M/B notation from one million upwards.
     */
    public static String formatLiters(BigDecimal liters) {
        if (liters == null) return "0";
        if (Math.abs(liters.doubleValue()) >= ABBREVIATE_LITERS_FROM) {
            return abbreviate(liters.doubleValue());
        }
        return formatWhole(liters);
    }

    public static String abbreviate(double value) {
        if (value == 0 || !Double.isFinite(value)) return "0";

        double abs = Math.abs(value);
        if (abs >= 1_000_000_000) {
            return String.format(Locale.US, "%.1fB", value / 1_000_000_000);
        } else if (abs >= 1_000_000) {
            return String.format(Locale.US, "%.1fM", value / 1_000_000);
        } else if (abs >= 1_000) {
            return String.format(Locale.US, "%.1fk", value / 1_000);
        }
        return String.format(Locale.US, "%.0f", value);
    }

    public static String periodLabel(TimeWindow window) {
        LocalDate first = window.getStartDate();
        LocalDate last = window.getEndDateInclusive();
        if (first.equals(last)) {
            return "Day " + first.format(DAY_MONTH_YEAR);
        }
        return first.format(DAY_MONTH) + " to " + last.format(DAY_MONTH_YEAR);
    }
}
