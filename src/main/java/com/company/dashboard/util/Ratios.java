package com.company.dashboard.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Derived KPI ratios. A zero or non-finite denominator always yields 0.0.
 */
public final class Ratios {

    private static final double LITERS_PER_CUBIC_METER = 1000.0;

    private Ratios() {
    }

    public static double safeDivide(double numerator, double denominator) {
        if (denominator == 0.0 || !Double.isFinite(denominator) || !Double.isFinite(numerator)) {
            return 0.0;
        }
        double result = numerator / denominator;
        return Double.isFinite(result) ? result : 0.0;
    }

    public static double toLiters(double cubicMeters) {
        return cubicMeters * LITERS_PER_CUBIC_METER;
    }

    public static double weightPerCycle(double totalKg, double cycles) {
        return safeDivide(totalKg, cycles);
    }

    /**
     * Liters of water per kilogram; water is recorded in cubic meters.
     */
    public static double waterPerKg(double waterCubicMeters, double totalKg) {
        return safeDivide(toLiters(waterCubicMeters), totalKg);
    }

    public static double chemicalPerKg(double chemicalTotal, double totalKg) {
        return safeDivide(chemicalTotal, totalKg);
    }

    /**
     * Efficiency over summed minutes, never a mean of per-record ratios.
     */
    public static double efficiencyPercent(double productionMinutes, double downtimeMinutes) {
        return safeDivide(productionMinutes, productionMinutes + downtimeMinutes) * 100.0;
    }

    public static double dailyAverage(double total, long dayCount) {
        return dayCount > 0 ? safeDivide(total, dayCount) : 0.0;
    }

    public static BigDecimal round(double value, int scale) {
        if (!Double.isFinite(value)) {
            return BigDecimal.ZERO.setScale(scale, RoundingMode.HALF_UP);
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP);
    }
}
