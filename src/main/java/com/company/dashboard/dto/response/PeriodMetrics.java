package com.company.dashboard.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Rounded period figures shared by the period bundle and the report summary.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PeriodMetrics {
    private BigDecimal productionKg;
    private long cycles;
    private BigDecimal weightPerCycle;
    private BigDecimal waterLiters;
    private BigDecimal waterPerKg;
    private BigDecimal chemicalsMl;
    private BigDecimal chemicalPerKg;
    private BigDecimal efficiency;
    private BigDecimal dailyAverageKg;
    private long dayCount;
    private long periodAlarms;
}
