package com.company.dashboard.domain;

import com.company.dashboard.util.Ratios;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sums over consolidated daily records (Rel_Diario) for one window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductionTotals {
    private long records;
    private long cycles;              // records with production kg > 0
    private double totalKg;
    private double productionMinutes;
    private double downtimeMinutes;

    public static ProductionTotals empty() {
        return new ProductionTotals(0L, 0L, 0.0, 0.0, 0.0);
    }

    public double efficiencyPercent() {
        return Ratios.efficiencyPercent(productionMinutes, downtimeMinutes);
    }
}
