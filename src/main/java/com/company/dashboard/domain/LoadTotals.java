package com.company.dashboard.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sums over the per-load ledger (Rel_Carga) for one window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoadTotals {
    private long loads;
    private long productiveLoads;   // loads with kg > 0
    private double totalKg;
    private double productiveKg;
    private double waterM3;

    public static LoadTotals empty() {
        return new LoadTotals(0L, 0L, 0.0, 0.0, 0.0);
    }
}
