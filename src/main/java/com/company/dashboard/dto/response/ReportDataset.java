package com.company.dashboard.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Tables behind the period report export. Each table is built independently.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportDataset {
    private ReportSummary summary;
    private List<ClientProductionRow> productionByClient;
    private List<DailyProductionRow> dailyProduction;
    private List<WaterChemicalsDailyRow> waterChemicalsDaily;
    private List<AlarmDailyRow> alarmsDaily;
}
