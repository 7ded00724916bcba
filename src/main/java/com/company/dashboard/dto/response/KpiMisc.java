package com.company.dashboard.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Labels, rankings and breakdowns shown next to the KPI cards.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KpiMisc {
    private String periodLabel;
    private String todayLabel;
    private List<AlarmRankingEntry> topAlarmsToday;
    private List<AlarmRankingEntry> topAlarmsPeriod;
    private Map<String, Long> alarmsByPriority;
    private Map<String, String> chemicalsByProduct;
    private List<ActiveAlarmResponse> activeAlarms;
    private List<ProgramProductionRow> productionByProgram;
}
