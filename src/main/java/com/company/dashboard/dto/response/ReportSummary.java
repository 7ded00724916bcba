package com.company.dashboard.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportSummary {
    private LocalDate periodStart;
    private LocalDate periodEnd;
    private long periodDays;
    private String periodLabel;
    private PeriodMetrics metrics;
    private long activeAlarmsToday;
    private Map<String, String> formatted;
}
