package com.company.dashboard.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KpiResponse {
    private LocalDate periodStart;
    private LocalDate periodEnd;
    private Integer clientId;
    private KpiBundle today;
    private KpiBundle period;
    private KpiMisc misc;
    private PeriodMetrics periodMetrics;
}
