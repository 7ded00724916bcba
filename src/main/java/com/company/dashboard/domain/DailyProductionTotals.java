package com.company.dashboard.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyProductionTotals {
    private LocalDate day;
    private long cycles;
    private double totalKg;
    private double productionMinutes;
    private double downtimeMinutes;
}
