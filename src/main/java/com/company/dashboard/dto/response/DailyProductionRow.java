package com.company.dashboard.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyProductionRow {
    private LocalDate day;
    private BigDecimal kg;
    private long cycles;
    private long loads;
    private BigDecimal productionMinutes;
    private BigDecimal downtimeMinutes;
    private BigDecimal efficiency;
}
