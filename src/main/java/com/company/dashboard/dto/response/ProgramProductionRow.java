package com.company.dashboard.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProgramProductionRow {
    private int programId;
    private String program;
    private long loads;
    private BigDecimal totalKg;
    private BigDecimal avgKg;
}
