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
public class WaterChemicalsDailyRow {
    private LocalDate day;
    private BigDecimal kg;
    private BigDecimal waterLiters;
    private BigDecimal chemicalsMl;
    private BigDecimal waterPerKg;
    private BigDecimal chemicalPerKg;
}
