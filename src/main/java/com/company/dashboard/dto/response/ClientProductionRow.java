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
public class ClientProductionRow {
    private int clientId;
    private String client;
    private BigDecimal totalKg;
    private long totalLoads;
    private BigDecimal avgWeight;
    private BigDecimal waterLiters;
    private BigDecimal waterPerKg;
}
