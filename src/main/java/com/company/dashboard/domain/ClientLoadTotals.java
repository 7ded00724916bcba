package com.company.dashboard.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClientLoadTotals {
    private int clientId;
    private long loads;
    private double totalKg;
    private double waterM3;
}
