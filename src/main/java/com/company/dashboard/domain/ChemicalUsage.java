package com.company.dashboard.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChemicalUsage {
    private String chemical;   // Q1..Q9
    private double totalMl;
}
