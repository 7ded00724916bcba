package com.company.dashboard.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ledger loads of one wash program. {@code programName} is null when the program
 * is not registered.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProgramLoadTotals {
    private int programId;
    private String programName;
    private long loads;
    private double totalKg;
    private double avgKg;

    public String displayName() {
        return programName != null && !programName.isBlank() ? programName : "Program " + programId;
    }
}
