package com.company.dashboard.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Last cumulative status poll of a day (Sts_Dados). Values accumulate during the day
 * and reset at midnight, so a snapshot is read, never summed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusSnapshot {
    private LocalDateTime recordedAt;
    private double kgWashed;     // D3
    private long cycles;         // D2
    private double waterM3;      // D1
    private Integer clientId;    // D5

    public static StatusSnapshot empty() {
        return new StatusSnapshot(null, 0.0, 0L, 0.0, null);
    }
}
