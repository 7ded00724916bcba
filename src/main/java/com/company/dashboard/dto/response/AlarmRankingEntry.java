package com.company.dashboard.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlarmRankingEntry {
    private String tag;
    private String message;
    private long occurrences;
    private LocalDateTime lastOccurrence;
}
