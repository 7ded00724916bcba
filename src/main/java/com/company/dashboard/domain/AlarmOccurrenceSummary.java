package com.company.dashboard.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One entry of a top-N alarm list, grouped by tag and message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlarmOccurrenceSummary {
    private String tag;
    private String message;
    private long occurrences;
    private LocalDateTime lastOccurrence;
}
