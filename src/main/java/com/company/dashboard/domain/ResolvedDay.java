package com.company.dashboard.domain;

import com.company.dashboard.domain.enums.ReferenceDayState;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.LocalDate;

/**
 * Day whose cumulative status values back the "today" KPIs.
 */
@Data
@AllArgsConstructor
public class ResolvedDay {
    private LocalDate date;
    private ReferenceDayState state;

    public static ResolvedDay today(LocalDate today) {
        return new ResolvedDay(today, ReferenceDayState.HAS_TODAY_DATA);
    }

    public static ResolvedDay latest(LocalDate latest) {
        return new ResolvedDay(latest, ReferenceDayState.FALLBACK_TO_LATEST);
    }

    public boolean isFallback() {
        return state == ReferenceDayState.FALLBACK_TO_LATEST;
    }
}
