package com.company.dashboard.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.io.Serializable;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Half-open query interval [start, endExclusive). Every range query filters
 * {@code ts >= start AND ts < endExclusive}.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class TimeWindow implements Serializable {
    private static final long serialVersionUID = 1L;

    private final LocalDateTime start;
    private final LocalDateTime endExclusive;

    private TimeWindow(LocalDateTime start, LocalDateTime endExclusive) {
        if (start == null || endExclusive == null) {
            throw new IllegalArgumentException("Window bounds are required");
        }
        if (!start.isBefore(endExclusive)) {
            throw new IllegalArgumentException(
                    "Window start " + start + " must be before end " + endExclusive);
        }
        this.start = start;
        this.endExclusive = endExclusive;
    }

    public static TimeWindow of(LocalDateTime start, LocalDateTime endExclusive) {
        return new TimeWindow(start, endExclusive);
    }

    /**
     * The end day is fully included: endExclusive is the midnight after {@code endInclusive}.
     */
    public static TimeWindow fromInclusiveEnd(LocalDateTime start, LocalDateTime endInclusive) {
        return new TimeWindow(start, endInclusive.toLocalDate().plusDays(1).atStartOfDay());
    }

    public static TimeWindow forDay(LocalDate day) {
        return new TimeWindow(day.atStartOfDay(), day.plusDays(1).atStartOfDay());
    }

    public LocalDate getStartDate() {
        return start.toLocalDate();
    }

    /**
     * Last calendar day the window covers.
     */
    public LocalDate getEndDateInclusive() {
        return endExclusive.minusNanos(1).toLocalDate();
    }

    /**
     * Calendar days from start date to end date, both included. Used for daily averages,
     * independent of the time-of-day carried by {@link #start}.
     */
    public long inclusiveDayCount() {
        return ChronoUnit.DAYS.between(getStartDate(), getEndDateInclusive()) + 1;
    }

    public boolean isSingleDay() {
        return getStartDate().equals(getEndDateInclusive());
    }
}
