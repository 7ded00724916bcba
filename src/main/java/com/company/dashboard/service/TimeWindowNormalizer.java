package com.company.dashboard.service;

import com.company.dashboard.domain.TimeWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.Date;

/**
 * Converts loosely typed period bounds into a half-open {@link TimeWindow}.
 * <p>
 * Missing bounds fall back to the default lookback; an unreadable bound replaces the
 * whole window with the default one. The end day is always fully included.
 */
@Service
@Slf4j
public class TimeWindowNormalizer {

    private final Clock clock;
    private final int lookbackDays;

    public TimeWindowNormalizer(Clock clock,
                                @Value("${dashboard.default-lookback-days:7}") int lookbackDays) {
        this.clock = clock;
        this.lookbackDays = lookbackDays;
    }

    public TimeWindow normalize(Object start, Object end) {
        try {
            return toWindow(toLocalDateTime(start), toLocalDateTime(end));
        } catch (DateTimeException | IllegalArgumentException e) {
            log.warn("Unreadable period bounds start={} end={}, using the last {} days: {}",
                    start, end, lookbackDays, e.getMessage());
            return defaultWindow();
        }
    }

    private TimeWindow toWindow(LocalDateTime from, LocalDateTime to) {
        LocalDateTime now = LocalDateTime.now(clock);
        if (from == null) {
            from = now.minusDays(lookbackDays);
        }
        if (to == null) {
            to = now;
        }

        if (from.toLocalDate().isAfter(to.toLocalDate())) {
            log.debug("Reversed period bounds {} / {}, swapping", from, to);
            return TimeWindow.fromInclusiveEnd(to.toLocalDate().atStartOfDay(), from);
        }
        return TimeWindow.fromInclusiveEnd(from, to);
    }

    public TimeWindow defaultWindow() {
        LocalDateTime now = LocalDateTime.now(clock);
        return TimeWindow.fromInclusiveEnd(now.minusDays(lookbackDays), now);
    }

    /**
     * Literal calendar day in the plant zone, [midnight, next midnight).
     */
    public TimeWindow today() {
        return TimeWindow.forDay(currentDate());
    }

    public TimeWindow forDay(LocalDate day) {
        return TimeWindow.forDay(day);
    }

    public LocalDate currentDate() {
        return LocalDate.now(clock);
    }

    private LocalDateTime toLocalDateTime(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof CharSequence) {
            String text = value.toString().trim();
            return text.isEmpty() ? null : parse(text);
        }
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay();
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).atZoneSameInstant(clock.getZone()).toLocalDateTime();
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).withZoneSameInstant(clock.getZone()).toLocalDateTime();
        }
        if (value instanceof Instant) {
            return LocalDateTime.ofInstant((Instant) value, clock.getZone());
        }
        // java.sql.Date does not support toInstant()
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate().atStartOfDay();
        }
        if (value instanceof Date) {
            return LocalDateTime.ofInstant(((Date) value).toInstant(), clock.getZone());
        }
        throw new IllegalArgumentException("Unsupported date type " + value.getClass().getName());
    }

    private LocalDateTime parse(String text) {
        if (text.length() == 10) {
            return LocalDate.parse(text).atStartOfDay();
        }
        TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text.replace(' ', 'T'),
                ZonedDateTime::from, OffsetDateTime::from, LocalDateTime::from);
        if (parsed instanceof ZonedDateTime) {
            return ((ZonedDateTime) parsed).withZoneSameInstant(clock.getZone()).toLocalDateTime();
        }
        if (parsed instanceof OffsetDateTime) {
            return ((OffsetDateTime) parsed).atZoneSameInstant(clock.getZone()).toLocalDateTime();
        }
        return (LocalDateTime) parsed;
    }
}
