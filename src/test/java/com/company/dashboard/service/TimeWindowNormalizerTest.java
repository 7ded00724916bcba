package com.company.dashboard.service;

import com.company.dashboard.domain.TimeWindow;
import com.company.dashboard.support.DashboardFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class TimeWindowNormalizerTest {

    private TimeWindowNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new TimeWindowNormalizer(DashboardFixture.FIXED_CLOCK, 7);
    }

    @Test
    void missingBoundsDefaultToLookback() {
        TimeWindow window = normalizer.normalize(null, null);

        assertThat(window.getStart()).isEqualTo(LocalDateTime.of(2024, 1, 3, 15, 0));
        assertThat(window.getEndExclusive()).isEqualTo(LocalDateTime.of(2024, 1, 11, 0, 0));
        assertThat(window).isEqualTo(normalizer.defaultWindow());
    }

    @Test
    void blankStringsCountAsMissing() {
        TimeWindow window = normalizer.normalize("  ", "2024-01-09");

        assertThat(window.getStart()).isEqualTo(LocalDateTime.of(2024, 1, 3, 15, 0));
        assertThat(window.getEndExclusive()).isEqualTo(LocalDateTime.of(2024, 1, 10, 0, 0));
    }

    @Test
    void isoDatesIncludeTheEndDay() {
        TimeWindow window = normalizer.normalize("2024-01-01", "2024-01-07");

        assertThat(window.getStart()).isEqualTo(LocalDateTime.of(2024, 1, 1, 0, 0));
        assertThat(window.getEndExclusive()).isEqualTo(LocalDateTime.of(2024, 1, 8, 0, 0));
    }

    @Test
    void sameDayGivesSingleDayWindow() {
        TimeWindow window = normalizer.normalize("2024-01-07", "2024-01-07");

        assertThat(window).isEqualTo(TimeWindow.forDay(LocalDate.of(2024, 1, 7)));
    }

    @Test
    void endAtLastRepresentableDayFallsBackToDefault() {
        assertThat(normalizer.normalize("2024-01-01", "+999999999-12-31T10:00"))
                .isEqualTo(normalizer.defaultWindow());
        assertThat(normalizer.normalize("+999999999-12-31", "2024-01-01"))
                .isEqualTo(normalizer.defaultWindow());
    }

    @Test
    void acceptsLocalDateTimeText() {
        TimeWindow window = normalizer.normalize("2024-01-07 10:15", "2024-01-08T08:00:00");

        assertThat(window.getStart()).isEqualTo(LocalDateTime.of(2024, 1, 7, 10, 15));
        assertThat(window.getEndExclusive()).isEqualTo(LocalDateTime.of(2024, 1, 9, 0, 0));
    }

    @Test
    void offsetTextIsConvertedToPlantZone() {
        TimeWindow window = normalizer.normalize("2024-01-05T00:00:00Z", "2024-01-07T23:30:00-03:00");

        // 23:30 at -03:00 is already the 8th in UTC
        assertThat(window.getStart()).isEqualTo(LocalDateTime.of(2024, 1, 5, 0, 0));
        assertThat(window.getEndDateInclusive()).isEqualTo(LocalDate.of(2024, 1, 8));
    }

    @Test
    void acceptsTemporalAndLegacyTypes() {
        TimeWindow window = normalizer.normalize(
                java.sql.Date.valueOf("2024-01-05"), Instant.parse("2024-01-06T12:00:00Z"));

        assertThat(window.getStart()).isEqualTo(LocalDateTime.of(2024, 1, 5, 0, 0));
        assertThat(window.getEndExclusive()).isEqualTo(LocalDateTime.of(2024, 1, 7, 0, 0));

        TimeWindow fromLocalDates = normalizer.normalize(LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 3));
        assertThat(fromLocalDates.inclusiveDayCount()).isEqualTo(2);
    }

    @Test
    void unreadableBoundFallsBackToWholeDefaultWindow() {
        assertThat(normalizer.normalize("2024-01-01", "not-a-date")).isEqualTo(normalizer.defaultWindow());
        assertThat(normalizer.normalize("2024-13-45", null)).isEqualTo(normalizer.defaultWindow());
        assertThat(normalizer.normalize(42, "2024-01-07")).isEqualTo(normalizer.defaultWindow());
    }

    @Test
    void reversedBoundsAreSwapped() {
        TimeWindow window = normalizer.normalize("2024-01-07", "2024-01-01");

        assertThat(window.getStart()).isEqualTo(LocalDateTime.of(2024, 1, 1, 0, 0));
        assertThat(window.getEndExclusive()).isEqualTo(LocalDateTime.of(2024, 1, 8, 0, 0));
    }

    @Test
    void todayIsTheLiteralCalendarDay() {
        assertThat(normalizer.today()).isEqualTo(TimeWindow.forDay(LocalDate.of(2024, 1, 10)));
        assertThat(normalizer.currentDate()).isEqualTo(DashboardFixture.TODAY);
        assertThat(normalizer.forDay(LocalDate.of(2024, 1, 7)).getEndExclusive())
                .isEqualTo(LocalDateTime.of(2024, 1, 8, 0, 0));
    }
}
