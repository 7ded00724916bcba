package com.company.dashboard.service;

import com.company.dashboard.domain.TimeWindow;
import com.company.dashboard.dto.response.KpiBundle;
import com.company.dashboard.dto.response.KpiResponse;
import com.company.dashboard.support.DashboardFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class KpiComposerTest {

    private static final LocalDateTime MIDNIGHT = LocalDateTime.of(2024, 1, 10, 0, 0);

    private DashboardFixture fixture;
    private TimeWindow firstWeek;

    @BeforeEach
    void setUp() {
        fixture = DashboardFixture.withSchema();
        firstWeek = fixture.windowNormalizer.normalize("2024-01-01", "2024-01-07");
    }

    @Test
    void efficiencyIsRatioOfSummedMinutes() {
        fixture.records
                .daily(LocalDateTime.of(2024, 1, 2, 23, 0), 10, 90, 1.0, 100, 1)
                .daily(LocalDateTime.of(2024, 1, 3, 23, 0), 90, 10, 1.0, 100, 1);

        KpiBundle period = fixture.kpiComposer.compose(firstWeek, null).getPeriod();

        assertThat(period.get("efficiency")).isEqualTo("50.0");
        assertThat(period.getRaw("efficiency")).isEqualByComparingTo("50.0");
    }

    @Test
    void periodBundleFormulas() {
        fixture.records
                .daily(LocalDateTime.of(2024, 1, 2, 23, 0), 0, 60, 1.5, 400, 1)
                .daily(LocalDateTime.of(2024, 1, 4, 23, 0), 0, 60, 1.5, 300, 1)
                .daily(LocalDateTime.of(2024, 1, 5, 23, 0), 0, 60, 0, 0, 1)
                .chemical(LocalDateTime.of(2024, 1, 3, 8, 0), 50.0, 37.5)
                .alarm("A", "a", LocalDateTime.of(2024, 1, 3, 8, 0), null, 1)
                .alarm("B", "b", LocalDateTime.of(2024, 1, 4, 8, 0), LocalDateTime.of(2024, 1, 4, 9, 0), 2);

        KpiBundle period = fixture.kpiComposer.compose(firstWeek, null).getPeriod();

        assertThat(period.get("production_kg")).isEqualTo("700");
        assertThat(period.get("cycles")).isEqualTo("2");
        assertThat(period.get("weight_per_cycle")).isEqualTo("350.00");
        assertThat(period.get("water_liters")).isEqualTo("3,000");
        assertThat(period.get("water_per_kg")).isEqualTo("4.29");
        assertThat(period.get("chemicals_ml")).isEqualTo("88");
        assertThat(period.get("chemical_per_kg")).isEqualTo("0.125");
        assertThat(period.get("daily_average_kg")).isEqualTo("100");
        assertThat(period.get("day_count")).isEqualTo("7");
        assertThat(period.get("period_alarms")).isEqualTo("2");
    }

    @Test
    void zeroDenominatorsGiveZeroNotErrors() {
        fixture.records.chemical(LocalDateTime.of(2024, 1, 3, 8, 0), 80.0);

        KpiBundle period = fixture.kpiComposer.compose(firstWeek, null).getPeriod();

        assertThat(period.get("production_kg")).isEqualTo("0");
        assertThat(period.get("weight_per_cycle")).isEqualTo("0.00");
        assertThat(period.get("water_per_kg")).isEqualTo("0.00");
        assertThat(period.get("chemical_per_kg")).isEqualTo("0.000");
        assertThat(period.get("efficiency")).isEqualTo("0.0");
        assertThat(period.get("chemicals_ml")).isEqualTo("80");
    }

    @Test
    void clientFilterLeavesChemicalRatioOnTotalProduction() {
        fixture.records
                .daily(LocalDateTime.of(2024, 1, 2, 23, 0), 0, 60, 1.0, 100, 1)
                .daily(LocalDateTime.of(2024, 1, 3, 23, 0), 0, 60, 2.0, 300, 2)
                .chemical(LocalDateTime.of(2024, 1, 3, 8, 0), 80.0);

        KpiBundle period = fixture.kpiComposer.compose(firstWeek, 1).getPeriod();

        assertThat(period.get("production_kg")).isEqualTo("100");
        assertThat(period.get("water_liters")).isEqualTo("1,000");
        assertThat(period.get("water_per_kg")).isEqualTo("10.00");
        assertThat(period.get("chemical_per_kg")).isEqualTo("0.200");
    }

    @Test
    void todayFallsBackToLatestStatusDay() {
        fixture.records
                .status(LocalDateTime.of(2024, 1, 7, 9, 0), 1.0, 2, 200, 1)
                .status(LocalDateTime.of(2024, 1, 7, 21, 0), 2.0, 4, 500, 1)
                .chemical(LocalDateTime.of(2024, 1, 7, 12, 0), 100.0);

        KpiBundle today = fixture.kpiComposer.compose(firstWeek, null).getToday();

        assertThat(today.get("reference_date")).isEqualTo("07/01/2024");
        assertThat(today.get("reference_state")).isEqualTo("FALLBACK_TO_LATEST");
        assertThat(today.get("kg_washed")).isEqualTo("500");
        assertThat(today.get("cycles")).isEqualTo("4");
        assertThat(today.get("water_liters")).isEqualTo("2,000");
        assertThat(today.get("weight_per_cycle")).isEqualTo("125.00");
        assertThat(today.get("water_per_kg")).isEqualTo("4.00");
        assertThat(today.get("chemicals_ml")).isEqualTo("100");
        assertThat(today.get("chemical_per_kg")).isEqualTo("0.200");
    }

    @Test
    void ledgerCardsAndActiveAlarmsUseTheLiteralToday() {
        fixture.records
                // status only on an older day, so the status cards fall back
                .status(LocalDateTime.of(2024, 1, 7, 21, 0), 2.0, 4, 500, 1)
                .load(LocalDateTime.of(2024, 1, 7, 10, 0), 1, 999, 9)
                .load(MIDNIGHT.plusHours(8), 1, 40, 0.2)
                .load(MIDNIGHT.plusHours(9), 1, 0, 0.5)
                .alarm("T1", "Door open", MIDNIGHT.plusHours(1), null, 2)
                .alarm("T2", "Old open", LocalDateTime.of(2024, 1, 7, 10, 0), null, 2);

        KpiBundle today = fixture.kpiComposer.compose(firstWeek, null).getToday();

        assertThat(today.get("current_day_load_kg")).isEqualTo("40");
        assertThat(today.get("current_day_loads")).isEqualTo("1");
        assertThat(today.get("current_day_load_water_liters")).isEqualTo("200");
        assertThat(today.get("current_day_load_water_per_kg")).isEqualTo("5.00");
        assertThat(today.get("active_alarms")).isEqualTo("1");
    }

    @Test
    void miscCarriesLabelsAndRankings() {
        fixture.records
                .alarm("SOAP", "Soap low", MIDNIGHT.plusHours(1), MIDNIGHT.plusHours(2), 3)
                .alarm("PUMP", "Pump fault", LocalDateTime.of(2024, 1, 2, 8, 0), LocalDateTime.of(2024, 1, 2, 9, 0), 1)
                .alarm("OPEN", "Still open", MIDNIGHT.plusHours(3), null, 1)
                .chemical(LocalDateTime.of(2024, 1, 3, 8, 0), 12.0)
                .program(3, "Delicate")
                .load(LocalDateTime.of(2024, 1, 4, 8, 0), 3, 7, 40, 1);

        KpiResponse response = fixture.kpiComposer.compose(firstWeek, null);

        assertThat(response.getMisc().getPeriodLabel()).isEqualTo("01/01 to 07/01/2024");
        assertThat(response.getMisc().getTodayLabel()).isEqualTo("Latest data 10/01/2024");
        assertThat(response.getMisc().getTopAlarmsToday()).extracting("tag").containsExactly("SOAP");
        assertThat(response.getMisc().getTopAlarmsPeriod()).extracting("tag").containsExactly("PUMP");
        assertThat(response.getMisc().getAlarmsByPriority()).containsEntry("CRITICAL", 1L).hasSize(5);
        assertThat(response.getMisc().getChemicalsByProduct()).containsEntry("Q1", "12").hasSize(9);
        assertThat(response.getMisc().getActiveAlarms()).extracting("tag").containsExactly("OPEN");
        assertThat(response.getMisc().getProductionByProgram()).singleElement().satisfies(row -> {
            assertThat(row.getProgram()).isEqualTo("Delicate");
            assertThat(row.getLoads()).isEqualTo(1);
            assertThat(row.getAvgKg()).isEqualByComparingTo("40");
        });
        assertThat(response.getPeriodStart()).isEqualTo(firstWeek.getStartDate());
        assertThat(response.getPeriodEnd()).isEqualTo(firstWeek.getEndDateInclusive());
    }

    @Test
    void totalSourceFailureYieldsZeroBundlesWithoutThrowing() {
        DashboardFixture broken = DashboardFixture.withoutSchema();

        assertThatCode(() -> broken.kpiComposer.compose(firstWeek, 3)).doesNotThrowAnyException();

        KpiResponse response = broken.kpiComposer.compose(firstWeek, 3);
        assertThat(response.getToday().get("kg_washed")).isEqualTo("0");
        assertThat(response.getToday().get("reference_state")).isEqualTo("FALLBACK_TO_LATEST");
        assertThat(response.getToday().get("active_alarms")).isEqualTo("0");
        assertThat(response.getPeriod().get("production_kg")).isEqualTo("0");
        assertThat(response.getPeriod().get("efficiency")).isEqualTo("0.0");
        assertThat(response.getMisc().getTopAlarmsPeriod()).isEmpty();
        assertThat(response.getMisc().getActiveAlarms()).isEmpty();
        assertThat(response.getMisc().getProductionByProgram()).isEmpty();
        assertThat(broken.meterRegistry.find("dashboard.source.unavailable").counters()).isNotEmpty();
    }
}
