package com.company.dashboard.service;

import com.company.dashboard.domain.TimeWindow;
import com.company.dashboard.dto.response.ClientProductionRow;
import com.company.dashboard.dto.response.DailyProductionRow;
import com.company.dashboard.dto.response.ReportDataset;
import com.company.dashboard.dto.response.WaterChemicalsDailyRow;
import com.company.dashboard.support.DashboardFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class ReportDatasetBuilderTest {

    private DashboardFixture fixture;
    private TimeWindow firstWeek;

    @BeforeEach
    void setUp() {
        fixture = DashboardFixture.withSchema();
        firstWeek = fixture.windowNormalizer.normalize("2024-01-01", "2024-01-07");

        fixture.records
                .load(LocalDateTime.of(2024, 1, 2, 8, 0), 7, 100, 50)
                .load(LocalDateTime.of(2024, 1, 3, 8, 0), 7, 200, 80)
                .load(LocalDateTime.of(2024, 1, 3, 9, 0), 7, 0, 0)
                .daily(LocalDateTime.of(2024, 1, 2, 23, 0), 10, 90, 50, 100, 7)
                .daily(LocalDateTime.of(2024, 1, 3, 23, 0), 90, 10, 80, 200, 7)
                .chemical(LocalDateTime.of(2024, 1, 3, 12, 0), 30.0)
                .chemical(LocalDateTime.of(2024, 1, 6, 12, 0), 5.0)
                .alarm("PUMP", "Pump fault", LocalDateTime.of(2024, 1, 3, 10, 0), null, 1)
                .alarm("DOOR", "Door open", LocalDateTime.of(2024, 1, 3, 11, 0), null, 3);
    }

    @Test
    void productionByClientForTheReferenceScenario() {
        ReportDataset dataset = fixture.reportDatasetBuilder.build(firstWeek);

        assertThat(dataset.getProductionByClient()).hasSize(1);
        ClientProductionRow row = dataset.getProductionByClient().get(0);
        assertThat(row.getClientId()).isEqualTo(7);
        assertThat(row.getClient()).isEqualTo("Client 7");
        assertThat(row.getTotalKg()).isEqualByComparingTo("300");
        assertThat(row.getTotalLoads()).isEqualTo(3);
        assertThat(row.getAvgWeight()).isEqualByComparingTo("100");
        assertThat(row.getWaterLiters()).isEqualByComparingTo("130000");
        assertThat(row.getWaterPerKg()).isEqualByComparingTo("433.33");
    }

    @Test
    void clientRowsUseRegisteredAlias() {
        fixture.records.alias(7, "Hotel Sol");

        ReportDataset dataset = fixture.reportDatasetBuilder.build(firstWeek);

        assertThat(dataset.getProductionByClient().get(0).getClient()).isEqualTo("Hotel Sol");
    }

    @Test
    void dailyProductionReconcilesWithSummary() {
        ReportDataset dataset = fixture.reportDatasetBuilder.build(firstWeek);

        BigDecimal dailySum = dataset.getDailyProduction().stream()
                .map(DailyProductionRow::getKg)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        assertThat(dailySum).isEqualByComparingTo(dataset.getSummary().getMetrics().getProductionKg());
        assertThat(dataset.getSummary().getMetrics().getProductionKg()).isEqualByComparingTo("300");
        assertThat(dataset.getSummary().getMetrics().getEfficiency()).isEqualByComparingTo("50.0");
        assertThat(dataset.getSummary().getFormatted()).containsEntry("production_kg", "300");
        assertThat(dataset.getSummary().getPeriodDays()).isEqualTo(7);
    }

    @Test
    void dailyProductionMergesLedgerLoadCount() {
        ReportDataset dataset = fixture.reportDatasetBuilder.build(firstWeek);

        assertThat(dataset.getDailyProduction()).extracting(DailyProductionRow::getDay)
                .containsExactly(LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 3));
        DailyProductionRow third = dataset.getDailyProduction().get(1);
        assertThat(third.getLoads()).isEqualTo(2);
        assertThat(third.getCycles()).isEqualTo(1);
        assertThat(third.getEfficiency()).isEqualByComparingTo("10.0");
    }

    @Test
    void waterAndChemicalsAreOuterMergedByDay() {
        ReportDataset dataset = fixture.reportDatasetBuilder.build(firstWeek);

        assertThat(dataset.getWaterChemicalsDaily()).extracting(WaterChemicalsDailyRow::getDay)
                .containsExactly(LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 3), LocalDate.of(2024, 1, 6));

        WaterChemicalsDailyRow third = dataset.getWaterChemicalsDaily().get(1);
        assertThat(third.getWaterLiters()).isEqualByComparingTo("80000");
        assertThat(third.getWaterPerKg()).isEqualByComparingTo("400.00");
        assertThat(third.getChemicalPerKg()).isEqualByComparingTo("0.150");

        // chemicals without production on that day
        WaterChemicalsDailyRow sixth = dataset.getWaterChemicalsDaily().get(2);
        assertThat(sixth.getKg()).isEqualByComparingTo("0");
        assertThat(sixth.getChemicalsMl()).isEqualByComparingTo("5");
        assertThat(sixth.getChemicalPerKg()).isEqualByComparingTo("0");
    }

    @Test
    void alarmsPerDayWithCriticalCount() {
        ReportDataset dataset = fixture.reportDatasetBuilder.build(firstWeek);

        assertThat(dataset.getAlarmsDaily()).hasSize(1);
        assertThat(dataset.getAlarmsDaily().get(0).getAlarms()).isEqualTo(2);
        assertThat(dataset.getAlarmsDaily().get(0).getCriticalAlarms()).isEqualTo(1);
        assertThat(dataset.getSummary().getMetrics().getPeriodAlarms()).isEqualTo(2);
    }

    @Test
    void buildsAreIdempotent() {
        ReportDataset first = fixture.reportDatasetBuilder.build(firstWeek);
        ReportDataset second = fixture.reportDatasetBuilder.build(firstWeek);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void totalSourceFailureStillReturnsSummaryAndEmptyTables() {
        DashboardFixture broken = DashboardFixture.withoutSchema();

        ReportDataset dataset = broken.reportDatasetBuilder.build(firstWeek);

        assertThat(dataset.getSummary()).isNotNull();
        assertThat(dataset.getSummary().getMetrics().getProductionKg()).isEqualByComparingTo("0");
        assertThat(dataset.getProductionByClient()).isEmpty();
        assertThat(dataset.getDailyProduction()).isEmpty();
        assertThat(dataset.getWaterChemicalsDaily()).isEmpty();
        assertThat(dataset.getAlarmsDaily()).isEmpty();
    }
}
