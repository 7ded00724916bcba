package com.company.dashboard.service;

import com.company.dashboard.domain.ClientAliasSnapshot;
import com.company.dashboard.domain.DailyProductionTotals;
import com.company.dashboard.domain.TimeWindow;
import com.company.dashboard.dto.response.AlarmDailyRow;
import com.company.dashboard.dto.response.ClientProductionRow;
import com.company.dashboard.dto.response.DailyProductionRow;
import com.company.dashboard.dto.response.KpiResponse;
import com.company.dashboard.dto.response.ReportDataset;
import com.company.dashboard.dto.response.ReportSummary;
import com.company.dashboard.dto.response.WaterChemicalsDailyRow;
import com.company.dashboard.service.aggregation.AlarmAggregator;
import com.company.dashboard.service.aggregation.ChemicalAggregator;
import com.company.dashboard.service.aggregation.ProductionAggregator;
import com.company.dashboard.service.aggregation.WaterAggregator;
import com.company.dashboard.util.Ratios;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static com.company.dashboard.util.KpiFormatUtils.*;

/**
 * Assembles the multi-table period report. The summary comes from a single KPI
 * composition; the tables re-query by day and by client, and one alias snapshot
 * names every client row of the build.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReportDatasetBuilder {

    private static final int AVG_WEIGHT_SCALE = 2;

    private final KpiComposer kpiComposer;
    private final ClientAliasResolver aliasResolver;
    private final ProductionAggregator productionAggregator;
    private final WaterAggregator waterAggregator;
    private final ChemicalAggregator chemicalAggregator;
    private final AlarmAggregator alarmAggregator;

    public ReportDataset build(TimeWindow window) {
        long startTime = System.currentTimeMillis();
        ClientAliasSnapshot aliases = aliasResolver.snapshot();

        KpiResponse composition = kpiComposer.compose(window, null);

        ReportDataset dataset = ReportDataset.builder()
                .summary(toSummary(window, composition))
                .productionByClient(buildTable("productionByClient", window,
                        () -> productionByClient(window, aliases)))
                .dailyProduction(buildTable("dailyProduction", window,
                        () -> dailyProduction(window)))
                .waterChemicalsDaily(buildTable("waterChemicalsDaily", window,
                        () -> waterChemicalsDaily(window)))
                .alarmsDaily(buildTable("alarmsDaily", window,
                        () -> alarmsDaily(window)))
                .build();

        log.info("Built report dataset for {} to {}: {} client rows, {} production days in {}ms",
                window.getStartDate(), window.getEndDateInclusive(),
                dataset.getProductionByClient().size(), dataset.getDailyProduction().size(),
                System.currentTimeMillis() - startTime);
        return dataset;
    }

    private ReportSummary toSummary(TimeWindow window, KpiResponse composition) {
        BigDecimal activeToday = composition.getToday().getRaw("active_alarms");
        return ReportSummary.builder()
                .periodStart(window.getStartDate())
                .periodEnd(window.getEndDateInclusive())
                .periodDays(window.inclusiveDayCount())
                .periodLabel(composition.getMisc().getPeriodLabel())
                .metrics(composition.getPeriodMetrics())
                .activeAlarmsToday(activeToday != null ? activeToday.longValue() : 0L)
                .formatted(composition.getPeriod().getValues())
                .build();
    }

    List<ClientProductionRow> productionByClient(TimeWindow window, ClientAliasSnapshot aliases) {
        return productionAggregator.loadsByClient(window).stream()
                .map(totals -> ClientProductionRow.builder()
                        .clientId(totals.getClientId())
                        .client(aliases.resolve(totals.getClientId()))
                        .totalKg(Ratios.round(totals.getTotalKg(), KG_SCALE))
                        .totalLoads(totals.getLoads())
                        .avgWeight(Ratios.round(
                                Ratios.safeDivide(totals.getTotalKg(), totals.getLoads()), AVG_WEIGHT_SCALE))
                        .waterLiters(Ratios.round(Ratios.toLiters(totals.getWaterM3()), LITERS_SCALE))
                        .waterPerKg(Ratios.round(
                                Ratios.waterPerKg(totals.getWaterM3(), totals.getTotalKg()), WATER_PER_KG_SCALE))
                        .build())
                .collect(Collectors.toList());
    }

    /**
     * Consolidated production per day, merged with the ledger load count. Days that only
     * appear in the ledger carry zero production.
     */
    List<DailyProductionRow> dailyProduction(TimeWindow window) {
        Map<LocalDate, DailyProductionTotals> production = new TreeMap<>();
        for (DailyProductionTotals day : productionAggregator.consolidatedByDay(window)) {
            production.put(day.getDay(), day);
        }
        Map<LocalDate, Long> loads = productionAggregator.loadCountByDay(window);

        TreeSet<LocalDate> days = new TreeSet<>(production.keySet());
        days.addAll(loads.keySet());

        List<DailyProductionRow> rows = new ArrayList<>(days.size());
        for (LocalDate day : days) {
            DailyProductionTotals totals = production.getOrDefault(day,
                    new DailyProductionTotals(day, 0L, 0.0, 0.0, 0.0));
            rows.add(DailyProductionRow.builder()
                    .day(day)
                    .kg(Ratios.round(totals.getTotalKg(), KG_SCALE))
                    .cycles(totals.getCycles())
                    .loads(loads.getOrDefault(day, 0L))
                    .productionMinutes(Ratios.round(totals.getProductionMinutes(), MINUTES_SCALE))
                    .downtimeMinutes(Ratios.round(totals.getDowntimeMinutes(), MINUTES_SCALE))
                    .efficiency(Ratios.round(
                            Ratios.efficiencyPercent(totals.getProductionMinutes(), totals.getDowntimeMinutes()),
                            EFFICIENCY_SCALE))
                    .build());
        }
        return rows;
    }

    List<WaterChemicalsDailyRow> waterChemicalsDaily(TimeWindow window) {
        Map<LocalDate, Double> kgByDay = new TreeMap<>();
        for (DailyProductionTotals day : productionAggregator.consolidatedByDay(window)) {
            kgByDay.put(day.getDay(), day.getTotalKg());
        }
        Map<LocalDate, Double> waterByDay = waterAggregator.consolidatedWaterByDay(window);
        Map<LocalDate, Double> chemicalsByDay = chemicalAggregator.totalByDay(window);

        TreeSet<LocalDate> days = new TreeSet<>(kgByDay.keySet());
        days.addAll(waterByDay.keySet());
        days.addAll(chemicalsByDay.keySet());

        List<WaterChemicalsDailyRow> rows = new ArrayList<>(days.size());
        for (LocalDate day : days) {
            double kg = kgByDay.getOrDefault(day, 0.0);
            double waterM3 = waterByDay.getOrDefault(day, 0.0);
            double chemicals = chemicalsByDay.getOrDefault(day, 0.0);
            rows.add(WaterChemicalsDailyRow.builder()
                    .day(day)
                    .kg(Ratios.round(kg, KG_SCALE))
                    .waterLiters(Ratios.round(Ratios.toLiters(waterM3), LITERS_SCALE))
                    .chemicalsMl(Ratios.round(chemicals, CHEMICALS_SCALE))
                    .waterPerKg(Ratios.round(Ratios.waterPerKg(waterM3, kg), WATER_PER_KG_SCALE))
                    .chemicalPerKg(Ratios.round(Ratios.chemicalPerKg(chemicals, kg), CHEMICAL_PER_KG_SCALE))
                    .build());
        }
        return rows;
    }

    List<AlarmDailyRow> alarmsDaily(TimeWindow window) {
        return alarmAggregator.countByDay(window).stream()
                .map(day -> new AlarmDailyRow(day.getDay(), day.getAlarms(), day.getCriticalAlarms()))
                .collect(Collectors.toList());
    }

    private <T> List<T> buildTable(String table, TimeWindow window, Supplier<List<T>> builder) {
        try {
            return builder.get();
        } catch (RuntimeException e) {
            log.error("Failed to build report table {} for {}", table, window, e);
            return Collections.emptyList();
        }
    }
}
