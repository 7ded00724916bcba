package com.company.dashboard.service;

import com.company.dashboard.domain.ActiveAlarm;
import com.company.dashboard.domain.AlarmOccurrenceSummary;
import com.company.dashboard.domain.ChemicalUsage;
import com.company.dashboard.domain.LoadTotals;
import com.company.dashboard.domain.ProductionTotals;
import com.company.dashboard.domain.ProgramLoadTotals;
import com.company.dashboard.domain.ResolvedDay;
import com.company.dashboard.domain.StatusSnapshot;
import com.company.dashboard.domain.TimeWindow;
import com.company.dashboard.domain.enums.AlarmPriority;
import com.company.dashboard.dto.response.ActiveAlarmResponse;
import com.company.dashboard.dto.response.AlarmRankingEntry;
import com.company.dashboard.dto.response.KpiBundle;
import com.company.dashboard.dto.response.KpiMisc;
import com.company.dashboard.dto.response.KpiResponse;
import com.company.dashboard.dto.response.PeriodMetrics;
import com.company.dashboard.dto.response.ProgramProductionRow;
import com.company.dashboard.service.aggregation.AlarmAggregator;
import com.company.dashboard.service.aggregation.ChemicalAggregator;
import com.company.dashboard.service.aggregation.ProductionAggregator;
import com.company.dashboard.service.aggregation.WaterAggregator;
import com.company.dashboard.util.Ratios;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.company.dashboard.util.KpiFormatUtils.*;

/**
 * Builds the "today" and "period" KPI bundles.
 * <p>
 * Two notions of today coexist: status-sourced cards (and today's chemicals) follow the
 * resolved reference day, while load-ledger cards and the active alarm count always use
 * the literal calendar day.
 */
@Service
@Slf4j
public class KpiComposer {

    public static final String SCOPE_TODAY = "today";
    public static final String SCOPE_PERIOD = "period";

    private static final int ACTIVE_ALARMS_LOOKBACK_DAYS = 7;
    private static final int AVG_KG_SCALE = 2;
    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    private final TimeWindowNormalizer windowNormalizer;
    private final TodayLatestResolver todayLatestResolver;
    private final ProductionAggregator productionAggregator;
    private final WaterAggregator waterAggregator;
    private final ChemicalAggregator chemicalAggregator;
    private final AlarmAggregator alarmAggregator;
    private final int topAlarmsLimit;
    private final int activeAlarmsLimit;

    public KpiComposer(TimeWindowNormalizer windowNormalizer,
                       TodayLatestResolver todayLatestResolver,
                       ProductionAggregator productionAggregator,
                       WaterAggregator waterAggregator,
                       ChemicalAggregator chemicalAggregator,
                       AlarmAggregator alarmAggregator,
                       @Value("${dashboard.top-alarms-limit:5}") int topAlarmsLimit,
                       @Value("${dashboard.active-alarms-limit:20}") int activeAlarmsLimit) {
        this.windowNormalizer = windowNormalizer;
        this.todayLatestResolver = todayLatestResolver;
        this.productionAggregator = productionAggregator;
        this.waterAggregator = waterAggregator;
        this.chemicalAggregator = chemicalAggregator;
        this.alarmAggregator = alarmAggregator;
        this.topAlarmsLimit = topAlarmsLimit;
        this.activeAlarmsLimit = activeAlarmsLimit;
    }

    public KpiResponse compose(TimeWindow window, Integer clientId) {
        long startTime = System.currentTimeMillis();

        ResolvedDay referenceDay = todayLatestResolver.resolve();
        KpiBundle today = composeToday(referenceDay);
        PeriodMetrics periodMetrics = composePeriodMetrics(window, clientId);
        KpiBundle period = periodBundle(periodMetrics);
        KpiMisc misc = composeMisc(window, clientId, referenceDay);

        log.debug("Composed KPIs for {} (client={}, reference={}) in {}ms",
                window, clientId, referenceDay, System.currentTimeMillis() - startTime);

        return KpiResponse.builder()
                .periodStart(window.getStartDate())
                .periodEnd(window.getEndDateInclusive())
                .clientId(clientId)
                .today(today)
                .period(period)
                .misc(misc)
                .periodMetrics(periodMetrics)
                .build();
    }

    KpiBundle composeToday(ResolvedDay referenceDay) {
        StatusSnapshot status = productionAggregator.latestStatus(referenceDay.getDate());
        double chemicals = chemicalAggregator.total(TimeWindow.forDay(referenceDay.getDate()));

        TimeWindow literalToday = windowNormalizer.today();
        LoadTotals loads = productionAggregator.loadTotals(literalToday, null);
        double loadWaterM3 = waterAggregator.loadWaterM3(literalToday);
        long activeAlarms = alarmAggregator.countActive(literalToday);

        double kg = status.getKgWashed();
        KpiBundle bundle = new KpiBundle(SCOPE_TODAY)
                .putText("reference_date", referenceDay.getDate().format(DAY_FORMAT))
                .putText("reference_state", referenceDay.getState().name());

        putWhole(bundle, "kg_washed", kg);
        putCount(bundle, "cycles", status.getCycles());
        putLiters(bundle, "water_liters", status.getWaterM3());
        putDecimal(bundle, "weight_per_cycle", Ratios.weightPerCycle(kg, status.getCycles()), WEIGHT_PER_CYCLE_SCALE);
        putDecimal(bundle, "water_per_kg", Ratios.waterPerKg(status.getWaterM3(), kg), WATER_PER_KG_SCALE);
        putWhole(bundle, "chemicals_ml", chemicals);
        putDecimal(bundle, "chemical_per_kg", Ratios.chemicalPerKg(chemicals, kg), CHEMICAL_PER_KG_SCALE);

        putWhole(bundle, "current_day_load_kg", loads.getProductiveKg());
        putCount(bundle, "current_day_loads", loads.getProductiveLoads());
        putLiters(bundle, "current_day_load_water_liters", loadWaterM3);
        putDecimal(bundle, "current_day_load_water_per_kg",
                Ratios.waterPerKg(loadWaterM3, loads.getProductiveKg()), WATER_PER_KG_SCALE);
        putCount(bundle, "active_alarms", activeAlarms);
        return bundle;
    }

    PeriodMetrics composePeriodMetrics(TimeWindow window, Integer clientId) {
        ProductionTotals production = productionAggregator.consolidatedTotals(window, clientId);
        double waterM3 = waterAggregator.consolidatedWaterM3(window, clientId);
        double chemicals = chemicalAggregator.total(window);
        // chemicals have no client dimension, so their ratio uses the unfiltered production
        double chemicalKg = clientId == null
                ? production.getTotalKg()
                : productionAggregator.consolidatedTotals(window, null).getTotalKg();
        long dayCount = window.inclusiveDayCount();
        long periodAlarms = alarmAggregator.countStarted(window);

        double kg = production.getTotalKg();
        return PeriodMetrics.builder()
                .productionKg(Ratios.round(kg, KG_SCALE))
                .cycles(production.getCycles())
                .weightPerCycle(Ratios.round(Ratios.weightPerCycle(kg, production.getCycles()), WEIGHT_PER_CYCLE_SCALE))
                .waterLiters(Ratios.round(Ratios.toLiters(waterM3), LITERS_SCALE))
                .waterPerKg(Ratios.round(Ratios.waterPerKg(waterM3, kg), WATER_PER_KG_SCALE))
                .chemicalsMl(Ratios.round(chemicals, CHEMICALS_SCALE))
                .chemicalPerKg(Ratios.round(Ratios.chemicalPerKg(chemicals, chemicalKg), CHEMICAL_PER_KG_SCALE))
                .efficiency(Ratios.round(production.efficiencyPercent(), EFFICIENCY_SCALE))
                .dailyAverageKg(Ratios.round(Ratios.dailyAverage(kg, dayCount), KG_SCALE))
                .dayCount(dayCount)
                .periodAlarms(periodAlarms)
                .build();
    }

    /**
     * Display bundle for already rounded period figures.
     */
    public static KpiBundle periodBundle(PeriodMetrics metrics) {
        return new KpiBundle(SCOPE_PERIOD)
                .put("production_kg", metrics.getProductionKg(), formatWhole(metrics.getProductionKg()))
                .put("cycles", BigDecimal.valueOf(metrics.getCycles()), formatWhole(metrics.getCycles()))
                .put("weight_per_cycle", metrics.getWeightPerCycle(),
                        formatDecimal(metrics.getWeightPerCycle(), WEIGHT_PER_CYCLE_SCALE))
                .put("water_liters", metrics.getWaterLiters(), formatLiters(metrics.getWaterLiters()))
                .put("water_per_kg", metrics.getWaterPerKg(),
                        formatDecimal(metrics.getWaterPerKg(), WATER_PER_KG_SCALE))
                .put("chemicals_ml", metrics.getChemicalsMl(), formatWhole(metrics.getChemicalsMl()))
                .put("chemical_per_kg", metrics.getChemicalPerKg(),
                        formatDecimal(metrics.getChemicalPerKg(), CHEMICAL_PER_KG_SCALE))
                .put("efficiency", metrics.getEfficiency(), formatDecimal(metrics.getEfficiency(), EFFICIENCY_SCALE))
                .put("daily_average_kg", metrics.getDailyAverageKg(), formatWhole(metrics.getDailyAverageKg()))
                .put("day_count", BigDecimal.valueOf(metrics.getDayCount()), formatWhole(metrics.getDayCount()))
                .put("period_alarms", BigDecimal.valueOf(metrics.getPeriodAlarms()),
                        formatWhole(metrics.getPeriodAlarms()));
    }

    KpiMisc composeMisc(TimeWindow window, Integer clientId, ResolvedDay referenceDay) {
        LocalDate today = windowNormalizer.currentDate();

        Map<String, Long> byPriority = new LinkedHashMap<>();
        alarmAggregator.countByPriority(window)
                .forEach((priority, count) -> byPriority.put(priority.name(), count));

        Map<String, String> chemicalsByProduct = new LinkedHashMap<>();
        for (ChemicalUsage usage : chemicalAggregator.perChemical(window)) {
            chemicalsByProduct.put(usage.getChemical(),
                    formatWhole(Ratios.round(usage.getTotalMl(), CHEMICALS_SCALE)));
        }

        String todayLabel = referenceDay.isFallback()
                ? "Latest data " + referenceDay.getDate().format(DAY_FORMAT)
                : "Today " + today.format(DAY_FORMAT);

        return KpiMisc.builder()
                .periodLabel(periodLabel(window))
                .todayLabel(todayLabel)
                .topAlarmsToday(toRanking(alarmAggregator.topClosedSince(today.atStartOfDay(), topAlarmsLimit)))
                .topAlarmsPeriod(toRanking(alarmAggregator.topClosedWithin(window, topAlarmsLimit)))
                .alarmsByPriority(byPriority)
                .chemicalsByProduct(chemicalsByProduct)
                .activeAlarms(toActiveAlarms(alarmAggregator.findActive(
                        today.minusDays(ACTIVE_ALARMS_LOOKBACK_DAYS).atStartOfDay(), activeAlarmsLimit)))
                .productionByProgram(toProgramRows(productionAggregator.loadsByProgram(window, clientId)))
                .build();
    }

    private static void putWhole(KpiBundle bundle, String key, double value) {
        BigDecimal rounded = Ratios.round(value, KG_SCALE);
        bundle.put(key, rounded, formatWhole(rounded));
    }

    private static void putCount(KpiBundle bundle, String key, long value) {
        bundle.put(key, BigDecimal.valueOf(value), formatWhole(value));
    }

    private static void putLiters(KpiBundle bundle, String key, double cubicMeters) {
        BigDecimal liters = Ratios.round(Ratios.toLiters(cubicMeters), LITERS_SCALE);
        bundle.put(key, liters, formatLiters(liters));
    }

    private static void putDecimal(KpiBundle bundle, String key, double value, int scale) {
        BigDecimal rounded = Ratios.round(value, scale);
        bundle.put(key, rounded, formatDecimal(rounded, scale));
    }

    private static List<AlarmRankingEntry> toRanking(List<AlarmOccurrenceSummary> summaries) {
        return summaries.stream()
                .map(s -> AlarmRankingEntry.builder()
                        .tag(s.getTag())
                        .message(s.getMessage())
                        .occurrences(s.getOccurrences())
                        .lastOccurrence(s.getLastOccurrence())
                        .build())
                .collect(Collectors.toList());
    }

    private static List<ProgramProductionRow> toProgramRows(List<ProgramLoadTotals> programs) {
        return programs.stream()
                .map(p -> ProgramProductionRow.builder()
                        .programId(p.getProgramId())
                        .program(p.displayName())
                        .loads(p.getLoads())
                        .totalKg(Ratios.round(p.getTotalKg(), KG_SCALE))
                        .avgKg(Ratios.round(p.getAvgKg(), AVG_KG_SCALE))
                        .build())
                .collect(Collectors.toList());
    }

    private static List<ActiveAlarmResponse> toActiveAlarms(List<ActiveAlarm> alarms) {
        return alarms.stream()
                .map(a -> {
                    AlarmPriority priority = a.getPriority() != null ? a.getPriority() : AlarmPriority.INFO;
                    return ActiveAlarmResponse.builder()
                            .alarmId(a.getAlarmId())
                            .tag(a.getTag())
                            .message(a.getMessage())
                            .startTime(a.getStartTime())
                            .priority(priority.name())
                            .priorityLevel(priority.getLevel())
                            .section(a.getSection())
                            .build();
                })
                .collect(Collectors.toList());
    }
}
