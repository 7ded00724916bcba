package com.company.dashboard.service.aggregation;

import com.company.dashboard.domain.ClientLoadTotals;
import com.company.dashboard.domain.DailyProductionTotals;
import com.company.dashboard.domain.LoadTotals;
import com.company.dashboard.domain.ProductionTotals;
import com.company.dashboard.domain.ProgramLoadTotals;
import com.company.dashboard.domain.StatusSnapshot;
import com.company.dashboard.domain.TimeWindow;
import com.company.dashboard.repository.DailyReportRepository;
import com.company.dashboard.repository.LoadRecordRepository;
import com.company.dashboard.repository.StatusRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Production figures from the three sources: cumulative status, load ledger and
 * consolidated daily records.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProductionAggregator {

    private final StatusRecordRepository statusRepository;
    private final LoadRecordRepository loadRepository;
    private final DailyReportRepository dailyReportRepository;
    private final SourceFailureHandler failureHandler;

    /**
     * Last cumulative status of {@code day}; all zero when the day has no polls.
     */
    public StatusSnapshot latestStatus(LocalDate day) {
        return failureHandler.absorb("latestStatus",
                () -> statusRepository.findLastWithin(TimeWindow.forDay(day)).orElseGet(StatusSnapshot::empty),
                StatusSnapshot.empty());
    }

    public ProductionTotals consolidatedTotals(TimeWindow window, Integer clientId) {
        ProductionTotals totals = failureHandler.absorb("consolidatedTotals",
                () -> dailyReportRepository.sumProduction(window, clientId),
                ProductionTotals.empty());
        log.debug("Consolidated totals for {} (client={}): {}", window, clientId, totals);
        return totals;
    }

    public List<DailyProductionTotals> consolidatedByDay(TimeWindow window) {
        return failureHandler.absorb("consolidatedByDay",
                () -> dailyReportRepository.sumProductionByDay(window),
                Collections.emptyList());
    }

    public LoadTotals loadTotals(TimeWindow window, Integer clientId) {
        return failureHandler.absorb("loadTotals",
                () -> loadRepository.sumTotals(window, clientId),
                LoadTotals.empty());
    }

    public List<ClientLoadTotals> loadsByClient(TimeWindow window) {
        return failureHandler.absorb("loadsByClient",
                () -> loadRepository.sumByClient(window),
                Collections.emptyList());
    }

    public List<ProgramLoadTotals> loadsByProgram(TimeWindow window, Integer clientId) {
        return failureHandler.absorb("loadsByProgram",
                () -> loadRepository.sumByProgram(window, clientId),
                Collections.emptyList());
    }

    public Map<LocalDate, Long> loadCountByDay(TimeWindow window) {
        return failureHandler.absorb("loadCountByDay",
                () -> loadRepository.countByDay(window),
                Collections.emptyMap());
    }
}
