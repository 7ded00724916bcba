package com.company.dashboard.service.aggregation;

import com.company.dashboard.domain.TimeWindow;
import com.company.dashboard.repository.DailyReportRepository;
import com.company.dashboard.repository.LoadRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;

/**
 * Water consumption in cubic meters. Conversion to liters happens in the ratios.
 */
@Service
@RequiredArgsConstructor
public class WaterAggregator {

    private final DailyReportRepository dailyReportRepository;
    private final LoadRecordRepository loadRepository;
    private final SourceFailureHandler failureHandler;

    public double consolidatedWaterM3(TimeWindow window, Integer clientId) {
        return failureHandler.absorb("consolidatedWater",
                () -> dailyReportRepository.sumWater(window, clientId), 0.0);
    }

    public Map<LocalDate, Double> consolidatedWaterByDay(TimeWindow window) {
        return failureHandler.absorb("consolidatedWaterByDay",
                () -> dailyReportRepository.sumWaterByDay(window), Collections.emptyMap());
    }

    public double loadWaterM3(TimeWindow window) {
        return failureHandler.absorb("loadWater",
                () -> loadRepository.sumProductiveWater(window), 0.0);
    }
}
