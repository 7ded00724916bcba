package com.company.dashboard.service.aggregation;

import com.company.dashboard.domain.ChemicalUsage;
import com.company.dashboard.domain.TimeWindow;
import com.company.dashboard.repository.ChemicalRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class ChemicalAggregator {

    private final ChemicalRecordRepository chemicalRepository;
    private final SourceFailureHandler failureHandler;

    public double total(TimeWindow window) {
        return failureHandler.absorb("chemicalTotal",
                () -> chemicalRepository.sumTotal(window), 0.0);
    }

    public Map<LocalDate, Double> totalByDay(TimeWindow window) {
        return failureHandler.absorb("chemicalByDay",
                () -> chemicalRepository.sumByDay(window), Collections.emptyMap());
    }

    public List<ChemicalUsage> perChemical(TimeWindow window) {
        return failureHandler.absorb("chemicalBreakdown",
                () -> chemicalRepository.sumPerChemical(window), Collections.emptyList());
    }
}
