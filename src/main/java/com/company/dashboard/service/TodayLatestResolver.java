package com.company.dashboard.service;

import com.company.dashboard.domain.ResolvedDay;
import com.company.dashboard.repository.StatusRecordRepository;
import com.company.dashboard.service.aggregation.SourceFailureHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

/**
 * Picks the day whose cumulative status backs the "today" cards: today when the
 * machine has reported, otherwise the latest day with any status row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TodayLatestResolver {

    private final StatusRecordRepository statusRepository;
    private final TimeWindowNormalizer windowNormalizer;
    private final SourceFailureHandler failureHandler;

    public ResolvedDay resolve() {
        LocalDate today = windowNormalizer.currentDate();

        return failureHandler.absorb("resolveReferenceDay", () -> {
            if (statusRepository.existsWithin(windowNormalizer.today())) {
                return ResolvedDay.today(today);
            }
            ResolvedDay fallback = statusRepository.findLatestDate()
                    .map(ResolvedDay::latest)
                    .orElseGet(() -> ResolvedDay.latest(today));
            log.debug("No status for {} yet, using {}", today, fallback.getDate());
            return fallback;
        }, ResolvedDay.latest(today));
    }
}
