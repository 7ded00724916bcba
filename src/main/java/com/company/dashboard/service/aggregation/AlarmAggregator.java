package com.company.dashboard.service.aggregation;

import com.company.dashboard.domain.ActiveAlarm;
import com.company.dashboard.domain.AlarmDayCount;
import com.company.dashboard.domain.AlarmOccurrenceSummary;
import com.company.dashboard.domain.TimeWindow;
import com.company.dashboard.domain.enums.AlarmPriority;
import com.company.dashboard.repository.AlarmHistoryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Alarm counts and rankings.
 * <p>
 * The period ranking keeps both timestamps inside [start, end); the "today" ranking
 * compares strictly after midnight and has no upper bound.
 */
@Service
@RequiredArgsConstructor
public class AlarmAggregator {

    private final AlarmHistoryRepository alarmRepository;
    private final SourceFailureHandler failureHandler;

    public long countActive(TimeWindow window) {
        return failureHandler.absorb("activeAlarms",
                () -> alarmRepository.countActiveStartedWithin(window), 0L);
    }

    public long countStarted(TimeWindow window) {
        return failureHandler.absorb("startedAlarms",
                () -> alarmRepository.countStartedWithin(window), 0L);
    }

    public List<AlarmOccurrenceSummary> topClosedWithin(TimeWindow window, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        return failureHandler.absorb("topAlarmsPeriod",
                () -> alarmRepository.findTopClosedWithin(window, limit), Collections.emptyList());
    }

    public List<AlarmOccurrenceSummary> topClosedSince(LocalDateTime midnight, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        return failureHandler.absorb("topAlarmsToday",
                () -> alarmRepository.findTopClosedAfter(midnight, limit), Collections.emptyList());
    }

    /**
     * Count per priority, always holding all five levels in order CRITICAL..INFO.
     */
    public Map<AlarmPriority, Long> countByPriority(TimeWindow window) {
        Map<Integer, Long> byLevel = failureHandler.absorb("alarmsByPriority",
                () -> alarmRepository.countByPriority(window), Collections.emptyMap());

        Map<AlarmPriority, Long> result = new LinkedHashMap<>();
        for (AlarmPriority priority : AlarmPriority.values()) {
            result.put(priority, 0L);
        }
        // out-of-range levels fold into INFO, like a missing priority
        byLevel.forEach((level, count) -> result.merge(AlarmPriority.fromLevel(level), count, Long::sum));
        return result;
    }

    public List<AlarmDayCount> countByDay(TimeWindow window) {
        return failureHandler.absorb("alarmsByDay",
                () -> alarmRepository.countByDay(window), Collections.emptyList());
    }

    public List<ActiveAlarm> findActive(LocalDateTime since, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        return failureHandler.absorb("activeAlarmList",
                () -> alarmRepository.findActive(since, limit), Collections.emptyList());
    }
}
