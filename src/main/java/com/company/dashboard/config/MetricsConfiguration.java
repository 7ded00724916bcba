package com.company.dashboard.config;

import com.company.dashboard.repository.AlarmHistoryRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Dashboard-specific metrics
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final AlarmHistoryRepository alarmHistoryRepository;

    @Bean
    public MeterBinder dashboardMetrics(MeterRegistry registry) {
        return (reg) -> {
            Gauge.builder("dashboard.alarms.active", alarmHistoryRepository, repo -> {
                        try {
                            return repo.countAllActive();
                        } catch (Exception e) {
                            log.warn("Failed to count active alarms", e);
                            return 0;
                        }
                    })
                    .description("Alarms without a normalization time")
                    .register(reg);

            log.info("Dashboard metrics registered");
        };
    }
}
