package com.company.dashboard.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
@Slf4j
public class DashboardConfig {

    /**
     * Plant-local clock. Every notion of "now" and "today" in the engine comes from here.
     */
    @Bean
    public Clock dashboardClock(@Value("${dashboard.zone:America/Sao_Paulo}") String zone) {
        ZoneId zoneId = ZoneId.of(zone);
        log.info("Dashboard clock running in zone {}", zoneId);
        return Clock.system(zoneId);
    }
}
