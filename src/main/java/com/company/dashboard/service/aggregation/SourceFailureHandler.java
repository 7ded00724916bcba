package com.company.dashboard.service.aggregation;

import com.company.dashboard.exception.SourceUnavailableException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Turns an unavailable record source into an empty result. Every absorbed failure is
 * logged and counted under {@code dashboard.source.unavailable}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SourceFailureHandler {

    private final MeterRegistry meterRegistry;

    public <T> T absorb(String operation, Supplier<T> query, T fallback) {
        try {
            return query.get();
        } catch (SourceUnavailableException e) {
            log.warn("{} degraded to empty result: {} ({})",
                    operation, e.getMessage(), rootMessage(e));
            meterRegistry.counter("dashboard.source.unavailable",
                    "source", e.getSource()
            ).increment();
            return fallback;
        }
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
