package com.company.dashboard.service.aggregation;

import com.company.dashboard.exception.SourceUnavailableException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceFailureHandlerTest {

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final SourceFailureHandler handler = new SourceFailureHandler(meterRegistry);

    @Test
    void returnsQueryResultWhenSourceIsUp() {
        assertThat(handler.absorb("op", () -> 12L, 0L)).isEqualTo(12L);
        assertThat(meterRegistry.find("dashboard.source.unavailable").counter()).isNull();
    }

    @Test
    void timeoutIsAbsorbedLikeAnyOtherFailure() {
        Long result = handler.absorb("op", () -> {
            throw new SourceUnavailableException("loads", new QueryTimeoutException("statement timeout"));
        }, 0L);

        assertThat(result).isZero();
        assertThat(meterRegistry.get("dashboard.source.unavailable").tag("source", "loads").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void unexpectedErrorsAreNotSwallowed() {
        assertThatThrownBy(() -> handler.absorb("op", () -> {
            throw new IllegalStateException("bug");
        }, 0L)).isInstanceOf(IllegalStateException.class);
    }
}
