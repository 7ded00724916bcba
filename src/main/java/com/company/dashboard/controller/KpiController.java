package com.company.dashboard.controller;

import com.company.dashboard.domain.TimeWindow;
import com.company.dashboard.dto.response.KpiResponse;
import com.company.dashboard.service.KpiComposer;
import com.company.dashboard.service.TimeWindowNormalizer;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/kpis")
@Tag(name = "KPIs", description = "Today and selected period production indicators")
@RequiredArgsConstructor
@Slf4j
public class KpiController {

    private final TimeWindowNormalizer windowNormalizer;
    private final KpiComposer kpiComposer;
    private final MeterRegistry meterRegistry;

    @GetMapping
    @Operation(
            summary = "Get today and period KPIs",
            description = "Missing bounds default to the last 7 days; the end day is fully included"
    )
    public ResponseEntity<KpiResponse> getKpis(
            @Parameter(description = "Period start, ISO date or date-time")
            @RequestParam(required = false) String start,
            @Parameter(description = "Period end, ISO date or date-time (inclusive day)")
            @RequestParam(required = false) String end,
            @Parameter(description = "Restrict consolidated production to one client")
            @RequestParam(required = false) @Min(0) Integer clientId) {

        TimeWindow window = windowNormalizer.normalize(start, end);

        meterRegistry.counter("api.kpis.requests",
                "client_filter", String.valueOf(clientId != null)
        ).increment();

        KpiResponse response = kpiComposer.compose(window, clientId);
        log.info("KPIs served for {} to {} (client={})",
                window.getStartDate(), window.getEndDateInclusive(), clientId);

        return ResponseEntity.ok()
                .cacheControl(CacheControl.noStore())
                .body(response);
    }
}
