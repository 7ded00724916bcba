package com.company.dashboard.controller;

import com.company.dashboard.domain.TimeWindow;
import com.company.dashboard.dto.response.ReportDataset;
import com.company.dashboard.service.ReportDatasetBuilder;
import com.company.dashboard.service.TimeWindowNormalizer;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/reports")
@Tag(name = "Reports", description = "Tabular datasets for period report export")
@RequiredArgsConstructor
@Slf4j
public class ReportController {

    private final TimeWindowNormalizer windowNormalizer;
    private final ReportDatasetBuilder reportDatasetBuilder;
    private final MeterRegistry meterRegistry;

    @GetMapping("/dataset")
    @Operation(
            summary = "Build the report dataset for a period",
            description = "Summary plus per-client, per-day production, water/chemicals and alarm tables"
    )
    public ResponseEntity<ReportDataset> getDataset(
            @RequestParam(required = false) String start,
            @RequestParam(required = false) String end) {

        TimeWindow window = windowNormalizer.normalize(start, end);

        meterRegistry.counter("api.reports.requests",
                "days", String.valueOf(window.inclusiveDayCount())
        ).increment();

        return ResponseEntity.ok()
                .cacheControl(CacheControl.noStore())
                .body(reportDatasetBuilder.build(window));
    }
}
