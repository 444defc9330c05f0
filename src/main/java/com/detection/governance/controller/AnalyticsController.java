package com.detection.governance.controller;

import com.detection.governance.dto.analytics.ContentStatistics;
import com.detection.governance.dto.analytics.DdlcAnalyticsReport;
import com.detection.governance.service.analytics.DdlcAnalyticsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private final DdlcAnalyticsService analyticsService;

    @GetMapping("/ddlc")
    public ResponseEntity<DdlcAnalyticsReport> getDdlcAnalytics() {
        return ResponseEntity.ok(analyticsService.computeAnalytics());
    }

    @GetMapping("/statistics")
    public ResponseEntity<ContentStatistics> getStatistics() {
        return ResponseEntity.ok(analyticsService.computeStatistics());
    }
}
