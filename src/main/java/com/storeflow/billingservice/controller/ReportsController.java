package com.storeflow.billingservice.controller;

import com.storeflow.billingservice.dto.response.DashboardSummaryResponse;
import com.storeflow.billingservice.service.ReportingService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/billing/reports")
@RequiredArgsConstructor
@Tag(name = "Reports", description = "Dashboard figures")
public class ReportsController {

    private final ReportingService reportingService;

    @GetMapping("/dashboard")
    public ResponseEntity<DashboardSummaryResponse> getDashboard() {
        return ResponseEntity.ok(reportingService.getDashboard());
    }
}
