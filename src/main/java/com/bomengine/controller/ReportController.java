package com.bomengine.controller;

import com.bomengine.dto.ProductionReport;
import com.bomengine.service.ProductionReportService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/tenants/{tenantId}/bom/reports")
@RequiredArgsConstructor
public class ReportController {

    private final ProductionReportService reportService;

    @GetMapping("/production-overview")
    public ResponseEntity<ProductionReport> productionOverview(@PathVariable UUID tenantId) {
        return ResponseEntity.ok(reportService.productionOverview(tenantId));
    }
}
