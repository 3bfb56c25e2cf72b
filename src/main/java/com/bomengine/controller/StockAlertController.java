package com.bomengine.controller;

import com.bomengine.dto.ActiveAlertReport;
import com.bomengine.dto.AlertDashboard;
import com.bomengine.dto.LowStockMaterial;
import com.bomengine.dto.PredictiveAlertReport;
import com.bomengine.dto.ReorderReport;
import com.bomengine.service.StockAlertService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@Validated
@RestController
@RequestMapping("/api/v1/tenants/{tenantId}/bom/alerts")
@RequiredArgsConstructor
public class StockAlertController {

    private final StockAlertService alertService;

    @GetMapping("/active")
    public ResponseEntity<ActiveAlertReport> active(@PathVariable UUID tenantId) {
        return ResponseEntity.ok(alertService.activeAlerts(tenantId));
    }

    @GetMapping("/predictive")
    public ResponseEntity<PredictiveAlertReport> predictive(
            @PathVariable UUID tenantId,
            @RequestParam(defaultValue = "${bom.alerts.default-forecast-days:7}")
            @Min(value = 1, message = "forecastDays must be >= 1")
            @Max(value = 90, message = "forecastDays must be <= 90") int forecastDays) {
        return ResponseEntity.ok(alertService.predictiveAlerts(tenantId, forecastDays));
    }

    @GetMapping("/reorder-recommendations")
    public ResponseEntity<ReorderReport> reorderRecommendations(
            @PathVariable UUID tenantId,
            @RequestParam(defaultValue = "${bom.alerts.default-target-days:30}")
            @Min(value = 1, message = "targetDaysOfStock must be >= 1")
            @Max(value = 365, message = "targetDaysOfStock must be <= 365") int targetDaysOfStock) {
        return ResponseEntity.ok(alertService.reorderRecommendations(tenantId, targetDaysOfStock));
    }

    @GetMapping("/dashboard")
    public ResponseEntity<AlertDashboard> dashboard(@PathVariable UUID tenantId) {
        return ResponseEntity.ok(alertService.dashboard(tenantId));
    }

    @GetMapping("/low-stock-in-recipes")
    public ResponseEntity<List<LowStockMaterial>> lowStockInRecipes(@PathVariable UUID tenantId) {
        return ResponseEntity.ok(alertService.lowStockInActiveRecipes(tenantId));
    }
}
