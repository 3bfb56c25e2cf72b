package com.bomengine.service;

import com.bomengine.domain.Material;
import com.bomengine.domain.TenantSnapshot;
import com.bomengine.dto.PredictiveAlertReport;
import com.bomengine.dto.ReorderReport;
import com.bomengine.engine.StockAlertEngine;
import com.bomengine.engine.UsageForecaster;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;

import static com.bomengine.BomFixtures.AS_OF;
import static com.bomengine.BomFixtures.TENANT;
import static com.bomengine.BomFixtures.dailyDeductions;
import static com.bomengine.BomFixtures.material;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StockAlertServiceTest {

    @Mock
    BomSnapshotService snapshotService;

    StockAlertService alertService;

    private final Material butter = material("Butter", "50", "20", "3");

    @BeforeEach
    void setUp() {
        alertService = new StockAlertService(snapshotService, new StockAlertEngine(new UsageForecaster()),
            Clock.fixed(AS_OF, ZoneOffset.UTC));
        ReflectionTestUtils.setField(alertService, "usageWindowDays", 30);
        ReflectionTestUtils.setField(alertService, "dashboardTopN", 10);

        TenantSnapshot snapshot = TenantSnapshot.builder()
            .tenantId(TENANT)
            .products(List.of())
            .materials(List.of(butter))
            .activeRecipes(List.of())
            .history(dailyDeductions(butter, "2", 30))
            .asOf(AS_OF)
            .build();
        when(snapshotService.loadTenantSnapshot(TENANT, 30, AS_OF)).thenReturn(snapshot);
    }

    @Test
    void predictiveAlerts_usesConfiguredWindowAndClock() {
        PredictiveAlertReport week = alertService.predictiveAlerts(TENANT, 7);
        PredictiveAlertReport month = alertService.predictiveAlerts(TENANT, 30);

        assertThat(week.getTotalAlerts()).isZero();
        assertThat(month.getTotalAlerts()).isEqualTo(1);
        assertThat(month.getUsageWindowDays()).isEqualTo(30);
        assertThat(month.getGeneratedAt()).isEqualTo(AS_OF);
        verify(snapshotService, times(2)).loadTenantSnapshot(TENANT, 30, AS_OF);
    }

    @Test
    void reorderRecommendations_forTargetDays() {
        ReorderReport report = alertService.reorderRecommendations(TENANT, 30);

        assertThat(report.getRecommendations()).singleElement()
            .satisfies(r -> assertThat(r.getRecommendedOrderQuantity()).isEqualTo(10.0));
        assertThat(report.getTargetDaysOfStock()).isEqualTo(30);
    }

    @Test
    void dashboard_summarisesAllAlerts() {
        var dashboard = alertService.dashboard(TENANT);

        assertThat(dashboard.getSummary().getActiveAlerts()).isZero();
        assertThat(dashboard.getSummary().getPredictiveAlerts()).isZero();
        assertThat(dashboard.getSummary().getReorderRecommendations()).isEqualTo(1);
    }
}
