package ru.uzden.vpnpanel.services;

import org.junit.jupiter.api.Test;
import ru.uzden.vpnpanel.model.HealthCheckResult;
import ru.uzden.vpnpanel.model.SyncCycleReport;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PanelMaintenanceJobsTest {

    private final PanelService panelService = mock(PanelService.class);
    private final PanelMaintenanceJobs jobs = new PanelMaintenanceJobs(panelService);

    @Test
    void cyclesRunThroughPanelService() {
        when(panelService.checkAllPanelsHealth()).thenReturn(List.of(HealthCheckResult.failed(1L, "timeout")));
        when(panelService.syncInboundsFromPanels()).thenReturn(new SyncCycleReport(Map.of(), Map.of(1L, "timeout")));

        jobs.healthCycle();
        jobs.syncCycle();

        verify(panelService).checkAllPanelsHealth();
        verify(panelService).syncInboundsFromPanels();
    }

    @Test
    void failedCycleDoesNotKillScheduler() {
        when(panelService.checkAllPanelsHealth()).thenThrow(new IllegalStateException("db down"));
        when(panelService.syncInboundsFromPanels()).thenThrow(new IllegalStateException("db down"));

        assertDoesNotThrow(jobs::healthCycle);
        assertDoesNotThrow(jobs::syncCycle);
    }
}
