package ru.uzden.vpnpanel.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import ru.uzden.vpnpanel.model.HealthCheckResult;
import ru.uzden.vpnpanel.model.SyncCycleReport;

import java.util.List;

/**
 * Периодические проверки здоровья панелей и синхронизация inbound'ов.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "panels.jobs", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PanelMaintenanceJobs {

    private final PanelService panelService;

    @Scheduled(
            initialDelayString = "${panels.health.initial-delay-ms:30000}",
            fixedDelayString = "${panels.health.interval-ms:300000}")
    public void healthCycle() {
        try {
            List<HealthCheckResult> results = panelService.checkAllPanelsHealth();
            long unhealthy = results.stream().filter(r -> !r.healthy()).count();
            if (unhealthy > 0) {
                log.warn("Unhealthy panels after health cycle: {}", unhealthy);
            }
        } catch (RuntimeException e) {
            // следующий цикл попробует снова
            log.error("Health cycle failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(
            initialDelayString = "${panels.sync.initial-delay-ms:60000}",
            fixedDelayString = "${panels.sync.interval-ms:600000}")
    public void syncCycle() {
        try {
            SyncCycleReport report = panelService.syncInboundsFromPanels();
            if (!report.failed().isEmpty()) {
                log.warn("Inbound sync failed for panels {}", report.failed().keySet());
            }
        } catch (RuntimeException e) {
            log.error("Inbound sync cycle failed: {}", e.getMessage(), e);
        }
    }
}
