package ru.uzden.vpnpanel.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.uzden.vpnpanel.entities.Panel;
import ru.uzden.vpnpanel.model.HealthCheckResult;
import ru.uzden.vpnpanel.repositories.PanelRepository;
import ru.uzden.vpnpanel.xui.XuiPanelClientFactory;

import java.time.Instant;

/**
 * Проверка доступности панели свежим логином.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PanelHealthMonitor {

    private final PanelRepository panelRepository;
    private final XuiPanelClientFactory clientFactory;

    /**
     * Проверяет панель и записывает is_healthy/last_checked в транзакции вызывающего кода.
     */
    public HealthCheckResult check(long panelId) {
        Panel panel = panelRepository.findById(panelId).orElse(null);
        if (panel == null) {
            return HealthCheckResult.failed(panelId, "Panel not found");
        }
        if (!panel.isActive()) {
            return HealthCheckResult.failed(panelId, "Panel is inactive");
        }
        HealthCheckResult result = probe(panel);
        record(panel, result);
        return result;
    }

    /**
     * Только сетевая часть, без записи в БД: используется при параллельной проверке.
     */
    public HealthCheckResult probe(Panel panel) {
        try {
            clientFactory.forPanel(panel).login();
            return HealthCheckResult.ok(panel.getId());
        } catch (RuntimeException e) {
            log.warn("Panel {} health check failed: {}", panel.getId(), safeMsg(e));
            return HealthCheckResult.failed(panel.getId(), safeMsg(e));
        }
    }

    public void record(Panel panel, HealthCheckResult result) {
        Boolean before = panel.getHealthy();
        panel.markHealth(result.healthy(), Instant.now());
        panelRepository.save(panel);
        if (before == null || before != result.healthy()) {
            log.info("Panel {} health changed: {} -> {}", panel.getId(), before, result.healthy());
        }
    }

    private static String safeMsg(Throwable t) {
        String m = t.getMessage();
        return (m == null || m.isBlank()) ? t.getClass().getSimpleName() : m;
    }
}
