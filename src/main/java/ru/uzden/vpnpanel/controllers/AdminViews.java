package ru.uzden.vpnpanel.controllers;

import ru.uzden.vpnpanel.entities.Location;
import ru.uzden.vpnpanel.entities.Panel;
import ru.uzden.vpnpanel.entities.PanelInbound;

import java.time.Instant;
import java.util.Map;

/**
 * Ответы admin API. Сущности наружу не отдаём: в панели лежат зашифрованные учётные данные.
 */
public final class AdminViews {

    private AdminViews() {
    }

    public record PanelView(
            Long id,
            String name,
            String baseUrl,
            String panelType,
            Long locationId,
            boolean active,
            Boolean healthy,
            Instant lastChecked,
            int priority,
            boolean premium,
            String publicHost
    ) {
        public static PanelView of(Panel p) {
            return new PanelView(
                    p.getId(),
                    p.getName(),
                    p.getBaseUrl(),
                    p.getPanelType() == null ? null : p.getPanelType().name(),
                    p.getLocation() == null ? null : p.getLocation().getId(),
                    p.isActive(),
                    p.getHealthy(),
                    p.getLastChecked(),
                    p.getPriority(),
                    p.isPremium(),
                    p.getPublicHost()
            );
        }
    }

    public record LocationView(Long id, String name, String flag) {
        public static LocationView of(Location l) {
            return new LocationView(l.getId(), l.getName(), l.getFlag());
        }
    }

    public record InboundView(
            Long id,
            Integer remoteInboundId,
            String tag,
            String remark,
            String protocol,
            Integer port,
            String listenIp,
            boolean panelEnabled,
            boolean active,
            double totalGb,
            Instant expiryTime,
            Map<String, Object> streamSettings
    ) {
        public static InboundView of(PanelInbound i) {
            return new InboundView(
                    i.getId(),
                    i.getRemoteInboundId(),
                    i.getTag(),
                    i.getRemark(),
                    i.getProtocol(),
                    i.getPort(),
                    i.getListenIp(),
                    i.isPanelEnabled(),
                    i.isActive(),
                    i.getTotalGb(),
                    i.getExpiryTime(),
                    i.getStreamSettings()
            );
        }
    }

    public record LocationRequest(String name, String flag) {
    }

    public record ErrorResponse(String error, String message) {
    }
}
