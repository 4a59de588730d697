package ru.uzden.vpnpanel.services;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.uzden.vpnpanel.entities.Panel;
import ru.uzden.vpnpanel.entities.PanelInbound;
import ru.uzden.vpnpanel.model.SyncOutcome;
import ru.uzden.vpnpanel.repositories.PanelInboundRepository;
import ru.uzden.vpnpanel.repositories.PanelRepository;
import ru.uzden.vpnpanel.xui.InboundJson;
import ru.uzden.vpnpanel.xui.XuiPanelClientFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Приводит локальное зеркало inbound'ов панели к состоянию на панели.
 * <p>
 * Работа разделена на {@link #fetch} (только HTTP, можно параллельно) и {@link #apply}
 * (только БД). Транзакцию открывает вызывающий код.
 */
@Slf4j
@Service
public class InboundSynchronizer {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final double BYTES_IN_GB = 1024d * 1024d * 1024d;

    private final XuiPanelClientFactory clientFactory;
    private final PanelRepository panelRepository;
    private final PanelInboundRepository inboundRepository;
    private final ObjectMapper om;

    public InboundSynchronizer(XuiPanelClientFactory clientFactory,
                               PanelRepository panelRepository,
                               PanelInboundRepository inboundRepository,
                               ObjectMapper om) {
        this.clientFactory = clientFactory;
        this.panelRepository = panelRepository;
        this.inboundRepository = inboundRepository;
        this.om = om;
    }

    public SyncOutcome sync(Panel panel) {
        return apply(panel, fetch(panel));
    }

    /**
     * Забирает inbound'ы с панели. При любой ошибке панель помечается нездоровой, ошибка пробрасывается.
     */
    public List<JsonNode> fetch(Panel panel) {
        try {
            return clientFactory.forPanel(panel).getInbounds();
        } catch (RuntimeException e) {
            log.warn("Inbound fetch failed for panel {}: {}", panel.getId(), e.getMessage());
            Instant now = Instant.now();
            panel.markHealth(false, now);
            // только колонки здоровья: снимок панели мог устареть, пока шёл запрос
            panelRepository.updateHealth(panel.getId(), false, now);
            throw e;
        }
    }

    public SyncOutcome apply(Panel panel, List<JsonNode> remote) {
        Map<Integer, PanelInbound> local = new HashMap<>();
        for (PanelInbound row : inboundRepository.findByPanelId(panel.getId())) {
            local.put(row.getRemoteInboundId(), row);
        }

        int added = 0;
        int updated = 0;
        int deactivated = 0;
        Set<Integer> seen = new HashSet<>();
        List<PanelInbound> changed = new ArrayList<>();

        for (JsonNode raw : remote) {
            JsonNode id = raw == null ? null : raw.path("id");
            // inbound с известным id есть на панели, даже если разобрать его не удалось
            if (id != null && id.canConvertToInt() && !seen.add(id.asInt())) {
                log.warn("Panel {}: duplicate inbound id {} in list, ignored", panel.getId(), id.asInt());
                continue;
            }
            InboundSnapshot snap;
            try {
                snap = toSnapshot(raw);
            } catch (IllegalArgumentException e) {
                log.warn("Panel {}: skipping malformed inbound {}: {}", panel.getId(),
                        id == null ? "?" : id.asText("?"), e.getMessage());
                continue;
            }

            PanelInbound row = local.get(snap.remoteId());
            if (row == null) {
                row = new PanelInbound();
                row.setPanel(panel);
                row.setRemoteInboundId(snap.remoteId());
                snap.copyTo(row);
                row.setActive(true);
                changed.add(row);
                added++;
            } else if (!row.isActive() || !snap.sameAs(row)) {
                snap.copyTo(row);
                row.setActive(true);
                changed.add(row);
                updated++;
            }
        }

        for (PanelInbound row : local.values()) {
            if (row.isActive() && !seen.contains(row.getRemoteInboundId())) {
                row.setActive(false);
                changed.add(row);
                deactivated++;
            }
        }

        if (!changed.isEmpty()) {
            inboundRepository.saveAll(changed);
        }
        panel.markHealth(true, Instant.now());
        panelRepository.save(panel);

        SyncOutcome outcome = new SyncOutcome(remote.size(), added, updated, deactivated);
        log.info("Panel {} inbounds synced: fetched={}, added={}, updated={}, deactivated={}",
                panel.getId(), outcome.fetched(), added, updated, deactivated);
        return outcome;
    }

    InboundSnapshot toSnapshot(JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            throw new IllegalArgumentException("inbound is not an object");
        }
        if (!raw.path("id").canConvertToInt()) {
            throw new IllegalArgumentException("inbound id is missing");
        }
        String protocol = InboundJson.textOrNull(raw, "protocol");
        if (protocol == null) {
            throw new IllegalArgumentException("protocol is missing");
        }
        if (!raw.path("port").canConvertToInt()) {
            throw new IllegalArgumentException("port is missing");
        }

        Map<String, Object> settings = toMap(InboundJson.embeddedObject(om, raw, "settings"));
        Map<String, Object> streamSettings = toMap(InboundJson.embeddedObject(om, raw, "streamSettings"));

        long totalBytes = raw.path("total").asLong(0);
        double totalGb = BigDecimal.valueOf(totalBytes / BYTES_IN_GB).setScale(2, RoundingMode.HALF_UP).doubleValue();
        long expiry = raw.path("expiryTime").asLong(0);

        return new InboundSnapshot(
                raw.path("id").asInt(),
                InboundJson.textOrNull(raw, "tag"),
                InboundJson.textOrNull(raw, "remark"),
                protocol.toLowerCase(Locale.ROOT),
                raw.path("port").asInt(),
                InboundJson.textOrNull(raw, "listen"),
                raw.path("enable").asBoolean(true),
                settings,
                streamSettings,
                totalGb,
                expiry > 0 ? Instant.ofEpochMilli(expiry) : null
        );
    }

    private Map<String, Object> toMap(JsonNode node) {
        if (node == null || node.isMissingNode()) return new LinkedHashMap<>();
        return om.convertValue(node, MAP_TYPE);
    }

    record InboundSnapshot(
            int remoteId,
            String tag,
            String remark,
            String protocol,
            int port,
            String listenIp,
            boolean panelEnabled,
            Map<String, Object> settings,
            Map<String, Object> streamSettings,
            double totalGb,
            Instant expiryTime
    ) {

        boolean sameAs(PanelInbound row) {
            return Objects.equals(tag, row.getTag())
                    && Objects.equals(protocol, row.getProtocol())
                    && Objects.equals(port, row.getPort())
                    && Objects.equals(listenIp, row.getListenIp())
                    && panelEnabled == row.isPanelEnabled()
                    && Objects.equals(settings, row.getSettings())
                    && Objects.equals(streamSettings, row.getStreamSettings())
                    && Double.compare(totalGb, row.getTotalGb()) == 0
                    && Objects.equals(expiryTime, row.getExpiryTime())
                    && Objects.equals(remark, row.getRemark());
        }

        void copyTo(PanelInbound row) {
            row.setTag(tag);
            row.setRemark(remark);
            row.setProtocol(protocol);
            row.setPort(port);
            row.setListenIp(listenIp);
            row.setPanelEnabled(panelEnabled);
            row.setSettings(settings);
            row.setStreamSettings(streamSettings);
            row.setTotalGb(totalGb);
            row.setExpiryTime(expiryTime);
        }
    }
}
