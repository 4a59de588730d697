package ru.uzden.vpnpanel.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import ru.uzden.vpnpanel.entities.Panel;
import ru.uzden.vpnpanel.entities.PanelInbound;
import ru.uzden.vpnpanel.exceptions.PanelConnectionException;
import ru.uzden.vpnpanel.model.SyncOutcome;
import ru.uzden.vpnpanel.repositories.PanelInboundRepository;
import ru.uzden.vpnpanel.repositories.PanelRepository;
import ru.uzden.vpnpanel.xui.XuiPanelClient;
import ru.uzden.vpnpanel.xui.XuiPanelClientFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class InboundSynchronizerTest {

    private final ObjectMapper om = new ObjectMapper();
    private final XuiPanelClientFactory clientFactory = mock(XuiPanelClientFactory.class);
    private final PanelRepository panelRepository = mock(PanelRepository.class);
    private final PanelInboundRepository inboundRepository = mock(PanelInboundRepository.class);
    private final InboundSynchronizer synchronizer =
            new InboundSynchronizer(clientFactory, panelRepository, inboundRepository, om);

    @Test
    void firstSyncAddsEveryInbound() throws Exception {
        Panel panel = panel();
        when(inboundRepository.findByPanelId(1L)).thenReturn(List.of());

        SyncOutcome outcome = synchronizer.apply(panel, remote(
                inbound(1, "vless", 443), inbound(2, "vmess", 8443), inbound(3, "trojan", 2053)));

        assertEquals(new SyncOutcome(3, 3, 0, 0), outcome);
        List<PanelInbound> saved = captureSaved();
        assertEquals(3, saved.size());
        PanelInbound first = saved.get(0);
        assertEquals(Integer.valueOf(1), first.getRemoteInboundId());
        assertEquals("vless", first.getProtocol());
        assertTrue(first.isActive());
        assertEquals(10.0, first.getTotalGb());
        assertNull(first.getExpiryTime());
        assertEquals("ws", first.getStreamSettings().get("network"));
        assertEquals(Boolean.TRUE, panel.getHealthy());
        verify(panelRepository).save(panel);
    }

    @Test
    void repeatedSyncWithoutChangesWritesNothing() throws Exception {
        Panel panel = panel();
        List<PanelInbound> existing = new ArrayList<>();
        for (JsonNode raw : remote(inbound(1, "vless", 443), inbound(2, "vmess", 8443))) {
            PanelInbound row = new PanelInbound();
            row.setPanel(panel);
            row.setRemoteInboundId(raw.path("id").asInt());
            synchronizer.toSnapshot(raw).copyTo(row);
            row.setActive(true);
            existing.add(row);
        }
        when(inboundRepository.findByPanelId(1L)).thenReturn(existing);

        SyncOutcome outcome = synchronizer.apply(panel, remote(inbound(1, "vless", 443), inbound(2, "vmess", 8443)));

        assertEquals(new SyncOutcome(2, 0, 0, 0), outcome);
        assertFalse(outcome.hasChanges());
        verify(inboundRepository, never()).saveAll(anyList());
    }

    @Test
    void vanishedInboundIsDeactivatedAndReturningOneReactivated() throws Exception {
        Panel panel = panel();
        PanelInbound gone = row(panel, 1, true);
        PanelInbound back = row(panel, 2, false);
        when(inboundRepository.findByPanelId(1L)).thenReturn(List.of(gone, back));

        SyncOutcome outcome = synchronizer.apply(panel, remote(inbound(2, "vless", 443)));

        assertEquals(new SyncOutcome(1, 0, 1, 1), outcome);
        assertFalse(gone.isActive());
        assertTrue(back.isActive());
        assertEquals(Integer.valueOf(443), back.getPort());
    }

    @Test
    void changedPortIsUpdated() throws Exception {
        Panel panel = panel();
        PanelInbound existing = row(panel, 1, true);
        synchronizer.toSnapshot(remote(inbound(1, "vless", 443)).get(0)).copyTo(existing);
        when(inboundRepository.findByPanelId(1L)).thenReturn(List.of(existing));

        SyncOutcome outcome = synchronizer.apply(panel, remote(inbound(1, "vless", 9443)));

        assertEquals(new SyncOutcome(1, 0, 1, 0), outcome);
        assertEquals(Integer.valueOf(9443), existing.getPort());
    }

    @Test
    void malformedInboundIsSkippedOthersApplied() throws Exception {
        Panel panel = panel();
        when(inboundRepository.findByPanelId(1L)).thenReturn(List.of());

        String noPort = "{\"id\":5,\"protocol\":\"vless\"}";
        String brokenSettings = "{\"id\":6,\"protocol\":\"vless\",\"port\":443,\"settings\":\"{not json\"}";
        List<JsonNode> list = new ArrayList<>(remote(inbound(1, "vless", 443)));
        list.add(om.readTree(noPort));
        list.add(om.readTree(brokenSettings));

        SyncOutcome outcome = synchronizer.apply(panel, list);

        assertEquals(new SyncOutcome(3, 1, 0, 0), outcome);
        assertEquals(1, captureSaved().size());
    }

    @Test
    void fetchFailureMarksPanelUnhealthy() {
        Panel panel = panel();
        panel.setHealthy(true);
        XuiPanelClient client = mock(XuiPanelClient.class);
        when(clientFactory.forPanel(panel)).thenReturn(client);
        when(client.getInbounds()).thenThrow(new PanelConnectionException("timeout", null));

        assertThrows(PanelConnectionException.class, () -> synchronizer.sync(panel));

        assertEquals(Boolean.FALSE, panel.getHealthy());
        verify(panelRepository).updateHealth(eq(1L), eq(false), any(Instant.class));
        verify(panelRepository, never()).save(any());
        verify(inboundRepository, never()).saveAll(anyList());
    }

    @Test
    void malformedInboundStillOnPanelKeepsItsRowActive() throws Exception {
        Panel panel = panel();
        PanelInbound existing = row(panel, 6, true);
        when(inboundRepository.findByPanelId(1L)).thenReturn(List.of(existing));

        String brokenSettings = "{\"id\":6,\"protocol\":\"vless\",\"port\":443,\"settings\":\"{not json\"}";
        SyncOutcome outcome = synchronizer.apply(panel, remote(brokenSettings));

        assertEquals(new SyncOutcome(1, 0, 0, 0), outcome);
        assertTrue(existing.isActive());
        assertEquals(Integer.valueOf(1), existing.getPort());
        verify(inboundRepository, never()).saveAll(anyList());
    }

    @Test
    void totalBytesAreRoundedToGigabytes() throws Exception {
        JsonNode raw = om.readTree("{\"id\":1,\"protocol\":\"VLESS\",\"port\":443,\"total\":1610612736,"
                + "\"expiryTime\":1893456000000,\"enable\":false}");

        InboundSynchronizer.InboundSnapshot snap = synchronizer.toSnapshot(raw);

        assertEquals(1.5, snap.totalGb());
        assertEquals("vless", snap.protocol());
        assertEquals(Instant.ofEpochMilli(1893456000000L), snap.expiryTime());
        assertFalse(snap.panelEnabled());
        assertTrue(snap.settings().isEmpty());
    }

    @SuppressWarnings("unchecked")
    private List<PanelInbound> captureSaved() {
        ArgumentCaptor<List<PanelInbound>> captor = ArgumentCaptor.forClass(List.class);
        verify(inboundRepository).saveAll(captor.capture());
        return captor.getValue();
    }

    private static Panel panel() {
        Panel p = new Panel();
        p.setId(1L);
        p.setName("de-1");
        p.setBaseUrl("https://de1.example.com:2053");
        return p;
    }

    private static PanelInbound row(Panel panel, int remoteId, boolean active) {
        PanelInbound r = new PanelInbound();
        r.setPanel(panel);
        r.setRemoteInboundId(remoteId);
        r.setProtocol("vless");
        r.setPort(1);
        r.setActive(active);
        r.setPanelEnabled(true);
        r.setSettings(Map.of());
        r.setStreamSettings(Map.of());
        return r;
    }

    private List<JsonNode> remote(String... inbounds) throws Exception {
        List<JsonNode> out = new ArrayList<>();
        for (String s : inbounds) out.add(om.readTree(s));
        return out;
    }

    private static String inbound(int id, String protocol, int port) {
        return """
                {"id":%d,"remark":"in-%d","tag":"inbound-%d","protocol":"%s","port":%d,"listen":"",
                 "enable":true,"total":10737418240,"expiryTime":0,
                 "settings":"{\\"clients\\":[],\\"decryption\\":\\"none\\"}",
                 "streamSettings":"{\\"network\\":\\"ws\\",\\"security\\":\\"none\\"}"}
                """.formatted(id, id, port, protocol, port);
    }
}
