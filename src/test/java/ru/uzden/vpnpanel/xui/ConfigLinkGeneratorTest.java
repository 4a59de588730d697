package ru.uzden.vpnpanel.xui;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import ru.uzden.vpnpanel.entities.Panel;
import ru.uzden.vpnpanel.entities.PanelInbound;
import ru.uzden.vpnpanel.exceptions.ConfigGenerationException;
import ru.uzden.vpnpanel.model.ClientIdentifier;
import ru.uzden.vpnpanel.model.VpnProtocol;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLinkGeneratorTest {

    private static final String UUID_1 = "9b2f3c1e-5a47-4d8e-b3a0-6f1e2d3c4b5a";

    private final ObjectMapper om = new ObjectMapper();
    private final ConfigLinkGenerator generator = new ConfigLinkGenerator(om);

    @Test
    void vlessOverWebsocketWithTls() throws Exception {
        PanelInbound inbound = inbound("vless", 443, "DE ws", """
                {"network":"ws","security":"tls",
                 "wsSettings":{"path":"/ws","headers":{"Host":"cdn.example.com"}},
                 "tlsSettings":{"serverName":"vpn.example.com","alpn":["h2","http/1.1"],"settings":{"fingerprint":"chrome"}}}
                """, "{\"clients\":[{\"id\":\"" + UUID_1 + "\",\"flow\":\"\"}]}");

        String link = generator.generate(panel("de1.example.com"), inbound, vless(), "DE 1").orElseThrow();

        URI uri = URI.create(link);
        assertEquals("vless", uri.getScheme());
        assertEquals(UUID_1, uri.getUserInfo());
        assertEquals("de1.example.com", uri.getHost());
        assertEquals(443, uri.getPort());
        assertEquals("DE%201", uri.getRawFragment());
        assertEquals("DE 1", uri.getFragment());

        Map<String, String> q = query(uri);
        assertEquals("ws", q.get("type"));
        assertEquals("tls", q.get("security"));
        assertEquals("/ws", q.get("path"));
        assertEquals("cdn.example.com", q.get("host"));
        assertEquals("vpn.example.com", q.get("sni"));
        assertEquals("chrome", q.get("fp"));
        assertEquals("h2,http/1.1", q.get("alpn"));
        // пустой flow в ссылку не попадает
        assertFalse(q.containsKey("flow"));
    }

    @Test
    void vlessReality() throws Exception {
        PanelInbound inbound = inbound("vless", 8443, "reality", """
                {"network":"tcp","security":"reality",
                 "realitySettings":{"serverNames":["www.google.com"],"shortIds":["ab12",""],
                   "settings":{"publicKey":"PUBKEY123","fingerprint":"firefox","spiderX":"/"}}}
                """, "{\"clients\":[{\"id\":\"" + UUID_1 + "\",\"flow\":\"xtls-rprx-vision\"}]}");

        Map<String, String> q = query(URI.create(generator.generate(panel(null), inbound, vless(), null).orElseThrow()));

        assertEquals("tcp", q.get("type"));
        assertEquals("reality", q.get("security"));
        assertEquals("www.google.com", q.get("sni"));
        assertEquals("firefox", q.get("fp"));
        assertEquals("PUBKEY123", q.get("pbk"));
        assertEquals("ab12", q.get("sid"));
        assertEquals("/", q.get("spx"));
        assertEquals("xtls-rprx-vision", q.get("flow"));
    }

    @Test
    void realityWithoutPublicKeyFails() throws Exception {
        PanelInbound inbound = inbound("vless", 8443, "reality", """
                {"network":"tcp","security":"reality","realitySettings":{"serverNames":["a.com"],"settings":{}}}
                """, "{\"clients\":[]}");

        assertThrows(ConfigGenerationException.class, () -> generator.generate(panel(null), inbound, vless(), null));
    }

    @Test
    void vlessGrpcWithoutSecurity() throws Exception {
        PanelInbound inbound = inbound("vless", 2096, "grpc", """
                {"network":"grpc","security":"none","grpcSettings":{"serviceName":"svc","multiMode":true}}
                """, "{\"clients\":[{\"id\":\"" + UUID_1 + "\",\"flow\":\"xtls-rprx-vision\"}]}");

        URI uri = URI.create(generator.generate(panel(null), inbound, vless(), null).orElseThrow());
        Map<String, String> q = query(uri);

        assertEquals("grpc", q.get("type"));
        assertEquals("none", q.get("security"));
        assertEquals("svc", q.get("serviceName"));
        assertEquals("multi", q.get("mode"));
        assertFalse(q.containsKey("flow"));
        // хост из base_url, тег из remark inbound'а
        assertEquals("10.0.0.1", uri.getHost());
        assertEquals("grpc", URLDecoder.decode(uri.getRawFragment(), StandardCharsets.UTF_8));
    }

    @Test
    void vmessIsBase64Json() throws Exception {
        PanelInbound inbound = inbound("vmess", 443, "vm", """
                {"network":"ws","security":"tls","wsSettings":{"path":"ws"},"tlsSettings":{"serverName":"vm.example.com"}}
                """, "{\"clients\":[{\"id\":\"" + UUID_1 + "\",\"alterId\":0}]}");

        String link = generator.generate(panel("vm-host.example.com"), inbound,
                ClientIdentifier.of(VpnProtocol.VMESS, UUID_1), "FR").orElseThrow();

        assertTrue(link.startsWith("vmess://"));
        JsonNode json = om.readTree(Base64.getUrlDecoder().decode(link.substring("vmess://".length())));
        assertEquals("2", json.path("v").asText());
        assertEquals("FR", json.path("ps").asText());
        assertEquals("vm-host.example.com", json.path("add").asText());
        assertEquals("443", json.path("port").asText());
        assertEquals(UUID_1, json.path("id").asText());
        assertEquals("ws", json.path("net").asText());
        assertEquals("/ws", json.path("path").asText());
        assertEquals("tls", json.path("tls").asText());
        assertEquals("vm.example.com", json.path("sni").asText());
        assertFalse(json.has("alpn"));
    }

    @Test
    void unsupportedProtocolYieldsNoLink() throws Exception {
        PanelInbound inbound = inbound("trojan", 443, "tj", "{}", "{}");

        Optional<String> link = generator.generate(panel(null), inbound,
                ClientIdentifier.of(VpnProtocol.TROJAN, "secret"), null);

        assertTrue(link.isEmpty());
    }

    @Test
    void identifierProtocolMustMatchInbound() throws Exception {
        PanelInbound inbound = inbound("vless", 443, "x", "{}", "{}");

        assertThrows(IllegalArgumentException.class, () -> generator.generate(panel(null), inbound,
                ClientIdentifier.of(VpnProtocol.VMESS, UUID_1), null));
    }

    @Test
    void malformedNestedSettingsAreReportedAsGenerationFailure() throws Exception {
        PanelInbound inbound = inbound("vless", 443, "x",
                "{\"network\":\"ws\",\"security\":\"none\",\"wsSettings\":\"broken\"}", "{}");

        assertThrows(ConfigGenerationException.class, () -> generator.generate(panel(null), inbound, vless(), null));
    }

    @Test
    void hostResolution() {
        assertEquals("pub.example.com", generator.resolveHost(panel("pub.example.com")));
        assertEquals("10.0.0.1", generator.resolveHost(panel("  ")));

        Panel broken = panel(null);
        broken.setBaseUrl("not a url");
        assertThrows(ConfigGenerationException.class, () -> generator.resolveHost(broken));
    }

    private static ClientIdentifier vless() {
        return ClientIdentifier.of(VpnProtocol.VLESS, UUID_1);
    }

    private static Panel panel(String publicHost) {
        Panel p = new Panel();
        p.setId(1L);
        p.setName("de-1");
        p.setBaseUrl("https://10.0.0.1:2053");
        p.setPublicHost(publicHost);
        return p;
    }

    private PanelInbound inbound(String protocol, int port, String remark, String stream, String settings) throws Exception {
        PanelInbound i = new PanelInbound();
        i.setId(10L);
        i.setRemoteInboundId(3);
        i.setProtocol(protocol);
        i.setPort(port);
        i.setRemark(remark);
        i.setStreamSettings(om.readValue(stream, new TypeReference<LinkedHashMap<String, Object>>() {
        }));
        i.setSettings(om.readValue(settings, new TypeReference<LinkedHashMap<String, Object>>() {
        }));
        return i;
    }

    private static Map<String, String> query(URI uri) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String pair : uri.getRawQuery().split("&")) {
            String[] kv = pair.split("=", 2);
            out.put(kv[0], URLDecoder.decode(kv[1], StandardCharsets.UTF_8));
        }
        return out;
    }
}
