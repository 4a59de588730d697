package ru.uzden.vpnpanel.xui;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;
import ru.uzden.vpnpanel.entities.Panel;
import ru.uzden.vpnpanel.entities.PanelInbound;
import ru.uzden.vpnpanel.exceptions.ConfigGenerationException;
import ru.uzden.vpnpanel.model.ClientIdentifier;
import ru.uzden.vpnpanel.model.VpnProtocol;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static ru.uzden.vpnpanel.xui.InboundJson.firstNonBlank;
import static ru.uzden.vpnpanel.xui.InboundJson.firstText;
import static ru.uzden.vpnpanel.xui.InboundJson.objectOrMissing;
import static ru.uzden.vpnpanel.xui.InboundJson.textOrNull;

/**
 * Собирает ссылки подключения vless:// и vmess:// по локальному зеркалу inbound'а.
 * Для остальных протоколов ссылок нет (пустой результат).
 */
@Slf4j
@Component
public class ConfigLinkGenerator {

    private final ObjectMapper om;

    public ConfigLinkGenerator(ObjectMapper om) {
        this.om = om;
    }

    public Optional<String> generate(Panel panel, PanelInbound inbound, ClientIdentifier identifier, String remark) {
        Optional<VpnProtocol> protocol = VpnProtocol.fromWire(inbound.getProtocol());
        if (protocol.isEmpty() || !protocol.get().usesUuid()) {
            log.warn("Config link is not supported for protocol '{}' (panel {}, inbound {})",
                    inbound.getProtocol(), panel.getId(), inbound.getRemoteInboundId());
            return Optional.empty();
        }
        if (identifier.protocol() != protocol.get()) {
            throw new IllegalArgumentException("Identifier protocol " + identifier.protocol().wireName()
                    + " does not match inbound protocol " + inbound.getProtocol());
        }

        String host = resolveHost(panel);
        Integer port = inbound.getPort();
        if (port == null || port <= 0) {
            throw new ConfigGenerationException("Inbound " + inbound.getRemoteInboundId() + " has no port");
        }
        String tag = firstNonBlank(remark, inbound.getRemark(), "vpn");

        try {
            JsonNode stream = InboundJson.toTree(om, inbound.getStreamSettings());
            JsonNode settings = InboundJson.toTree(om, inbound.getSettings());
            String link = protocol.get() == VpnProtocol.VLESS
                    ? vless(host, port, identifier, tag, stream, settings)
                    : vmess(host, port, identifier, tag, stream, settings);
            log.debug("Config link generated for panel {}, inbound {}", panel.getId(), inbound.getRemoteInboundId());
            return Optional.of(link);
        } catch (IllegalArgumentException e) {
            throw new ConfigGenerationException("Malformed inbound settings: " + e.getMessage(), e);
        }
    }

    /* ============================ vless ============================ */

    private String vless(String host, int port, ClientIdentifier identifier, String tag,
                         JsonNode stream, JsonNode settings) {
        String network = firstNonBlank(textOrNull(stream, "network"), "tcp");
        String security = firstNonBlank(textOrNull(stream, "security"), "none");

        Map<String, String> params = new LinkedHashMap<>();
        params.put("type", network);
        params.put("security", security);

        switch (network) {
            case "tcp" -> {
                JsonNode header = objectOrMissing(objectOrMissing(stream, "tcpSettings"), "header");
                if ("http".equals(textOrNull(header, "type"))) {
                    JsonNode request = objectOrMissing(header, "request");
                    params.put("headerType", "http");
                    params.put("path", withSlash(firstText(request, "path")));
                    params.put("host", firstText(objectOrMissing(request, "headers"), "Host"));
                }
            }
            case "ws" -> {
                JsonNode ws = objectOrMissing(stream, "wsSettings");
                params.put("path", withSlash(textOrNull(ws, "path")));
                params.put("host", firstNonBlank(textOrNull(ws, "host"),
                        textOrNull(objectOrMissing(ws, "headers"), "Host")));
            }
            case "grpc" -> {
                JsonNode grpc = objectOrMissing(stream, "grpcSettings");
                params.put("serviceName", textOrNull(grpc, "serviceName"));
                params.put("mode", grpc.path("multiMode").asBoolean(false) ? "multi" : "gun");
            }
            default -> {
                // неизвестный транспорт: только type
            }
        }

        switch (security) {
            case "tls" -> {
                JsonNode tls = objectOrMissing(stream, "tlsSettings");
                params.put("sni", firstNonBlank(textOrNull(tls, "serverName"), textOrNull(tls, "sni"), host));
                params.put("fp", firstNonBlank(textOrNull(tls, "fingerprint"),
                        textOrNull(objectOrMissing(tls, "settings"), "fingerprint")));
                params.put("alpn", joinArray(tls.path("alpn")));
            }
            case "reality" -> {
                JsonNode reality = objectOrMissing(stream, "realitySettings");
                JsonNode inner = reality.has("settings") ? objectOrMissing(reality, "settings") : reality;
                String pbk = firstNonBlank(textOrNull(inner, "publicKey"), textOrNull(reality, "publicKey"));
                if (pbk == null) {
                    throw new ConfigGenerationException("reality publicKey not found in streamSettings.realitySettings");
                }
                params.put("sni", firstNonBlank(firstText(reality, "serverNames"), host));
                params.put("fp", firstNonBlank(textOrNull(inner, "fingerprint"), textOrNull(reality, "fingerprint"), "chrome"));
                params.put("pbk", pbk);
                params.put("sid", firstNonBlank(firstText(inner, "shortIds"), firstText(reality, "shortIds")));
                params.put("spx", firstNonBlank(textOrNull(inner, "spiderX"), textOrNull(reality, "spiderX")));
            }
            default -> {
                // none и неизвестные значения параметров не добавляют
            }
        }

        if ("tls".equals(security) || "reality".equals(security)) {
            String flow = firstNonBlank(textOrNull(findClient(settings, identifier), "flow"), textOrNull(settings, "flow"));
            params.put("flow", flow);
        }

        StringBuilder sb = new StringBuilder();
        sb.append("vless://")
                .append(identifier.value())
                .append("@")
                .append(host)
                .append(":")
                .append(port)
                .append("?");
        boolean first = true;
        for (Map.Entry<String, String> e : params.entrySet()) {
            if (e.getValue() == null || e.getValue().isEmpty()) continue;
            if (!first) sb.append("&");
            sb.append(e.getKey()).append("=").append(enc(e.getValue()));
            first = false;
        }
        // имя профиля: пробел как %20, не "+"
        sb.append("#").append(UriUtils.encodeFragment(tag, StandardCharsets.UTF_8));
        return sb.toString();
    }

    /* ============================ vmess ============================ */

    private String vmess(String host, int port, ClientIdentifier identifier, String tag,
                         JsonNode stream, JsonNode settings) {
        String network = firstNonBlank(textOrNull(stream, "network"), "tcp");
        String security = firstNonBlank(textOrNull(stream, "security"), "none");
        JsonNode client = findClient(settings, identifier);

        // TreeMap: ключи в JSON идут по алфавиту, как у панели
        Map<String, String> data = new TreeMap<>();
        data.put("v", "2");
        data.put("ps", tag);
        data.put("add", host);
        data.put("port", String.valueOf(port));
        data.put("id", identifier.value());
        data.put("aid", String.valueOf(client.path("alterId").asInt(0)));
        data.put("scy", "auto");
        data.put("net", network);
        data.put("type", "none");

        switch (network) {
            case "tcp" -> {
                JsonNode header = objectOrMissing(objectOrMissing(stream, "tcpSettings"), "header");
                if ("http".equals(textOrNull(header, "type"))) {
                    JsonNode request = objectOrMissing(header, "request");
                    data.put("type", "http");
                    String paths = joinArray(request.path("path"));
                    data.put("path", paths == null ? "/" : paths);
                    data.put("host", firstText(objectOrMissing(request, "headers"), "Host"));
                }
            }
            case "ws" -> {
                JsonNode ws = objectOrMissing(stream, "wsSettings");
                data.put("path", withSlash(textOrNull(ws, "path")));
                data.put("host", firstNonBlank(textOrNull(ws, "host"),
                        textOrNull(objectOrMissing(ws, "headers"), "Host")));
            }
            case "grpc" -> {
                JsonNode grpc = objectOrMissing(stream, "grpcSettings");
                data.put("path", textOrNull(grpc, "serviceName"));
                data.put("type", grpc.path("multiMode").asBoolean(false) ? "multi" : "gun");
            }
            default -> {
            }
        }

        if ("tls".equals(security)) {
            JsonNode tls = objectOrMissing(stream, "tlsSettings");
            data.put("tls", "tls");
            data.put("sni", firstNonBlank(textOrNull(tls, "serverName"), textOrNull(tls, "sni"), host));
            data.put("fp", firstNonBlank(textOrNull(tls, "fingerprint"),
                    textOrNull(objectOrMissing(tls, "settings"), "fingerprint")));
            data.put("alpn", joinArray(tls.path("alpn")));
        }

        data.values().removeIf(v -> v == null || v.isEmpty());
        try {
            String json = om.writeValueAsString(data);
            return "vmess://" + Base64.getUrlEncoder().withoutPadding()
                    .encodeToString(json.getBytes(StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            throw new ConfigGenerationException("Failed to serialize vmess config", e);
        }
    }

    /* ============================ helpers ============================ */

    /**
     * Хост для клиентов: public_host панели, иначе хост из base_url.
     */
    String resolveHost(Panel panel) {
        String publicHost = InboundJson.blankToNull(panel.getPublicHost());
        if (publicHost != null) return publicHost;
        try {
            String host = panel.getBaseUrl() == null ? null : URI.create(panel.getBaseUrl().trim()).getHost();
            if (host != null && !host.isBlank()) return host;
        } catch (IllegalArgumentException e) {
            throw new ConfigGenerationException("Panel " + panel.getId() + " has invalid base url", e);
        }
        throw new ConfigGenerationException("Panel " + panel.getId() + " has no host for config links");
    }

    /**
     * Клиент из settings.clients[] по идентификатору, иначе первый в списке.
     */
    private static JsonNode findClient(JsonNode settings, ClientIdentifier identifier) {
        JsonNode clients = settings.path("clients");
        if (!clients.isArray() || clients.isEmpty()) return MissingNode.getInstance();
        for (JsonNode c : clients) {
            if (identifier.value().equals(c.path(identifier.keyField()).asText(null))) return c;
        }
        return clients.get(0);
    }

    private static String joinArray(JsonNode arr) {
        if (arr == null || !arr.isArray() || arr.isEmpty()) return null;
        List<String> values = new ArrayList<>();
        for (JsonNode n : arr) {
            String v = InboundJson.blankToNull(n.asText(""));
            if (v != null) values.add(v);
        }
        return values.isEmpty() ? null : String.join(",", values);
    }

    private static String withSlash(String path) {
        if (path == null || path.isBlank()) return "/";
        return path.startsWith("/") ? path : "/" + path;
    }

    private static String enc(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
