package ru.uzden.vpnpanel.xui;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.uzden.vpnpanel.model.ClientIdentifier;
import ru.uzden.vpnpanel.model.ClientSpec;
import ru.uzden.vpnpanel.model.VpnProtocol;

import java.util.UUID;

/**
 * Тела запросов addClient/updateClient. Объект клиента повторяет то, что шлёт web-панель 3x-ui.
 */
final class XuiClientPayloads {

    private XuiClientPayloads() {
    }

    static void validate(ClientSpec spec, VpnProtocol protocol) {
        if (spec == null) {
            throw new IllegalArgumentException("Client spec is required");
        }
        if (spec.email() == null || spec.email().isBlank()) {
            throw new IllegalArgumentException("Client email is required");
        }
        switch (protocol) {
            case VMESS, VLESS -> {
                if (spec.uuid() == null || spec.uuid().isBlank()) {
                    throw new IllegalArgumentException(protocol.wireName() + " client requires a UUID");
                }
                UUID.fromString(spec.uuid().trim());
            }
            case TROJAN, SHADOWSOCKS -> {
                if (spec.password() == null || spec.password().isBlank()) {
                    throw new IllegalArgumentException(protocol.wireName() + " client requires a password");
                }
            }
        }
    }

    static ObjectNode clientObject(ObjectMapper om, ClientSpec spec, VpnProtocol protocol) {
        ObjectNode c = om.createObjectNode();
        switch (protocol) {
            case VMESS -> c.put("id", spec.uuid().trim());
            case VLESS -> {
                c.put("id", spec.uuid().trim());
                c.put("flow", spec.flow() == null ? "" : spec.flow());
            }
            case TROJAN -> c.put("password", spec.password());
            case SHADOWSOCKS -> {
                c.put("password", spec.password());
                c.put("method", spec.method() == null ? "" : spec.method());
            }
        }
        c.put("email", spec.email().trim());
        c.put("limitIp", spec.limitIp());
        // totalGB в 3x-ui исторически называется так, но хранит байты
        c.put("totalGB", Math.max(0L, spec.totalBytes()));
        c.put("expiryTime", spec.expiresAt() == null ? 0L : spec.expiresAt().toEpochMilli());
        c.put("enable", spec.enable());
        c.put("tgId", "");
        c.put("subId", spec.subId() == null ? "" : spec.subId());
        c.put("reset", 0);
        return c;
    }

    /**
     * {"id": inboundId, "settings": "{\"clients\":[...]}"} - settings уходит строкой.
     */
    static ObjectNode settingsEnvelope(ObjectMapper om, int remoteInboundId, JsonNode client) {
        ObjectNode settings = om.createObjectNode();
        ArrayNode clients = settings.putArray("clients");
        clients.add(client);

        ObjectNode payload = om.createObjectNode();
        payload.put("id", remoteInboundId);
        try {
            payload.put("settings", om.writeValueAsString(settings));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize client settings", e);
        }
        return payload;
    }

    static ClientIdentifier nativeIdentifier(ClientSpec spec, VpnProtocol protocol) {
        return switch (protocol) {
            case VMESS, VLESS -> ClientIdentifier.of(protocol, spec.uuid());
            case TROJAN -> ClientIdentifier.of(protocol, spec.password());
            case SHADOWSOCKS -> ClientIdentifier.of(protocol, spec.email());
        };
    }

    /**
     * Ссылка подписки "на лучшее усилие": /sub/{subId}, если subId задан, иначе /{protocol}/{identifier}.
     */
    static String subscriptionUrl(String baseUrl, ClientSpec spec, ClientIdentifier identifier) {
        if (spec.subId() != null && !spec.subId().isBlank()) {
            return baseUrl + "/sub/" + spec.subId().trim();
        }
        return baseUrl + "/" + identifier.protocol().wireName() + "/" + identifier.value();
    }
}
