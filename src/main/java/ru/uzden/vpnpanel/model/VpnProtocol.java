package ru.uzden.vpnpanel.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Протоколы клиентов 3x-ui. keyField - поле в settings.clients[], по которому панель
 * адресует клиента (lookup/update/delete/traffic).
 */
public enum VpnProtocol {
    VMESS("vmess", "id"),
    VLESS("vless", "id"),
    TROJAN("trojan", "password"),
    SHADOWSOCKS("shadowsocks", "email");

    private final String wireName;
    private final String keyField;

    VpnProtocol(String wireName, String keyField) {
        this.wireName = wireName;
        this.keyField = keyField;
    }

    public String wireName() {
        return wireName;
    }

    public String keyField() {
        return keyField;
    }

    public boolean usesUuid() {
        return this == VMESS || this == VLESS;
    }

    public static Optional<VpnProtocol> fromWire(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (VpnProtocol p : values()) {
            if (p.wireName.equals(v)) return Optional.of(p);
        }
        return Optional.empty();
    }

    public static VpnProtocol requireWire(String value) {
        return fromWire(value)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported protocol: " + value));
    }
}
