package ru.uzden.vpnpanel.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Нативный идентификатор клиента на панели: протокол всегда идёт вместе со значением,
 * чтобы нельзя было передать UUID туда, где панель ждёт пароль или email.
 */
public record ClientIdentifier(VpnProtocol protocol, String value) {

    public ClientIdentifier {
        Objects.requireNonNull(protocol, "protocol is required");
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Client identifier value is required for " + protocol.wireName());
        }
        value = value.trim();
        if (protocol.usesUuid()) {
            try {
                UUID.fromString(value);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(protocol.wireName() + " identifier must be a UUID: " + value);
            }
        }
    }

    public static ClientIdentifier of(VpnProtocol protocol, String value) {
        return new ClientIdentifier(protocol, value);
    }

    public static ClientIdentifier uuid(VpnProtocol protocol, UUID uuid) {
        return new ClientIdentifier(protocol, uuid.toString());
    }

    public String keyField() {
        return protocol.keyField();
    }

    @Override
    public String toString() {
        return protocol.wireName() + ":" + keyField() + "=" + value;
    }
}
