package ru.uzden.vpnpanel.model;

/**
 * Результат добавления клиента на панель. subscriptionUrl может быть null.
 */
public record ProvisionedClient(ClientIdentifier nativeIdentifier, String subscriptionUrl) {
}
