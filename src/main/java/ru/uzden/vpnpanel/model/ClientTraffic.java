package ru.uzden.vpnpanel.model;

/**
 * Счётчики трафика клиента в байтах. expiryTime - epoch millis, 0 - без срока.
 */
public record ClientTraffic(long up, long down, long total, long expiryTime) {

    public long used() {
        return up + down;
    }
}
