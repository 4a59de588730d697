package ru.uzden.vpnpanel.model;

/**
 * Итог синхронизации inbound'ов одной панели. processed = added + updated + deactivated.
 */
public record SyncOutcome(int fetched, int added, int updated, int deactivated) {

    public int processed() {
        return added + updated + deactivated;
    }

    public boolean hasChanges() {
        return processed() > 0;
    }
}
