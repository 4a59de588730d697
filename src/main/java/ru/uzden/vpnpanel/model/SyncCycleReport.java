package ru.uzden.vpnpanel.model;

import java.util.Map;

/**
 * Итог синхронизации всех панелей: успешные с результатом, упавшие с текстом ошибки.
 */
public record SyncCycleReport(Map<Long, SyncOutcome> synced, Map<Long, String> failed) {

    public int processed() {
        return synced.values().stream().mapToInt(SyncOutcome::processed).sum();
    }
}
