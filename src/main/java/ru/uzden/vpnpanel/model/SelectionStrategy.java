package ru.uzden.vpnpanel.model;

/**
 * Стратегия выбора панели. BALANCED пока совпадает с LEAST_LOAD.
 */
public enum SelectionStrategy {
    LEAST_LOAD,
    ROUND_ROBIN,
    PRIORITY,
    BALANCED
}
