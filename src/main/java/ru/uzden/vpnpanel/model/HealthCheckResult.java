package ru.uzden.vpnpanel.model;

public record HealthCheckResult(long panelId, boolean healthy, String errorMessage) {

    public static HealthCheckResult ok(long panelId) {
        return new HealthCheckResult(panelId, true, "");
    }

    public static HealthCheckResult failed(long panelId, String errorMessage) {
        return new HealthCheckResult(panelId, false, errorMessage == null ? "" : errorMessage);
    }
}
