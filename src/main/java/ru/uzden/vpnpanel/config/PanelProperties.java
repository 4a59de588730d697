package ru.uzden.vpnpanel.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Настройки работы с панелями 3x-ui.
 */
@ConfigurationProperties(prefix = "panels")
public record PanelProperties(
        @DefaultValue Http http,
        @DefaultValue Session session,
        @DefaultValue Security security,
        @DefaultValue Selection selection,
        @DefaultValue FanOut fanOut,
        @DefaultValue Admin admin
) {

    public record Http(
            @DefaultValue("5s") Duration connectTimeout,
            @DefaultValue("15s") Duration readTimeout
    ) {
    }

    public record Session(
            @DefaultValue("6h") Duration ttl,
            @DefaultValue("vpnpanel:panel_session:") String keyPrefix
    ) {
    }

    /**
     * credentialKey - секрет, из которого выводится AES-ключ для логинов/паролей панелей.
     */
    public record Security(
            String credentialKey,
            @DefaultValue("vpnpanel-credential-vault") String credentialSalt
    ) {
    }

    public record Selection(
            @DefaultValue("redis") String cursorStore,
            @DefaultValue("vpnpanel:round_robin_last_panel:") String cursorKeyPrefix
    ) {
    }

    public record FanOut(
            @DefaultValue("4") int parallelism
    ) {
    }

    public record Admin(
            String token
    ) {
    }
}
