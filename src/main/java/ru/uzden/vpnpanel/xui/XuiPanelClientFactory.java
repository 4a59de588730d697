package ru.uzden.vpnpanel.xui;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import ru.uzden.vpnpanel.entities.Panel;
import ru.uzden.vpnpanel.security.CredentialVault;
import ru.uzden.vpnpanel.services.PanelSessionCache;

import java.util.Objects;

/**
 * Собирает {@link XuiPanelClient} для конкретной панели. Логин/пароль расшифровываются
 * на каждую сборку и живут только внутри клиента.
 */
@Slf4j
@Component
public class XuiPanelClientFactory {

    private final RestClient.Builder panelRestClientBuilder;
    private final CredentialVault vault;
    private final PanelSessionCache sessionCache;
    private final ObjectMapper objectMapper;

    public XuiPanelClientFactory(RestClient.Builder panelRestClientBuilder,
                                 CredentialVault vault,
                                 PanelSessionCache sessionCache,
                                 ObjectMapper objectMapper) {
        this.panelRestClientBuilder = panelRestClientBuilder;
        this.vault = vault;
        this.sessionCache = sessionCache;
        this.objectMapper = objectMapper;
    }

    public XuiPanelClient forPanel(Panel panel) {
        Objects.requireNonNull(panel.getId(), "panel must be persisted");
        String baseUrl = normalizeBaseUrl(panel.getBaseUrl());

        RestClient rest = panelRestClientBuilder.clone()
                .baseUrl(baseUrl)
                .build();

        return new XuiPanelClient(
                rest,
                panel.getId(),
                baseUrl,
                vault.decrypt(panel.getEncryptedUsername()),
                vault.decrypt(panel.getEncryptedPassword()),
                sessionCache,
                objectMapper
        );
    }

    /**
     * Без завершающего слэша, только http/https.
     */
    public static String normalizeBaseUrl(String raw) {
        String bu = Objects.requireNonNull(raw, "base url is required").trim();
        if (!bu.startsWith("http://") && !bu.startsWith("https://")) {
            throw new IllegalArgumentException("Panel base url must start with http:// or https://: " + raw);
        }
        while (bu.endsWith("/")) bu = bu.substring(0, bu.length() - 1);
        return bu;
    }
}
