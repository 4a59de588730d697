package ru.uzden.vpnpanel.model;

/**
 * Данные для регистрации панели. Логин и пароль приходят открытым текстом и сразу шифруются.
 */
public record PanelDraft(
        String name,
        String baseUrl,
        Long locationId,
        String username,
        String password,
        Integer priority,
        Boolean premium,
        String publicHost
) {

    @Override
    public String toString() {
        return "PanelDraft[name=" + name + ", baseUrl=" + baseUrl + ", locationId=" + locationId + "]";
    }
}
