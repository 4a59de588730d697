package ru.uzden.vpnpanel.model;

/**
 * Частичное изменение панели: null - поле не трогаем.
 */
public record PanelChanges(
        String name,
        String baseUrl,
        Long locationId,
        String username,
        String password,
        Integer priority,
        Boolean premium,
        String publicHost,
        Boolean active
) {

    public boolean touchesSession() {
        return baseUrl != null || username != null || password != null;
    }

    @Override
    public String toString() {
        return "PanelChanges[name=" + name + ", baseUrl=" + baseUrl + ", locationId=" + locationId
                + ", credentials=" + (username != null || password != null) + ", active=" + active + "]";
    }
}
