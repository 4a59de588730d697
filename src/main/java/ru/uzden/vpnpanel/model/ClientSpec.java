package ru.uzden.vpnpanel.model;

import java.time.Instant;

/**
 * Желаемые параметры клиента на панели.
 *
 * @param email          уникальное внутри inbound имя клиента (обязательно)
 * @param uuid           clients[].id для vmess/vless
 * @param password       пароль для trojan/shadowsocks
 * @param totalBytes     лимит трафика в байтах, 0 - без лимита
 * @param expiresAt      окончание, null - бессрочно
 * @param limitIp        ограничение одновременных IP, 0 - без ограничения
 * @param flow           flow для vless (например xtls-rprx-vision)
 * @param method         шифр shadowsocks-клиента, пусто - метод inbound'а
 * @param subId          id подписки 3x-ui
 * @param enable         включён ли клиент
 */
public record ClientSpec(
        String email,
        String uuid,
        String password,
        long totalBytes,
        Instant expiresAt,
        int limitIp,
        String flow,
        String method,
        String subId,
        boolean enable
) {

    public static ClientSpec of(String email) {
        return new ClientSpec(email, null, null, 0L, null, 0, null, null, null, true);
    }

    public ClientSpec withUuid(String uuid) {
        return new ClientSpec(email, uuid, password, totalBytes, expiresAt, limitIp, flow, method, subId, enable);
    }

    public ClientSpec withPassword(String password) {
        return new ClientSpec(email, uuid, password, totalBytes, expiresAt, limitIp, flow, method, subId, enable);
    }

    public ClientSpec withEmail(String email) {
        return new ClientSpec(email, uuid, password, totalBytes, expiresAt, limitIp, flow, method, subId, enable);
    }

    public ClientSpec withSubId(String subId) {
        return new ClientSpec(email, uuid, password, totalBytes, expiresAt, limitIp, flow, method, subId, enable);
    }

    public ClientSpec withLimits(long totalBytes, Instant expiresAt) {
        return new ClientSpec(email, uuid, password, totalBytes, expiresAt, limitIp, flow, method, subId, enable);
    }

    public ClientSpec withFlow(String flow) {
        return new ClientSpec(email, uuid, password, totalBytes, expiresAt, limitIp, flow, method, subId, enable);
    }
}
