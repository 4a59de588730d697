package ru.uzden.vpnpanel.services;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import ru.uzden.vpnpanel.config.PanelProperties;

import java.time.Duration;
import java.util.Optional;

/**
 * Cookie сессий панелей в Redis. Недоступный Redis не должен останавливать работу с панелями:
 * ошибка пишется в лог и считается промахом.
 */
@Slf4j
@Service
public class PanelSessionCache {

    private final StringRedisTemplate redis;
    private final Duration ttl;
    private final String keyPrefix;

    public PanelSessionCache(StringRedisTemplate redis, PanelProperties props) {
        this.redis = redis;
        this.ttl = props.session().ttl();
        this.keyPrefix = props.session().keyPrefix();
    }

    public Optional<String> get(long panelId) {
        try {
            String cookie = redis.opsForValue().get(key(panelId));
            if (cookie == null || cookie.isBlank()) return Optional.empty();
            return Optional.of(cookie);
        } catch (DataAccessException e) {
            log.warn("Session cache read failed for panel {}: {}", panelId, e.getMessage());
            return Optional.empty();
        }
    }

    public void put(long panelId, String cookie) {
        try {
            redis.opsForValue().set(key(panelId), cookie, ttl);
        } catch (DataAccessException e) {
            log.warn("Session cache write failed for panel {}: {}", panelId, e.getMessage());
        }
    }

    public void evict(long panelId) {
        try {
            redis.delete(key(panelId));
        } catch (DataAccessException e) {
            log.warn("Session cache evict failed for panel {}: {}", panelId, e.getMessage());
        }
    }

    String key(long panelId) {
        return keyPrefix + panelId;
    }
}
