package ru.uzden.vpnpanel.services;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Service;
import ru.uzden.vpnpanel.config.PanelProperties;

import java.util.List;

@Slf4j
@Service
@ConditionalOnProperty(prefix = "panels.selection", name = "cursor-store", havingValue = "redis", matchIfMissing = true)
public class RedisRoundRobinCursor implements RoundRobinCursor {

    private final StringRedisTemplate redis;
    private final DefaultRedisScript<String> script;
    private final String keyPrefix;

    public RedisRoundRobinCursor(StringRedisTemplate redis, PanelProperties props) {
        this.redis = redis;
        this.keyPrefix = props.selection().cursorKeyPrefix();
        this.script = new DefaultRedisScript<>();
        this.script.setResultType(String.class);
        // чтение и запись последнего id в одном скрипте
        this.script.setScriptText(
                "local last = redis.call('GET', KEYS[1]); " +
                        "local idx = 1; " +
                        "if last then " +
                        "  for i = 1, #ARGV do " +
                        "    if ARGV[i] == last then idx = (i % #ARGV) + 1; break; end; " +
                        "  end; " +
                        "end; " +
                        "redis.call('SET', KEYS[1], ARGV[idx]); " +
                        "return ARGV[idx];"
        );
    }

    @Override
    public long advance(long locationId, List<Long> candidateIds) {
        if (candidateIds.isEmpty()) {
            throw new IllegalArgumentException("No candidates for round-robin");
        }
        Object[] args = candidateIds.stream().map(String::valueOf).toArray();
        String picked = redis.execute(script, List.of(keyPrefix + locationId), args);
        if (picked == null) {
            throw new IllegalStateException("Round-robin script returned nothing for location " + locationId);
        }
        log.debug("Round-robin location={} picked panel {}", locationId, picked);
        return Long.parseLong(picked);
    }
}
