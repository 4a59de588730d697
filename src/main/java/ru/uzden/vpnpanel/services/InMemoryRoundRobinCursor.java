package ru.uzden.vpnpanel.services;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Курсор в памяти процесса, для одного экземпляра сервиса.
 */
@Service
@ConditionalOnProperty(prefix = "panels.selection", name = "cursor-store", havingValue = "memory")
public class InMemoryRoundRobinCursor implements RoundRobinCursor {

    private final ConcurrentHashMap<Long, Long> lastByLocation = new ConcurrentHashMap<>();

    @Override
    public long advance(long locationId, List<Long> candidateIds) {
        if (candidateIds.isEmpty()) {
            throw new IllegalArgumentException("No candidates for round-robin");
        }
        return lastByLocation.compute(locationId, (k, last) -> RoundRobinCursor.nextAfter(last, candidateIds));
    }
}
