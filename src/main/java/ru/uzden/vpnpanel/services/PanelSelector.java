package ru.uzden.vpnpanel.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.uzden.vpnpanel.entities.Panel;
import ru.uzden.vpnpanel.model.SelectionStrategy;
import ru.uzden.vpnpanel.model.VpnProtocol;
import ru.uzden.vpnpanel.repositories.ClientAccountRepository;
import ru.uzden.vpnpanel.repositories.PanelRepository;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Выбор панели для нового клиента внутри локации.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PanelSelector {

    private final PanelRepository panelRepository;
    private final ClientAccountRepository clientAccountRepository;
    private final RoundRobinCursor roundRobinCursor;

    /**
     * @param protocol        если задан - только панели с активным и включённым inbound'ом этого протокола
     * @param premiumRequired только премиум-панели
     * @param excludeIds      панели, которые уже не подошли (например, упали при выдаче)
     */
    @Transactional(readOnly = true)
    public Optional<Panel> select(long locationId,
                                  SelectionStrategy strategy,
                                  VpnProtocol protocol,
                                  boolean premiumRequired,
                                  Collection<Long> excludeIds) {
        List<Panel> candidates = candidates(locationId, protocol, premiumRequired, excludeIds);
        if (candidates.isEmpty()) {
            log.warn("No panel candidates for location {} (protocol={}, premium={})", locationId,
                    protocol == null ? "any" : protocol.wireName(), premiumRequired);
            return Optional.empty();
        }

        SelectionStrategy effective = strategy;
        if (effective == null) {
            log.warn("Selection strategy not set for location {}, using PRIORITY", locationId);
            effective = SelectionStrategy.PRIORITY;
        }

        Panel picked = switch (effective) {
            case LEAST_LOAD, BALANCED -> leastLoaded(candidates);
            case ROUND_ROBIN -> roundRobin(locationId, candidates);
            case PRIORITY -> candidates.get(0);
        };
        log.debug("Location {}: strategy {} picked panel {} of {}", locationId, effective, picked.getId(), candidates.size());
        return Optional.of(picked);
    }

    List<Panel> candidates(long locationId, VpnProtocol protocol, boolean premiumRequired, Collection<Long> excludeIds) {
        List<Panel> all = protocol == null
                ? panelRepository.findCandidates(locationId, premiumRequired)
                : panelRepository.findCandidatesWithProtocol(locationId, premiumRequired, protocol.wireName());
        if (excludeIds == null || excludeIds.isEmpty()) {
            return all;
        }
        Set<Long> excluded = Set.copyOf(excludeIds);
        return all.stream().filter(p -> !excluded.contains(p.getId())).toList();
    }

    /**
     * Минимум активных клиентов, при равенстве - раньше в списке.
     */
    private Panel leastLoaded(List<Panel> candidates) {
        List<Long> ids = candidates.stream().map(Panel::getId).toList();
        Map<Long, Long> loads = new HashMap<>();
        for (ClientAccountRepository.PanelLoad row : clientAccountRepository.countActiveByPanels(ids)) {
            loads.put(row.getPanelId(), row.getClients());
        }

        Panel best = null;
        long bestLoad = Long.MAX_VALUE;
        for (Panel p : candidates) {
            long load = loads.getOrDefault(p.getId(), 0L);
            if (load < bestLoad) {
                best = p;
                bestLoad = load;
            }
        }
        return best;
    }

    private Panel roundRobin(long locationId, List<Panel> candidates) {
        List<Long> ids = candidates.stream().map(Panel::getId).toList();
        long pickedId = roundRobinCursor.advance(locationId, ids);
        return candidates.stream()
                .filter(p -> p.getId() == pickedId)
                .findFirst()
                .orElse(candidates.get(0));
    }
}
