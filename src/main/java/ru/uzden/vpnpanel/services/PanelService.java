package ru.uzden.vpnpanel.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import ru.uzden.vpnpanel.entities.ClientAccount;
import ru.uzden.vpnpanel.entities.Location;
import ru.uzden.vpnpanel.entities.Panel;
import ru.uzden.vpnpanel.entities.PanelInbound;
import ru.uzden.vpnpanel.exceptions.NotFoundException;
import ru.uzden.vpnpanel.exceptions.ServiceException;
import ru.uzden.vpnpanel.model.ClientIdentifier;
import ru.uzden.vpnpanel.model.ClientSpec;
import ru.uzden.vpnpanel.model.ClientTraffic;
import ru.uzden.vpnpanel.model.HealthCheckResult;
import ru.uzden.vpnpanel.model.PanelChanges;
import ru.uzden.vpnpanel.model.PanelDraft;
import ru.uzden.vpnpanel.model.ProvisionedClient;
import ru.uzden.vpnpanel.model.SelectionStrategy;
import ru.uzden.vpnpanel.model.SyncCycleReport;
import ru.uzden.vpnpanel.model.SyncOutcome;
import ru.uzden.vpnpanel.model.VpnProtocol;
import ru.uzden.vpnpanel.repositories.ClientAccountRepository;
import ru.uzden.vpnpanel.repositories.LocationRepository;
import ru.uzden.vpnpanel.repositories.PanelInboundRepository;
import ru.uzden.vpnpanel.repositories.PanelRepository;
import ru.uzden.vpnpanel.security.CredentialVault;
import ru.uzden.vpnpanel.xui.ConfigLinkGenerator;
import ru.uzden.vpnpanel.xui.XuiPanelClientFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Точка входа для остальной системы: реестр панелей, выбор панели, выдача клиентов,
 * синхронизация и проверка здоровья.
 */
@Slf4j
@Service
public class PanelService {

    private final PanelRepository panelRepository;
    private final LocationRepository locationRepository;
    private final PanelInboundRepository inboundRepository;
    private final ClientAccountRepository accountRepository;
    private final CredentialVault vault;
    private final PanelSessionCache sessionCache;
    private final PanelSelector selector;
    private final InboundSynchronizer synchronizer;
    private final ClientProvisioner provisioner;
    private final PanelHealthMonitor healthMonitor;
    private final ConfigLinkGenerator linkGenerator;
    private final TransactionTemplate tx;
    private final Executor fanOutExecutor;

    public PanelService(PanelRepository panelRepository,
                        LocationRepository locationRepository,
                        PanelInboundRepository inboundRepository,
                        ClientAccountRepository accountRepository,
                        CredentialVault vault,
                        PanelSessionCache sessionCache,
                        PanelSelector selector,
                        InboundSynchronizer synchronizer,
                        ClientProvisioner provisioner,
                        PanelHealthMonitor healthMonitor,
                        ConfigLinkGenerator linkGenerator,
                        TransactionTemplate tx,
                        @Qualifier("panelFanOutExecutor") Executor fanOutExecutor) {
        this.panelRepository = panelRepository;
        this.locationRepository = locationRepository;
        this.inboundRepository = inboundRepository;
        this.accountRepository = accountRepository;
        this.vault = vault;
        this.sessionCache = sessionCache;
        this.selector = selector;
        this.synchronizer = synchronizer;
        this.provisioner = provisioner;
        this.healthMonitor = healthMonitor;
        this.linkGenerator = linkGenerator;
        this.tx = tx;
        this.fanOutExecutor = fanOutExecutor;
    }

    /* ============================ реестр панелей ============================ */

    @Transactional
    public Panel createPanel(PanelDraft draft) {
        requireText(draft.name(), "name");
        requireText(draft.username(), "username");
        requireText(draft.password(), "password");
        if (draft.locationId() == null) {
            throw new IllegalArgumentException("locationId is required");
        }
        String baseUrl = XuiPanelClientFactory.normalizeBaseUrl(draft.baseUrl());

        Location location = locationRepository.findById(draft.locationId())
                .orElseThrow(() -> new NotFoundException("Location " + draft.locationId() + " not found"));
        if (panelRepository.existsByBaseUrl(baseUrl)) {
            throw new ServiceException("Panel with url " + baseUrl + " already exists");
        }

        Panel panel = new Panel();
        panel.setName(draft.name().trim());
        panel.setBaseUrl(baseUrl);
        panel.setPanelType(Panel.PanelType.XUI);
        panel.setLocation(location);
        panel.setEncryptedUsername(vault.encrypt(draft.username()));
        panel.setEncryptedPassword(vault.encrypt(draft.password()));
        panel.setPriority(draft.priority() == null ? 0 : draft.priority());
        panel.setPremium(Boolean.TRUE.equals(draft.premium()));
        panel.setPublicHost(blankToNull(draft.publicHost()));
        panel.setActive(true);
        panel.setHealthy(null);

        Panel saved = panelRepository.save(panel);
        log.info("Panel {} registered: {} ({})", saved.getId(), saved.getName(), baseUrl);
        return saved;
    }

    public Panel updatePanel(long panelId, PanelChanges changes) {
        Panel updated = tx.execute(status -> {
            Panel panel = requirePanel(panelId);
            if (changes.name() != null) {
                requireText(changes.name(), "name");
                panel.setName(changes.name().trim());
            }
            if (changes.baseUrl() != null) {
                String baseUrl = XuiPanelClientFactory.normalizeBaseUrl(changes.baseUrl());
                Optional<Panel> other = panelRepository.findByBaseUrl(baseUrl);
                if (other.isPresent() && !other.get().getId().equals(panel.getId())) {
                    throw new ServiceException("Panel with url " + baseUrl + " already exists");
                }
                panel.setBaseUrl(baseUrl);
            }
            if (changes.locationId() != null) {
                Location location = locationRepository.findById(changes.locationId())
                        .orElseThrow(() -> new NotFoundException("Location " + changes.locationId() + " not found"));
                panel.setLocation(location);
            }
            if (changes.username() != null) {
                requireText(changes.username(), "username");
                panel.setEncryptedUsername(vault.encrypt(changes.username()));
            }
            if (changes.password() != null) {
                requireText(changes.password(), "password");
                panel.setEncryptedPassword(vault.encrypt(changes.password()));
            }
            if (changes.priority() != null) panel.setPriority(changes.priority());
            if (changes.premium() != null) panel.setPremium(changes.premium());
            if (changes.publicHost() != null) panel.setPublicHost(blankToNull(changes.publicHost()));
            if (changes.active() != null) panel.setActive(changes.active());
            return panelRepository.save(panel);
        });
        if (changes.touchesSession()) {
            sessionCache.evict(panelId);
        }
        log.info("Panel {} updated: {}", panelId, changes);
        return updated;
    }

    /**
     * Удаляет панель, если на ней нет активных клиентов. Inbound'ы удаляет каскад в БД.
     */
    public void deletePanel(long panelId) {
        tx.executeWithoutResult(status -> {
            Panel panel = requirePanel(panelId);
            long clients = accountRepository.countActiveByPanel(panelId);
            if (clients > 0) {
                throw new ServiceException("Panel " + panelId + " has " + clients + " active clients");
            }
            panelRepository.delete(panel);
        });
        sessionCache.evict(panelId);
        log.info("Panel {} deleted", panelId);
    }

    @Transactional(readOnly = true)
    public List<Panel> listPanels() {
        return panelRepository.findAllByOrderByIdAsc();
    }

    @Transactional(readOnly = true)
    public List<PanelInbound> getPanelInbounds(long panelId, boolean activeOnly) {
        if (!panelRepository.existsById(panelId)) {
            throw new NotFoundException("Panel " + panelId + " not found");
        }
        return activeOnly
                ? inboundRepository.findByPanelIdAndActiveTrueOrderByRemoteInboundIdAsc(panelId)
                : inboundRepository.findByPanelIdOrderByRemoteInboundIdAsc(panelId);
    }

    /* ============================ выбор панели ============================ */

    public Optional<Panel> selectPanelForLocation(long locationId,
                                                  SelectionStrategy strategy,
                                                  VpnProtocol protocol,
                                                  boolean premiumRequired,
                                                  Collection<Long> excludeIds) {
        return selector.select(locationId, strategy, protocol, premiumRequired, excludeIds);
    }

    public Optional<Panel> selectPanelForLocation(long locationId, SelectionStrategy strategy) {
        return selector.select(locationId, strategy, null, false, List.of());
    }

    /* ============================ синхронизация ============================ */

    /**
     * Неактивная панель не синхронизируется: результат нулевой.
     */
    public SyncOutcome syncPanelInbounds(long panelId) {
        Panel panel = requirePanel(panelId);
        if (!panel.isActive()) {
            log.warn("Panel {} is inactive, sync skipped", panelId);
            return new SyncOutcome(0, 0, 0, 0);
        }
        List<JsonNode> remote = synchronizer.fetch(panel);
        return tx.execute(status -> synchronizer.apply(requirePanel(panelId), remote));
    }

    /**
     * Параллельно забирает inbound'ы всех активных здоровых панелей и применяет успешные
     * одной транзакцией.
     */
    public SyncCycleReport syncInboundsFromPanels() {
        List<Panel> panels = panelRepository.findByActiveTrueAndHealthyTrueOrderByIdAsc();
        Map<Long, CompletableFuture<List<JsonNode>>> fetches = new LinkedHashMap<>();
        for (Panel p : panels) {
            fetches.put(p.getId(), CompletableFuture.supplyAsync(() -> synchronizer.fetch(p), fanOutExecutor));
        }

        Map<Long, List<JsonNode>> fetched = new LinkedHashMap<>();
        Map<Long, String> failed = new LinkedHashMap<>();
        fetches.forEach((panelId, future) -> {
            try {
                fetched.put(panelId, future.join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.error("Inbound sync failed for panel {}: {}", panelId, safeMsg(cause));
                failed.put(panelId, safeMsg(cause));
            }
        });

        Map<Long, SyncOutcome> synced = new LinkedHashMap<>();
        if (!fetched.isEmpty()) {
            tx.executeWithoutResult(status -> fetched.forEach((panelId, remote) ->
                    panelRepository.findById(panelId).ifPresent(panel ->
                            synced.put(panelId, synchronizer.apply(panel, remote)))));
        }
        SyncCycleReport report = new SyncCycleReport(synced, failed);
        log.info("Inbound sync cycle: panels={}, synced={}, failed={}, processed={}",
                panels.size(), synced.size(), failed.size(), report.processed());
        return report;
    }

    /* ============================ здоровье ============================ */

    public HealthCheckResult checkPanelHealth(long panelId) {
        return tx.execute(status -> healthMonitor.check(panelId));
    }

    /**
     * Проверяет все активные панели параллельно, результаты пишет одной транзакцией.
     * Ошибка одной панели на остальные не влияет.
     */
    public List<HealthCheckResult> checkAllPanelsHealth() {
        List<Panel> panels = panelRepository.findByActiveTrueOrderByIdAsc();
        List<CompletableFuture<HealthCheckResult>> futures = new ArrayList<>();
        for (Panel p : panels) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> healthMonitor.probe(p), fanOutExecutor)
                    .exceptionally(e -> HealthCheckResult.failed(p.getId(), safeMsg(e))));
        }
        List<HealthCheckResult> results = futures.stream().map(CompletableFuture::join).toList();

        if (!results.isEmpty()) {
            tx.executeWithoutResult(status -> {
                for (HealthCheckResult r : results) {
                    panelRepository.findById(r.panelId()).ifPresent(p -> healthMonitor.record(p, r));
                }
            });
        }
        long healthy = results.stream().filter(HealthCheckResult::healthy).count();
        log.info("Health cycle: panels={}, healthy={}", results.size(), healthy);
        return results;
    }

    /* ============================ клиенты ============================ */

    public ProvisionedClient addClientToPanel(long panelId, int remoteInboundId, ClientSpec spec, VpnProtocol protocol) {
        return provisioner.addClient(panelId, remoteInboundId, spec, protocol);
    }

    public ClientAccount provisionClient(long panelId, long inboundId, ClientSpec spec, String ownerRef) {
        return provisioner.provisionAccount(panelId, inboundId, spec, ownerRef);
    }

    public boolean updateClientOnPanel(long panelId,
                                       ClientIdentifier identifier,
                                       int remoteInboundId,
                                       Map<String, Object> updates,
                                       boolean resetTraffic) {
        return provisioner.updateClient(panelId, identifier, remoteInboundId, updates, resetTraffic);
    }

    public boolean deleteClientFromPanel(long panelId, int remoteInboundId, ClientIdentifier identifier) {
        return provisioner.deleteClient(panelId, remoteInboundId, identifier);
    }

    @Transactional(readOnly = true)
    public List<ClientAccount> listClientAccounts(String ownerRef) {
        requireText(ownerRef, "ownerRef");
        return accountRepository.findByOwnerRefOrderByCreatedAtDesc(ownerRef.trim());
    }

    public ClientAccount revokeClientAccount(long accountId) {
        return provisioner.revokeAccount(accountId);
    }

    public Optional<ClientTraffic> getClientUsageFromPanel(long panelId, ClientIdentifier identifier) {
        return provisioner.getUsage(panelId, identifier);
    }

    public ObjectNode getClientConfigFromPanel(long panelId, ClientIdentifier identifier, int remoteInboundId) {
        return provisioner.getClientConfig(panelId, identifier, remoteInboundId);
    }

    /**
     * @param inboundId локальный id inbound'а
     */
    @Transactional(readOnly = true)
    public Optional<String> generateConfigLink(long panelId, long inboundId, ClientIdentifier identifier, String remark) {
        Panel panel = requirePanel(panelId);
        PanelInbound inbound = inboundRepository.findById(inboundId)
                .orElseThrow(() -> new NotFoundException("Inbound " + inboundId + " not found"));
        if (inbound.getPanel() == null || !panel.getId().equals(inbound.getPanel().getId())) {
            throw new IllegalArgumentException("Inbound " + inboundId + " does not belong to panel " + panelId);
        }
        return linkGenerator.generate(panel, inbound, identifier, remark);
    }

    /* ============================ helpers ============================ */

    private Panel requirePanel(long panelId) {
        return panelRepository.findById(panelId)
                .orElseThrow(() -> new NotFoundException("Panel " + panelId + " not found"));
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }

    private static String safeMsg(Throwable t) {
        Throwable root = t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
        String m = root.getMessage();
        return (m == null || m.isBlank()) ? root.getClass().getSimpleName() : m;
    }
}
