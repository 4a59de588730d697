package ru.uzden.vpnpanel.services;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import ru.uzden.vpnpanel.entities.ClientAccount;
import ru.uzden.vpnpanel.entities.Panel;
import ru.uzden.vpnpanel.entities.PanelInbound;
import ru.uzden.vpnpanel.exceptions.ConfigGenerationException;
import ru.uzden.vpnpanel.exceptions.NotFoundException;
import ru.uzden.vpnpanel.exceptions.PanelApiException;
import ru.uzden.vpnpanel.exceptions.ServiceException;
import ru.uzden.vpnpanel.model.ClientIdentifier;
import ru.uzden.vpnpanel.model.ClientSpec;
import ru.uzden.vpnpanel.model.ClientTraffic;
import ru.uzden.vpnpanel.model.ProvisionedClient;
import ru.uzden.vpnpanel.model.VpnProtocol;
import ru.uzden.vpnpanel.repositories.ClientAccountRepository;
import ru.uzden.vpnpanel.repositories.PanelInboundRepository;
import ru.uzden.vpnpanel.repositories.PanelRepository;
import ru.uzden.vpnpanel.xui.ConfigLinkGenerator;
import ru.uzden.vpnpanel.xui.InboundJson;
import ru.uzden.vpnpanel.xui.XuiPanelClient;
import ru.uzden.vpnpanel.xui.XuiPanelClientFactory;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Создание, изменение и удаление клиентов на панелях.
 * <p>
 * HTTP к панели никогда не выполняется внутри транзакции: сначала панель, потом БД.
 * Если запись в БД не удалась, клиент на панели удаляется обратно.
 */
@Slf4j
@Service
public class ClientProvisioner {

    private static final String SUB_ID_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";

    private final PanelRepository panelRepository;
    private final PanelInboundRepository inboundRepository;
    private final ClientAccountRepository accountRepository;
    private final XuiPanelClientFactory clientFactory;
    private final ConfigLinkGenerator linkGenerator;
    private final TransactionTemplate tx;
    private final SecureRandom random = new SecureRandom();

    public ClientProvisioner(PanelRepository panelRepository,
                             PanelInboundRepository inboundRepository,
                             ClientAccountRepository accountRepository,
                             XuiPanelClientFactory clientFactory,
                             ConfigLinkGenerator linkGenerator,
                             TransactionTemplate tx) {
        this.panelRepository = panelRepository;
        this.inboundRepository = inboundRepository;
        this.accountRepository = accountRepository;
        this.clientFactory = clientFactory;
        this.linkGenerator = linkGenerator;
        this.tx = tx;
    }

    /**
     * Только панель: без локальной записи.
     */
    public ProvisionedClient addClient(long panelId, int remoteInboundId, ClientSpec spec, VpnProtocol protocol) {
        Panel panel = requireActivePanel(panelId);
        return clientFactory.forPanel(panel).addClient(remoteInboundId, spec, protocol);
    }

    /**
     * Полная выдача: дополняет spec, создаёт клиента на панели, строит ссылку и только потом
     * сохраняет {@link ClientAccount}.
     *
     * @param inboundId локальный id inbound'а (panel_inbounds.id)
     */
    public ClientAccount provisionAccount(long panelId, long inboundId, ClientSpec spec, String ownerRef) {
        Panel panel = requireActivePanel(panelId);
        PanelInbound inbound = inboundRepository.findById(inboundId)
                .orElseThrow(() -> new NotFoundException("Inbound " + inboundId + " not found"));
        if (inbound.getPanel() == null || !panel.getId().equals(inbound.getPanel().getId())) {
            throw new IllegalArgumentException("Inbound " + inboundId + " does not belong to panel " + panelId);
        }
        if (!inbound.isActive() || !inbound.isPanelEnabled()) {
            throw new ServiceException("Inbound " + inboundId + " is not available for new clients");
        }
        VpnProtocol protocol = VpnProtocol.requireWire(inbound.getProtocol());
        ClientSpec filled = complete(spec == null ? ClientSpec.of(null) : spec, protocol, inbound, ownerRef);

        XuiPanelClient client = clientFactory.forPanel(panel);
        ProvisionedClient provisioned = client.addClient(inbound.getRemoteInboundId(), filled, protocol);

        String link = null;
        String linkError = null;
        try {
            link = linkGenerator.generate(panel, inbound, provisioned.nativeIdentifier(), filled.email()).orElse(null);
        } catch (ConfigGenerationException e) {
            log.warn("Config link for {} on panel {} not generated: {}", filled.email(), panelId, e.getMessage());
            linkError = "config link: " + e.getMessage();
        }

        ClientAccount account = new ClientAccount();
        account.setPanel(panel);
        account.setInbound(inbound);
        account.setRemoteInboundId(inbound.getRemoteInboundId());
        account.setProtocol(protocol.wireName());
        account.setNativeIdentifier(provisioned.nativeIdentifier().value());
        account.setEmail(filled.email());
        account.setSubscriptionUrl(provisioned.subscriptionUrl());
        account.setConfigLink(link);
        account.setOwnerRef(ownerRef);
        account.setTrafficLimitBytes(filled.totalBytes());
        account.setExpiresAt(filled.expiresAt());
        account.setStatus(ClientAccount.Status.ACTIVE);
        account.setLastError(linkError);

        try {
            ClientAccount saved = tx.execute(status -> accountRepository.save(account));
            log.info("Client {} provisioned on panel {} inbound {} (account {})",
                    filled.email(), panelId, inbound.getRemoteInboundId(), saved.getId());
            return saved;
        } catch (RuntimeException e) {
            log.error("Failed to persist client {} on panel {}, rolling back remote client", filled.email(), panelId, e);
            compensate(client, inbound.getRemoteInboundId(), provisioned.nativeIdentifier());
            throw e;
        }
    }

    public boolean updateClient(long panelId,
                                ClientIdentifier identifier,
                                int remoteInboundId,
                                Map<String, Object> updates,
                                boolean resetTraffic) {
        Panel panel = requirePanel(panelId);
        XuiPanelClient client = clientFactory.forPanel(panel);

        boolean ok = client.updateClient(remoteInboundId, identifier, updates);
        if (ok && resetTraffic) {
            boolean reset = client.resetClientTraffic(identifier, remoteInboundId);
            if (!reset) {
                log.warn("Traffic reset for {} on panel {} did not find the client", identifier, panelId);
            }
        }
        if (ok) {
            tx.executeWithoutResult(status -> syncLocalAccount(panelId, identifier, updates));
        }
        return ok;
    }

    public boolean deleteClient(long panelId, int remoteInboundId, ClientIdentifier identifier) {
        Panel panel = requirePanel(panelId);
        boolean ok = clientFactory.forPanel(panel).deleteClient(remoteInboundId, identifier);
        if (ok) {
            tx.executeWithoutResult(status -> accountRepository
                    .findLatestLive(panelId, identifier.protocol().wireName(), identifier.value())
                    .ifPresent(ClientAccount::markDeleted));
        }
        return ok;
    }

    /**
     * Удаляет клиента аккаунта с панели и помечает аккаунт DELETED. Клиента, которого на панели
     * уже нет, считаем удалённым.
     */
    public ClientAccount revokeAccount(long accountId) {
        ClientAccount account = accountRepository.findById(accountId)
                .orElseThrow(() -> new NotFoundException("Client account " + accountId + " not found"));
        if (account.getStatus() == ClientAccount.Status.DELETED) {
            return account;
        }

        Long panelId = account.getPanel() == null ? null : account.getPanel().getId();
        Panel panel = panelId == null ? null : panelRepository.findById(panelId).orElse(null);
        if (panel != null) {
            ClientIdentifier identifier = ClientIdentifier.of(
                    VpnProtocol.requireWire(account.getProtocol()), account.getNativeIdentifier());
            try {
                clientFactory.forPanel(panel).deleteClient(account.getRemoteInboundId(), identifier);
            } catch (PanelApiException e) {
                if (!e.isNotFound()) throw e;
                log.info("Client {} already absent on panel {}", identifier, panelId);
            }
        } else {
            log.warn("Account {} has no panel anymore, marking deleted locally", accountId);
        }

        return tx.execute(status -> {
            ClientAccount fresh = accountRepository.findById(accountId).orElseThrow();
            fresh.markDeleted();
            return accountRepository.save(fresh);
        });
    }

    public Optional<ClientTraffic> getUsage(long panelId, ClientIdentifier identifier) {
        Panel panel = requirePanel(panelId);
        return clientFactory.forPanel(panel).getClientTraffics(identifier);
    }

    public ObjectNode getClientConfig(long panelId, ClientIdentifier identifier, int remoteInboundId) {
        Panel panel = requirePanel(panelId);
        return clientFactory.forPanel(panel).getClientDetails(identifier, remoteInboundId)
                .orElseThrow(() -> new NotFoundException(
                        "Client " + identifier + " not found on panel " + panelId + " inbound " + remoteInboundId));
    }

    /* ============================ внутреннее ============================ */

    private Panel requirePanel(long panelId) {
        return panelRepository.findById(panelId)
                .orElseThrow(() -> new NotFoundException("Panel " + panelId + " not found"));
    }

    private Panel requireActivePanel(long panelId) {
        Panel panel = requirePanel(panelId);
        if (!panel.isActive()) {
            throw new ServiceException("Panel " + panelId + " is inactive");
        }
        return panel;
    }

    /**
     * Заполняет то, что не задал вызывающий: uuid/пароль, email, subId, flow из настроек inbound'а.
     */
    ClientSpec complete(ClientSpec spec, VpnProtocol protocol, PanelInbound inbound, String ownerRef) {
        ClientSpec out = spec;
        if (protocol.usesUuid() && isBlank(out.uuid())) {
            out = out.withUuid(UUID.randomUUID().toString());
        }
        if (!protocol.usesUuid() && isBlank(out.password())) {
            out = out.withPassword(randomToken(16));
        }
        if (isBlank(out.email())) {
            // email уникален внутри inbound'а, поэтому добавляем случайный хвост
            String prefix = isBlank(ownerRef) ? "client" : ownerRef.trim().replaceAll("[^A-Za-z0-9_.-]", "_");
            out = out.withEmail(prefix + "_" + randomSubId(8));
        }
        if (isBlank(out.subId())) {
            out = out.withSubId(randomSubId(16));
        }
        if (protocol == VpnProtocol.VLESS && out.flow() == null) {
            out = out.withFlow(inboundFlow(inbound));
        }
        return out;
    }

    private String inboundFlow(PanelInbound inbound) {
        Object clients = inbound.getSettings() == null ? null : inbound.getSettings().get("clients");
        if (clients instanceof List<?> list && !list.isEmpty() && list.get(0) instanceof Map<?, ?> first) {
            Object flow = first.get("flow");
            return flow == null ? null : InboundJson.blankToNull(flow.toString());
        }
        return null;
    }

    private void syncLocalAccount(long panelId, ClientIdentifier identifier, Map<String, Object> updates) {
        accountRepository.findLatestLive(panelId, identifier.protocol().wireName(), identifier.value())
                .ifPresent(account -> {
                    Object enable = updates.get("enable");
                    if (Boolean.FALSE.equals(enable)) {
                        account.markDisabled();
                    } else if (Boolean.TRUE.equals(enable)) {
                        account.setStatus(ClientAccount.Status.ACTIVE);
                    }
                    if (updates.get("totalGB") instanceof Number total) {
                        account.setTrafficLimitBytes(total.longValue());
                    }
                    if (updates.get("expiryTime") instanceof Number expiry) {
                        account.setExpiresAt(expiry.longValue() > 0 ? Instant.ofEpochMilli(expiry.longValue()) : null);
                    }
                });
    }

    private void compensate(XuiPanelClient client, int remoteInboundId, ClientIdentifier identifier) {
        try {
            client.deleteClient(remoteInboundId, identifier);
            log.info("Remote client {} removed after failed persist", identifier);
        } catch (RuntimeException ce) {
            log.error("Compensation failed: client {} stays on panel {} inbound {}",
                    identifier, client.getPanelId(), remoteInboundId, ce);
        }
    }

    private String randomSubId(int len) {
        StringBuilder sb = new StringBuilder(len);
        for (int i = 0; i < len; i++) sb.append(SUB_ID_ALPHABET.charAt(random.nextInt(SUB_ID_ALPHABET.length())));
        return sb.toString();
    }

    private String randomToken(int bytes) {
        byte[] buf = new byte[bytes];
        random.nextBytes(buf);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(buf);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
