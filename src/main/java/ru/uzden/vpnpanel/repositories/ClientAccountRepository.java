package ru.uzden.vpnpanel.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import ru.uzden.vpnpanel.entities.ClientAccount;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ClientAccountRepository extends JpaRepository<ClientAccount, Long> {

    /**
     * Нагрузка панели: сколько активных клиентов на ней выдано.
     */
    interface PanelLoad {
        Long getPanelId();

        long getClients();
    }

    @Query("""
           select count(c) from ClientAccount c
           where c.panel.id = :panelId
             and c.status = ru.uzden.vpnpanel.entities.ClientAccount$Status.ACTIVE
           """)
    long countActiveByPanel(@Param("panelId") long panelId);

    /**
     * Одним запросом для всех кандидатов. Панели без клиентов в результат не попадают.
     */
    @Query("""
           select c.panel.id as panelId, count(c) as clients
           from ClientAccount c
           where c.panel.id in :panelIds
             and c.status = ru.uzden.vpnpanel.entities.ClientAccount$Status.ACTIVE
           group by c.panel.id
           """)
    List<PanelLoad> countActiveByPanels(@Param("panelIds") Collection<Long> panelIds);

    @Query("""
           select c from ClientAccount c
           where c.panel.id = :panelId
             and c.protocol = :protocol
             and c.nativeIdentifier = :identifier
             and c.status <> ru.uzden.vpnpanel.entities.ClientAccount$Status.DELETED
           order by c.createdAt desc
           """)
    List<ClientAccount> findLiveByIdentifier(@Param("panelId") long panelId,
                                             @Param("protocol") String protocol,
                                             @Param("identifier") String identifier);

    List<ClientAccount> findByOwnerRefOrderByCreatedAtDesc(String ownerRef);

    default Optional<ClientAccount> findLatestLive(long panelId, String protocol, String identifier) {
        return findLiveByIdentifier(panelId, protocol, identifier).stream().findFirst();
    }
}
