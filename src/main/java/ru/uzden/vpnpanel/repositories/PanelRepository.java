package ru.uzden.vpnpanel.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import ru.uzden.vpnpanel.entities.Panel;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface PanelRepository extends JpaRepository<Panel, Long> {

    Optional<Panel> findByBaseUrl(String baseUrl);

    boolean existsByBaseUrl(String baseUrl);

    List<Panel> findByActiveTrueOrderByIdAsc();

    List<Panel> findByActiveTrueAndHealthyTrueOrderByIdAsc();

    List<Panel> findAllByOrderByIdAsc();

    long countByLocationId(Long locationId);

    long countByLocationIdAndActiveTrue(Long locationId);

    /**
     * Пишет только is_healthy/last_checked, остальные колонки панели не трогает.
     */
    @Transactional
    @Modifying
    @Query("update Panel p set p.healthy = :healthy, p.lastChecked = :checkedAt where p.id = :id")
    int updateHealth(@Param("id") long id,
                     @Param("healthy") boolean healthy,
                     @Param("checkedAt") Instant checkedAt);

    /**
     * Кандидаты на выдачу: активные и здоровые панели локации в порядке приоритета.
     */
    @Query("""
           select p from Panel p
           where p.location.id = :locationId
             and p.active = true
             and p.healthy = true
             and (:premiumOnly = false or p.premium = true)
           order by p.priority desc, p.id asc
           """)
    List<Panel> findCandidates(@Param("locationId") long locationId,
                               @Param("premiumOnly") boolean premiumOnly);

    /**
     * То же, но только панели, где есть активный и включённый inbound нужного протокола.
     */
    @Query("""
           select p from Panel p
           where p.location.id = :locationId
             and p.active = true
             and p.healthy = true
             and (:premiumOnly = false or p.premium = true)
             and exists (
                 select 1 from PanelInbound i
                 where i.panel = p
                   and i.active = true
                   and i.panelEnabled = true
                   and i.protocol = :protocol
             )
           order by p.priority desc, p.id asc
           """)
    List<Panel> findCandidatesWithProtocol(@Param("locationId") long locationId,
                                           @Param("premiumOnly") boolean premiumOnly,
                                           @Param("protocol") String protocol);
}
