package ru.uzden.vpnpanel.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import ru.uzden.vpnpanel.entities.PanelInbound;

import java.util.List;

@Repository
public interface PanelInboundRepository extends JpaRepository<PanelInbound, Long> {

    List<PanelInbound> findByPanelId(Long panelId);

    List<PanelInbound> findByPanelIdOrderByRemoteInboundIdAsc(Long panelId);

    List<PanelInbound> findByPanelIdAndActiveTrueOrderByRemoteInboundIdAsc(Long panelId);
}
