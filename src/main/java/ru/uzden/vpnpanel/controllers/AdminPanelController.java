package ru.uzden.vpnpanel.controllers;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import ru.uzden.vpnpanel.model.HealthCheckResult;
import ru.uzden.vpnpanel.model.PanelChanges;
import ru.uzden.vpnpanel.model.PanelDraft;
import ru.uzden.vpnpanel.model.SyncCycleReport;
import ru.uzden.vpnpanel.model.SyncOutcome;
import ru.uzden.vpnpanel.services.PanelService;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/admin/panels")
public class AdminPanelController {

    private final PanelService panelService;

    @GetMapping
    public List<AdminViews.PanelView> list() {
        return panelService.listPanels().stream().map(AdminViews.PanelView::of).toList();
    }

    @PostMapping
    public ResponseEntity<AdminViews.PanelView> create(@RequestBody PanelDraft draft) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(AdminViews.PanelView.of(panelService.createPanel(draft)));
    }

    @PatchMapping("/{id}")
    public AdminViews.PanelView update(@PathVariable("id") long id, @RequestBody PanelChanges changes) {
        return AdminViews.PanelView.of(panelService.updatePanel(id, changes));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") long id) {
        panelService.deletePanel(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/sync")
    public SyncOutcome sync(@PathVariable("id") long id) {
        return panelService.syncPanelInbounds(id);
    }

    @PostMapping("/sync")
    public SyncCycleReport syncAll() {
        return panelService.syncInboundsFromPanels();
    }

    @PostMapping("/{id}/health")
    public HealthCheckResult health(@PathVariable("id") long id) {
        return panelService.checkPanelHealth(id);
    }

    @PostMapping("/health")
    public List<HealthCheckResult> healthAll() {
        return panelService.checkAllPanelsHealth();
    }

    @GetMapping("/{id}/inbounds")
    public List<AdminViews.InboundView> inbounds(@PathVariable("id") long id,
                                                 @RequestParam(name = "activeOnly", defaultValue = "false") boolean activeOnly) {
        return panelService.getPanelInbounds(id, activeOnly).stream().map(AdminViews.InboundView::of).toList();
    }
}
