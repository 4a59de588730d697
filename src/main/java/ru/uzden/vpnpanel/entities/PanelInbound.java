package ru.uzden.vpnpanel.entities;

import jakarta.persistence.*;
import lombok.Data;
import lombok.ToString;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Локальное зеркало inbound'а панели. Пишется только синхронизатором, не удаляется:
 * пропавший на панели inbound помечается is_active=false.
 */
@Entity
@Table(
        name = "panel_inbounds",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_panel_inbounds_panel_remote",
                columnNames = {"panel_id", "remote_inbound_id"}
        ),
        indexes = {
                @Index(name = "idx_panel_inbounds_panel_id", columnList = "panel_id"),
                @Index(name = "idx_panel_inbounds_protocol", columnList = "protocol")
        }
)
@Data
public class PanelInbound {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "panel_id", nullable = false)
    @ToString.Exclude
    private Panel panel;

    /**
     * id inbound'а на самой панели.
     */
    @Column(name = "remote_inbound_id", nullable = false)
    private Integer remoteInboundId;

    @Column(name = "tag")
    private String tag;

    @Column(name = "remark")
    private String remark;

    @Column(name = "protocol", nullable = false)
    private String protocol;

    @Column(name = "port", nullable = false)
    private Integer port;

    @Column(name = "listen_ip")
    private String listenIp;

    /**
     * Зеркало флага enable на панели.
     */
    @Column(name = "panel_enabled", nullable = false)
    private boolean panelEnabled;

    /**
     * Локальный жизненный цикл: false, если inbound пропал с панели.
     */
    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "settings", columnDefinition = "jsonb")
    private Map<String, Object> settings = new LinkedHashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "stream_settings", columnDefinition = "jsonb")
    private Map<String, Object> streamSettings = new LinkedHashMap<>();

    /**
     * Лимит трафика inbound'а в ГБ, 0 - без лимита.
     */
    @Column(name = "total_gb", nullable = false)
    private double totalGb;

    @Column(name = "expiry_time")
    private Instant expiryTime;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = Instant.now();
    }
}
