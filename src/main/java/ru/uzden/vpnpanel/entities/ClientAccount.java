package ru.uzden.vpnpanel.entities;

import jakarta.persistence.*;
import lombok.Data;
import lombok.ToString;

import java.time.Instant;

/**
 * Клиент, выданный на панели. Хранит нативный идентификатор вместе с протоколом -
 * без них нельзя ни продлить, ни удалить клиента, ни получить трафик.
 */
@Entity
@Table(
        name = "client_accounts",
        indexes = {
                @Index(name = "idx_client_accounts_panel_status", columnList = "panel_id, status"),
                @Index(name = "idx_client_accounts_owner_ref", columnList = "owner_ref"),
                @Index(name = "idx_client_accounts_native_identifier", columnList = "native_identifier")
        }
)
@Data
public class ClientAccount {

    public enum Status {
        ACTIVE,    // клиент создан на панели и выдан
        DISABLED,  // выключен на панели (enable=false)
        DELETED    // удалён с панели
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "panel_id")
    @ToString.Exclude
    private Panel panel;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "inbound_id")
    @ToString.Exclude
    private PanelInbound inbound;

    @Column(name = "remote_inbound_id", nullable = false)
    private Integer remoteInboundId;

    /* ===== идентификация на панели ===== */

    @Column(name = "protocol", nullable = false)
    private String protocol;

    /**
     * uuid (vmess/vless), password (trojan) или email (shadowsocks).
     */
    @Column(name = "native_identifier", nullable = false)
    private String nativeIdentifier;

    @Column(name = "email", nullable = false)
    private String email;

    /* ===== что отдали пользователю ===== */

    @Column(name = "subscription_url", columnDefinition = "text")
    private String subscriptionUrl;

    @Column(name = "config_link", columnDefinition = "text")
    private String configLink;

    /**
     * Ссылка на запись заказа/подписки во внешней системе.
     */
    @Column(name = "owner_ref")
    private String ownerRef;

    @Column(name = "traffic_limit_bytes", nullable = false)
    private long trafficLimitBytes;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private Status status = Status.ACTIVE;

    @Column(name = "last_error", columnDefinition = "text")
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isActive() {
        return status == Status.ACTIVE;
    }

    public void markDeleted() {
        this.status = Status.DELETED;
        this.lastError = null;
    }

    public void markDisabled() {
        this.status = Status.DISABLED;
    }
}
