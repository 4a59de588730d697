package ru.uzden.vpnpanel.entities;

import jakarta.persistence.*;
import lombok.Data;
import lombok.ToString;

import java.time.Instant;

@Entity
@Table(
        name = "panels",
        indexes = {
                @Index(name = "idx_panels_location_id", columnList = "location_id"),
                @Index(name = "idx_panels_active_healthy", columnList = "is_active, is_healthy")
        }
)
@Data
public class Panel {

    public enum PanelType {
        XUI   // 3x-ui и совместимые форки
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "base_url", nullable = false, unique = true)
    private String baseUrl;

    @Enumerated(EnumType.STRING)
    @Column(name = "panel_type", nullable = false)
    private PanelType panelType = PanelType.XUI;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "location_id", nullable = false)
    @ToString.Exclude
    private Location location;

    /* ===== учётные данные, только в зашифрованном виде ===== */

    @Column(name = "encrypted_username", nullable = false, columnDefinition = "text")
    @ToString.Exclude
    private String encryptedUsername;

    @Column(name = "encrypted_password", nullable = false, columnDefinition = "text")
    @ToString.Exclude
    private String encryptedPassword;

    /* ===== выбор панели ===== */

    /**
     * Чем больше, тем раньше панель в списке кандидатов.
     */
    @Column(name = "priority", nullable = false)
    private int priority = 0;

    @Column(name = "is_premium", nullable = false)
    private boolean premium = false;

    /**
     * Хост для ссылок клиентов, если он отличается от хоста панели.
     */
    @Column(name = "public_host")
    private String publicHost;

    /* ===== состояние ===== */

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    /**
     * null - ещё не проверяли, true/false - результат последней проверки.
     */
    @Column(name = "is_healthy")
    private Boolean healthy;

    @Column(name = "last_checked")
    private Instant lastChecked;

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

    public void markHealth(boolean healthy, Instant checkedAt) {
        this.healthy = healthy;
        this.lastChecked = checkedAt;
    }
}
