package sp.sistemaspalacios.api_hermes.entity.delivery;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Una notificación concreta enviada a un empleado.
 *
 * El estado solo se modifica con UPDATE condicionales del repositorio;
 * la entidad se guarda una vez al crearse y no se vuelve a escribir completa.
 */
@Entity
@Table(name = "notification_delivery", indexes = {
        @Index(name = "idx_delivery_schedule", columnList = "schedule_id"),
        @Index(name = "idx_delivery_employee", columnList = "employee_id"),
        @Index(name = "idx_delivery_status_expires", columnList = "status, expires_at")
})
@Data
public class NotificationDelivery {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "schedule_id")
    private Long scheduleId;

    @Column(name = "notification_id")
    private Long notificationId;

    @Column(name = "employee_id", nullable = false)
    private String employeeId;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "body", nullable = false, columnDefinition = "TEXT")
    private String body;

    @Column(name = "url")
    private String url;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private DeliveryStatus status = DeliveryStatus.SENT;

    @Column(name = "sent_at", nullable = false, updatable = false)
    private Instant sentAt;

    @Column(name = "acked_at")
    private Instant ackedAt;

    @Column(name = "expires_at", updatable = false)
    private Instant expiresAt;

    @Column(name = "forced_checkout_at")
    private Instant forcedCheckoutAt;

    // Último intento de salida forzada; sirve de "lease" para reintentos
    @Column(name = "enforcement_attempt_at")
    private Instant enforcementAttemptAt;

    @Column(name = "enforcement_attempts", nullable = false)
    private Integer enforcementAttempts = 0;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "notification_delivery_meta", joinColumns = @JoinColumn(name = "delivery_id"))
    @MapKeyColumn(name = "meta_key", length = DeliveryMetadata.MAX_KEY_LENGTH)
    @Column(name = "meta_value", length = DeliveryMetadata.MAX_VALUE_LENGTH)
    private Map<String, String> metadata = new LinkedHashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public void setMetadata(DeliveryMetadata metadata) {
        this.metadata = metadata == null ? new LinkedHashMap<>() : metadata.copy();
    }
}
