package sp.sistemaspalacios.api_hermes.entity.push;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "push_subscription", indexes = {
        @Index(name = "idx_push_subscription_employee", columnList = "employee_id")
})
@Data
public class PushSubscription {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "employee_id", nullable = false)
    private String employeeId;

    @Column(name = "endpoint", nullable = false, unique = true, length = 1024)
    private String endpoint;

    @Column(name = "p256dh", length = 255)
    private String p256dh;

    @Column(name = "auth", length = 255)
    private String auth;

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
}
