package sp.sistemaspalacios.api_hermes.entity.schedule;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * Intención recurrente de notificación para un empleado.
 * Nunca se borra: el estado terminal es {@code active = false}.
 */
@Entity
@Table(name = "notification_schedule", indexes = {
        @Index(name = "idx_notification_schedule_employee", columnList = "employee_id")
})
@Data
public class NotificationSchedule {

    public static final String DEFAULT_TIMEZONE = "Asia/Kathmandu";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "employee_id", nullable = false)
    private String employeeId;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "body", nullable = false, columnDefinition = "TEXT")
    private String body;

    @Column(name = "url")
    private String url;

    @Column(name = "every_minutes", nullable = false)
    private Integer everyMinutes;

    @Column(name = "start_at", nullable = false)
    private Instant startAt;

    @Column(name = "stop_at", nullable = false)
    private Instant stopAt;

    // Solo para mostrar y para CRON_TZ; la ventana se evalúa en UTC
    @Column(name = "timezone", nullable = false)
    private String timezone = DEFAULT_TIMEZONE;

    @Column(name = "external_job_id", unique = true)
    private String externalJobId;

    @Column(name = "active", nullable = false)
    private Boolean active = true;

    @Column(name = "created_by")
    private String createdBy;

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

    public boolean isBefore(Instant now) {
        return now.isBefore(startAt);
    }

    public boolean isAfter(Instant now) {
        return now.isAfter(stopAt);
    }
}
