package sp.sistemaspalacios.api_hermes.repository.delivery;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_hermes.entity.delivery.DeliveryStatus;
import sp.sistemaspalacios.api_hermes.entity.delivery.NotificationDelivery;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Libro de envíos. Toda mutación de estado es un UPDATE condicionado al
 * estado actual de la fila; el número de filas afectadas indica quién ganó.
 */
@Repository
public interface NotificationDeliveryRepository extends JpaRepository<NotificationDelivery, Long> {

    List<NotificationDelivery> findTop200ByEmployeeIdOrderBySentAtDesc(String employeeId);

    long countByIdIn(Collection<Long> ids);

    long countByIdInAndEmployeeId(Collection<Long> ids, String employeeId);

    @Query("SELECT d.status AS status, COUNT(d) AS total FROM NotificationDelivery d " +
            "WHERE d.scheduleId = :scheduleId GROUP BY d.status")
    List<DeliveryStatusCount> countByStatusForSchedule(@Param("scheduleId") Long scheduleId);

    // ===== Confirmación =====

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE NotificationDelivery d SET d.status = :acked, d.ackedAt = :now, d.updatedAt = :now " +
            "WHERE d.id IN :ids AND d.status = :sent")
    int acknowledge(@Param("ids") Collection<Long> ids,
                    @Param("now") Instant now,
                    @Param("sent") DeliveryStatus sent,
                    @Param("acked") DeliveryStatus acked);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE NotificationDelivery d SET d.status = :acked, d.ackedAt = :now, d.updatedAt = :now " +
            "WHERE d.id IN :ids AND d.employeeId = :employeeId AND d.status = :sent")
    int acknowledgeForEmployee(@Param("ids") Collection<Long> ids,
                               @Param("employeeId") String employeeId,
                               @Param("now") Instant now,
                               @Param("sent") DeliveryStatus sent,
                               @Param("acked") DeliveryStatus acked);

    // ===== Barrido =====

    @Query("SELECT d FROM NotificationDelivery d " +
            "WHERE d.status = :sent AND d.expiresAt <= :now ORDER BY d.expiresAt ASC")
    List<NotificationDelivery> findOverdue(@Param("sent") DeliveryStatus sent,
                                           @Param("now") Instant now,
                                           Pageable page);

    @Query("SELECT d FROM NotificationDelivery d " +
            "WHERE d.status = :expired AND d.forcedCheckoutAt IS NULL " +
            "AND (d.enforcementAttemptAt IS NULL OR d.enforcementAttemptAt <= :staleBefore) " +
            "ORDER BY d.expiresAt ASC")
    List<NotificationDelivery> findPendingEnforcement(@Param("expired") DeliveryStatus expired,
                                                      @Param("staleBefore") Instant staleBefore,
                                                      Pageable page);

    /** SENT → EXPIRED solo si la fila sigue en SENT. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE NotificationDelivery d SET d.status = :expired, d.enforcementAttemptAt = :now, " +
            "d.enforcementAttempts = d.enforcementAttempts + 1, d.updatedAt = :now " +
            "WHERE d.id = :id AND d.status = :sent")
    int expireIfSent(@Param("id") Long id,
                     @Param("now") Instant now,
                     @Param("sent") DeliveryStatus sent,
                     @Param("expired") DeliveryStatus expired);

    /** Reclama un reintento de salida forzada cuyo intento anterior ya caducó. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE NotificationDelivery d SET d.enforcementAttemptAt = :now, " +
            "d.enforcementAttempts = d.enforcementAttempts + 1, d.updatedAt = :now " +
            "WHERE d.id = :id AND d.status = :expired AND d.forcedCheckoutAt IS NULL " +
            "AND (d.enforcementAttemptAt IS NULL OR d.enforcementAttemptAt <= :staleBefore)")
    int claimEnforcementRetry(@Param("id") Long id,
                              @Param("now") Instant now,
                              @Param("staleBefore") Instant staleBefore,
                              @Param("expired") DeliveryStatus expired);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE NotificationDelivery d SET d.forcedCheckoutAt = :at, d.updatedAt = :at " +
            "WHERE d.id = :id AND d.status = :expired AND d.forcedCheckoutAt IS NULL")
    int markForcedCheckout(@Param("id") Long id,
                           @Param("at") Instant at,
                           @Param("expired") DeliveryStatus expired);
}
