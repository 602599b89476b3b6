package sp.sistemaspalacios.api_hermes.service.delivery;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_hermes.dto.delivery.SweepResult;
import sp.sistemaspalacios.api_hermes.entity.delivery.DeliveryStatus;
import sp.sistemaspalacios.api_hermes.entity.delivery.NotificationDelivery;
import sp.sistemaspalacios.api_hermes.repository.delivery.NotificationDeliveryRepository;
import sp.sistemaspalacios.api_hermes.service.attendance.ForceCheckoutGateway;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Vence los envíos sin confirmar y aplica la salida forzada.
 *
 * <p>Cada fila se reclama con un UPDATE condicional; solo quien lo gana llama
 * al servicio de asistencia. Si la llamada falla, la fila queda EXPIRED sin
 * {@code forcedCheckoutAt} y un barrido posterior la reintenta cuando caduca
 * el intento anterior ({@code hermes.sweep.retry-after-seconds}). Ese plazo debe
 * quedar por debajo del intervalo del barrido para que el siguiente lo reintente.</p>
 */
@Slf4j
@Service
public class DeliverySweepService {

    public static final String FORCE_CHECKOUT_REASON = "no acknowledgement within 15 minutes";

    private final NotificationDeliveryRepository deliveryRepository;
    private final ForceCheckoutGateway forceCheckoutGateway;
    private final int batchSize;
    private final Duration retryAfter;

    public DeliverySweepService(
            NotificationDeliveryRepository deliveryRepository,
            ForceCheckoutGateway forceCheckoutGateway,
            @Value("${hermes.sweep.batch-size:500}") int batchSize,
            @Value("${hermes.sweep.retry-after-seconds:30}") long retryAfterSeconds
    ) {
        this.deliveryRepository = deliveryRepository;
        this.forceCheckoutGateway = forceCheckoutGateway;
        this.batchSize = Math.max(1, batchSize);
        this.retryAfter = Duration.ofSeconds(Math.max(0, retryAfterSeconds));
    }

    public SweepResult sweep(Instant now) {
        // Leer ambas listas antes de mutar: lo que venza ahora no entra como reintento
        List<NotificationDelivery> overdue = deliveryRepository.findOverdue(
                DeliveryStatus.SENT, now, PageRequest.of(0, batchSize));
        List<NotificationDelivery> pending = deliveryRepository.findPendingEnforcement(
                DeliveryStatus.EXPIRED, now.minus(retryAfter), PageRequest.of(0, batchSize));

        SweepResult result = new SweepResult();
        result.setChecked(overdue.size() + pending.size());

        for (NotificationDelivery d : overdue) {
            int won = deliveryRepository.expireIfSent(d.getId(), now, DeliveryStatus.SENT, DeliveryStatus.EXPIRED);
            if (won == 0) {
                log.debug("Envío {} ya resuelto por otro proceso", d.getId());
                result.setSkipped(result.getSkipped() + 1);
                continue;
            }
            result.setExpired(result.getExpired() + 1);
            enforce(d, now, result);
        }

        for (NotificationDelivery d : pending) {
            int claimed = deliveryRepository.claimEnforcementRetry(
                    d.getId(), now, now.minus(retryAfter), DeliveryStatus.EXPIRED);
            if (claimed == 0) {
                result.setSkipped(result.getSkipped() + 1);
                continue;
            }
            log.info("🔁 Reintentando salida forzada del envío {}", d.getId());
            enforce(d, now, result);
        }

        if (result.getChecked() > 0) {
            log.info("🧹 Barrido: revisados={} vencidos={} forzados={} fallidos={} omitidos={}",
                    result.getChecked(), result.getExpired(), result.getForced(),
                    result.getFailed(), result.getSkipped());
        }
        return result;
    }

    private void enforce(NotificationDelivery d, Instant now, SweepResult result) {
        try {
            forceCheckoutGateway.forceCheckout(d.getEmployeeId(), FORCE_CHECKOUT_REASON, d.getId());
        } catch (RuntimeException e) {
            log.error("❌ Salida forzada fallida para envío {} (empleado {}): {}",
                    d.getId(), d.getEmployeeId(), e.getMessage());
            result.setFailed(result.getFailed() + 1);
            return;
        }
        deliveryRepository.markForcedCheckout(d.getId(), now, DeliveryStatus.EXPIRED);
        result.setForced(result.getForced() + 1);
    }
}
