package sp.sistemaspalacios.api_hermes.service.delivery;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_hermes.dto.delivery.AckResult;
import sp.sistemaspalacios.api_hermes.entity.delivery.DeliveryStatus;
import sp.sistemaspalacios.api_hermes.exception.UnauthorizedException;
import sp.sistemaspalacios.api_hermes.repository.delivery.NotificationDeliveryRepository;
import sp.sistemaspalacios.api_hermes.security.Actor;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Marca envíos como confirmados. Solo SENT pasa a ACKED; un envío ya vencido
 * no se reabre porque la salida forzada pudo haberse aplicado.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AcknowledgementService {

    private final NotificationDeliveryRepository deliveryRepository;
    private final Clock clock;

    /**
     * @param actor si es un empleado, solo se confirman sus propios envíos; el administrador no tiene límite
     */
    public AckResult acknowledge(Collection<Long> deliveryIds, Actor actor) {
        if (actor == null) {
            throw new UnauthorizedException("Unauthorized");
        }
        Set<Long> ids = new LinkedHashSet<>();
        if (deliveryIds != null) {
            deliveryIds.stream().filter(Objects::nonNull).forEach(ids::add);
        }
        if (ids.isEmpty()) {
            throw new IllegalArgumentException("No ids provided");
        }

        Instant now = clock.instant();
        long matched;
        long modified;
        if (actor.isEmployee()) {
            matched = deliveryRepository.countByIdInAndEmployeeId(ids, actor.getEmployeeId());
            modified = deliveryRepository.acknowledgeForEmployee(
                    ids, actor.getEmployeeId(), now, DeliveryStatus.SENT, DeliveryStatus.ACKED);
        } else {
            matched = deliveryRepository.countByIdIn(ids);
            modified = deliveryRepository.acknowledge(ids, now, DeliveryStatus.SENT, DeliveryStatus.ACKED);
        }

        if (matched == 0) {
            log.info("ℹ️ Confirmación sin coincidencias para {} ({})", ids, actor);
        } else {
            log.info("✅ Confirmados {}/{} envío(s)", modified, matched);
        }
        return new AckResult(matched, modified);
    }
}
