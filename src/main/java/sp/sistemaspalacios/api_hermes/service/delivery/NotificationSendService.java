package sp.sistemaspalacios.api_hermes.service.delivery;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_hermes.dto.delivery.SendCommand;
import sp.sistemaspalacios.api_hermes.dto.delivery.SendResult;
import sp.sistemaspalacios.api_hermes.entity.delivery.DeliveryMetadata;
import sp.sistemaspalacios.api_hermes.entity.delivery.DeliveryStatus;
import sp.sistemaspalacios.api_hermes.entity.delivery.NotificationDelivery;
import sp.sistemaspalacios.api_hermes.entity.push.PushSubscription;
import sp.sistemaspalacios.api_hermes.repository.delivery.NotificationDeliveryRepository;
import sp.sistemaspalacios.api_hermes.repository.push.PushSubscriptionRepository;
import sp.sistemaspalacios.api_hermes.service.push.PushOutcome;
import sp.sistemaspalacios.api_hermes.service.push.PushPayload;
import sp.sistemaspalacios.api_hermes.service.push.PushTransport;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Crea una fila de envío por destinatario y después intenta el push.
 *
 * <p>Las filas se guardan antes de cualquier push: si el dispositivo nunca
 * recibe la notificación, el barrido igual aplica la salida forzada.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationSendService {

    public static final Duration ACK_WINDOW = Duration.ofMinutes(15);

    private final NotificationDeliveryRepository deliveryRepository;
    private final PushSubscriptionRepository subscriptionRepository;
    private final PushTransport pushTransport;
    private final Clock clock;

    public SendResult send(SendCommand command) {
        validate(command);

        Set<String> recipients = new LinkedHashSet<>();
        command.getEmployeeIds().stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .forEach(recipients::add);
        if (recipients.isEmpty()) {
            throw new IllegalArgumentException("No recipients");
        }

        DeliveryMetadata metadata = DeliveryMetadata.of(command.getMetadata());
        Instant now = clock.instant();
        Instant expiresAt = now.plus(ACK_WINDOW);

        List<NotificationDelivery> rows = new ArrayList<>();
        for (String employeeId : recipients) {
            NotificationDelivery d = new NotificationDelivery();
            d.setScheduleId(command.getScheduleId());
            d.setNotificationId(command.getNotificationId());
            d.setEmployeeId(employeeId);
            d.setTitle(command.getTitle().trim());
            d.setBody(command.getBody().trim());
            d.setUrl(command.getUrl());
            d.setStatus(DeliveryStatus.SENT);
            d.setSentAt(now);
            d.setExpiresAt(expiresAt);
            d.setMetadata(metadata);
            rows.add(d);
        }
        List<NotificationDelivery> saved = deliveryRepository.saveAll(rows);

        Map<String, NotificationDelivery> byEmployee = new HashMap<>();
        List<Long> deliveryIds = new ArrayList<>();
        for (NotificationDelivery d : saved) {
            byEmployee.put(d.getEmployeeId(), d);
            deliveryIds.add(d.getId());
        }

        SendResult result = SendResult.builder()
                .created(saved.size())
                .deliveryIds(deliveryIds)
                .build();

        List<PushSubscription> subscriptions = subscriptionRepository.findByEmployeeIdIn(recipients);
        if (subscriptions.isEmpty()) {
            log.info("ℹ️ Sin dispositivos registrados para {} destinatario(s); solo se registra el envío", recipients.size());
        }

        for (PushSubscription subscription : subscriptions) {
            NotificationDelivery delivery = byEmployee.get(subscription.getEmployeeId());
            if (delivery == null) {
                continue;
            }
            dispatchOne(subscription, delivery, result);
        }

        log.info("📨 Envío: {} fila(s), {} push entregado(s), {} fallido(s)",
                result.getCreated(), result.getDispatched(), result.getFailed());
        return result;
    }

    private void dispatchOne(PushSubscription subscription, NotificationDelivery delivery, SendResult result) {
        PushPayload payload = PushPayload.builder()
                .title(delivery.getTitle())
                .body(delivery.getBody())
                .url(delivery.getUrl())
                .deliveryId(delivery.getId())
                .tag("delivery-" + delivery.getId())
                .build();

        PushOutcome outcome;
        try {
            outcome = pushTransport.dispatch(subscription, payload);
        } catch (RuntimeException e) {
            log.warn("⚠️ Push fallido para envío {}: {}", delivery.getId(), e.getMessage());
            outcome = PushOutcome.FAILED;
        }

        switch (outcome) {
            case DELIVERED -> result.setDispatched(result.getDispatched() + 1);
            case GONE -> {
                result.setFailed(result.getFailed() + 1);
                subscriptionRepository.deleteByEndpoint(subscription.getEndpoint());
                result.setRemovedSubscriptions(result.getRemovedSubscriptions() + 1);
            }
            default -> result.setFailed(result.getFailed() + 1);
        }
    }

    private void validate(SendCommand command) {
        if (command == null || command.getEmployeeIds() == null || command.getEmployeeIds().isEmpty()) {
            throw new IllegalArgumentException("No recipients");
        }
        if (command.getTitle() == null || command.getTitle().isBlank()
                || command.getBody() == null || command.getBody().isBlank()) {
            throw new IllegalArgumentException("Title and body required");
        }
    }
}
