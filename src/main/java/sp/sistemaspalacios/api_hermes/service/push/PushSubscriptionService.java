package sp.sistemaspalacios.api_hermes.service.push;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_hermes.dto.push.SubscribeRequest;
import sp.sistemaspalacios.api_hermes.entity.push.PushSubscription;
import sp.sistemaspalacios.api_hermes.repository.push.PushSubscriptionRepository;

@Slf4j
@Service
@RequiredArgsConstructor
public class PushSubscriptionService {

    private final PushSubscriptionRepository subscriptionRepository;

    /**
     * Alta o actualización por endpoint. Si otro dispositivo del mismo navegador
     * ya estaba registrado, pasa a ser del empleado actual con las llaves nuevas.
     */
    public PushSubscription subscribe(String employeeId, SubscribeRequest request) {
        if (employeeId == null || employeeId.isBlank()) {
            throw new IllegalArgumentException("Missing employee id");
        }
        if (request == null || request.getSubscription() == null
                || request.getSubscription().getEndpoint() == null
                || request.getSubscription().getEndpoint().isBlank()) {
            throw new IllegalArgumentException("Missing subscription endpoint");
        }

        try {
            return upsert(employeeId.trim(), request.getSubscription());
        } catch (DataIntegrityViolationException e) {
            // otro request insertó el mismo endpoint entre la lectura y el insert
            log.warn("⚠️ Endpoint registrado en paralelo, reintentando como actualización");
            return upsert(employeeId.trim(), request.getSubscription());
        }
    }

    private PushSubscription upsert(String employeeId, SubscribeRequest.Subscription sub) {
        String endpoint = sub.getEndpoint().trim();
        PushSubscription entity = subscriptionRepository.findByEndpoint(endpoint).orElseGet(PushSubscription::new);
        boolean isNew = entity.getId() == null;

        entity.setEndpoint(endpoint);
        entity.setEmployeeId(employeeId);
        entity.setP256dh(sub.getKeys() == null ? null : sub.getKeys().getP256dh());
        entity.setAuth(sub.getKeys() == null ? null : sub.getKeys().getAuth());

        PushSubscription saved = subscriptionRepository.saveAndFlush(entity);
        log.info("📱 Suscripción {} para empleado {}", isNew ? "creada" : "actualizada", employeeId);
        return saved;
    }
}
