package sp.sistemaspalacios.api_hermes.service.push;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.*;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import sp.sistemaspalacios.api_hermes.entity.push.PushSubscription;

import java.util.HashMap;
import java.util.Map;

/**
 * Entrega push a través del gateway Web Push (el cifrado VAPID vive allí).
 */
@Slf4j
@Service
public class PushGatewayTransport implements PushTransport {

    private final RestTemplate restTemplate;
    private final String gatewayUrl;
    private final int ttlSeconds;

    public PushGatewayTransport(
            RestTemplate restTemplate,
            @Value("${hermes.push.gateway-url:http://localhost:3010}") String gatewayUrl,
            @Value("${hermes.push.ttl-seconds:3600}") int ttlSeconds
    ) {
        this.restTemplate = restTemplate;
        this.gatewayUrl = gatewayUrl.replaceAll("/+$", "");
        this.ttlSeconds = ttlSeconds;
    }

    @Override
    public PushOutcome dispatch(PushSubscription subscription, PushPayload payload) {
        String url = gatewayUrl + "/v1/push";

        Map<String, Object> keys = new HashMap<>();
        keys.put("p256dh", subscription.getP256dh());
        keys.put("auth", subscription.getAuth());

        Map<String, Object> target = new HashMap<>();
        target.put("endpoint", subscription.getEndpoint());
        target.put("keys", keys);

        Map<String, Object> request = new HashMap<>();
        request.put("subscription", target);
        request.put("payload", payload);
        request.put("ttl", ttlSeconds);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        try {
            ResponseEntity<Void> response = restTemplate.exchange(
                    url, HttpMethod.POST, new HttpEntity<>(request, headers), Void.class);
            if (response.getStatusCode().is2xxSuccessful()) {
                return PushOutcome.DELIVERED;
            }
            log.warn("⚠️ Respuesta no exitosa del gateway push: {}", response.getStatusCode());
            return PushOutcome.FAILED;
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (status == 404 || status == 410) {
                log.info("🧹 Suscripción expirada ({}) para empleado {}", status, subscription.getEmployeeId());
                return PushOutcome.GONE;
            }
            log.warn("⚠️ Push rechazado ({}) para empleado {}: {}",
                    status, subscription.getEmployeeId(), e.getMessage());
            return PushOutcome.FAILED;
        } catch (RestClientException e) {
            log.warn("⚠️ Gateway push no disponible para empleado {}: {}",
                    subscription.getEmployeeId(), e.getMessage());
            return PushOutcome.FAILED;
        }
    }
}
