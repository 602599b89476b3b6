package sp.sistemaspalacios.api_hermes.service.attendance;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.*;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import sp.sistemaspalacios.api_hermes.exception.UpstreamServiceException;
import sp.sistemaspalacios.api_hermes.security.ActorResolver;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@Service
public class AttendanceForceCheckoutService implements ForceCheckoutGateway {

    private static final String SERVICE = "attendance";

    private final RestTemplate restTemplate;
    private final String attendanceUrl;
    private final String endpoint;
    private final String adminToken;

    public AttendanceForceCheckoutService(
            RestTemplate restTemplate,
            @Value("${hermes.attendance.url:http://localhost:3000}") String attendanceUrl,
            @Value("${hermes.attendance.endpoint:/api/admin/attendance/force-checkout}") String endpoint,
            @Value("${hermes.attendance.token:${hermes.admin-token:}}") String adminToken
    ) {
        this.restTemplate = restTemplate;
        this.attendanceUrl = attendanceUrl.replaceAll("/+$", "");
        this.endpoint = endpoint;
        this.adminToken = adminToken;
    }

    @Override
    public void forceCheckout(String employeeId, String reason, Long deliveryId) {
        String url = attendanceUrl + endpoint;

        Map<String, Object> payload = new HashMap<>();
        payload.put("employeeId", employeeId);
        payload.put("reason", reason);
        if (deliveryId != null) {
            payload.put("deliveryId", String.valueOf(deliveryId));
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(ActorResolver.ADMIN_TOKEN_HEADER, adminToken);

        log.info("📤 Salida forzada para empleado {} (envío {})", employeeId, deliveryId);

        ResponseEntity<Map> response;
        try {
            response = restTemplate.exchange(url, HttpMethod.POST, new HttpEntity<>(payload, headers), Map.class);
        } catch (HttpClientErrorException.Conflict e) {
            // Sin entrada abierta que cerrar: el servicio ya hizo todo lo que podía
            log.info("ℹ️ Empleado {} sin entrada abierta, nada que cerrar", employeeId);
            return;
        } catch (RestClientException e) {
            throw new UpstreamServiceException(SERVICE,
                    "Salida forzada fallida para empleado " + employeeId + ": " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new UpstreamServiceException(SERVICE,
                    "Respuesta no exitosa de asistencia: " + response.getStatusCode());
        }
        log.debug("📦 Respuesta de asistencia: {}", response.getBody());
    }
}
