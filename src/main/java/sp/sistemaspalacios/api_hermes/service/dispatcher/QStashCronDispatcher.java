package sp.sistemaspalacios.api_hermes.service.dispatcher;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.*;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import sp.sistemaspalacios.api_hermes.exception.UpstreamServiceException;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

@Slf4j
@Service
public class QStashCronDispatcher implements CronDispatcher {

    private static final String SERVICE = "dispatcher";
    private static final String FORWARD_PREFIX = "Upstash-Forward-";

    private final RestTemplate restTemplate;
    private final String dispatcherUrl;
    private final String token;

    public QStashCronDispatcher(
            RestTemplate restTemplate,
            @Value("${hermes.dispatcher.url:https://qstash.upstash.io}") String dispatcherUrl,
            @Value("${hermes.dispatcher.token:}") String token
    ) {
        this.restTemplate = restTemplate;
        this.dispatcherUrl = dispatcherUrl.replaceAll("/+$", "");
        this.token = token;
    }

    @Override
    public String createSchedule(String destinationUrl, CronRecurrence recurrence, String jobId,
                                 String body, Map<String, String> forwardedHeaders) {
        // El destino va sin codificar tras /v2/schedules/
        URI uri = URI.create(dispatcherUrl + "/v2/schedules/" + destinationUrl);

        HttpHeaders headers = authHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("Upstash-Cron", recurrence.expression());
        headers.set("Upstash-Schedule-Id", jobId);
        if (forwardedHeaders != null) {
            forwardedHeaders.forEach((name, value) -> headers.set(FORWARD_PREFIX + name, value));
        }

        log.info("📤 Registrando trabajo {} en el despachador: {} -> {}", jobId, recurrence, destinationUrl);

        try {
            ResponseEntity<Map> response = restTemplate.exchange(
                    uri, HttpMethod.POST, new HttpEntity<>(body == null ? "{}" : body, headers), Map.class);

            Object returnedId = response.getBody() == null ? null : response.getBody().get("scheduleId");
            if (returnedId == null || String.valueOf(returnedId).isBlank()) {
                return jobId;
            }
            return String.valueOf(returnedId);
        } catch (RestClientException e) {
            throw new UpstreamServiceException(SERVICE,
                    "No se pudo registrar el trabajo " + jobId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean deleteSchedule(String jobId) {
        URI uri = URI.create(dispatcherUrl + "/v2/schedules/"
                + URLEncoder.encode(jobId, StandardCharsets.UTF_8));
        try {
            restTemplate.exchange(uri, HttpMethod.DELETE, new HttpEntity<>(authHeaders()), Void.class);
            log.info("🗑️ Trabajo {} eliminado del despachador", jobId);
            return true;
        } catch (HttpClientErrorException.NotFound e) {
            return false;
        } catch (RestClientException e) {
            throw new UpstreamServiceException(SERVICE,
                    "No se pudo eliminar el trabajo " + jobId + ": " + e.getMessage(), e);
        }
    }

    private HttpHeaders authHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(token);
        return headers;
    }
}
