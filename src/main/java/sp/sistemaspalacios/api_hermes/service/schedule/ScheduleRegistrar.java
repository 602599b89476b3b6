package sp.sistemaspalacios.api_hermes.service.schedule;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_hermes.entity.schedule.NotificationSchedule;
import sp.sistemaspalacios.api_hermes.exception.UpstreamServiceException;
import sp.sistemaspalacios.api_hermes.repository.schedule.NotificationScheduleRepository;
import sp.sistemaspalacios.api_hermes.security.ActorResolver;
import sp.sistemaspalacios.api_hermes.service.dispatcher.CronDispatcher;
import sp.sistemaspalacios.api_hermes.service.dispatcher.CronRecurrence;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Une cada {@link NotificationSchedule} con un único trabajo del despachador cron.
 *
 * <p>El id externo se deriva del id del horario, así que registrar dos veces
 * el mismo horario reemplaza el trabajo existente en vez de crear otro.</p>
 */
@Slf4j
@Service
public class ScheduleRegistrar {

    public static final String JOB_ID_PREFIX = "notification-schedule-";
    public static final String TICK_PATH = "/api/schedules/tick";

    private final CronDispatcher dispatcher;
    private final NotificationScheduleRepository scheduleRepository;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final String publicBaseUrl;
    private final String adminToken;

    public ScheduleRegistrar(
            CronDispatcher dispatcher,
            NotificationScheduleRepository scheduleRepository,
            ObjectMapper mapper,
            Clock clock,
            @Value("${hermes.public-base-url:http://localhost:8085}") String publicBaseUrl,
            @Value("${hermes.admin-token:}") String adminToken
    ) {
        this.dispatcher = dispatcher;
        this.scheduleRepository = scheduleRepository;
        this.mapper = mapper;
        this.clock = clock;
        this.publicBaseUrl = publicBaseUrl.replaceAll("/+$", "");
        this.adminToken = adminToken;
    }

    public static String jobIdFor(NotificationSchedule schedule) {
        if (schedule.getId() == null) {
            throw new IllegalStateException("El horario debe guardarse antes de registrarse");
        }
        return JOB_ID_PREFIX + schedule.getId();
    }

    /**
     * Registra (o vuelve a registrar) el horario. No toca la base de datos:
     * el llamador guarda el id devuelto.
     *
     * @throws UpstreamServiceException si el despachador falla
     */
    public String register(NotificationSchedule schedule) {
        String jobId = jobIdFor(schedule);
        CronRecurrence recurrence = CronRecurrence.everyMinutes(schedule.getEveryMinutes(), schedule.getTimezone());

        Map<String, Object> body = new HashMap<>();
        body.put("scheduleId", schedule.getId());

        String returned = registerJob(jobId, TICK_PATH, recurrence, body);
        if (!jobId.equals(returned)) {
            log.warn("⚠️ El despachador devolvió id {} para el trabajo {}; se conserva el id estable", returned, jobId);
        }
        return jobId;
    }

    /**
     * Registra un trabajo con id fijo contra una ruta propia, reenviando el token
     * de administrador para que la llamada de vuelta se autentique.
     */
    public String registerJob(String jobId, String path, CronRecurrence recurrence, Map<String, Object> body) {
        Map<String, String> forwarded = new HashMap<>();
        forwarded.put(ActorResolver.ADMIN_TOKEN_HEADER, adminToken);
        forwarded.put("Content-Type", "application/json");

        return dispatcher.createSchedule(publicBaseUrl + path, recurrence, jobId, toJson(body), forwarded);
    }

    /**
     * Elimina el trabajo externo si puede y siempre deja el horario inactivo.
     */
    public void deregister(NotificationSchedule schedule) {
        String jobId = schedule.getExternalJobId();
        if (jobId != null && !jobId.isBlank()) {
            try {
                if (!dispatcher.deleteSchedule(jobId)) {
                    log.warn("⚠️ El trabajo {} ya no existía en el despachador", jobId);
                }
            } catch (UpstreamServiceException e) {
                log.error("❌ No se pudo eliminar el trabajo {}: {}", jobId, e.getMessage());
            }
        }

        if (scheduleRepository.deactivateIfActive(schedule.getId(), clock.instant()) > 0) {
            log.info("🛑 Horario {} desactivado", schedule.getId());
        }
        schedule.setActive(false);
    }

    private String toJson(Map<String, Object> body) {
        try {
            return mapper.writeValueAsString(body == null ? Map.of() : body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("No se pudo serializar el cuerpo del trabajo", e);
        }
    }
}
