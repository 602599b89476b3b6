package sp.sistemaspalacios.api_hermes.service.schedule;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_hermes.dto.schedule.ScheduleCreateRequest;
import sp.sistemaspalacios.api_hermes.dto.schedule.ScheduleStatsDTO;
import sp.sistemaspalacios.api_hermes.entity.delivery.DeliveryStatus;
import sp.sistemaspalacios.api_hermes.entity.schedule.NotificationSchedule;
import sp.sistemaspalacios.api_hermes.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_hermes.repository.delivery.DeliveryStatusCount;
import sp.sistemaspalacios.api_hermes.repository.delivery.NotificationDeliveryRepository;
import sp.sistemaspalacios.api_hermes.repository.schedule.NotificationScheduleRepository;
import sp.sistemaspalacios.api_hermes.security.Actor;
import sp.sistemaspalacios.api_hermes.service.dispatcher.CronRecurrence;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationScheduleService {

    private final NotificationScheduleRepository scheduleRepository;
    private final NotificationDeliveryRepository deliveryRepository;
    private final ScheduleRegistrar registrar;

    /**
     * Guarda y registra el horario en una sola transacción: si el despachador
     * falla, la fila nueva se revierte y el error llega al administrador.
     */
    @Transactional
    public NotificationSchedule createSchedule(ScheduleCreateRequest request, Actor actor) {
        validate(request);

        NotificationSchedule schedule = new NotificationSchedule();
        schedule.setEmployeeId(request.getEmployeeId().trim());
        schedule.setTitle(request.getTitle().trim());
        schedule.setBody(request.getBody().trim());
        schedule.setUrl(request.getUrl() == null || request.getUrl().isBlank() ? null : request.getUrl().trim());
        schedule.setEveryMinutes(request.getEveryMinutes());
        schedule.setStartAt(request.getStartAt());
        schedule.setStopAt(request.getStopAt());
        schedule.setTimezone(timezoneOf(request));
        schedule.setActive(true);
        schedule.setCreatedBy(request.getCreatedBy() != null ? request.getCreatedBy()
                : actor == null ? null : actor.getUsername());

        NotificationSchedule saved = scheduleRepository.saveAndFlush(schedule);
        saved.setExternalJobId(registrar.register(saved));
        saved = scheduleRepository.save(saved);

        log.info("🗓️ Horario {} creado para empleado {} cada {} min ({} → {})",
                saved.getId(), saved.getEmployeeId(), saved.getEveryMinutes(), saved.getStartAt(), saved.getStopAt());
        return saved;
    }

    /** Vuelve a registrar un horario activo; reutiliza el mismo id externo. */
    @Transactional
    public NotificationSchedule reregister(Long id) {
        NotificationSchedule schedule = getSchedule(id);
        if (!Boolean.TRUE.equals(schedule.getActive())) {
            throw new IllegalArgumentException("El horario " + id + " está inactivo");
        }
        schedule.setExternalJobId(registrar.register(schedule));
        return scheduleRepository.save(schedule);
    }

    @Transactional(readOnly = true)
    public List<NotificationSchedule> listSchedules() {
        return scheduleRepository.findTop200ByOrderByCreatedAtDesc();
    }

    @Transactional(readOnly = true)
    public NotificationSchedule getSchedule(Long id) {
        return scheduleRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Schedule not found with id " + id));
    }

    public void deleteSchedule(Long id) {
        NotificationSchedule schedule = getSchedule(id);
        registrar.deregister(schedule);
    }

    @Transactional(readOnly = true)
    public ScheduleStatsDTO getStats(Long id) {
        getSchedule(id);

        Map<DeliveryStatus, Long> by = new EnumMap<>(DeliveryStatus.class);
        for (DeliveryStatusCount row : deliveryRepository.countByStatusForSchedule(id)) {
            by.put(row.getStatus(), row.getTotal() == null ? 0L : row.getTotal());
        }
        long acked = by.getOrDefault(DeliveryStatus.ACKED, 0L);
        long expired = by.getOrDefault(DeliveryStatus.EXPIRED, 0L);
        long pending = by.getOrDefault(DeliveryStatus.SENT, 0L);
        long sent = acked + expired + pending;

        return ScheduleStatsDTO.builder()
                .scheduleId(id)
                .sent(sent)
                .acked(acked)
                .expired(expired)
                .pending(pending)
                .ackRate(sent == 0 ? 0.0 : (double) acked / sent)
                .build();
    }

    private void validate(ScheduleCreateRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Missing fields");
        }
        if (isBlank(request.getEmployeeId()) || isBlank(request.getTitle()) || isBlank(request.getBody())
                || request.getEveryMinutes() == null || request.getStartAt() == null || request.getStopAt() == null) {
            throw new IllegalArgumentException("Missing fields");
        }
        int every = request.getEveryMinutes();
        if (every < CronRecurrence.MIN_EVERY_MINUTES || every > CronRecurrence.MAX_EVERY_MINUTES) {
            throw new IllegalArgumentException("everyMinutes debe estar entre 1 y 60");
        }
        if (!request.getStartAt().isBefore(request.getStopAt())) {
            throw new IllegalArgumentException("Invalid startAt/stopAt: startAt debe ser anterior a stopAt");
        }
        // valida la zona con la misma regla que el cron
        CronRecurrence.everyMinutes(every, timezoneOf(request));
    }

    private static String timezoneOf(ScheduleCreateRequest request) {
        return isBlank(request.getTimezone()) ? NotificationSchedule.DEFAULT_TIMEZONE : request.getTimezone().trim();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
