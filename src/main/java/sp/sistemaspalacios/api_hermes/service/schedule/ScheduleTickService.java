package sp.sistemaspalacios.api_hermes.service.schedule;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_hermes.dto.delivery.SendCommand;
import sp.sistemaspalacios.api_hermes.dto.delivery.SendResult;
import sp.sistemaspalacios.api_hermes.dto.schedule.TickRequest;
import sp.sistemaspalacios.api_hermes.dto.schedule.TickResult;
import sp.sistemaspalacios.api_hermes.entity.schedule.NotificationSchedule;
import sp.sistemaspalacios.api_hermes.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_hermes.repository.schedule.NotificationScheduleRepository;
import sp.sistemaspalacios.api_hermes.service.delivery.NotificationSendService;

import java.time.Clock;
import java.time.Instant;

/**
 * Atiende cada disparo del despachador. La ventana se revisa aquí aunque el
 * trabajo externo siga vivo: un disparo tardío después de stopAt desactiva el
 * horario y no envía nada.
 *
 * <p>Un disparo repetido genera filas de envío duplicadas; quedan como
 * auditoría y no rompen ninguna transición.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleTickService {

    private final NotificationScheduleRepository scheduleRepository;
    private final NotificationSendService sendService;
    private final Clock clock;

    public TickResult onTick(Long scheduleId, TickRequest overrides) {
        if (scheduleId == null) {
            throw new IllegalArgumentException("Missing scheduleId");
        }
        NotificationSchedule schedule = scheduleRepository.findById(scheduleId)
                .orElseThrow(() -> new ResourceNotFoundException("Schedule not found"));

        Instant now = clock.instant();
        if (!Boolean.TRUE.equals(schedule.getActive())) {
            log.info("[tick] omitido (inactivo) {}", scheduleId);
            return TickResult.skipped(TickResult.INACTIVE);
        }
        if (schedule.isBefore(now)) {
            log.info("[tick] omitido (antes de startAt) {}", scheduleId);
            return TickResult.skipped(TickResult.BEFORE_START);
        }
        if (schedule.isAfter(now)) {
            scheduleRepository.deactivateIfActive(scheduleId, now);
            log.info("[tick] horario {} desactivado automáticamente (después de stopAt)", scheduleId);
            return TickResult.skipped(TickResult.AFTER_STOP);
        }

        TickRequest o = overrides == null ? new TickRequest() : overrides;
        String employeeId = firstNonBlank(o.getEmployeeId(), schedule.getEmployeeId());
        log.info("[tick] disparando horario {} para empleado {} a las {}", scheduleId, employeeId, now);

        SendResult sent = sendService.send(SendCommand.builder()
                .employeeId(employeeId)
                .title(firstNonBlank(o.getTitle(), schedule.getTitle()))
                .body(firstNonBlank(o.getBody(), schedule.getBody()))
                .url(firstNonBlank(o.getUrl(), schedule.getUrl()))
                .scheduleId(schedule.getId())
                .build());
        return TickResult.sent(sent);
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }
}
