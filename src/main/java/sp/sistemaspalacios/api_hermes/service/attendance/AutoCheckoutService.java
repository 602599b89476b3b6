package sp.sistemaspalacios.api_hermes.service.attendance;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.api_hermes.dto.autocheckout.AutoCheckoutRequest;
import sp.sistemaspalacios.api_hermes.dto.autocheckout.AutoCheckoutResult;
import sp.sistemaspalacios.api_hermes.repository.push.PushSubscriptionRepository;
import sp.sistemaspalacios.api_hermes.service.dispatcher.CronRecurrence;
import sp.sistemaspalacios.api_hermes.service.schedule.ScheduleRegistrar;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Salida automática diaria de todos los empleados que siguen con entrada abierta.
 */
@Slf4j
@Service
public class AutoCheckoutService {

    public static final String REASON = "auto-8pm";
    public static final String SWEEP_PATH = "/api/sweeps/auto-checkout";

    private final ScheduleRegistrar registrar;
    private final ForceCheckoutGateway forceCheckoutGateway;
    private final PushSubscriptionRepository subscriptionRepository;
    private final String jobId;
    private final int hour;
    private final int minute;
    private final String timezone;

    public AutoCheckoutService(
            ScheduleRegistrar registrar,
            ForceCheckoutGateway forceCheckoutGateway,
            PushSubscriptionRepository subscriptionRepository,
            @Value("${hermes.auto-checkout.job-id:auto-checkout-8pm-v1}") String jobId,
            @Value("${hermes.auto-checkout.hour:20}") int hour,
            @Value("${hermes.auto-checkout.minute:0}") int minute,
            @Value("${hermes.auto-checkout.timezone:Asia/Kathmandu}") String timezone
    ) {
        this.registrar = registrar;
        this.forceCheckoutGateway = forceCheckoutGateway;
        this.subscriptionRepository = subscriptionRepository;
        this.jobId = jobId;
        this.hour = hour;
        this.minute = minute;
        this.timezone = timezone;
    }

    /** Registra el trabajo diario; con id fijo, repetir la llamada no lo duplica. */
    public Map<String, Object> registerDaily() {
        CronRecurrence recurrence = CronRecurrence.dailyAt(hour, minute, timezone);
        String id = registrar.registerJob(jobId, SWEEP_PATH, recurrence, Map.of());
        log.info("⏰ Salida automática diaria registrada ({}) con cron {}", jobId, recurrence);
        return Map.of("jobId", jobId, "scheduleId", id, "cron", recurrence.expression());
    }

    public AutoCheckoutResult run(AutoCheckoutRequest request) {
        Set<String> employees = new LinkedHashSet<>();
        List<String> named = request == null ? null : request.getEmployees();
        if (named != null && !named.isEmpty()) {
            named.stream().filter(Objects::nonNull).map(String::trim).filter(s -> !s.isEmpty()).forEach(employees::add);
        } else {
            employees.addAll(subscriptionRepository.findDistinctEmployeeIds());
        }

        AutoCheckoutResult result = new AutoCheckoutResult();
        for (String employeeId : employees) {
            result.setProcessed(result.getProcessed() + 1);
            try {
                forceCheckoutGateway.forceCheckout(employeeId, REASON, null);
                result.setForced(result.getForced() + 1);
            } catch (RuntimeException e) {
                result.setFailed(result.getFailed() + 1);
                log.error("❌ Salida automática falló para empleado {}: {}", employeeId, e.getMessage());
            }
        }
        log.info("🌙 Salida automática: {} procesados, {} forzados, {} fallidos",
                result.getProcessed(), result.getForced(), result.getFailed());
        return result;
    }
}
