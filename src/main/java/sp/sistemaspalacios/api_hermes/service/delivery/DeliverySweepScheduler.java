package sp.sistemaspalacios.api_hermes.service.delivery;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/** Dispara el barrido desde el propio proceso cuando {@code hermes.sweep.enabled=true}. */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "hermes.sweep", name = "enabled", havingValue = "true")
public class DeliverySweepScheduler {

    private final DeliverySweepService sweepService;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${hermes.sweep.interval-ms:60000}",
            initialDelayString = "${hermes.sweep.initial-delay-ms:30000}")
    public void run() {
        try {
            sweepService.sweep(clock.instant());
        } catch (Exception e) {
            log.error("❌ Error en el barrido programado: {}", e.getMessage(), e);
        }
    }
}
