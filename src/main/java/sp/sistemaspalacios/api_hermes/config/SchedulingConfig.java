package sp.sistemaspalacios.api_hermes.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Temporizador interno del barrido. Apagado por defecto: normalmente lo
 * dispara el despachador externo contra /api/notifications/sweep.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "hermes.sweep", name = "enabled", havingValue = "true")
public class SchedulingConfig {
}
