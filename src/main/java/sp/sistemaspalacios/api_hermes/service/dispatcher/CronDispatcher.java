package sp.sistemaspalacios.api_hermes.service.dispatcher;

import java.util.Map;

/**
 * Despachador cron externo que llama de vuelta a nuestros endpoints.
 */
public interface CronDispatcher {

    /**
     * Crea o reemplaza el trabajo {@code jobId}. Reutilizar el mismo id no duplica el trabajo.
     *
     * @return id del trabajo según el despachador
     */
    String createSchedule(String destinationUrl, CronRecurrence recurrence, String jobId,
                          String body, Map<String, String> forwardedHeaders);

    /**
     * @return {@code false} si el trabajo ya no existía
     */
    boolean deleteSchedule(String jobId);
}
