package sp.sistemaspalacios.api_hermes.service.attendance;

/**
 * Salida forzada en el servicio de asistencia. Idempotente por empleado:
 * si la última marcación ya es salida, no crea otra.
 */
public interface ForceCheckoutGateway {

    /**
     * @param deliveryId envío que originó la salida; {@code null} para barridos diarios
     * @throws sp.sistemaspalacios.api_hermes.exception.UpstreamServiceException si el servicio falla
     */
    void forceCheckout(String employeeId, String reason, Long deliveryId);
}
