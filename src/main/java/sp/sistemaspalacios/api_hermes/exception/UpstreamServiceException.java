package sp.sistemaspalacios.api_hermes.exception;

/**
 * Fallo de un colaborador externo (despachador cron, gateway push, asistencia).
 */
public class UpstreamServiceException extends RuntimeException {

    private final String service;

    public UpstreamServiceException(String service, String message) {
        super(message);
        this.service = service;
    }

    public UpstreamServiceException(String service, String message, Throwable cause) {
        super(message, cause);
        this.service = service;
    }

    public String getService() {
        return service;
    }
}
