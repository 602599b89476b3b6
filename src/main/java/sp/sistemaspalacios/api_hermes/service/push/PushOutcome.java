package sp.sistemaspalacios.api_hermes.service.push;

public enum PushOutcome {
    DELIVERED,
    /** El endpoint ya no existe (404/410); la suscripción debe borrarse. */
    GONE,
    FAILED
}
