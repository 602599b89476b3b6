package sp.sistemaspalacios.api_hermes.entity.delivery;

/**
 * Estado de confirmación de un envío.
 *
 * <pre>
 *   SENT ──ack──────▶ ACKED
 *     │
 *     └──vencido────▶ EXPIRED
 * </pre>
 *
 * Las transiciones son de un solo sentido y siempre salen de SENT.
 */
public enum DeliveryStatus {
    SENT,
    ACKED,
    EXPIRED
}
