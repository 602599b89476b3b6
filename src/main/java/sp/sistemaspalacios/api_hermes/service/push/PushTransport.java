package sp.sistemaspalacios.api_hermes.service.push;

import sp.sistemaspalacios.api_hermes.entity.push.PushSubscription;

public interface PushTransport {

    /** Nunca lanza excepción: los fallos se devuelven como {@link PushOutcome}. */
    PushOutcome dispatch(PushSubscription subscription, PushPayload payload);
}
