package sp.sistemaspalacios.api_hermes.controller.schedule;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_hermes.dto.schedule.TickRequest;
import sp.sistemaspalacios.api_hermes.dto.schedule.TickResult;
import sp.sistemaspalacios.api_hermes.security.ActorResolver;
import sp.sistemaspalacios.api_hermes.security.DispatcherCallbackVerifier;
import sp.sistemaspalacios.api_hermes.service.schedule.ScheduleTickService;

/**
 * Llamada de vuelta del despachador cron. El cuerpo se recibe crudo porque la
 * firma cubre los bytes exactos.
 */
@RestController
@RequestMapping("/api/schedules")
public class ScheduleTickController {

    private final ScheduleTickService tickService;
    private final DispatcherCallbackVerifier verifier;
    private final ObjectMapper mapper;

    public ScheduleTickController(ScheduleTickService tickService, DispatcherCallbackVerifier verifier,
                                  ObjectMapper mapper) {
        this.tickService = tickService;
        this.verifier = verifier;
        this.mapper = mapper;
    }

    @PostMapping("/tick")
    public TickResult tick(
            @RequestHeader(value = ActorResolver.ADMIN_TOKEN_HEADER, required = false) String adminToken,
            @RequestHeader(value = DispatcherCallbackVerifier.SIGNATURE_HEADER, required = false) String signature,
            @RequestBody(required = false) String rawBody) {
        verifier.verify(adminToken, signature, rawBody == null ? "" : rawBody);

        TickRequest tick = parse(rawBody);
        return tickService.onTick(tick.getScheduleId(), tick);
    }

    private TickRequest parse(String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            return new TickRequest();
        }
        try {
            return mapper.readValue(rawBody, TickRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cuerpo de disparo inválido");
        }
    }
}
