package sp.sistemaspalacios.api_hermes.controller.autocheckout;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_hermes.dto.autocheckout.AutoCheckoutRequest;
import sp.sistemaspalacios.api_hermes.dto.autocheckout.AutoCheckoutResult;
import sp.sistemaspalacios.api_hermes.security.ActorResolver;
import sp.sistemaspalacios.api_hermes.security.DispatcherCallbackVerifier;
import sp.sistemaspalacios.api_hermes.service.attendance.AutoCheckoutService;

import java.util.Map;

@RestController
@RequestMapping("/api")
public class AutoCheckoutController {

    private final AutoCheckoutService autoCheckoutService;
    private final ActorResolver actorResolver;
    private final DispatcherCallbackVerifier verifier;
    private final ObjectMapper mapper;

    public AutoCheckoutController(AutoCheckoutService autoCheckoutService, ActorResolver actorResolver,
                                  DispatcherCallbackVerifier verifier, ObjectMapper mapper) {
        this.autoCheckoutService = autoCheckoutService;
        this.actorResolver = actorResolver;
        this.verifier = verifier;
        this.mapper = mapper;
    }

    // Registrar el trabajo diario de las 20:00
    @PostMapping("/admin/auto-checkout/schedule")
    public Map<String, Object> registerDaily(HttpServletRequest request) {
        actorResolver.requireAdmin(request);
        return autoCheckoutService.registerDaily();
    }

    // Llamada de vuelta del despachador
    @PostMapping("/sweeps/auto-checkout")
    public AutoCheckoutResult run(
            @RequestHeader(value = ActorResolver.ADMIN_TOKEN_HEADER, required = false) String adminToken,
            @RequestHeader(value = DispatcherCallbackVerifier.SIGNATURE_HEADER, required = false) String signature,
            @RequestBody(required = false) String rawBody) {
        verifier.verify(adminToken, signature, rawBody == null ? "" : rawBody);
        return autoCheckoutService.run(parse(rawBody));
    }

    private AutoCheckoutRequest parse(String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            return new AutoCheckoutRequest();
        }
        try {
            return mapper.readValue(rawBody, AutoCheckoutRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cuerpo de salida automática inválido");
        }
    }
}
