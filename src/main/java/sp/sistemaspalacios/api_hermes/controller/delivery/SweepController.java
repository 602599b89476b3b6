package sp.sistemaspalacios.api_hermes.controller.delivery;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import sp.sistemaspalacios.api_hermes.dto.delivery.SweepResult;
import sp.sistemaspalacios.api_hermes.security.ActorResolver;
import sp.sistemaspalacios.api_hermes.service.delivery.DeliverySweepService;

import java.time.Clock;

@RestController
@RequestMapping("/api/notifications")
public class SweepController {

    private final DeliverySweepService sweepService;
    private final ActorResolver actorResolver;
    private final Clock clock;

    public SweepController(DeliverySweepService sweepService, ActorResolver actorResolver, Clock clock) {
        this.sweepService = sweepService;
        this.actorResolver = actorResolver;
        this.clock = clock;
    }

    @PostMapping("/sweep")
    public SweepResult sweep(HttpServletRequest request) {
        actorResolver.requireAdmin(request);
        return sweepService.sweep(clock.instant());
    }
}
