package sp.sistemaspalacios.api_hermes.controller.push;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_hermes.dto.delivery.AckRequest;
import sp.sistemaspalacios.api_hermes.dto.delivery.AckResult;
import sp.sistemaspalacios.api_hermes.dto.delivery.RecentDeliveryDTO;
import sp.sistemaspalacios.api_hermes.dto.delivery.SendCommand;
import sp.sistemaspalacios.api_hermes.dto.delivery.SendRequest;
import sp.sistemaspalacios.api_hermes.dto.delivery.SendResult;
import sp.sistemaspalacios.api_hermes.dto.push.SubscribeRequest;
import sp.sistemaspalacios.api_hermes.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_hermes.security.Actor;
import sp.sistemaspalacios.api_hermes.security.ActorResolver;
import sp.sistemaspalacios.api_hermes.service.delivery.AcknowledgementService;
import sp.sistemaspalacios.api_hermes.service.delivery.DeliveryQueryService;
import sp.sistemaspalacios.api_hermes.service.delivery.NotificationSendService;
import sp.sistemaspalacios.api_hermes.service.push.PushSubscriptionService;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/push")
public class PushController {

    private final PushSubscriptionService subscriptionService;
    private final AcknowledgementService acknowledgementService;
    private final DeliveryQueryService deliveryQueryService;
    private final NotificationSendService sendService;
    private final ActorResolver actorResolver;

    public PushController(PushSubscriptionService subscriptionService,
                          AcknowledgementService acknowledgementService,
                          DeliveryQueryService deliveryQueryService,
                          NotificationSendService sendService,
                          ActorResolver actorResolver) {
        this.subscriptionService = subscriptionService;
        this.acknowledgementService = acknowledgementService;
        this.deliveryQueryService = deliveryQueryService;
        this.sendService = sendService;
        this.actorResolver = actorResolver;
    }

    // Registrar el dispositivo del empleado
    @PostMapping("/subscribe")
    public ResponseEntity<Map<String, Object>> subscribe(@Valid @RequestBody SubscribeRequest body,
                                                         HttpServletRequest request) {
        Actor actor = actorResolver.requireEmployee(request);
        subscriptionService.subscribe(actor.getEmployeeId(), body);
        return ResponseEntity.ok(Map.of("ok", true));
    }

    // Confirmar uno o varios envíos; el empleado solo confirma los suyos
    @PostMapping("/ack")
    public ResponseEntity<Map<String, Object>> ack(@RequestBody AckRequest body, HttpServletRequest request) {
        Actor actor = actorResolver.requireActor(request);
        AckResult result = acknowledgementService.acknowledge(body.toIdList(), actor);
        return ResponseEntity.ok(Map.of("ok", true, "matched", result.getMatched(), "modified", result.getModified()));
    }

    @PostMapping("/{id}/ack")
    public ResponseEntity<Map<String, Object>> ackOne(@PathVariable("id") Long id, HttpServletRequest request) {
        Actor actor = actorResolver.requireActor(request);
        AckResult result = acknowledgementService.acknowledge(List.of(id), actor);
        if (result.getMatched() == 0) {
            throw new ResourceNotFoundException("Delivery not found");
        }
        return ResponseEntity.ok(Map.of("ok", true, "modified", result.getModified()));
    }

    // Últimos envíos: el empleado ve los suyos, el administrador indica ?employeeId
    @GetMapping("/recent")
    public List<RecentDeliveryDTO> recent(@RequestParam(value = "employeeId", required = false) String employeeId,
                                          HttpServletRequest request) {
        Actor actor = actorResolver.requireActor(request);
        String target = actor.isEmployee() ? actor.getEmployeeId() : employeeId;
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("Missing employeeId");
        }
        return deliveryQueryService.recentFor(target);
    }

    // Envío manual desde administración
    @PostMapping("/send")
    public SendResult send(@Valid @RequestBody SendRequest body, HttpServletRequest request) {
        actorResolver.requireAdmin(request);
        return sendService.send(SendCommand.builder()
                .employeeIds(body.getEmployeeIds())
                .title(body.getTitle())
                .body(body.getBody())
                .url(body.getUrl())
                .scheduleId(body.getScheduleId())
                .notificationId(body.getNotificationId())
                .metadata(body.getMetadata())
                .build());
    }
}
