package sp.sistemaspalacios.api_hermes.controller.schedule;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_hermes.dto.schedule.ScheduleCreateRequest;
import sp.sistemaspalacios.api_hermes.dto.schedule.ScheduleStatsDTO;
import sp.sistemaspalacios.api_hermes.entity.schedule.NotificationSchedule;
import sp.sistemaspalacios.api_hermes.security.Actor;
import sp.sistemaspalacios.api_hermes.security.ActorResolver;
import sp.sistemaspalacios.api_hermes.service.schedule.NotificationScheduleService;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin/schedules")
public class AdminScheduleController {

    private final NotificationScheduleService scheduleService;
    private final ActorResolver actorResolver;

    public AdminScheduleController(NotificationScheduleService scheduleService, ActorResolver actorResolver) {
        this.scheduleService = scheduleService;
        this.actorResolver = actorResolver;
    }

    // Crear y registrar un horario
    @PostMapping
    public ResponseEntity<NotificationSchedule> createSchedule(@Valid @RequestBody ScheduleCreateRequest body,
                                                               HttpServletRequest request) {
        Actor actor = actorResolver.requireAdmin(request);
        NotificationSchedule created = scheduleService.createSchedule(body, actor);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    // Últimos 200 horarios
    @GetMapping
    public List<NotificationSchedule> listSchedules(HttpServletRequest request) {
        actorResolver.requireAdmin(request);
        return scheduleService.listSchedules();
    }

    // Quitar del despachador y desactivar
    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> deleteSchedule(@PathVariable("id") Long id, HttpServletRequest request) {
        actorResolver.requireAdmin(request);
        scheduleService.deleteSchedule(id);
        return ResponseEntity.ok(Map.of("ok", true, "id", id));
    }

    @GetMapping("/{id}/stats")
    public ScheduleStatsDTO getStats(@PathVariable("id") Long id, HttpServletRequest request) {
        actorResolver.requireAdmin(request);
        return scheduleService.getStats(id);
    }

    @PostMapping("/{id}/register")
    public NotificationSchedule reregister(@PathVariable("id") Long id, HttpServletRequest request) {
        actorResolver.requireAdmin(request);
        return scheduleService.reregister(id);
    }
}
