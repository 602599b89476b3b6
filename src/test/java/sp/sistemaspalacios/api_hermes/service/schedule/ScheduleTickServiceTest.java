package sp.sistemaspalacios.api_hermes.service.schedule;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import sp.sistemaspalacios.api_hermes.dto.delivery.SendCommand;
import sp.sistemaspalacios.api_hermes.dto.delivery.SendResult;
import sp.sistemaspalacios.api_hermes.dto.schedule.TickRequest;
import sp.sistemaspalacios.api_hermes.dto.schedule.TickResult;
import sp.sistemaspalacios.api_hermes.entity.schedule.NotificationSchedule;
import sp.sistemaspalacios.api_hermes.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_hermes.repository.schedule.NotificationScheduleRepository;
import sp.sistemaspalacios.api_hermes.service.delivery.NotificationSendService;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ScheduleTickServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private NotificationScheduleRepository scheduleRepository;
    @Mock
    private NotificationSendService sendService;

    private ScheduleTickService service;

    @BeforeEach
    void setUp() {
        service = new ScheduleTickService(scheduleRepository, sendService, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void onTick_inWindowSendsWithScheduleValues() {
        NotificationSchedule schedule = schedule(NOW.minus(Duration.ofHours(1)), NOW.plus(Duration.ofHours(1)));
        when(scheduleRepository.findById(7L)).thenReturn(Optional.of(schedule));
        when(sendService.send(any())).thenReturn(SendResult.builder().created(1).deliveryIds(List.of(99L)).build());

        TickResult result = service.onTick(7L, null);

        ArgumentCaptor<SendCommand> captor = ArgumentCaptor.forClass(SendCommand.class);
        verify(sendService).send(captor.capture());
        SendCommand command = captor.getValue();
        assertEquals(List.of("emp-1"), command.getEmployeeIds());
        assertEquals("Check in", command.getTitle());
        assertEquals(7L, command.getScheduleId());
        assertTrue(result.isSent());
        assertEquals(List.of(99L), result.getDetail().getDeliveryIds());
    }

    @Test
    void onTick_overridesReplaceScheduleText() {
        NotificationSchedule schedule = schedule(NOW.minus(Duration.ofHours(1)), NOW.plus(Duration.ofHours(1)));
        when(scheduleRepository.findById(7L)).thenReturn(Optional.of(schedule));
        when(sendService.send(any())).thenReturn(SendResult.builder().created(1).build());

        TickRequest overrides = new TickRequest();
        overrides.setTitle("Reminder");
        overrides.setBody(" ");

        service.onTick(7L, overrides);

        ArgumentCaptor<SendCommand> captor = ArgumentCaptor.forClass(SendCommand.class);
        verify(sendService).send(captor.capture());
        assertEquals("Reminder", captor.getValue().getTitle());
        assertEquals("Are you at your desk?", captor.getValue().getBody());
    }

    @Test
    void onTick_afterStopDeactivatesWithoutSending() {
        NotificationSchedule schedule = schedule(NOW.minus(Duration.ofHours(2)), NOW.minus(Duration.ofMinutes(1)));
        when(scheduleRepository.findById(7L)).thenReturn(Optional.of(schedule));

        TickResult result = service.onTick(7L, null);

        verify(scheduleRepository).deactivateIfActive(7L, NOW);
        verifyNoInteractions(sendService);
        assertTrue(result.isSkipped());
        assertEquals(TickResult.AFTER_STOP, result.getReason());
    }

    @Test
    void onTick_beforeStartIsSkipped() {
        NotificationSchedule schedule = schedule(NOW.plus(Duration.ofMinutes(5)), NOW.plus(Duration.ofHours(1)));
        when(scheduleRepository.findById(7L)).thenReturn(Optional.of(schedule));

        TickResult result = service.onTick(7L, null);

        verifyNoInteractions(sendService);
        verify(scheduleRepository, never()).deactivateIfActive(any(), any());
        assertEquals(TickResult.BEFORE_START, result.getReason());
    }

    @Test
    void onTick_inactiveScheduleIsSkipped() {
        NotificationSchedule schedule = schedule(NOW.minus(Duration.ofHours(1)), NOW.plus(Duration.ofHours(1)));
        schedule.setActive(false);
        when(scheduleRepository.findById(7L)).thenReturn(Optional.of(schedule));

        TickResult result = service.onTick(7L, null);

        verifyNoInteractions(sendService);
        assertEquals(TickResult.INACTIVE, result.getReason());
    }

    @Test
    void onTick_unknownOrMissingSchedule() {
        when(scheduleRepository.findById(404L)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> service.onTick(404L, null));
        assertThrows(IllegalArgumentException.class, () -> service.onTick(null, null));
        verifyNoInteractions(sendService);
    }

    private static NotificationSchedule schedule(Instant startAt, Instant stopAt) {
        NotificationSchedule s = new NotificationSchedule();
        s.setId(7L);
        s.setEmployeeId("emp-1");
        s.setTitle("Check in");
        s.setBody("Are you at your desk?");
        s.setEveryMinutes(5);
        s.setStartAt(startAt);
        s.setStopAt(stopAt);
        s.setActive(true);
        return s;
    }
}
