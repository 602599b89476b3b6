package sp.sistemaspalacios.api_hermes.controller.schedule;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import sp.sistemaspalacios.api_hermes.dto.schedule.ScheduleStatsDTO;
import sp.sistemaspalacios.api_hermes.entity.schedule.NotificationSchedule;
import sp.sistemaspalacios.api_hermes.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_hermes.exception.UpstreamServiceException;
import sp.sistemaspalacios.api_hermes.security.ActorResolver;
import sp.sistemaspalacios.api_hermes.service.schedule.NotificationScheduleService;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AdminScheduleController.class)
@Import(ActorResolver.class)
class AdminScheduleControllerTest {

    private static final String ADMIN_TOKEN = "test-admin-token";
    private static final String BODY = "{\"employeeId\":\"emp-1\",\"title\":\"Check in\",\"body\":\"Are you there?\","
            + "\"everyMinutes\":15,\"startAt\":\"2024-05-01T09:00:00Z\",\"stopAt\":\"2024-05-01T17:00:00Z\"}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private NotificationScheduleService scheduleService;

    @Test
    void createSchedule_returnsCreatedWithJobId() throws Exception {
        NotificationSchedule created = new NotificationSchedule();
        created.setId(7L);
        created.setExternalJobId("notification-schedule-7");
        when(scheduleService.createSchedule(any(), any())).thenReturn(created);

        mockMvc.perform(post("/api/admin/schedules")
                        .header("x-admin-token", ADMIN_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(7))
                .andExpect(jsonPath("$.externalJobId").value("notification-schedule-7"));
    }

    @Test
    void createSchedule_requiresAdmin() throws Exception {
        mockMvc.perform(post("/api/admin/schedules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(post("/api/admin/schedules")
                        .header("x-user-id", "emp-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isForbidden());

        verifyNoInteractions(scheduleService);
    }

    @Test
    void createSchedule_intervalOutOfRangeIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/admin/schedules")
                        .header("x-admin-token", ADMIN_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY.replace("\"everyMinutes\":15", "\"everyMinutes\":0")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));

        verifyNoInteractions(scheduleService);
    }

    @Test
    void createSchedule_dispatcherFailureIsBadGateway() throws Exception {
        when(scheduleService.createSchedule(any(), any()))
                .thenThrow(new UpstreamServiceException("dispatcher", "timeout"));

        mockMvc.perform(post("/api/admin/schedules")
                        .header("x-admin-token", ADMIN_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isBadGateway());
    }

    @Test
    void deleteSchedule_unknownIsNotFound() throws Exception {
        doThrow(new ResourceNotFoundException("Schedule not found with id 9"))
                .when(scheduleService).deleteSchedule(9L);

        mockMvc.perform(delete("/api/admin/schedules/9").header("x-admin-token", ADMIN_TOKEN))
                .andExpect(status().isNotFound());
    }

    @Test
    void getStats_returnsCounts() throws Exception {
        when(scheduleService.getStats(7L)).thenReturn(ScheduleStatsDTO.builder()
                .scheduleId(7L).sent(4).acked(3).expired(1).ackRate(0.75).build());

        mockMvc.perform(get("/api/admin/schedules/7/stats").header("x-admin-token", ADMIN_TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.acked").value(3))
                .andExpect(jsonPath("$.ackRate").value(0.75));
    }
}
