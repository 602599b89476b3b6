package sp.sistemaspalacios.api_hermes.controller.push;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import sp.sistemaspalacios.api_hermes.dto.delivery.AckResult;
import sp.sistemaspalacios.api_hermes.dto.delivery.RecentDeliveryDTO;
import sp.sistemaspalacios.api_hermes.dto.delivery.SendResult;
import sp.sistemaspalacios.api_hermes.security.Actor;
import sp.sistemaspalacios.api_hermes.security.ActorResolver;
import sp.sistemaspalacios.api_hermes.service.delivery.AcknowledgementService;
import sp.sistemaspalacios.api_hermes.service.delivery.DeliveryQueryService;
import sp.sistemaspalacios.api_hermes.service.delivery.NotificationSendService;
import sp.sistemaspalacios.api_hermes.service.push.PushSubscriptionService;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PushController.class)
@Import(ActorResolver.class)
class PushControllerTest {

    private static final String ADMIN_TOKEN = "test-admin-token";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PushSubscriptionService subscriptionService;
    @MockBean
    private AcknowledgementService acknowledgementService;
    @MockBean
    private DeliveryQueryService deliveryQueryService;
    @MockBean
    private NotificationSendService sendService;

    @Test
    void ack_employeeBatchIsScopedToEmployee() throws Exception {
        when(acknowledgementService.acknowledge(eq(List.of(1L, 2L)), any(Actor.class)))
                .thenReturn(new AckResult(2, 1));

        mockMvc.perform(post("/api/push/ack")
                        .header("x-user-id", "emp-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ids\":[1,2]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.matched").value(2))
                .andExpect(jsonPath("$.modified").value(1));

        verify(acknowledgementService).acknowledge(eq(List.of(1L, 2L)),
                argThat(actor -> actor.isEmployee() && "emp-1".equals(actor.getEmployeeId())));
    }

    @Test
    void ack_singleIdAliasAsAdmin() throws Exception {
        when(acknowledgementService.acknowledge(eq(List.of(5L)), any(Actor.class))).thenReturn(new AckResult(1, 1));

        mockMvc.perform(post("/api/push/ack")
                        .header("x-admin-token", ADMIN_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"deliveryId\":5}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true));

        verify(acknowledgementService).acknowledge(eq(List.of(5L)), argThat(Actor::isAdmin));
    }

    @Test
    void ack_withoutActorIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/push/ack")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"deliveryId\":5}"))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(post("/api/push/5/ack"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(acknowledgementService);
    }

    @Test
    void ack_emptyIdsIsBadRequest() throws Exception {
        when(acknowledgementService.acknowledge(eq(List.of()), any()))
                .thenThrow(new IllegalArgumentException("No ids provided"));

        mockMvc.perform(post("/api/push/ack")
                        .header("x-user-id", "emp-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("No ids provided"));
    }

    @Test
    void ackOne_unknownDeliveryIsNotFound() throws Exception {
        when(acknowledgementService.acknowledge(eq(List.of(99L)), any())).thenReturn(new AckResult(0, 0));

        mockMvc.perform(post("/api/push/99/ack").header("x-user-id", "emp-1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void recent_employeeSeesOwnDeliveries() throws Exception {
        when(deliveryQueryService.recentFor("emp-1"))
                .thenReturn(List.of(RecentDeliveryDTO.builder().id(1L).title("Check in").body("").build()));

        mockMvc.perform(get("/api/push/recent")
                        .header("x-user-id", "emp-1")
                        .param("employeeId", "emp-2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].title").value("Check in"));

        verify(deliveryQueryService).recentFor("emp-1");
    }

    @Test
    void recent_requiresActor() throws Exception {
        mockMvc.perform(get("/api/push/recent"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(deliveryQueryService);
    }

    @Test
    void subscribe_requiresEmployee() throws Exception {
        String body = "{\"subscription\":{\"endpoint\":\"https://push/a\",\"keys\":{\"p256dh\":\"p\",\"auth\":\"a\"}}}";

        mockMvc.perform(post("/api/push/subscribe")
                        .header("x-user-id", "emp-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk());
        mockMvc.perform(post("/api/push/subscribe")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isUnauthorized());

        verify(subscriptionService, times(1)).subscribe(eq("emp-1"), any());
    }

    @Test
    void subscribe_missingEndpointIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/push/subscribe")
                        .header("x-user-id", "emp-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"subscription\":{}}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(subscriptionService);
    }

    @Test
    void send_adminOnly() throws Exception {
        String body = "{\"employeeIds\":[\"emp-1\",\"emp-2\"],\"title\":\"Meeting\",\"body\":\"Room 4\"}";
        when(sendService.send(any())).thenReturn(SendResult.builder().created(2).build());

        mockMvc.perform(post("/api/push/send")
                        .header("x-admin-token", ADMIN_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.created").value(2));
        mockMvc.perform(post("/api/push/send")
                        .header("x-user-id", "emp-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isForbidden());

        verify(sendService, times(1)).send(argThat(c -> c.getEmployeeIds().equals(List.of("emp-1", "emp-2"))));
    }

    @Test
    void send_withoutRecipientsIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/push/send")
                        .header("x-admin-token", ADMIN_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"employeeIds\":[],\"title\":\"t\",\"body\":\"b\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("No recipients"));
    }
}
