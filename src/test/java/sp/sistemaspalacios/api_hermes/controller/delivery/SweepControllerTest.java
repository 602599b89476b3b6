package sp.sistemaspalacios.api_hermes.controller.delivery;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;
import sp.sistemaspalacios.api_hermes.config.ClockConfig;
import sp.sistemaspalacios.api_hermes.dto.delivery.SweepResult;
import sp.sistemaspalacios.api_hermes.security.ActorResolver;
import sp.sistemaspalacios.api_hermes.service.delivery.DeliverySweepService;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SweepController.class)
@Import({ActorResolver.class, ClockConfig.class})
class SweepControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DeliverySweepService sweepService;

    @Test
    void sweep_runsWithAdminToken() throws Exception {
        SweepResult result = new SweepResult();
        result.setChecked(2);
        result.setExpired(2);
        result.setForced(1);
        result.setFailed(1);
        when(sweepService.sweep(any())).thenReturn(result);

        mockMvc.perform(post("/api/notifications/sweep").header("x-admin-token", "test-admin-token"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.expired").value(2))
                .andExpect(jsonPath("$.failed").value(1));
    }

    @Test
    void sweep_rejectsMissingToken() throws Exception {
        mockMvc.perform(post("/api/notifications/sweep"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(sweepService);
    }
}
