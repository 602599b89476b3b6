package sp.sistemaspalacios.api_hermes.service.attendance;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import sp.sistemaspalacios.api_hermes.dto.autocheckout.AutoCheckoutRequest;
import sp.sistemaspalacios.api_hermes.dto.autocheckout.AutoCheckoutResult;
import sp.sistemaspalacios.api_hermes.exception.UpstreamServiceException;
import sp.sistemaspalacios.api_hermes.repository.push.PushSubscriptionRepository;
import sp.sistemaspalacios.api_hermes.service.dispatcher.CronRecurrence;
import sp.sistemaspalacios.api_hermes.service.schedule.ScheduleRegistrar;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AutoCheckoutServiceTest {

    @Mock
    private ScheduleRegistrar registrar;
    @Mock
    private ForceCheckoutGateway forceCheckoutGateway;
    @Mock
    private PushSubscriptionRepository subscriptionRepository;

    private AutoCheckoutService service;

    @BeforeEach
    void setUp() {
        service = new AutoCheckoutService(registrar, forceCheckoutGateway, subscriptionRepository,
                "auto-checkout-8pm-v1", 20, 0, "Asia/Kathmandu");
    }

    @Test
    void registerDaily_usesFixedJobIdAndEightPm() {
        when(registrar.registerJob(eq("auto-checkout-8pm-v1"), eq(AutoCheckoutService.SWEEP_PATH),
                eq(CronRecurrence.dailyAt(20, 0, "Asia/Kathmandu")), anyMap()))
                .thenReturn("auto-checkout-8pm-v1");

        Map<String, Object> result = service.registerDaily();

        assertEquals("auto-checkout-8pm-v1", result.get("jobId"));
        assertEquals("CRON_TZ=Asia/Kathmandu 0 20 * * *", result.get("cron"));
    }

    @Test
    void run_namedEmployeesOnly() {
        AutoCheckoutRequest request = new AutoCheckoutRequest();
        request.setEmployees(List.of("emp-1", "emp-1", "emp-2"));

        AutoCheckoutResult result = service.run(request);

        verify(forceCheckoutGateway).forceCheckout("emp-1", AutoCheckoutService.REASON, null);
        verify(forceCheckoutGateway).forceCheckout("emp-2", AutoCheckoutService.REASON, null);
        verifyNoInteractions(subscriptionRepository);
        assertEquals(2, result.getProcessed());
        assertEquals(2, result.getForced());
    }

    @Test
    void run_emptyBodyTargetsEverySubscribedEmployee() {
        when(subscriptionRepository.findDistinctEmployeeIds()).thenReturn(List.of("emp-1", "emp-2", "emp-3"));
        doNothing()
                .doThrow(new UpstreamServiceException("attendance", "down"))
                .doNothing()
                .when(forceCheckoutGateway).forceCheckout(any(), eq(AutoCheckoutService.REASON), any());

        AutoCheckoutResult result = service.run(null);

        assertEquals(3, result.getProcessed());
        assertEquals(2, result.getForced());
        assertEquals(1, result.getFailed());
    }
}
