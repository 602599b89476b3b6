package sp.sistemaspalacios.api_hermes.dto.delivery;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;
import java.util.Map;

@Data
@Builder
public class SendCommand {
    @Singular
    private List<String> employeeIds;
    private String title;
    private String body;
    private String url;
    private Long scheduleId;
    private Long notificationId;
    private Map<String, String> metadata;
}
