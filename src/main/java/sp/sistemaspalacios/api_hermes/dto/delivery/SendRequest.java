package sp.sistemaspalacios.api_hermes.dto.delivery;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
public class SendRequest {

    @NotEmpty(message = "No recipients")
    private List<String> employeeIds;

    @NotBlank(message = "Title and body required")
    private String title;

    @NotBlank(message = "Title and body required")
    private String body;

    private String url;
    private Long scheduleId;
    private Long notificationId;
    private Map<String, String> metadata;
}
