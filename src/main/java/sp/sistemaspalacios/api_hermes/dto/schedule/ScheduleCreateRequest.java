package sp.sistemaspalacios.api_hermes.dto.schedule;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Instant;

@Data
public class ScheduleCreateRequest {

    @NotBlank(message = "employeeId es requerido")
    private String employeeId;

    @NotBlank(message = "title es requerido")
    private String title;

    @NotBlank(message = "body es requerido")
    private String body;

    private String url;

    @NotNull(message = "everyMinutes es requerido")
    @Min(value = 1, message = "everyMinutes debe estar entre 1 y 60")
    @Max(value = 60, message = "everyMinutes debe estar entre 1 y 60")
    private Integer everyMinutes;

    @NotNull(message = "startAt es requerido")
    private Instant startAt;

    @NotNull(message = "stopAt es requerido")
    private Instant stopAt;

    private String timezone;

    private String createdBy;
}
