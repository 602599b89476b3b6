package sp.sistemaspalacios.api_hermes.dto.schedule;

import lombok.Data;

/** Cuerpo que el despachador reenvía en cada disparo; los campos opcionales sobrescriben el horario. */
@Data
public class TickRequest {
    private Long scheduleId;
    private String employeeId;
    private String title;
    private String body;
    private String url;
}
