package sp.sistemaspalacios.api_hermes.dto.schedule;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import sp.sistemaspalacios.api_hermes.dto.delivery.SendResult;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TickResult {

    public static final String INACTIVE = "inactive";
    public static final String BEFORE_START = "before startAt";
    public static final String AFTER_STOP = "after stopAt";

    private boolean sent;
    private boolean skipped;
    private String reason;
    private SendResult detail;

    public static TickResult skipped(String reason) {
        return new TickResult(false, true, reason, null);
    }

    public static TickResult sent(SendResult detail) {
        return new TickResult(true, false, null, detail);
    }
}
