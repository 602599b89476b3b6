package sp.sistemaspalacios.api_hermes.dto.schedule;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleStatsDTO {
    private Long scheduleId;
    /** acked + expired + pending */
    private long sent;
    private long acked;
    private long expired;
    /** Aún en SENT */
    private long pending;
    private double ackRate;
}
