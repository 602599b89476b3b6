package sp.sistemaspalacios.api_hermes.dto.delivery;

import lombok.Builder;
import lombok.Data;
import sp.sistemaspalacios.api_hermes.entity.delivery.DeliveryStatus;
import sp.sistemaspalacios.api_hermes.entity.delivery.NotificationDelivery;

import java.time.Instant;

@Data
@Builder
public class RecentDeliveryDTO {

    static final String DEFAULT_TITLE = "Notification";

    private Long id;
    private Long scheduleId;
    private String title;
    private String body;
    private String url;
    private DeliveryStatus status;
    private Instant sentAt;
    private Instant ackedAt;
    private Instant expiresAt;

    /**
     * Sin título propio, la primera línea del mensaje hace de título y el resto de cuerpo.
     */
    public static RecentDeliveryDTO from(NotificationDelivery d) {
        String title = d.getTitle();
        String body = d.getBody() == null ? "" : d.getBody();
        if (title == null || title.isBlank()) {
            int newline = body.indexOf('\n');
            String first = newline < 0 ? body : body.substring(0, newline);
            title = first.isBlank() ? DEFAULT_TITLE : first.trim();
            body = newline < 0 ? "" : body.substring(newline + 1);
        }
        return RecentDeliveryDTO.builder()
                .id(d.getId())
                .scheduleId(d.getScheduleId())
                .title(title)
                .body(body)
                .url(d.getUrl())
                .status(d.getStatus())
                .sentAt(d.getSentAt())
                .ackedAt(d.getAckedAt())
                .expiresAt(d.getExpiresAt())
                .build();
    }
}
