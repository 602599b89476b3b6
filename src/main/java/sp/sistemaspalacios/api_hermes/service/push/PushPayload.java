package sp.sistemaspalacios.api_hermes.service.push;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Contenido que recibe el service worker del dispositivo. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PushPayload {
    private String title;
    private String body;
    private String url;
    private Long deliveryId;
    private String tag;
}
