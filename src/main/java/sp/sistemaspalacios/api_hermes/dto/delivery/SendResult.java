package sp.sistemaspalacios.api_hermes.dto.delivery;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SendResult {
    /** Filas de envío creadas (una por destinatario). */
    private int created;
    /** Push aceptados por el gateway. */
    private int dispatched;
    private int failed;
    private int removedSubscriptions;
    @Builder.Default
    private List<Long> deliveryIds = new ArrayList<>();
}
