package sp.sistemaspalacios.api_hermes.dto.delivery;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AckResult {
    private long matched;
    private long modified;
}
