package sp.sistemaspalacios.api_hermes.dto.autocheckout;

import lombok.Data;

@Data
public class AutoCheckoutResult {
    private int processed;
    private int forced;
    private int failed;
}
