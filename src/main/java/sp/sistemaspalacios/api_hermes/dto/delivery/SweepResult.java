package sp.sistemaspalacios.api_hermes.dto.delivery;

import lombok.Data;

@Data
public class SweepResult {
    /** Candidatos leídos (vencidos en SENT + EXPIRED sin salida forzada). */
    private int checked;
    /** Transiciones SENT → EXPIRED ganadas por este barrido. */
    private int expired;
    private int forced;
    private int failed;
    /** Filas que otro proceso resolvió antes. */
    private int skipped;
}
