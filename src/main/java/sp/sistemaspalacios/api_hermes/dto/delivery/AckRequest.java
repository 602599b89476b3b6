package sp.sistemaspalacios.api_hermes.dto.delivery;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class AckRequest {

    @JsonAlias("deliveryId")
    private Long id;

    @JsonAlias("deliveryIds")
    private List<Long> ids;

    public List<Long> toIdList() {
        List<Long> result = new ArrayList<>();
        if (ids != null) {
            ids.stream().filter(java.util.Objects::nonNull).forEach(result::add);
        } else if (id != null) {
            result.add(id);
        }
        return result;
    }
}
