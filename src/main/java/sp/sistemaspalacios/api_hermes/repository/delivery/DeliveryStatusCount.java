package sp.sistemaspalacios.api_hermes.repository.delivery;

import sp.sistemaspalacios.api_hermes.entity.delivery.DeliveryStatus;

public interface DeliveryStatusCount {
    DeliveryStatus getStatus();
    Long getTotal();
}
