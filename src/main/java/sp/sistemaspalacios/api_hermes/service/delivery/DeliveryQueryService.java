package sp.sistemaspalacios.api_hermes.service.delivery;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_hermes.dto.delivery.RecentDeliveryDTO;
import sp.sistemaspalacios.api_hermes.repository.delivery.NotificationDeliveryRepository;

import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class DeliveryQueryService {

    private final NotificationDeliveryRepository deliveryRepository;

    @Transactional(readOnly = true)
    public List<RecentDeliveryDTO> recentFor(String employeeId) {
        if (employeeId == null || employeeId.isBlank()) {
            throw new IllegalArgumentException("employeeId es requerido");
        }
        return deliveryRepository.findTop200ByEmployeeIdOrderBySentAtDesc(employeeId.trim()).stream()
                .map(RecentDeliveryDTO::from)
                .collect(Collectors.toList());
    }
}
