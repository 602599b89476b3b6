package sp.sistemaspalacios.api_hermes.repository.push;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_hermes.entity.push.PushSubscription;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface PushSubscriptionRepository extends JpaRepository<PushSubscription, Long> {

    Optional<PushSubscription> findByEndpoint(String endpoint);

    List<PushSubscription> findByEmployeeIdIn(Collection<String> employeeIds);

    @Query("SELECT DISTINCT s.employeeId FROM PushSubscription s ORDER BY s.employeeId")
    List<String> findDistinctEmployeeIds();

    @Modifying
    @Transactional
    long deleteByEndpoint(String endpoint);
}
