package sp.sistemaspalacios.api_hermes.repository.schedule;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_hermes.entity.schedule.NotificationSchedule;

import java.time.Instant;
import java.util.List;

@Repository
public interface NotificationScheduleRepository extends JpaRepository<NotificationSchedule, Long> {

    List<NotificationSchedule> findTop200ByOrderByCreatedAtDesc();

    /** Desactiva solo si sigue activo; devuelve 0 si otro proceso ya lo hizo. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE NotificationSchedule s SET s.active = false, s.updatedAt = :now " +
            "WHERE s.id = :id AND s.active = true")
    int deactivateIfActive(@Param("id") Long id, @Param("now") Instant now);
}
