package personal.dine.seating.hours.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for WeeklyHours
 */
public interface JpaWeeklyHoursRepository extends JpaRepository<WeeklyHoursEntity, Long> {

    Optional<WeeklyHoursEntity> findByDayOfWeek(int dayOfWeek);

    List<WeeklyHoursEntity> findAllByOrderByDayOfWeekAsc();
}
