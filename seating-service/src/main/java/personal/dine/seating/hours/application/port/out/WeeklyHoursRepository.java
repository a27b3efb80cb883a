package personal.dine.seating.hours.application.port.out;

import personal.dine.seating.hours.domain.model.WeeklyHours;

import java.util.List;
import java.util.Optional;

/**
 * Weekly Hours Repository (Output Port)
 */
public interface WeeklyHoursRepository {

    Optional<WeeklyHours> findByDayOfWeek(int dayOfWeek);

    /**
     * 요일 순 (월 → 일)
     */
    List<WeeklyHours> findAll();

    WeeklyHours save(WeeklyHours weeklyHours);
}
