package personal.dine.seating.hours.application.port.out;

import personal.dine.seating.hours.domain.model.SpecialHours;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Special Hours Repository (Output Port)
 */
public interface SpecialHoursRepository {

    Optional<SpecialHours> findByDate(LocalDate date);

    Optional<SpecialHours> findById(Long specialHoursId);

    /**
     * 날짜 범위 조회 (양 끝 포함, null이면 제한 없음)
     */
    List<SpecialHours> findBetween(LocalDate from, LocalDate to);

    SpecialHours save(SpecialHours specialHours);

    void deleteById(Long specialHoursId);
}
