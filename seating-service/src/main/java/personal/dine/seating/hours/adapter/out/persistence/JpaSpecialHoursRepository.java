package personal.dine.seating.hours.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for SpecialHours
 */
public interface JpaSpecialHoursRepository extends JpaRepository<SpecialHoursEntity, Long> {

    Optional<SpecialHoursEntity> findByDate(LocalDate date);

    /**
     * 날짜 범위 조회 (null 경계는 제한 없음)
     */
    @Query("""
            SELECT s FROM SpecialHoursEntity s
            WHERE (:from IS NULL OR s.date >= :from)
              AND (:to IS NULL OR s.date <= :to)
            ORDER BY s.date
            """)
    List<SpecialHoursEntity> findBetween(@Param("from") LocalDate from, @Param("to") LocalDate to);
}
