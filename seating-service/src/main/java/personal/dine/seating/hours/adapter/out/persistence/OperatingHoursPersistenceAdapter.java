package personal.dine.seating.hours.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.dine.seating.hours.application.port.out.SpecialHoursRepository;
import personal.dine.seating.hours.application.port.out.WeeklyHoursRepository;
import personal.dine.seating.hours.domain.model.SpecialHours;
import personal.dine.seating.hours.domain.model.WeeklyHours;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Operating Hours Persistence Adapter
 * JPA를 사용한 요일/특별 영업 시간 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OperatingHoursPersistenceAdapter implements WeeklyHoursRepository, SpecialHoursRepository {

    private final JpaWeeklyHoursRepository jpaWeeklyHoursRepository;
    private final JpaSpecialHoursRepository jpaSpecialHoursRepository;

    @Override
    public Optional<WeeklyHours> findByDayOfWeek(int dayOfWeek) {
        return jpaWeeklyHoursRepository.findByDayOfWeek(dayOfWeek)
                .map(WeeklyHoursEntity::toDomain);
    }

    @Override
    public List<WeeklyHours> findAll() {
        return jpaWeeklyHoursRepository.findAllByOrderByDayOfWeekAsc().stream()
                .map(WeeklyHoursEntity::toDomain)
                .toList();
    }

    @Override
    public WeeklyHours save(WeeklyHours weeklyHours) {
        WeeklyHoursEntity entity = jpaWeeklyHoursRepository.findByDayOfWeek(weeklyHours.dayOfWeek())
                .orElseGet(() -> WeeklyHoursEntity.fromDomain(weeklyHours));
        entity.apply(weeklyHours);
        return jpaWeeklyHoursRepository.save(entity).toDomain();
    }

    @Override
    public Optional<SpecialHours> findByDate(LocalDate date) {
        return jpaSpecialHoursRepository.findByDate(date)
                .map(SpecialHoursEntity::toDomain);
    }

    @Override
    public Optional<SpecialHours> findById(Long specialHoursId) {
        return jpaSpecialHoursRepository.findById(specialHoursId)
                .map(SpecialHoursEntity::toDomain);
    }

    @Override
    public List<SpecialHours> findBetween(LocalDate from, LocalDate to) {
        return jpaSpecialHoursRepository.findBetween(from, to).stream()
                .map(SpecialHoursEntity::toDomain)
                .toList();
    }

    @Override
    public SpecialHours save(SpecialHours specialHours) {
        SpecialHoursEntity entity = jpaSpecialHoursRepository.findByDate(specialHours.date())
                .orElseGet(() -> SpecialHoursEntity.fromDomain(specialHours));
        entity.apply(specialHours);
        log.debug("Saving special hours: date={}, closed={}", specialHours.date(), specialHours.closed());
        return jpaSpecialHoursRepository.save(entity).toDomain();
    }

    @Override
    public void deleteById(Long specialHoursId) {
        jpaSpecialHoursRepository.deleteById(specialHoursId);
    }
}
