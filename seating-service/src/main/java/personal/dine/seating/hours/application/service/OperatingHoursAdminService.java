package personal.dine.seating.hours.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.dine.seating.hours.application.port.in.ManageOperatingHoursUseCase;
import personal.dine.seating.hours.application.port.in.SetSpecialHoursCommand;
import personal.dine.seating.hours.application.port.in.SetWeeklyHoursCommand;
import personal.dine.seating.hours.application.port.out.SpecialHoursRepository;
import personal.dine.seating.hours.application.port.out.WeeklyHoursRepository;
import personal.dine.seating.hours.domain.exception.SpecialHoursNotFoundException;
import personal.dine.seating.hours.domain.model.SpecialHours;
import personal.dine.seating.hours.domain.model.WeeklyHours;

/**
 * Operating Hours Admin Service
 * 요일/특별 영업 시간 등록 및 수정 (같은 요일/날짜가 있으면 덮어쓴다)
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class OperatingHoursAdminService implements ManageOperatingHoursUseCase {

    private final WeeklyHoursRepository weeklyHoursRepository;
    private final SpecialHoursRepository specialHoursRepository;

    @Override
    public WeeklyHours setWeeklyHours(SetWeeklyHoursCommand command) {
        Long existingId = weeklyHoursRepository.findByDayOfWeek(command.dayOfWeek())
                .map(WeeklyHours::id)
                .orElse(null);

        WeeklyHours saved = weeklyHoursRepository.save(new WeeklyHours(existingId, command.dayOfWeek(),
                command.openTime(), command.closeTime(), command.lastReservationTime()));
        log.info("Weekly hours saved: dayOfWeek={}, open={}, close={}, lastReservation={}",
                saved.dayOfWeek(), saved.openTime(), saved.closeTime(), saved.lastReservationTime());
        return saved;
    }

    @Override
    public SpecialHours setSpecialHours(SetSpecialHoursCommand command) {
        Long existingId = command.date() == null ? null : specialHoursRepository.findByDate(command.date())
                .map(SpecialHours::id)
                .orElse(null);

        // 휴무일이면 시간 필드는 저장하지 않는다
        SpecialHours specialHours = command.closed()
                ? new SpecialHours(existingId, command.date(), command.name(), command.description(),
                true, null, null, null)
                : new SpecialHours(existingId, command.date(), command.name(), command.description(),
                false, command.openTime(), command.closeTime(), command.lastReservationTime());

        SpecialHours saved = specialHoursRepository.save(specialHours);
        log.info("Special hours saved: date={}, name={}, closed={}", saved.date(), saved.name(), saved.closed());
        return saved;
    }

    @Override
    public void deleteSpecialHours(Long specialHoursId) {
        if (specialHoursRepository.findById(specialHoursId).isEmpty()) {
            throw new SpecialHoursNotFoundException(specialHoursId);
        }
        specialHoursRepository.deleteById(specialHoursId);
        log.info("Special hours deleted: specialHoursId={}", specialHoursId);
    }
}
