package personal.dine.seating.hours.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.dine.common.exception.BusinessException;
import personal.dine.common.exception.ErrorCode;
import personal.dine.seating.hours.application.port.out.SpecialHoursRepository;
import personal.dine.seating.hours.application.port.out.WeeklyHoursRepository;
import personal.dine.seating.hours.domain.model.OperatingWindow;
import personal.dine.seating.hours.domain.model.SpecialHours;
import personal.dine.seating.hours.domain.model.WeeklyHours;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Hours Resolver (Domain Service)
 * 특정 날짜의 실제 영업 구간 결정
 *
 * 1. 해당 날짜의 특별 영업 시간이 있으면 그것이 전부 (휴무 또는 별도 시간)
 * 2. 없으면 요일 영업 시간
 * 3. 요일 영업 시간도 없으면 휴무
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HoursResolver {

    private final WeeklyHoursRepository weeklyHoursRepository;
    private final SpecialHoursRepository specialHoursRepository;

    public OperatingWindow resolve(LocalDate date) {
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Date cannot be null");
        }

        Optional<SpecialHours> special = specialHoursRepository.findByDate(date);
        if (special.isPresent()) {
            log.debug("Special hours applied: date={}, name={}, closed={}",
                    date, special.get().name(), special.get().closed());
            return special.get().toWindow();
        }

        return weeklyHoursRepository.findByDayOfWeek(WeeklyHours.dayIndexOf(date))
                .map(WeeklyHours::toWindow)
                .orElseGet(() -> OperatingWindow.closed(OperatingWindow.Source.NONE));
    }
}
