package personal.dine.seating.hours.application.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.dine.common.exception.BusinessException;
import personal.dine.common.exception.ErrorCode;
import personal.dine.seating.hours.application.port.in.GetOperatingHoursUseCase;
import personal.dine.seating.hours.application.port.out.SpecialHoursRepository;
import personal.dine.seating.hours.application.port.out.WeeklyHoursRepository;
import personal.dine.seating.hours.domain.exception.SpecialHoursNotFoundException;
import personal.dine.seating.hours.domain.model.OperatingWindow;
import personal.dine.seating.hours.domain.model.SpecialHours;
import personal.dine.seating.hours.domain.model.WeeklyHours;
import personal.dine.seating.hours.domain.service.HoursResolver;

import java.time.LocalDate;
import java.util.List;

/**
 * Operating Hours Query Service
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class OperatingHoursQueryService implements GetOperatingHoursUseCase {

    private final WeeklyHoursRepository weeklyHoursRepository;
    private final SpecialHoursRepository specialHoursRepository;
    private final HoursResolver hoursResolver;

    @Override
    public List<WeeklyHours> getWeeklyHours() {
        return weeklyHoursRepository.findAll();
    }

    @Override
    public List<SpecialHours> getSpecialHours(LocalDate from, LocalDate to) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Invalid date range: from=%s, to=%s", from, to));
        }
        return specialHoursRepository.findBetween(from, to);
    }

    @Override
    public SpecialHours getSpecialHours(LocalDate date) {
        return specialHoursRepository.findByDate(date)
                .orElseThrow(() -> new SpecialHoursNotFoundException(date));
    }

    @Override
    public OperatingWindow getEffectiveHours(LocalDate date) {
        return hoursResolver.resolve(date);
    }
}
