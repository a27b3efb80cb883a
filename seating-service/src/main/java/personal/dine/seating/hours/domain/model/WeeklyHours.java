package personal.dine.seating.hours.domain.model;

import personal.dine.common.exception.BusinessException;
import personal.dine.common.exception.ErrorCode;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Weekly Hours Domain Model
 * 요일별 기본 영업 시간 (0 = 월요일 ... 6 = 일요일)
 */
public record WeeklyHours(
        Long id,
        int dayOfWeek,
        LocalTime openTime,
        LocalTime closeTime,
        LocalTime lastReservationTime
) {
    public WeeklyHours {
        if (dayOfWeek < 0 || dayOfWeek > 6) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Day of week must be between 0 and 6: dayOfWeek=%d", dayOfWeek));
        }
        OperatingWindow.validateBounds(openTime, closeTime, lastReservationTime);
    }

    /**
     * LocalDate의 요일을 0(월)~6(일) 인덱스로 변환
     */
    public static int dayIndexOf(LocalDate date) {
        return date.getDayOfWeek().getValue() - 1;
    }

    public OperatingWindow toWindow() {
        return OperatingWindow.open(openTime, closeTime, lastReservationTime, OperatingWindow.Source.WEEKLY);
    }
}
