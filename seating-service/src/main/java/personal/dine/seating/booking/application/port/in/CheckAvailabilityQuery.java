package personal.dine.seating.booking.application.port.in;

import personal.dine.common.exception.BusinessException;
import personal.dine.common.exception.ErrorCode;
import personal.dine.seating.booking.domain.model.TimeSlot;

import java.time.LocalDate;

/**
 * Check Availability Query
 *
 * @param durationMinutes    null이면 기본 이용 시간
 * @param granularityMinutes null이면 기본 간격
 */
public record CheckAvailabilityQuery(
        LocalDate date,
        int partySize,
        Integer durationMinutes,
        Integer granularityMinutes
) {
    public CheckAvailabilityQuery {
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Date cannot be null");
        }
        if (partySize <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Party size must be positive: partySize=%d", partySize));
        }
        if (durationMinutes != null && (durationMinutes <= 0 || durationMinutes > TimeSlot.MAX_DURATION_MINUTES)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Duration must be between 1 and %d minutes: durationMinutes=%d",
                            TimeSlot.MAX_DURATION_MINUTES, durationMinutes));
        }
        if (granularityMinutes != null && granularityMinutes <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Granularity must be positive: granularityMinutes=%d", granularityMinutes));
        }
    }
}
