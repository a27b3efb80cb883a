package personal.dine.seating.booking.application.port.in;

import personal.dine.common.exception.BusinessException;
import personal.dine.common.exception.ErrorCode;
import personal.dine.seating.booking.domain.model.TimeSlot;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Find Available Tables Query
 * 정확한 날짜/시각 기준 배정 가능한 후보 조회
 */
public record FindAvailableTablesQuery(
        LocalDate date,
        LocalTime startTime,
        int partySize,
        Integer durationMinutes
) {
    public FindAvailableTablesQuery {
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Date cannot be null");
        }
        if (startTime == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Start time cannot be null");
        }
        if (!TimeSlot.isWholeMinute(startTime)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Start time must be on a whole minute: startTime=%s", startTime));
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
    }
}
