package personal.dine.seating.booking.application.port.in;

import personal.dine.common.exception.BusinessException;
import personal.dine.common.exception.ErrorCode;
import personal.dine.seating.booking.domain.model.TimeSlot;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Reschedule Reservation Command
 * 예약 일정/인원 변경 커맨드 - null 필드는 기존 값 유지
 */
public record RescheduleReservationCommand(
        Long reservationId,
        LocalDate reservationDate,
        LocalTime startTime,
        Integer durationMinutes,
        Integer partySize
) {
    public RescheduleReservationCommand {
        if (reservationId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Reservation ID cannot be null");
        }
        if (durationMinutes != null && (durationMinutes <= 0 || durationMinutes > TimeSlot.MAX_DURATION_MINUTES)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Duration must be between 1 and %d minutes: durationMinutes=%d",
                            TimeSlot.MAX_DURATION_MINUTES, durationMinutes));
        }
        if (startTime != null && !TimeSlot.isWholeMinute(startTime)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Start time must be on a whole minute: startTime=%s", startTime));
        }
        if (partySize != null && partySize <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Party size must be positive: partySize=%d", partySize));
        }
    }
}
