package personal.dine.seating.booking.application.port.in;

import personal.dine.common.exception.BusinessException;
import personal.dine.common.exception.ErrorCode;
import personal.dine.seating.booking.domain.model.TimeSlot;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Create Reservation Command
 * 예약 생성 및 테이블 배정 커맨드
 *
 * @param durationMinutes null이면 기본 이용 시간 적용
 */
public record CreateReservationCommand(
        Long customerId,
        int partySize,
        LocalDate reservationDate,
        LocalTime startTime,
        Integer durationMinutes,
        String notes
) {
    public CreateReservationCommand {
        if (customerId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Customer ID cannot be null");
        }
        if (partySize <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Party size must be positive: partySize=%d", partySize));
        }
        if (reservationDate == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Reservation date cannot be null");
        }
        if (startTime == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Start time cannot be null");
        }
        if (!TimeSlot.isWholeMinute(startTime)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Start time must be on a whole minute: startTime=%s", startTime));
        }
        if (durationMinutes != null && (durationMinutes <= 0 || durationMinutes > TimeSlot.MAX_DURATION_MINUTES)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Duration must be between 1 and %d minutes: durationMinutes=%d",
                            TimeSlot.MAX_DURATION_MINUTES, durationMinutes));
        }
    }
}
