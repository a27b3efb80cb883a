package personal.dine.seating.booking.domain.model;

import personal.dine.common.exception.BusinessException;
import personal.dine.common.exception.ErrorCode;
import personal.dine.seating.booking.domain.exception.InvalidStatusTransitionException;
import personal.dine.seating.booking.domain.exception.ReservationNotModifiableException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Reservation Domain Model
 * 예약 도메인 모델 (불변) - 상태 변경 시 새 인스턴스를 반환
 */
public record Reservation(
        Long id,
        Long customerId,
        int partySize,
        LocalDate reservationDate,
        LocalTime startTime,
        int durationMinutes,
        String notes,
        ReservationStatus status,
        Long version,
        LocalDateTime createdAt
) {
    public Reservation {
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
        if (durationMinutes <= 0 || durationMinutes > TimeSlot.MAX_DURATION_MINUTES) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Duration must be between 1 and %d minutes: durationMinutes=%d",
                            TimeSlot.MAX_DURATION_MINUTES, durationMinutes));
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Status cannot be null");
        }
    }

    /**
     * 신규 예약 생성 (PENDING, 저장 전)
     */
    public static Reservation create(Long customerId, int partySize, LocalDate date,
                                     LocalTime startTime, int durationMinutes, String notes) {
        return new Reservation(null, customerId, partySize, date, startTime, durationMinutes,
                notes, ReservationStatus.PENDING, null, null);
    }

    public TimeSlot slot() {
        return new TimeSlot(startTime, durationMinutes);
    }

    public boolean occupiesTables() {
        return status.occupiesTables();
    }

    /**
     * 상태 전이
     * 허용되지 않는 전이는 InvalidStatusTransitionException
     */
    public Reservation transitionTo(ReservationStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStatusTransitionException(id, status, target);
        }
        return new Reservation(id, customerId, partySize, reservationDate, startTime,
                durationMinutes, notes, target, version, createdAt);
    }

    /**
     * 일정/인원 변경 (PENDING, CONFIRMED 상태에서만 가능)
     */
    public Reservation reschedule(LocalDate newDate, LocalTime newStartTime,
                                  int newDurationMinutes, int newPartySize) {
        if (!status.isReschedulable()) {
            throw new ReservationNotModifiableException(id, status);
        }
        return new Reservation(id, customerId, newPartySize, newDate, newStartTime,
                newDurationMinutes, notes, status, version, createdAt);
    }
}
