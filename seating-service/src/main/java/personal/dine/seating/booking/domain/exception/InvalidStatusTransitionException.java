package personal.dine.seating.booking.domain.exception;

import personal.dine.common.exception.BusinessException;
import personal.dine.common.exception.ErrorCode;

import personal.dine.seating.booking.domain.model.ReservationStatus;

/**
 * Invalid Status Transition Exception
 * 허용되지 않는 예약 상태 전이 시 발생하는 예외
 */
public class InvalidStatusTransitionException extends BusinessException {
    public InvalidStatusTransitionException(Long reservationId, ReservationStatus from, ReservationStatus to) {
        super(ErrorCode.INVALID_STATUS_TRANSITION,
                String.format("Invalid status transition: reservationId=%d, from=%s, to=%s", reservationId, from, to));
    }
}
