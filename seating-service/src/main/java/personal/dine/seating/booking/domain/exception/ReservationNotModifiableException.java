package personal.dine.seating.booking.domain.exception;

import personal.dine.common.exception.BusinessException;
import personal.dine.common.exception.ErrorCode;

import personal.dine.seating.booking.domain.model.ReservationStatus;

/**
 * Reservation Not Modifiable Exception
 * PENDING/CONFIRMED 이외 상태의 예약 일정을 변경하려 할 때 발생하는 예외
 */
public class ReservationNotModifiableException extends BusinessException {
    public ReservationNotModifiableException(Long reservationId, ReservationStatus status) {
        super(ErrorCode.RESERVATION_NOT_MODIFIABLE,
                String.format("Reservation cannot be rescheduled: reservationId=%d, status=%s", reservationId, status));
    }
}
