package personal.dine.seating.booking.application.port.in;

import personal.dine.seating.booking.domain.model.Reservation;

/**
 * Cancel Reservation UseCase (Input Port)
 * 예약 취소 (CANCELLED 상태 전이) - 배정된 테이블 즉시 해제
 */
public interface CancelReservationUseCase {

    Reservation cancel(Long reservationId);
}
