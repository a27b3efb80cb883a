package personal.dine.seating.booking.application.port.in;

import personal.dine.seating.booking.domain.model.Reservation;
import personal.dine.seating.booking.domain.model.ReservationStatus;

/**
 * Change Reservation Status UseCase (Input Port)
 */
public interface ChangeReservationStatusUseCase {

    /**
     * 예약 상태 변경
     *
     * @throws personal.dine.seating.booking.domain.exception.ReservationNotFoundException 예약을 찾을 수 없을 때
     * @throws personal.dine.seating.booking.domain.exception.InvalidStatusTransitionException 허용되지 않는 전이일 때
     */
    Reservation changeStatus(Long reservationId, ReservationStatus newStatus);
}
