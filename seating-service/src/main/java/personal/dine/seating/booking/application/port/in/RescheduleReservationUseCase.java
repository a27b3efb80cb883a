package personal.dine.seating.booking.application.port.in;

import personal.dine.seating.booking.domain.model.ReservationWithTables;

/**
 * Reschedule Reservation UseCase (Input Port)
 * 예약 일정 변경 및 테이블 재배정 유스케이스
 */
public interface RescheduleReservationUseCase {

    /**
     * 일정 변경
     * 재배정에 실패하면 예약과 기존 배정은 변경되지 않는다
     *
     * @throws personal.dine.seating.booking.domain.exception.ReservationNotFoundException 예약을 찾을 수 없을 때
     * @throws personal.dine.seating.booking.domain.exception.ReservationNotModifiableException PENDING/CONFIRMED가 아닐 때
     * @throws personal.dine.seating.booking.domain.exception.RestaurantClosedException 영업 시간 밖일 때
     * @throws personal.dine.seating.booking.domain.exception.NoTableAvailableException 재배정할 후보가 없을 때
     */
    ReservationWithTables reschedule(RescheduleReservationCommand command);
}
