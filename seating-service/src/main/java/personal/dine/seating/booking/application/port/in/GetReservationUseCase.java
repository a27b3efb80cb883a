package personal.dine.seating.booking.application.port.in;

import personal.dine.seating.booking.domain.model.ReservationWithTables;

import java.util.List;

/**
 * Get Reservation UseCase (Input Port)
 * 예약 조회 유스케이스
 */
public interface GetReservationUseCase {

    /**
     * @throws personal.dine.seating.booking.domain.exception.ReservationNotFoundException 예약을 찾을 수 없을 때
     */
    ReservationWithTables getReservation(Long reservationId);

    /**
     * 조건에 맞는 예약 목록 (날짜, 시작 시각 순)
     */
    List<ReservationWithTables> listReservations(ReservationSearchCondition condition);
}
