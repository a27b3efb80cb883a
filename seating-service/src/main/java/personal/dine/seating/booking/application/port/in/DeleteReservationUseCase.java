package personal.dine.seating.booking.application.port.in;

/**
 * Delete Reservation UseCase (Input Port)
 * 예약과 배정을 함께 삭제
 */
public interface DeleteReservationUseCase {

    void deleteReservation(Long reservationId);
}
