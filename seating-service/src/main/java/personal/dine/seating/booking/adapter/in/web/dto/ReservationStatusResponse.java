package personal.dine.seating.booking.adapter.in.web.dto;

import personal.dine.seating.booking.domain.model.Reservation;
import personal.dine.seating.booking.domain.model.ReservationStatus;

/**
 * 예약 상태 변경 응답 DTO
 */
public record ReservationStatusResponse(
        Long reservationId,
        ReservationStatus status
) {
    public static ReservationStatusResponse from(Reservation reservation) {
        return new ReservationStatusResponse(reservation.id(), reservation.status());
    }
}
