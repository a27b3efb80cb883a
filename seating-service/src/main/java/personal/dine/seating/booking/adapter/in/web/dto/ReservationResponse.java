package personal.dine.seating.booking.adapter.in.web.dto;

import personal.dine.seating.booking.domain.model.Reservation;
import personal.dine.seating.booking.domain.model.ReservationStatus;
import personal.dine.seating.booking.domain.model.ReservationWithTables;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

/**
 * 예약 조회/생성 응답 DTO
 */
public record ReservationResponse(
        Long reservationId,
        Long customerId,
        int partySize,
        LocalDate reservationDate,
        LocalTime startTime,
        LocalTime endTime,
        int durationMinutes,
        ReservationStatus status,
        String notes,
        List<TableResponse> tables,
        LocalDateTime createdAt
) {
    public static ReservationResponse from(ReservationWithTables result) {
        Reservation reservation = result.reservation();
        return new ReservationResponse(
                reservation.id(),
                reservation.customerId(),
                reservation.partySize(),
                reservation.reservationDate(),
                reservation.startTime(),
                reservation.startTime().plusMinutes(reservation.durationMinutes()),
                reservation.durationMinutes(),
                reservation.status(),
                reservation.notes(),
                result.tables().stream().map(TableResponse::from).toList(),
                reservation.createdAt()
        );
    }
}
