package personal.dine.seating.booking.adapter.out.persistence;

import personal.dine.seating.booking.domain.model.Occupancy;
import personal.dine.seating.booking.domain.model.TimeSlot;

import java.time.LocalTime;

/**
 * Occupancy Query DTO (Read-Only Projection)
 * 배정과 예약을 조인한 점유 조회 전용 DTO - 겹침 판단에 필요한 필드만 포함
 */
public record OccupancyRow(
        Long reservationId,
        Long tableId,
        LocalTime startTime,
        int durationMinutes
) {
    public Occupancy toDomain() {
        return new Occupancy(reservationId, tableId, new TimeSlot(startTime, durationMinutes));
    }
}
