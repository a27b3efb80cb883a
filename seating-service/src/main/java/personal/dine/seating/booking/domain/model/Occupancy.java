package personal.dine.seating.booking.domain.model;

/**
 * 테이블 점유 정보 (활성 예약의 배정 1건)
 */
public record Occupancy(
        Long reservationId,
        Long tableId,
        TimeSlot slot
) {
    public boolean blocks(Long tableId, TimeSlot requested, Long excludingReservationId) {
        if (excludingReservationId != null && excludingReservationId.equals(reservationId)) {
            return false;
        }
        return this.tableId.equals(tableId) && slot.overlaps(requested);
    }
}
