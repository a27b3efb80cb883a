package personal.dine.seating.booking.application.port.in;

import personal.dine.seating.booking.domain.model.DiningTable;

/**
 * 테이블 목록 필터 (null 필드는 조건 없음)
 */
public record TableSearchCondition(
        Boolean shared,
        String location,
        Integer minSeats
) {
    public static TableSearchCondition none() {
        return new TableSearchCondition(null, null, null);
    }

    public boolean matches(DiningTable table) {
        if (shared != null && table.shared() != shared) {
            return false;
        }
        if (location != null && !location.equalsIgnoreCase(table.location())) {
            return false;
        }
        return minSeats == null || table.maxCapacity() >= minSeats;
    }
}
