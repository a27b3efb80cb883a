package personal.dine.seating.booking.domain.model;

import java.util.List;

/**
 * 예약과 배정된 테이블 목록
 */
public record ReservationWithTables(
        Reservation reservation,
        List<DiningTable> tables
) {
    public ReservationWithTables {
        tables = tables == null ? List.of() : tables.stream().sorted(DiningTable.DISPLAY_ORDER).toList();
    }

    public List<Long> tableIds() {
        return tables.stream().map(DiningTable::id).toList();
    }
}
