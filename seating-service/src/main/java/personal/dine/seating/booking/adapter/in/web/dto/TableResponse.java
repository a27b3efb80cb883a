package personal.dine.seating.booking.adapter.in.web.dto;

import personal.dine.seating.booking.domain.model.DiningTable;

/**
 * 테이블 응답 DTO
 */
public record TableResponse(
        Long tableId,
        String tableNumber,
        int minCapacity,
        int maxCapacity,
        boolean shared,
        String location
) {
    public static TableResponse from(DiningTable table) {
        return new TableResponse(
                table.id(),
                table.tableNumber(),
                table.minCapacity(),
                table.maxCapacity(),
                table.shared(),
                table.location()
        );
    }
}
