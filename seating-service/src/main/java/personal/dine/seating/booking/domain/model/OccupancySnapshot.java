package personal.dine.seating.booking.domain.model;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 특정 날짜의 테이블 점유 스냅샷 (조회 전용 경로에서 사용)
 */
public final class OccupancySnapshot {

    private final Map<Long, List<Occupancy>> byTable;

    public OccupancySnapshot(List<Occupancy> occupancies) {
        this.byTable = occupancies.stream()
                .collect(Collectors.groupingBy(Occupancy::tableId));
    }

    public boolean isFree(Long tableId, TimeSlot slot, Long excludingReservationId) {
        return byTable.getOrDefault(tableId, List.of()).stream()
                .noneMatch(occupancy -> occupancy.blocks(tableId, slot, excludingReservationId));
    }

    public boolean isFree(TableCombination candidate, TimeSlot slot, Long excludingReservationId) {
        return candidate.tables().stream()
                .allMatch(table -> isFree(table.id(), slot, excludingReservationId));
    }
}
