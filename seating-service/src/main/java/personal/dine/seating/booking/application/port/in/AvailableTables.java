package personal.dine.seating.booking.application.port.in;

import personal.dine.seating.booking.domain.model.TableCombination;

import java.util.List;

/**
 * 정확한 시각 기준 배정 가능 후보
 *
 * @param validTime  영업 시간 내 요청인지 여부 (false면 candidates는 비어 있음)
 * @param candidates 충돌 없는 후보 (순위 순)
 */
public record AvailableTables(
        boolean validTime,
        List<TableCombination> candidates
) {
    public static AvailableTables invalidTime() {
        return new AvailableTables(false, List.of());
    }
}
