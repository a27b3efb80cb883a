package personal.dine.seating.booking.domain.model;

import personal.dine.common.exception.BusinessException;
import personal.dine.common.exception.ErrorCode;

import java.util.Comparator;
import java.util.List;

/**
 * Candidate Table Set
 * 단일 테이블 또는 2개 이상의 합석(shared) 테이블 조합
 */
public record TableCombination(List<DiningTable> tables) {

    public TableCombination {
        if (tables == null || tables.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Table combination cannot be empty");
        }
        tables = List.copyOf(tables);
        if (tables.size() > 1 && !tables.stream().allMatch(DiningTable::shared)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Only shared tables can be combined: tables=" + tables.stream().map(DiningTable::tableNumber).toList());
        }
    }

    public static TableCombination single(DiningTable table) {
        return new TableCombination(List.of(table));
    }

    public int size() {
        return tables.size();
    }

    public boolean isCombined() {
        return tables.size() > 1;
    }

    public int totalMinCapacity() {
        return tables.stream().mapToInt(DiningTable::minCapacity).sum();
    }

    public int totalMaxCapacity() {
        return tables.stream().mapToInt(DiningTable::maxCapacity).sum();
    }

    public boolean admits(int partySize) {
        return totalMinCapacity() <= partySize && partySize <= totalMaxCapacity();
    }

    public int excessFor(int partySize) {
        return totalMaxCapacity() - partySize;
    }

    public List<Long> tableIds() {
        return tables.stream().map(DiningTable::id).toList();
    }

    public List<String> tableNumbers() {
        return tables.stream().map(DiningTable::tableNumber).toList();
    }

    public boolean contains(Long tableId) {
        return tables.stream().anyMatch(table -> table.id().equals(tableId));
    }

    /**
     * 락 획득 순서 (테이블 ID 오름차순) - 교착 상태 방지
     */
    public List<Long> lockOrder() {
        return tables.stream().map(DiningTable::id).sorted().toList();
    }

    /**
     * 같은 크기 내 순위: 초과 인원 적은 순 → 테이블 번호 순 → ID 순
     */
    public static Comparator<TableCombination> rankingFor(int partySize) {
        return Comparator.<TableCombination>comparingInt(c -> c.excessFor(partySize))
                .thenComparing(TableCombination::tableNumbers, TableCombination::compareNumberSequences)
                .thenComparing(TableCombination::tableIds, TableCombination::compareIdSequences);
    }

    private static int compareNumberSequences(List<String> a, List<String> b) {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int cmp = DiningTable.TABLE_NUMBER_ORDER.compare(a.get(i), b.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(a.size(), b.size());
    }

    private static int compareIdSequences(List<Long> a, List<Long> b) {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int cmp = Long.compare(a.get(i), b.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(a.size(), b.size());
    }
}
