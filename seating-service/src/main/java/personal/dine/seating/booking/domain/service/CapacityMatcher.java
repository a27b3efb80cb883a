package personal.dine.seating.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.dine.common.exception.BusinessException;
import personal.dine.common.exception.ErrorCode;
import personal.dine.seating.booking.application.config.SeatingProperties;
import personal.dine.seating.booking.application.port.out.TableRepository;
import personal.dine.seating.booking.domain.model.CapacitySource;
import personal.dine.seating.booking.domain.model.DiningTable;
import personal.dine.seating.booking.domain.model.TableCombination;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * Capacity Matcher (Domain Service)
 * 인원수에 맞는 후보 테이블(조합)을 순위대로 지연 생성
 *
 * 순위:
 * 1. 단일 테이블 (min <= party <= max), 초과 인원 적은 순 → 테이블 번호 순
 * 2. 합석 테이블 조합 (2개 ~ maxCombinationSize), 테이블 수 적은 순 → 초과 인원 적은 순 → 테이블 번호 순
 *    조합 조건: Σmin <= party <= Σmax, Σmax - party <= maxExcessCapacity
 *
 * 다음 크기의 조합은 이전 크기를 모두 소비한 뒤에야 계산한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CapacityMatcher {

    private final TableRepository tableRepository;
    private final SeatingProperties seatingProperties;

    /**
     * 배정 대상 테이블 목록 (수용 인원 산정 기준 적용)
     */
    public List<DiningTable> loadSeatableTables() {
        List<DiningTable> tables = tableRepository.findAll();
        if (seatingProperties.matching().capacitySource() != CapacitySource.CHAIRS) {
            return tables;
        }

        Map<Long, Long> chairs = tableRepository.countAssignedChairsByTable();
        return tables.stream()
                .map(table -> table.withSeatsLimitedTo(chairs.getOrDefault(table.id(), 0L)))
                .filter(Objects::nonNull)
                .toList();
    }

    public Iterator<TableCombination> candidates(int partySize, Set<Long> exclude) {
        return candidates(loadSeatableTables(), partySize, exclude);
    }

    public Iterator<TableCombination> candidates(List<DiningTable> tables, int partySize, Set<Long> exclude) {
        if (partySize <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Party size must be positive: partySize=%d", partySize));
        }
        Set<Long> excluded = exclude == null ? Set.of() : exclude;
        List<DiningTable> pool = tables.stream()
                .filter(table -> !excluded.contains(table.id()))
                .sorted(DiningTable.DISPLAY_ORDER)
                .toList();
        return new CandidateIterator(pool, partySize);
    }

    private int maxCombinationSize() {
        return Math.max(1, seatingProperties.matching().maxCombinationSize());
    }

    private boolean withinExcessLimit(TableCombination combination, int partySize) {
        int limit = seatingProperties.matching().maxExcessCapacity();
        return limit < 0 || combination.excessFor(partySize) <= limit;
    }

    /**
     * 크기별로 순위가 매겨진 후보 목록을 차례로 펼치는 Iterator
     */
    private final class CandidateIterator implements Iterator<TableCombination> {

        private final List<DiningTable> pool;
        private final int partySize;
        private Iterator<TableCombination> current = Collections.emptyIterator();
        private int nextSize = 1;

        private CandidateIterator(List<DiningTable> pool, int partySize) {
            this.pool = pool;
            this.partySize = partySize;
        }

        @Override
        public boolean hasNext() {
            while (!current.hasNext() && nextSize <= maxCombinationSize()) {
                current = rank(nextSize++).iterator();
            }
            return current.hasNext();
        }

        @Override
        public TableCombination next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return current.next();
        }

        private List<TableCombination> rank(int size) {
            List<TableCombination> ranked = size == 1 ? singles() : combinations(size);
            ranked.sort(TableCombination.rankingFor(partySize));
            log.debug("Candidates ranked: size={}, partySize={}, count={}", size, partySize, ranked.size());
            return ranked;
        }

        private List<TableCombination> singles() {
            List<TableCombination> singles = new ArrayList<>();
            for (DiningTable table : pool) {
                if (table.seats(partySize)) {
                    singles.add(TableCombination.single(table));
                }
            }
            return singles;
        }

        private List<TableCombination> combinations(int size) {
            List<DiningTable> shared = pool.stream().filter(DiningTable::shared).toList();
            List<TableCombination> result = new ArrayList<>();
            collect(shared, size, 0, new ArrayList<>(), 0, result);
            return result;
        }

        private void collect(List<DiningTable> shared, int size, int from,
                             List<DiningTable> picked, int minSum, List<TableCombination> result) {
            if (picked.size() == size) {
                TableCombination combination = new TableCombination(picked);
                if (combination.admits(partySize) && withinExcessLimit(combination, partySize)) {
                    result.add(combination);
                }
                return;
            }
            for (int i = from; i <= shared.size() - (size - picked.size()); i++) {
                DiningTable table = shared.get(i);
                // 최소 인원 합이 이미 인원수를 넘으면 더 추가해도 만족할 수 없다
                if (minSum + table.minCapacity() > partySize) {
                    continue;
                }
                picked.add(table);
                collect(shared, size, i + 1, picked, minSum + table.minCapacity(), result);
                picked.remove(picked.size() - 1);
            }
        }
    }
}
