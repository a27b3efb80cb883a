package personal.dine.seating.booking.domain.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.dine.common.exception.BusinessException;
import personal.dine.common.exception.ErrorCode;
import personal.dine.seating.booking.domain.model.DiningTable;
import personal.dine.seating.booking.domain.model.OccupancySnapshot;
import personal.dine.seating.booking.domain.model.TableCombination;
import personal.dine.seating.booking.domain.model.TimeSlot;
import personal.dine.seating.hours.domain.model.OperatingWindow;
import personal.dine.seating.hours.domain.service.HoursResolver;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Availability Slot Generator (Domain Service)
 * 날짜/인원수 기준 예약 가능한 시작 시각 목록
 *
 * 조회 전용: 락을 잡지 않고 호출 시점의 점유 스냅샷으로 판단한다
 */
@Component
@RequiredArgsConstructor
public class AvailabilitySlotGenerator {

    private final HoursResolver hoursResolver;
    private final CapacityMatcher capacityMatcher;
    private final ConflictChecker conflictChecker;

    public Stream<LocalTime> slots(LocalDate date, int partySize, int granularityMinutes, int durationMinutes) {
        if (partySize <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Party size must be positive: partySize=%d", partySize));
        }
        if (durationMinutes <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Duration must be positive: durationMinutes=%d", durationMinutes));
        }

        OperatingWindow window = hoursResolver.resolve(date);
        if (window.closed()) {
            return window.startTimes(granularityMinutes);
        }

        List<DiningTable> tables = capacityMatcher.loadSeatableTables();
        OccupancySnapshot snapshot = conflictChecker.snapshot(date);

        return window.startTimes(granularityMinutes)
                .filter(start -> {
                    TimeSlot slot = new TimeSlot(start, durationMinutes);
                    return window.admits(slot) && hasFreeCandidate(tables, partySize, slot, snapshot);
                });
    }

    /**
     * 정확한 시각 기준 충돌 없는 후보 조합 목록 (순위 순)
     */
    public List<TableCombination> freeCandidates(LocalDate date, TimeSlot slot, int partySize) {
        OccupancySnapshot snapshot = conflictChecker.snapshot(date);
        List<TableCombination> free = new ArrayList<>();
        Iterator<TableCombination> candidates = capacityMatcher.candidates(partySize, Set.of());
        while (candidates.hasNext()) {
            TableCombination candidate = candidates.next();
            if (snapshot.isFree(candidate, slot, null)) {
                free.add(candidate);
            }
        }
        return free;
    }

    private boolean hasFreeCandidate(List<DiningTable> tables, int partySize,
                                     TimeSlot slot, OccupancySnapshot snapshot) {
        Iterator<TableCombination> candidates = capacityMatcher.candidates(tables, partySize, Set.of());
        while (candidates.hasNext()) {
            if (snapshot.isFree(candidates.next(), slot, null)) {
                return true;
            }
        }
        return false;
    }
}
