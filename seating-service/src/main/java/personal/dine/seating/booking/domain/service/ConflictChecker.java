package personal.dine.seating.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.dine.seating.booking.application.port.out.TableAssignmentRepository;
import personal.dine.seating.booking.domain.model.DiningTable;
import personal.dine.seating.booking.domain.model.OccupancySnapshot;
import personal.dine.seating.booking.domain.model.TableCombination;
import personal.dine.seating.booking.domain.model.TimeSlot;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Conflict Checker (Domain Service)
 * 테이블이 요청 구간에 이미 활성 예약으로 점유되어 있는지 확인
 *
 * [s1, e1) 와 [s2, e2) 는 s1 < e2 && s2 < e1 일 때 충돌
 * PENDING/CONFIRMED/SEATED 예약의 해제되지 않은 배정만 점유로 본다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConflictChecker {

    private final TableAssignmentRepository tableAssignmentRepository;

    /**
     * @param excludingReservationId 일정 변경 시 자기 자신의 배정은 무시 (null 가능)
     */
    public boolean hasConflict(Long tableId, LocalDate date, TimeSlot slot, Long excludingReservationId) {
        boolean conflict = tableAssignmentRepository.findActiveOccupancies(tableId, date).stream()
                .anyMatch(occupancy -> occupancy.blocks(tableId, slot, excludingReservationId));
        if (conflict) {
            log.debug("Table conflict: tableId={}, date={}, slot={}", tableId, date, slot);
        }
        return conflict;
    }

    /**
     * 후보 조합에서 처음으로 충돌하는 테이블
     */
    public Optional<DiningTable> firstConflicting(TableCombination candidate, LocalDate date,
                                                  TimeSlot slot, Long excludingReservationId) {
        return candidate.tables().stream()
                .filter(table -> hasConflict(table.id(), date, slot, excludingReservationId))
                .findFirst();
    }

    /**
     * 조회 전용 경로용 날짜 단위 점유 스냅샷 (락 없음)
     */
    public OccupancySnapshot snapshot(LocalDate date) {
        return new OccupancySnapshot(tableAssignmentRepository.findActiveOccupancies(date));
    }
}
