package personal.dine.seating.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.dine.seating.booking.application.port.out.ReservationRepository;
import personal.dine.seating.booking.application.port.out.TableAssignmentRepository;
import personal.dine.seating.booking.domain.model.DiningTable;
import personal.dine.seating.booking.domain.model.Reservation;
import personal.dine.seating.booking.domain.model.ReservationWithTables;
import personal.dine.seating.booking.domain.model.TableAssignment;
import personal.dine.seating.booking.domain.model.TableCombination;

import java.util.List;
import java.util.Optional;

/**
 * Allocation Domain Service (Transaction Manager)
 * 원자적 배정 단계: 테이블 락을 보유한 상태에서 호출된다
 *
 * 트랜잭션 내에서 후보의 모든 테이블을 재확인하고,
 * 충돌이 없을 때만 예약과 배정을 함께 저장 (부분 배정 없음)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AllocationManager {

    private final ConflictChecker conflictChecker;
    private final ReservationRepository reservationRepository;
    private final TableAssignmentRepository tableAssignmentRepository;

    /**
     * 신규 예약 저장 또는 기존 예약 재배정
     *
     * @param reservation 저장할 예약 (id가 있으면 일정 변경)
     * @param candidate   락을 보유한 후보 테이블 조합
     * @return 충돌 시 empty
     */
    @Transactional
    public Optional<ReservationWithTables> commitIfFree(Reservation reservation, TableCombination candidate) {
        Long excluding = reservation.id();

        Optional<DiningTable> conflicting =
                conflictChecker.firstConflicting(candidate, reservation.reservationDate(), reservation.slot(), excluding);
        if (conflicting.isPresent()) {
            log.debug("Candidate lost after lock: tables={}, conflictingTable={}",
                    candidate.tableNumbers(), conflicting.get().tableNumber());
            return Optional.empty();
        }

        // 일정 변경이면 기존 배정을 같은 트랜잭션에서 삭제 후 새로 배정
        if (excluding != null) {
            tableAssignmentRepository.deleteByReservationId(excluding);
        }
        Reservation saved = reservationRepository.save(reservation);

        List<TableAssignment> assignments = candidate.tables().stream()
                .map(table -> TableAssignment.assign(saved.id(), table.id()))
                .toList();
        tableAssignmentRepository.saveAll(assignments);

        return Optional.of(new ReservationWithTables(saved, candidate.tables()));
    }
}
