package personal.dine.seating.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.dine.seating.booking.application.config.SeatingProperties;
import personal.dine.seating.booking.application.config.TableLockProperties;
import personal.dine.seating.booking.application.port.in.CreateReservationCommand;
import personal.dine.seating.booking.application.port.in.CreateReservationUseCase;
import personal.dine.seating.booking.application.port.in.RescheduleReservationCommand;
import personal.dine.seating.booking.application.port.in.RescheduleReservationUseCase;
import personal.dine.seating.booking.application.port.out.ReservationRepository;
import personal.dine.seating.booking.application.port.out.TableLockRepository;
import personal.dine.seating.booking.domain.exception.NoTableAvailableException;
import personal.dine.seating.booking.domain.exception.ReservationNotFoundException;
import personal.dine.seating.booking.domain.exception.RestaurantClosedException;
import personal.dine.seating.booking.domain.model.DiningTable;
import personal.dine.seating.booking.domain.model.Reservation;
import personal.dine.seating.booking.domain.model.ReservationWithTables;
import personal.dine.seating.booking.domain.model.TableCombination;
import personal.dine.seating.booking.domain.service.AllocationManager;
import personal.dine.seating.booking.domain.service.CapacityMatcher;
import personal.dine.seating.booking.domain.service.ConflictChecker;
import personal.dine.seating.customer.application.port.in.GetCustomerUseCase;
import personal.dine.seating.hours.domain.model.OperatingWindow;
import personal.dine.seating.hours.domain.service.HoursResolver;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Table Allocation Service (Allocator)
 * 단일 책임: 예약 요청을 테이블(조합)에 원자적으로 배정
 *
 * 흐름:
 * 1. 입력 검증 (락 획득 전)
 * 2. 영업 시간 확인
 * 3. 후보를 순위대로 시도: 테이블 ID 오름차순으로 락 획득 → 트랜잭션 내 재확인 + 저장 → 락 해제
 * 4. 충돌하거나 락 대기 시간을 넘긴 후보는 건너뛰고, 모두 실패하면 NoTableAvailableException
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TableAllocationService implements CreateReservationUseCase, RescheduleReservationUseCase {

    private final GetCustomerUseCase getCustomerUseCase;
    private final HoursResolver hoursResolver;
    private final CapacityMatcher capacityMatcher;
    private final ConflictChecker conflictChecker;
    private final AllocationManager allocationManager;
    private final ReservationRepository reservationRepository;
    private final TableLockRepository tableLockRepository;
    private final TableLockProperties tableLockProperties;
    private final SeatingProperties seatingProperties;

    @Override
    public ReservationWithTables createAndAssign(CreateReservationCommand command) {
        getCustomerUseCase.validateCustomerExists(command.customerId());

        int duration = command.durationMinutes() != null
                ? command.durationMinutes()
                : seatingProperties.reservation().defaultDurationMinutes();
        Reservation draft = Reservation.create(command.customerId(), command.partySize(),
                command.reservationDate(), command.startTime(), duration, command.notes());

        ReservationWithTables result = allocate(draft);
        log.info("Reservation created: reservationId={}, partySize={}, date={}, startTime={}, tables={}",
                result.reservation().id(), draft.partySize(), draft.reservationDate(),
                draft.startTime(), result.tableIds());
        return result;
    }

    @Override
    public ReservationWithTables reschedule(RescheduleReservationCommand command) {
        Reservation current = reservationRepository.findById(command.reservationId())
                .orElseThrow(() -> new ReservationNotFoundException(command.reservationId()));

        Reservation rescheduled = current.reschedule(
                command.reservationDate() != null ? command.reservationDate() : current.reservationDate(),
                command.startTime() != null ? command.startTime() : current.startTime(),
                command.durationMinutes() != null ? command.durationMinutes() : current.durationMinutes(),
                command.partySize() != null ? command.partySize() : current.partySize());

        ReservationWithTables result = allocate(rescheduled);
        log.info("Reservation rescheduled: reservationId={}, date={}, startTime={}, tables={}",
                current.id(), rescheduled.reservationDate(), rescheduled.startTime(), result.tableIds());
        return result;
    }

    private ReservationWithTables allocate(Reservation reservation) {
        OperatingWindow window = hoursResolver.resolve(reservation.reservationDate());
        if (window.closed()) {
            log.warn("Reservation rejected, closed: date={}", reservation.reservationDate());
            throw new RestaurantClosedException(reservation.reservationDate(), "closed");
        }
        if (!window.admits(reservation.slot())) {
            log.warn("Reservation rejected, outside hours: date={}, slot={}",
                    reservation.reservationDate(), reservation.slot());
            throw new RestaurantClosedException(reservation.reservationDate(),
                    String.format("%s is outside %s-%s (last reservation %s)", reservation.slot(),
                            window.openTime(), window.closeTime(), window.lastReservationTime()));
        }

        // 충돌이 확인된 테이블은 이번 시도에서 다시 고려하지 않는다
        Set<Long> conflicted = new HashSet<>();
        Iterator<TableCombination> candidates = capacityMatcher.candidates(reservation.partySize(), Set.of());

        while (candidates.hasNext()) {
            TableCombination candidate = candidates.next();
            if (candidate.tables().stream().anyMatch(table -> conflicted.contains(table.id()))) {
                continue;
            }

            // 락 없이 먼저 확인하여 이미 점유된 후보의 락 경쟁을 피한다
            Optional<DiningTable> busy = conflictChecker.firstConflicting(
                    candidate, reservation.reservationDate(), reservation.slot(), reservation.id());
            if (busy.isPresent()) {
                conflicted.add(busy.get().id());
                continue;
            }

            Optional<ReservationWithTables> committed = tryCommit(reservation, candidate);
            if (committed.isPresent()) {
                return committed.get();
            }
        }

        log.warn("No table available: date={}, startTime={}, partySize={}",
                reservation.reservationDate(), reservation.startTime(), reservation.partySize());
        throw new NoTableAvailableException(
                reservation.reservationDate(), reservation.startTime(), reservation.partySize());
    }

    /**
     * 후보의 모든 테이블 락을 ID 오름차순으로 획득한 뒤 트랜잭션 실행
     * 일부만 획득한 경우에도 finally에서 획득한 락을 역순으로 해제
     */
    private Optional<ReservationWithTables> tryCommit(Reservation reservation, TableCombination candidate) {
        String owner = UUID.randomUUID().toString();
        Duration wait = Duration.ofMillis(tableLockProperties.getWaitMillis());
        Deque<Long> locked = new ArrayDeque<>();

        try {
            for (Long tableId : candidate.lockOrder()) {
                if (!tableLockRepository.tryLock(tableId, owner, wait)) {
                    log.debug("Candidate skipped, lock timeout: tables={}, tableId={}",
                            candidate.tableNumbers(), tableId);
                    return Optional.empty();
                }
                locked.push(tableId);
            }
            return allocationManager.commitIfFree(reservation, candidate);

        } finally {
            while (!locked.isEmpty()) {
                tableLockRepository.unlock(locked.pop(), owner);
            }
        }
    }
}
