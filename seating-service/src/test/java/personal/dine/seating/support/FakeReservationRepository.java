package personal.dine.seating.support;

import org.springframework.orm.ObjectOptimisticLockingFailureException;
import personal.dine.seating.booking.application.port.in.ReservationSearchCondition;
import personal.dine.seating.booking.application.port.out.ReservationRepository;
import personal.dine.seating.booking.domain.model.Reservation;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 테스트용 인메모리 예약 저장소 (version 검증 포함)
 */
public class FakeReservationRepository implements ReservationRepository {

    private final Map<Long, Reservation> reservations = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private FakeTableAssignmentRepository assignments;

    @Override
    public synchronized Reservation save(Reservation reservation) {
        if (reservation.id() == null) {
            Reservation saved = new Reservation(sequence.incrementAndGet(), reservation.customerId(),
                    reservation.partySize(), reservation.reservationDate(), reservation.startTime(),
                    reservation.durationMinutes(), reservation.notes(), reservation.status(), 0L,
                    LocalDateTime.now());
            reservations.put(saved.id(), saved);
            return saved;
        }

        Reservation current = reservations.get(reservation.id());
        if (current == null || !Objects.equals(current.version(), reservation.version())) {
            throw new ObjectOptimisticLockingFailureException(Reservation.class, reservation.id());
        }
        Reservation saved = new Reservation(reservation.id(), reservation.customerId(), reservation.partySize(),
                reservation.reservationDate(), reservation.startTime(), reservation.durationMinutes(),
                reservation.notes(), reservation.status(), current.version() + 1, current.createdAt());
        reservations.put(saved.id(), saved);
        return saved;
    }

    @Override
    public Optional<Reservation> findById(Long reservationId) {
        return Optional.ofNullable(reservations.get(reservationId));
    }

    @Override
    public List<Reservation> search(ReservationSearchCondition condition) {
        return reservations.values().stream()
                .filter(r -> condition.dateFrom() == null || !r.reservationDate().isBefore(condition.dateFrom()))
                .filter(r -> condition.dateTo() == null || !r.reservationDate().isAfter(condition.dateTo()))
                .filter(r -> condition.customerId() == null || condition.customerId().equals(r.customerId()))
                .filter(r -> condition.status() == null || r.status() == condition.status())
                .filter(r -> condition.tableId() == null || wasAssignedTo(r.id(), condition.tableId()))
                .sorted(Comparator.comparing(Reservation::reservationDate)
                        .thenComparing(Reservation::startTime)
                        .thenComparing(Reservation::id))
                .skip(condition.offset())
                .limit(condition.limit())
                .toList();
    }

    /**
     * 테이블 조건 검색에 사용할 배정 저장소 연결
     */
    public void attachAssignments(FakeTableAssignmentRepository assignments) {
        this.assignments = assignments;
    }

    private boolean wasAssignedTo(Long reservationId, Long tableId) {
        return assignments != null && assignments.findByReservationId(reservationId).stream()
                .anyMatch(assignment -> assignment.tableId().equals(tableId));
    }

    @Override
    public void deleteById(Long reservationId) {
        reservations.remove(reservationId);
    }

    public int count() {
        return reservations.size();
    }
}
