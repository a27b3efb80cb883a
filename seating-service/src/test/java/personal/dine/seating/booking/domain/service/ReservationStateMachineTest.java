package personal.dine.seating.booking.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.dine.seating.booking.application.port.in.CreateReservationCommand;
import personal.dine.seating.booking.domain.exception.InvalidStatusTransitionException;
import personal.dine.seating.booking.domain.exception.NoTableAvailableException;
import personal.dine.seating.booking.domain.exception.ReservationNotFoundException;
import personal.dine.seating.booking.domain.model.DiningTable;
import personal.dine.seating.booking.domain.model.Reservation;
import personal.dine.seating.booking.domain.model.ReservationStatus;
import personal.dine.seating.booking.domain.model.ReservationWithTables;
import personal.dine.seating.booking.domain.model.TableAssignment;
import personal.dine.seating.booking.domain.model.TimeSlot;
import personal.dine.seating.support.SeatingFixture;

import java.time.LocalDate;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ReservationStateMachine 단위 테스트")
class ReservationStateMachineTest {

    private static final LocalDate DATE = LocalDate.of(2025, 6, 14);
    private static final TimeSlot SAME_SLOT = new TimeSlot(LocalTime.of(18, 0), 90);

    private SeatingFixture fixture;
    private ReservationStateMachine stateMachine;
    private DiningTable table;

    @BeforeEach
    void setUp() {
        fixture = new SeatingFixture();
        stateMachine = fixture.stateMachine;
        table = fixture.tables.add("1", 2, 4, false);
        fixture.hours.openEveryDay(LocalTime.of(17, 0), LocalTime.of(22, 0), LocalTime.of(21, 0));
    }

    private ReservationWithTables allocateSameWindow() {
        return fixture.allocationService.createAndAssign(
                new CreateReservationCommand(2L, 3, DATE, LocalTime.of(18, 30), 60, null));
    }

    @Test
    @DisplayName("PENDING → CONFIRMED → SEATED → COMPLETED")
    void transition_HappyPath() {
        // given
        Reservation reservation = fixture.seed(DATE, LocalTime.of(18, 0), 90, 3, ReservationStatus.PENDING, table);

        // when
        stateMachine.transition(reservation.id(), ReservationStatus.CONFIRMED);
        stateMachine.transition(reservation.id(), ReservationStatus.SEATED);
        Reservation completed = stateMachine.transition(reservation.id(), ReservationStatus.COMPLETED);

        // then
        assertThat(completed.status()).isEqualTo(ReservationStatus.COMPLETED);
        assertThat(completed.version()).isEqualTo(3L);
        assertThat(fixture.assignments.findByReservationId(reservation.id()))
                .allSatisfy(assignment -> assertThat(assignment.isReleased()).isFalse());
        assertThat(fixture.conflictChecker.hasConflict(table.id(), DATE, SAME_SLOT, null)).isFalse();
    }

    @Test
    @DisplayName("취소 시 배정 해제되어 같은 시간대 재배정 가능")
    void transition_CancelReleasesTables() {
        // given
        Reservation reservation = fixture.seed(DATE, LocalTime.of(18, 0), 90, 3, ReservationStatus.CONFIRMED, table);
        assertThatThrownBy(this::allocateSameWindow).isInstanceOf(NoTableAvailableException.class);

        // when
        Reservation cancelled = stateMachine.transition(reservation.id(), ReservationStatus.CANCELLED);

        // then
        assertThat(cancelled.status()).isEqualTo(ReservationStatus.CANCELLED);
        assertThat(fixture.assignments.findByReservationId(reservation.id()))
                .extracting(TableAssignment::isReleased)
                .containsOnly(true);
        assertThat(fixture.conflictChecker.hasConflict(table.id(), DATE, SAME_SLOT, null)).isFalse();
        assertThat(allocateSameWindow().tableIds()).containsExactly(table.id());
    }

    @Test
    @DisplayName("노쇼 시 배정 해제되어 같은 테이블, 같은 시간대 재배정 가능")
    void transition_NoShowReleasesTables() {
        // given
        Reservation reservation = fixture.seed(DATE, LocalTime.of(18, 0), 90, 3, ReservationStatus.SEATED, table);
        assertThatThrownBy(this::allocateSameWindow).isInstanceOf(NoTableAvailableException.class);

        // when
        stateMachine.transition(reservation.id(), ReservationStatus.NO_SHOW);

        // then
        assertThat(fixture.assignments.findByReservationId(reservation.id()))
                .extracting(TableAssignment::isReleased)
                .containsOnly(true);
        ReservationWithTables reallocated = allocateSameWindow();
        assertThat(reallocated.tableIds()).containsExactly(table.id());
        assertThat(fixture.conflictChecker.hasConflict(table.id(), DATE, SAME_SLOT, null)).isTrue();
    }

    @Test
    @DisplayName("완료된 예약의 테이블은 배정 이력을 남긴 채 재배정 가능")
    void transition_CompletedFreesTableForAllocation() {
        // given
        Reservation reservation = fixture.seed(DATE, LocalTime.of(18, 0), 90, 3, ReservationStatus.SEATED, table);

        // when
        stateMachine.transition(reservation.id(), ReservationStatus.COMPLETED);

        // then
        assertThat(allocateSameWindow().tableIds()).containsExactly(table.id());
        assertThat(fixture.assignments.findByReservationId(reservation.id())).hasSize(1);
    }

    @Test
    @DisplayName("COMPLETED 예약을 CONFIRMED로 변경하면 예외, 상태 변경 없음")
    void transition_CompletedToConfirmed() {
        // given
        Reservation reservation = fixture.seed(DATE, LocalTime.of(18, 0), 90, 3, ReservationStatus.COMPLETED, table);

        // when & then
        assertThatThrownBy(() -> stateMachine.transition(reservation.id(), ReservationStatus.CONFIRMED))
                .isInstanceOf(InvalidStatusTransitionException.class)
                .hasMessageContaining("Invalid status transition");

        Reservation unchanged = fixture.reservations.findById(reservation.id()).orElseThrow();
        assertThat(unchanged.status()).isEqualTo(ReservationStatus.COMPLETED);
        assertThat(unchanged.version()).isEqualTo(reservation.version());
    }

    @Test
    @DisplayName("존재하지 않는 예약")
    void transition_NotFound() {
        assertThatThrownBy(() -> stateMachine.transition(999L, ReservationStatus.CONFIRMED))
                .isInstanceOf(ReservationNotFoundException.class)
                .hasMessageContaining("reservationId=999");
    }
}
