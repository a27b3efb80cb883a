package personal.dine.seating.booking.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import personal.dine.common.exception.BusinessException;
import personal.dine.common.exception.ErrorCode;
import personal.dine.seating.booking.application.config.SeatingProperties;
import personal.dine.seating.booking.application.config.TableLockProperties;
import personal.dine.seating.booking.application.port.in.CreateReservationCommand;
import personal.dine.seating.booking.application.port.in.RescheduleReservationCommand;
import personal.dine.seating.booking.application.port.out.TableLockRepository;
import personal.dine.seating.booking.domain.exception.NoTableAvailableException;
import personal.dine.seating.booking.domain.exception.ReservationNotFoundException;
import personal.dine.seating.booking.domain.exception.ReservationNotModifiableException;
import personal.dine.seating.booking.domain.exception.RestaurantClosedException;
import personal.dine.seating.booking.domain.model.DiningTable;
import personal.dine.seating.booking.domain.model.Reservation;
import personal.dine.seating.booking.domain.model.ReservationStatus;
import personal.dine.seating.booking.domain.model.ReservationWithTables;
import personal.dine.seating.booking.domain.model.TableAssignment;
import personal.dine.seating.booking.domain.model.TimeSlot;
import personal.dine.seating.customer.application.port.in.GetCustomerUseCase;
import personal.dine.seating.customer.domain.exception.CustomerNotFoundException;
import personal.dine.seating.hours.domain.model.SpecialHours;
import personal.dine.seating.support.SeatingFixture;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.mock;

@DisplayName("TableAllocationService 단위 테스트")
class TableAllocationServiceTest {

    private static final LocalDate DATE = LocalDate.of(2025, 6, 14);
    private static final Long CUSTOMER_ID = 1L;

    private SeatingFixture fixture;
    private TableAllocationService allocationService;

    @BeforeEach
    void setUp() {
        fixture = new SeatingFixture();
        fixture.hours.openEveryDay(LocalTime.of(17, 0), LocalTime.of(22, 0), LocalTime.of(21, 0));
        allocationService = fixture.allocationService;
    }

    private CreateReservationCommand request(int partySize, LocalTime start, Integer duration) {
        return new CreateReservationCommand(CUSTOMER_ID, partySize, DATE, start, duration, null);
    }

    @Nested
    @DisplayName("예약 생성 및 배정")
    class CreateAndAssign {

        @Test
        @DisplayName("단일 테이블: 18:00 90분 성공 → 19:00 60분 충돌 → 20:30 60분 성공")
        void singleTableTimeline() {
            // given
            DiningTable table = fixture.tables.add("1", 2, 4, false);

            // when
            ReservationWithTables first = allocationService.createAndAssign(request(3, LocalTime.of(18, 0), 90));

            // then
            assertThat(first.reservation().id()).isNotNull();
            assertThat(first.reservation().status()).isEqualTo(ReservationStatus.PENDING);
            assertThat(first.tableIds()).containsExactly(table.id());

            assertThatThrownBy(() -> allocationService.createAndAssign(request(3, LocalTime.of(19, 0), 60)))
                    .isInstanceOf(NoTableAvailableException.class)
                    .hasMessageContaining("startTime=19:00")
                    .hasMessageContaining("partySize=3");

            ReservationWithTables third = allocationService.createAndAssign(request(3, LocalTime.of(20, 30), 60));
            assertThat(third.tableIds()).containsExactly(table.id());
            assertThat(fixture.reservations.count()).isEqualTo(2);
        }

        @Test
        @DisplayName("실패한 시도는 예약과 배정을 남기지 않음")
        void failedAttemptLeavesNothing() {
            // given
            fixture.tables.add("1", 2, 4, false);
            allocationService.createAndAssign(request(3, LocalTime.of(18, 0), 90));

            // when
            assertThatThrownBy(() -> allocationService.createAndAssign(request(2, LocalTime.of(18, 30), 60)))
                    .isInstanceOf(NoTableAvailableException.class);

            // then
            assertThat(fixture.reservations.count()).isEqualTo(1);
            assertThat(fixture.assignments.findAll()).hasSize(1);
        }

        @Test
        @DisplayName("하루를 넘는 이용 시간은 거부되고 같은 테이블의 이후 예약을 막지 않음")
        void durationLongerThanADayRejected() {
            // given
            DiningTable table = fixture.tables.add("1", 2, 4, false);

            // when & then
            assertThatThrownBy(() -> allocationService.createAndAssign(
                    request(3, LocalTime.of(18, 0), Integer.MAX_VALUE - 100)))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.INVALID_INPUT);
            assertThat(fixture.reservations.count()).isZero();

            ReservationWithTables next = allocationService.createAndAssign(request(3, LocalTime.of(18, 30), 60));
            assertThat(next.tableIds()).containsExactly(table.id());
        }

        @Test
        @DisplayName("하루 이내라도 마감을 넘기는 이용 시간은 영업 시간 외로 거부")
        void fullDayDurationOutsideHours() {
            // given
            fixture.tables.add("1", 2, 4, false);

            // when & then
            assertThatThrownBy(() -> allocationService.createAndAssign(
                    request(3, LocalTime.of(18, 0), TimeSlot.MAX_DURATION_MINUTES)))
                    .isInstanceOf(RestaurantClosedException.class);
            assertThat(fixture.reservations.count()).isZero();
        }

        @Test
        @DisplayName("초 단위가 있는 시작 시각은 거부")
        void subMinuteStartRejected() {
            // given
            fixture.tables.add("1", 2, 4, false);

            // when & then
            assertThatThrownBy(() -> allocationService.createAndAssign(request(3, LocalTime.of(18, 0, 59), 90)))
                    .isInstanceOf(BusinessException.class)
                    .hasMessageContaining("whole minute");
            assertThat(fixture.reservations.count()).isZero();
        }

        @Test
        @DisplayName("초과 인원이 가장 적은 테이블부터 배정")
        void bestFitFirst() {
            // given
            DiningTable large = fixture.tables.add("1", 2, 6, false);
            DiningTable snug = fixture.tables.add("2", 2, 4, false);

            // when
            ReservationWithTables first = allocationService.createAndAssign(request(4, LocalTime.of(18, 0), 90));
            ReservationWithTables second = allocationService.createAndAssign(request(4, LocalTime.of(18, 0), 90));

            // then
            assertThat(first.tableIds()).containsExactly(snug.id());
            assertThat(second.tableIds()).containsExactly(large.id());
        }

        @Test
        @DisplayName("단일 테이블로 부족하면 합석 테이블 조합 배정")
        void combinationWhenNoSingleFits() {
            // given
            DiningTable left = fixture.tables.add("7", 1, 4, true);
            DiningTable right = fixture.tables.add("8", 1, 4, true);
            fixture.tables.add("1", 2, 4, false);

            // when
            ReservationWithTables result = allocationService.createAndAssign(request(6, LocalTime.of(19, 0), 90));

            // then
            assertThat(result.tableIds()).containsExactly(left.id(), right.id());
            assertThat(fixture.assignments.findByReservationId(result.reservation().id()))
                    .extracting(TableAssignment::tableId)
                    .containsExactlyInAnyOrder(left.id(), right.id());
        }

        @Test
        @DisplayName("조합 중 한 테이블이 점유되어 있으면 다른 조합으로 배정")
        void combinationSkipsBusyTable() {
            // given
            DiningTable t7 = fixture.tables.add("7", 1, 4, true);
            DiningTable t8 = fixture.tables.add("8", 1, 4, true);
            DiningTable t9 = fixture.tables.add("9", 1, 4, true);
            fixture.seed(DATE, LocalTime.of(19, 0), 90, 2, ReservationStatus.CONFIRMED, t7);

            // when
            ReservationWithTables result = allocationService.createAndAssign(request(6, LocalTime.of(19, 30), 60));

            // then
            assertThat(result.tableIds()).containsExactly(t8.id(), t9.id());
        }

        @Test
        @DisplayName("이용 시간 미지정 시 기본 이용 시간 적용")
        void defaultDuration() {
            // given
            fixture.tables.add("1", 2, 4, false);

            // when
            ReservationWithTables result = allocationService.createAndAssign(request(2, LocalTime.of(18, 0), null));

            // then
            assertThat(result.reservation().durationMinutes())
                    .isEqualTo(SeatingProperties.defaults().reservation().defaultDurationMinutes());
        }

        @Test
        @DisplayName("휴무일 예약은 RestaurantClosedException")
        void closedDay() {
            // given
            fixture.tables.add("1", 2, 4, false);
            fixture.hours.save(new SpecialHours(null, DATE, "임시 휴무", null, true, null, null, null));

            // when & then
            assertThatThrownBy(() -> allocationService.createAndAssign(request(2, LocalTime.of(18, 0), 90)))
                    .isInstanceOf(RestaurantClosedException.class)
                    .hasMessageContaining("reason=closed");
        }

        @Test
        @DisplayName("마지막 예약 시각 이후 또는 마감 초과는 RestaurantClosedException")
        void outsideHours() {
            // given
            fixture.tables.add("1", 2, 4, false);

            // when & then
            assertThatThrownBy(() -> allocationService.createAndAssign(request(2, LocalTime.of(21, 30), 30)))
                    .isInstanceOf(RestaurantClosedException.class);
            assertThatThrownBy(() -> allocationService.createAndAssign(request(2, LocalTime.of(21, 0), 90)))
                    .isInstanceOf(RestaurantClosedException.class);
            assertThatThrownBy(() -> allocationService.createAndAssign(request(2, LocalTime.of(16, 30), 60)))
                    .isInstanceOf(RestaurantClosedException.class);
        }

        @Test
        @DisplayName("수용 가능한 테이블이 없으면 NoTableAvailableException")
        void noCapacity() {
            // given
            fixture.tables.add("1", 2, 4, false);

            // when & then
            assertThatThrownBy(() -> allocationService.createAndAssign(request(12, LocalTime.of(18, 0), 90)))
                    .isInstanceOf(NoTableAvailableException.class);
        }

        @Test
        @DisplayName("존재하지 않는 고객이면 배정하지 않음")
        void unknownCustomer() {
            // given
            fixture.tables.add("1", 2, 4, false);
            GetCustomerUseCase customers = mock(GetCustomerUseCase.class);
            willThrow(new CustomerNotFoundException(CUSTOMER_ID)).given(customers).validateCustomerExists(anyLong());
            TableAllocationService service = serviceWith(customers, fixture.lock);

            // when & then
            assertThatThrownBy(() -> service.createAndAssign(request(2, LocalTime.of(18, 0), 90)))
                    .isInstanceOf(CustomerNotFoundException.class);
            assertThat(fixture.reservations.count()).isZero();
        }

        @Test
        @DisplayName("락 획득에 실패한 후보는 건너뛰고 다음 후보 배정")
        void lockTimeoutSkipsCandidate() {
            // given
            DiningTable contended = fixture.tables.add("1", 2, 4, false);
            DiningTable next = fixture.tables.add("2", 2, 6, false);
            RefusingLock lock = new RefusingLock(contended.id());
            TableAllocationService service = serviceWith(fixture.customers, lock);

            // when
            ReservationWithTables result = service.createAndAssign(request(4, LocalTime.of(18, 0), 90));

            // then
            assertThat(result.tableIds()).containsExactly(next.id());
            assertThat(lock.released).containsExactly(next.id());
        }
    }

    @Nested
    @DisplayName("일정 변경")
    class Reschedule {

        @Test
        @DisplayName("자기 자신과 겹치는 시간으로 변경 가능, 배정 교체")
        void overlapsOwnSlot() {
            // given
            fixture.tables.add("1", 2, 4, false);
            Reservation original = allocationService.createAndAssign(request(3, LocalTime.of(18, 0), 90)).reservation();

            // when
            ReservationWithTables moved = allocationService.reschedule(
                    new RescheduleReservationCommand(original.id(), null, LocalTime.of(18, 30), null, null));

            // then
            assertThat(moved.reservation().startTime()).isEqualTo(LocalTime.of(18, 30));
            assertThat(moved.reservation().durationMinutes()).isEqualTo(90);
            assertThat(moved.reservation().version()).isEqualTo(original.version() + 1);
            assertThat(fixture.assignments.findByReservationId(original.id())).hasSize(1);
            assertThat(fixture.reservations.count()).isEqualTo(1);
        }

        @Test
        @DisplayName("인원 증가 시 더 큰 테이블로 재배정")
        void partySizeIncrease() {
            // given
            DiningTable small = fixture.tables.add("1", 1, 2, false);
            DiningTable large = fixture.tables.add("2", 4, 6, false);
            Reservation original = allocationService.createAndAssign(request(2, LocalTime.of(18, 0), 90)).reservation();

            // when
            ReservationWithTables moved = allocationService.reschedule(
                    new RescheduleReservationCommand(original.id(), null, null, null, 5));

            // then
            assertThat(moved.tableIds()).containsExactly(large.id());
            assertThat(fixture.assignments.findByReservationId(original.id()))
                    .extracting(TableAssignment::tableId)
                    .containsExactly(large.id())
                    .doesNotContain(small.id());
        }

        @Test
        @DisplayName("다른 예약과 충돌하면 기존 일정 유지")
        void conflictKeepsOriginal() {
            // given
            DiningTable table = fixture.tables.add("1", 2, 4, false);
            Reservation original = allocationService.createAndAssign(request(3, LocalTime.of(18, 0), 60)).reservation();
            allocationService.createAndAssign(request(3, LocalTime.of(20, 0), 60));

            // when & then
            assertThatThrownBy(() -> allocationService.reschedule(
                    new RescheduleReservationCommand(original.id(), null, LocalTime.of(19, 30), null, null)))
                    .isInstanceOf(NoTableAvailableException.class);

            Reservation unchanged = fixture.reservations.findById(original.id()).orElseThrow();
            assertThat(unchanged.startTime()).isEqualTo(LocalTime.of(18, 0));
            assertThat(fixture.assignments.findByReservationId(original.id()))
                    .extracting(TableAssignment::tableId)
                    .containsExactly(table.id());
        }

        @Test
        @DisplayName("SEATED 예약은 일정 변경 불가")
        void seatedNotModifiable() {
            // given
            DiningTable table = fixture.tables.add("1", 2, 4, false);
            Reservation seated = fixture.seed(DATE, LocalTime.of(18, 0), 90, 3, ReservationStatus.SEATED, table);

            // when & then
            assertThatThrownBy(() -> allocationService.reschedule(
                    new RescheduleReservationCommand(seated.id(), null, LocalTime.of(19, 0), null, null)))
                    .isInstanceOf(ReservationNotModifiableException.class);
        }

        @Test
        @DisplayName("존재하지 않는 예약")
        void notFound() {
            assertThatThrownBy(() -> allocationService.reschedule(
                    new RescheduleReservationCommand(404L, null, LocalTime.of(19, 0), null, null)))
                    .isInstanceOf(ReservationNotFoundException.class);
        }
    }

    private TableAllocationService serviceWith(GetCustomerUseCase customers, TableLockRepository lock) {
        TableLockProperties lockProperties = new TableLockProperties();
        lockProperties.setWaitMillis(100);
        return new TableAllocationService(customers, fixture.hoursResolver, fixture.capacityMatcher,
                fixture.conflictChecker, fixture.allocationManager, fixture.reservations,
                lock, lockProperties, SeatingProperties.defaults());
    }

    /**
     * 지정한 테이블의 락 획득을 항상 실패시키는 락 저장소
     */
    private static final class RefusingLock implements TableLockRepository {

        private final Long refusedTableId;
        private final List<Long> released = new ArrayList<>();

        private RefusingLock(Long refusedTableId) {
            this.refusedTableId = refusedTableId;
        }

        @Override
        public boolean tryLock(Long tableId, String owner, Duration wait) {
            return !tableId.equals(refusedTableId);
        }

        @Override
        public void unlock(Long tableId, String owner) {
            released.add(tableId);
        }

        @Override
        public String getStrategyName() {
            return "refusing";
        }
    }
}
