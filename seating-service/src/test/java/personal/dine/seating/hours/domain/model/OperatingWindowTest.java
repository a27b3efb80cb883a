package personal.dine.seating.hours.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.dine.common.exception.BusinessException;
import personal.dine.seating.booking.domain.model.TimeSlot;

import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OperatingWindow 단위 테스트")
class OperatingWindowTest {

    private final OperatingWindow window = OperatingWindow.open(
            LocalTime.of(17, 0), LocalTime.of(22, 0), LocalTime.of(21, 0), OperatingWindow.Source.WEEKLY);

    @Test
    @DisplayName("영업 시간 내 구간 허용")
    void admits_Inside() {
        assertThat(window.admits(new TimeSlot(LocalTime.of(17, 0), 90))).isTrue();
        assertThat(window.admits(new TimeSlot(LocalTime.of(20, 30), 60))).isTrue();
        assertThat(window.admits(new TimeSlot(LocalTime.of(21, 0), 60))).isTrue();
    }

    @Test
    @DisplayName("오픈 전 시작, 마지막 예약 시각 이후 시작, 마감 초과 종료는 거부")
    void admits_Outside() {
        assertThat(window.admits(new TimeSlot(LocalTime.of(16, 45), 60))).isFalse();
        assertThat(window.admits(new TimeSlot(LocalTime.of(21, 15), 30))).isFalse();
        assertThat(window.admits(new TimeSlot(LocalTime.of(21, 0), 90))).isFalse();
    }

    @Test
    @DisplayName("휴무일은 어떤 구간도 거부")
    void admits_Closed() {
        OperatingWindow closed = OperatingWindow.closed(OperatingWindow.Source.SPECIAL);

        assertThat(closed.admits(new TimeSlot(LocalTime.of(18, 0), 60))).isFalse();
        assertThat(closed.startTimes(15)).isEmpty();
    }

    @Test
    @DisplayName("시작 시각은 오픈부터 마지막 예약 시각까지 간격 단위로 생성")
    void startTimes() {
        assertThat(window.startTimes(60))
                .containsExactly(LocalTime.of(17, 0), LocalTime.of(18, 0), LocalTime.of(19, 0),
                        LocalTime.of(20, 0), LocalTime.of(21, 0));
        assertThat(window.startTimes(15)).hasSize(17);
    }

    @Test
    @DisplayName("간격이 0 이하이면 예외")
    void startTimes_InvalidGranularity() {
        assertThatThrownBy(() -> window.startTimes(0))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("Granularity must be positive");
    }

    @Test
    @DisplayName("마지막 예약 시각이 마감 이후이면 생성 불가")
    void create_InvalidBounds() {
        assertThatThrownBy(() -> OperatingWindow.open(LocalTime.of(17, 0), LocalTime.of(22, 0),
                LocalTime.of(22, 30), OperatingWindow.Source.WEEKLY))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("Last reservation time must be before close time");
    }

    @Test
    @DisplayName("마지막 예약 시각이 오픈 시각과 같거나 이르면 생성 불가")
    void create_LastReservationNotAfterOpen() {
        assertThatThrownBy(() -> OperatingWindow.open(LocalTime.of(17, 0), LocalTime.of(22, 0),
                LocalTime.of(17, 0), OperatingWindow.Source.WEEKLY))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("Last reservation time must be after open time");
        assertThatThrownBy(() -> new WeeklyHours(null, 0, LocalTime.of(17, 0), LocalTime.of(22, 0),
                LocalTime.of(16, 30)))
                .isInstanceOf(BusinessException.class);
    }

    @Test
    @DisplayName("초 단위가 있는 영업 시간은 생성 불가")
    void create_SubMinuteBounds() {
        assertThatThrownBy(() -> OperatingWindow.open(LocalTime.of(17, 0, 30), LocalTime.of(22, 0),
                LocalTime.of(21, 0), OperatingWindow.Source.WEEKLY))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("whole minutes");
    }

    @Test
    @DisplayName("하루를 꽉 채운 구간도 영업 시간을 넘으면 거부")
    void admits_FullDayDurationRejected() {
        assertThat(window.admits(new TimeSlot(LocalTime.of(18, 0), TimeSlot.MAX_DURATION_MINUTES))).isFalse();
        assertThat(window.admits(new TimeSlot(LocalTime.of(17, 0), 5 * 60))).isTrue();
        assertThat(window.admits(new TimeSlot(LocalTime.of(17, 0), 5 * 60 + 1))).isFalse();
    }
}
