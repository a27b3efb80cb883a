package personal.dine.seating.booking.domain.model;

import personal.dine.common.exception.BusinessException;
import personal.dine.common.exception.ErrorCode;

import java.time.LocalTime;

/**
 * Occupancy Window
 * 예약이 테이블을 점유하는 구간 [start, start + duration) - 하루 기준 분 단위로 계산
 */
public record TimeSlot(
        LocalTime startTime,
        int durationMinutes
) {
    private static final int MINUTES_PER_DAY = 24 * 60;

    /**
     * 하루를 넘는 점유 구간은 어떤 영업 시간에도 들어갈 수 없다
     */
    public static final int MAX_DURATION_MINUTES = MINUTES_PER_DAY;

    public TimeSlot {
        if (startTime == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Start time cannot be null");
        }
        if (!isWholeMinute(startTime)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Start time must be on a whole minute: startTime=%s", startTime));
        }
        if (durationMinutes <= 0 || durationMinutes > MAX_DURATION_MINUTES) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Duration must be between 1 and %d minutes: durationMinutes=%d",
                            MAX_DURATION_MINUTES, durationMinutes));
        }
    }

    /**
     * 초/나노초가 0인 시각만 분 단위 계산에 사용할 수 있다
     */
    public static boolean isWholeMinute(LocalTime time) {
        return time.getSecond() == 0 && time.getNano() == 0;
    }

    public int startMinute() {
        return startTime.getHour() * 60 + startTime.getMinute();
    }

    /**
     * 자정을 넘기면 1440 이상의 값이 된다
     */
    public int endMinute() {
        return startMinute() + durationMinutes;
    }

    public boolean crossesMidnight() {
        return endMinute() > MINUTES_PER_DAY;
    }

    /**
     * 반열린 구간 겹침: s1 < e2 && s2 < e1
     */
    public boolean overlaps(TimeSlot other) {
        return startMinute() < other.endMinute() && other.startMinute() < endMinute();
    }

    @Override
    public String toString() {
        return String.format("[%s, +%dmin)", startTime, durationMinutes);
    }
}
