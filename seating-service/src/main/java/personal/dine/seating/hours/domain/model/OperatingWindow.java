package personal.dine.seating.hours.domain.model;

import personal.dine.common.exception.BusinessException;
import personal.dine.common.exception.ErrorCode;
import personal.dine.seating.booking.domain.model.TimeSlot;

import java.time.LocalTime;
import java.util.stream.Stream;

/**
 * Effective Operating Window
 * 특정 날짜의 실제 영업 구간 (휴무이면 closed)
 */
public record OperatingWindow(
        boolean closed,
        LocalTime openTime,
        LocalTime closeTime,
        LocalTime lastReservationTime,
        Source source
) {
    /**
     * 영업 시간 결정 근거
     */
    public enum Source {
        SPECIAL,
        WEEKLY,
        /** 요일 영업 시간 미등록 */
        NONE
    }

    public OperatingWindow {
        if (source == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Source cannot be null");
        }
        if (!closed) {
            validateBounds(openTime, closeTime, lastReservationTime);
        }
    }

    public static OperatingWindow open(LocalTime openTime, LocalTime closeTime,
                                       LocalTime lastReservationTime, Source source) {
        return new OperatingWindow(false, openTime, closeTime, lastReservationTime, source);
    }

    public static OperatingWindow closed(Source source) {
        return new OperatingWindow(true, null, null, null, source);
    }

    /**
     * open <= start <= lastReservation && start + duration <= close
     * (open < lastReservation < close 는 생성 시 검증)
     * 자정을 넘기는 구간은 허용하지 않는다
     */
    public boolean admits(TimeSlot slot) {
        if (closed || slot.crossesMidnight()) {
            return false;
        }
        LocalTime start = slot.startTime();
        return !start.isBefore(openTime)
                && !start.isAfter(lastReservationTime)
                && slot.endMinute() <= minuteOfDay(closeTime);
    }

    /**
     * 영업 시작부터 마지막 예약 가능 시각까지 granularity 간격의 시작 시각
     */
    public Stream<LocalTime> startTimes(int granularityMinutes) {
        if (granularityMinutes <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Granularity must be positive: granularityMinutes=%d", granularityMinutes));
        }
        if (closed) {
            return Stream.empty();
        }
        int first = minuteOfDay(openTime);
        int last = minuteOfDay(lastReservationTime);
        return Stream.iterate(first, minute -> minute <= last, minute -> minute + granularityMinutes)
                .map(minute -> LocalTime.of(minute / 60, minute % 60));
    }

    static void validateBounds(LocalTime openTime, LocalTime closeTime, LocalTime lastReservationTime) {
        if (openTime == null || closeTime == null || lastReservationTime == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Open, close and last reservation time are required");
        }
        if (!TimeSlot.isWholeMinute(openTime) || !TimeSlot.isWholeMinute(closeTime)
                || !TimeSlot.isWholeMinute(lastReservationTime)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Operating hours must be on whole minutes: open=%s, close=%s, last=%s",
                            openTime, closeTime, lastReservationTime));
        }
        if (!openTime.isBefore(closeTime)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Open time must be before close time: open=%s, close=%s", openTime, closeTime));
        }
        if (!lastReservationTime.isBefore(closeTime)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Last reservation time must be before close time: last=%s, close=%s",
                            lastReservationTime, closeTime));
        }
        if (!openTime.isBefore(lastReservationTime)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Last reservation time must be after open time: open=%s, last=%s",
                            openTime, lastReservationTime));
        }
    }

    private static int minuteOfDay(LocalTime time) {
        return time.getHour() * 60 + time.getMinute();
    }
}
