package personal.dine.seating.hours.application.port.in;

import java.time.LocalTime;

/**
 * 요일 영업 시간 등록/수정 커맨드 (dayOfWeek: 0 = 월요일)
 */
public record SetWeeklyHoursCommand(
        int dayOfWeek,
        LocalTime openTime,
        LocalTime closeTime,
        LocalTime lastReservationTime
) {
}
