package personal.dine.seating.hours.adapter.in.web.dto;

import personal.dine.seating.hours.domain.model.WeeklyHours;

import java.time.DayOfWeek;
import java.time.LocalTime;

/**
 * 요일 영업 시간 응답 DTO
 */
public record WeeklyHoursResponse(
        int dayOfWeek,
        DayOfWeek dayName,
        LocalTime openTime,
        LocalTime closeTime,
        LocalTime lastReservationTime
) {
    public static WeeklyHoursResponse from(WeeklyHours hours) {
        return new WeeklyHoursResponse(
                hours.dayOfWeek(),
                DayOfWeek.of(hours.dayOfWeek() + 1),
                hours.openTime(),
                hours.closeTime(),
                hours.lastReservationTime()
        );
    }
}
