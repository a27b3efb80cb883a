package personal.dine.seating.hours.adapter.in.web.dto;

import personal.dine.seating.hours.domain.model.SpecialHours;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 특별 영업 시간 응답 DTO
 */
public record SpecialHoursResponse(
        Long specialHoursId,
        LocalDate date,
        String name,
        String description,
        boolean closed,
        LocalTime openTime,
        LocalTime closeTime,
        LocalTime lastReservationTime
) {
    public static SpecialHoursResponse from(SpecialHours hours) {
        return new SpecialHoursResponse(
                hours.id(),
                hours.date(),
                hours.name(),
                hours.description(),
                hours.closed(),
                hours.openTime(),
                hours.closeTime(),
                hours.lastReservationTime()
        );
    }
}
