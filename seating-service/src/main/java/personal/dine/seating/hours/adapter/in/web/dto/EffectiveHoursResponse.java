package personal.dine.seating.hours.adapter.in.web.dto;

import personal.dine.seating.hours.domain.model.OperatingWindow;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 특정 날짜의 실제 영업 시간 응답 DTO
 */
public record EffectiveHoursResponse(
        LocalDate date,
        boolean closed,
        LocalTime openTime,
        LocalTime closeTime,
        LocalTime lastReservationTime,
        OperatingWindow.Source source
) {
    public static EffectiveHoursResponse of(LocalDate date, OperatingWindow window) {
        return new EffectiveHoursResponse(
                date,
                window.closed(),
                window.openTime(),
                window.closeTime(),
                window.lastReservationTime(),
                window.source()
        );
    }
}
