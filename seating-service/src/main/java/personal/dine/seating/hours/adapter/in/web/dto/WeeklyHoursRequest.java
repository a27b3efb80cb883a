package personal.dine.seating.hours.adapter.in.web.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import personal.dine.seating.hours.application.port.in.SetWeeklyHoursCommand;

import java.time.LocalTime;

/**
 * 요일 영업 시간 등록/수정 요청 DTO
 */
public record WeeklyHoursRequest(
        @NotNull(message = "요일은 필수입니다.")
        @Min(value = 0, message = "요일은 0(월)~6(일)입니다.")
        @Max(value = 6, message = "요일은 0(월)~6(일)입니다.")
        Integer dayOfWeek,

        @NotNull(message = "영업 시작 시각은 필수입니다.")
        LocalTime openTime,

        @NotNull(message = "영업 종료 시각은 필수입니다.")
        LocalTime closeTime,

        @NotNull(message = "마지막 예약 시각은 필수입니다.")
        LocalTime lastReservationTime
) {
    public SetWeeklyHoursCommand toCommand() {
        return new SetWeeklyHoursCommand(dayOfWeek, openTime, closeTime, lastReservationTime);
    }
}
