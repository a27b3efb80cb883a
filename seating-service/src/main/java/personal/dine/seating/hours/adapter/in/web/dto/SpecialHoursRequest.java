package personal.dine.seating.hours.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import personal.dine.seating.hours.application.port.in.SetSpecialHoursCommand;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 특별 영업 시간 등록/수정 요청 DTO
 */
public record SpecialHoursRequest(
        @NotNull(message = "날짜는 필수입니다.")
        LocalDate date,

        @NotBlank(message = "이름은 필수입니다.")
        @Size(max = 100, message = "이름은 100자 이하여야 합니다.")
        String name,

        String description,

        boolean closed,

        LocalTime openTime,
        LocalTime closeTime,
        LocalTime lastReservationTime
) {
    public SetSpecialHoursCommand toCommand() {
        return new SetSpecialHoursCommand(date, name, description, closed, openTime, closeTime, lastReservationTime);
    }
}
