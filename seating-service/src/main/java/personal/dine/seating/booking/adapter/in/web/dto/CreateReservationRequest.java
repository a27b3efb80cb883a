package personal.dine.seating.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import personal.dine.seating.booking.application.port.in.CreateReservationCommand;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 예약 생성 요청 DTO
 */
public record CreateReservationRequest(
        @NotNull(message = "고객 ID는 필수입니다.")
        Long customerId,

        @NotNull(message = "인원수는 필수입니다.")
        @Positive(message = "인원수는 1 이상이어야 합니다.")
        Integer partySize,

        @NotNull(message = "예약 날짜는 필수입니다.")
        LocalDate reservationDate,

        @NotNull(message = "시작 시각은 필수입니다.")
        LocalTime startTime,

        @Positive(message = "이용 시간은 1분 이상이어야 합니다.")
        @Max(value = 1440, message = "이용 시간은 1440분(24시간) 이하여야 합니다.")
        Integer durationMinutes,

        @Size(max = 1000, message = "메모는 1000자 이하여야 합니다.")
        String notes
) {
    public CreateReservationCommand toCommand() {
        return new CreateReservationCommand(customerId, partySize, reservationDate, startTime, durationMinutes, notes);
    }
}
