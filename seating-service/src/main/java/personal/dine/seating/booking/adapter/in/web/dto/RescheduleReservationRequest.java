package personal.dine.seating.booking.adapter.in.web.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;
import personal.dine.seating.booking.application.port.in.RescheduleReservationCommand;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 예약 일정 변경 요청 DTO (생략한 필드는 기존 값 유지)
 */
public record RescheduleReservationRequest(
        LocalDate reservationDate,
        LocalTime startTime,

        @Positive(message = "이용 시간은 1분 이상이어야 합니다.")
        @Max(value = 1440, message = "이용 시간은 1440분(24시간) 이하여야 합니다.")
        Integer durationMinutes,

        @Positive(message = "인원수는 1 이상이어야 합니다.")
        Integer partySize
) {
    public RescheduleReservationCommand toCommand(Long reservationId) {
        return new RescheduleReservationCommand(reservationId, reservationDate, startTime, durationMinutes, partySize);
    }
}
