package personal.dine.seating.booking.adapter.in.web.dto;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * 예약 가능 시각 응답 DTO (HH:mm)
 */
public record AvailabilitySlotsResponse(
        LocalDate date,
        int partySize,
        List<String> availableSlots
) {
    private static final DateTimeFormatter SLOT_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    public static AvailabilitySlotsResponse of(LocalDate date, int partySize, List<LocalTime> slots) {
        return new AvailabilitySlotsResponse(
                date,
                partySize,
                slots.stream().map(SLOT_FORMAT::format).toList()
        );
    }
}
