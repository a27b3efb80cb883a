package personal.dine.seating.hours.application.port.in;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 특별 영업 시간 등록/수정 커맨드 (closed=true면 시간 필드 무시)
 */
public record SetSpecialHoursCommand(
        LocalDate date,
        String name,
        String description,
        boolean closed,
        LocalTime openTime,
        LocalTime closeTime,
        LocalTime lastReservationTime
) {
}
