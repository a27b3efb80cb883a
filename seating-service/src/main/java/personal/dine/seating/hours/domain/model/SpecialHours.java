package personal.dine.seating.hours.domain.model;

import personal.dine.common.exception.BusinessException;
import personal.dine.common.exception.ErrorCode;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Special Hours Domain Model
 * 특정 날짜의 영업 시간 (휴무 또는 별도 시간) - 해당 날짜의 요일 영업 시간을 완전히 대체
 */
public record SpecialHours(
        Long id,
        LocalDate date,
        String name,
        String description,
        boolean closed,
        LocalTime openTime,
        LocalTime closeTime,
        LocalTime lastReservationTime
) {
    public SpecialHours {
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Special hours date cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Special hours name cannot be null or blank");
        }
        if (name.length() > 100) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Special hours name too long");
        }
        if (!closed) {
            OperatingWindow.validateBounds(openTime, closeTime, lastReservationTime);
        }
    }

    public OperatingWindow toWindow() {
        if (closed) {
            return OperatingWindow.closed(OperatingWindow.Source.SPECIAL);
        }
        return OperatingWindow.open(openTime, closeTime, lastReservationTime, OperatingWindow.Source.SPECIAL);
    }
}
