package personal.dine.seating.hours.domain.exception;

import personal.dine.common.exception.BusinessException;
import personal.dine.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * Special Hours Not Found Exception
 */
public class SpecialHoursNotFoundException extends BusinessException {
    public SpecialHoursNotFoundException(Long specialHoursId) {
        super(ErrorCode.SPECIAL_HOURS_NOT_FOUND, String.format("Special hours not found: specialHoursId=%d", specialHoursId));
    }

    public SpecialHoursNotFoundException(LocalDate date) {
        super(ErrorCode.SPECIAL_HOURS_NOT_FOUND, String.format("Special hours not found: date=%s", date));
    }
}
