package personal.dine.seating.booking.domain.exception;

import personal.dine.common.exception.BusinessException;
import personal.dine.common.exception.ErrorCode;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * No Table Available Exception
 * 모든 후보 테이블(조합)이 충돌하거나 수용 인원이 맞지 않을 때 발생하는 예외
 */
public class NoTableAvailableException extends BusinessException {
    public NoTableAvailableException(LocalDate date, LocalTime startTime, int partySize) {
        super(ErrorCode.NO_TABLE_AVAILABLE,
                String.format("No table available: date=%s, startTime=%s, partySize=%d", date, startTime, partySize));
    }
}
