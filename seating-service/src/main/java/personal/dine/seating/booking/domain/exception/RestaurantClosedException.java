package personal.dine.seating.booking.domain.exception;

import personal.dine.common.exception.BusinessException;
import personal.dine.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * Restaurant Closed Exception
 * 휴무일이거나 요청 시간이 영업 시간 범위를 벗어날 때 발생하는 예외
 */
public class RestaurantClosedException extends BusinessException {
    public RestaurantClosedException(LocalDate date, String reason) {
        super(ErrorCode.RESTAURANT_CLOSED, String.format("Restaurant closed: date=%s, reason=%s", date, reason));
    }
}
