package personal.dine.seating.booking.application.port.in;

import personal.dine.common.exception.BusinessException;
import personal.dine.common.exception.ErrorCode;
import personal.dine.seating.booking.domain.model.ReservationStatus;

import java.time.LocalDate;

/**
 * 예약 목록 검색 조건 (null 필드는 조건 없음)
 *
 * @param dateFrom 이 날짜 이후 (포함)
 * @param dateTo   이 날짜 이전 (포함)
 * @param tableId  해당 테이블에 배정된 적이 있는 예약 (해제된 배정 포함)
 * @param limit    1 ~ 500
 * @param offset   0 이상
 */
public record ReservationSearchCondition(
        LocalDate dateFrom,
        LocalDate dateTo,
        Long tableId,
        Long customerId,
        ReservationStatus status,
        int limit,
        int offset
) {
    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 500;

    public ReservationSearchCondition {
        if (dateFrom != null && dateTo != null && dateFrom.isAfter(dateTo)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Date range is reversed: dateFrom=%s, dateTo=%s", dateFrom, dateTo));
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Limit must be between 1 and %d: limit=%d", MAX_LIMIT, limit));
        }
        if (offset < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Offset must not be negative: offset=%d", offset));
        }
    }

    public static ReservationSearchCondition onDate(LocalDate date, ReservationStatus status) {
        return new ReservationSearchCondition(date, date, null, null, status, DEFAULT_LIMIT, 0);
    }
}
