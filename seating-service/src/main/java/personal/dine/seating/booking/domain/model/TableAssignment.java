package personal.dine.seating.booking.domain.model;

import personal.dine.common.exception.BusinessException;
import personal.dine.common.exception.ErrorCode;

import java.time.LocalDateTime;

/**
 * Table Assignment Domain Model
 * 예약-테이블 연결 (조합 배정 시 테이블마다 한 건)
 */
public record TableAssignment(
        Long id,
        Long reservationId,
        Long tableId,
        LocalDateTime releasedAt
) {
    public TableAssignment {
        if (reservationId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Reservation ID cannot be null");
        }
        if (tableId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Table ID cannot be null");
        }
    }

    public static TableAssignment assign(Long reservationId, Long tableId) {
        return new TableAssignment(null, reservationId, tableId, null);
    }

    public boolean isReleased() {
        return releasedAt != null;
    }
}
