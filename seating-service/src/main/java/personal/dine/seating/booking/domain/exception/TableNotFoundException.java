package personal.dine.seating.booking.domain.exception;

import personal.dine.common.exception.BusinessException;
import personal.dine.common.exception.ErrorCode;

/**
 * Table Not Found Exception
 * 테이블을 찾을 수 없을 때 발생하는 예외
 */
public class TableNotFoundException extends BusinessException {
    public TableNotFoundException(Long tableId) {
        super(ErrorCode.TABLE_NOT_FOUND, String.format("Table not found: tableId=%d", tableId));
    }
}
