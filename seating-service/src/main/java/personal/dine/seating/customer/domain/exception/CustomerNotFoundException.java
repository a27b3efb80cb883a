package personal.dine.seating.customer.domain.exception;

import personal.dine.common.exception.BusinessException;
import personal.dine.common.exception.ErrorCode;

/**
 * Customer Not Found Exception
 * 고객을 찾을 수 없을 때 발생하는 예외
 */
public class CustomerNotFoundException extends BusinessException {
    public CustomerNotFoundException(Long customerId) {
        super(ErrorCode.CUSTOMER_NOT_FOUND, String.format("Customer not found: customerId=%d", customerId));
    }
}
