package personal.dine.seating.customer.application.port.in;

import personal.dine.seating.customer.domain.model.Customer;

/**
 * Get Customer UseCase (Input Port)
 */
public interface GetCustomerUseCase {

    /**
     * @throws personal.dine.seating.customer.domain.exception.CustomerNotFoundException 고객을 찾을 수 없을 때
     */
    Customer getCustomer(Long customerId);

    /**
     * 고객 존재 여부 검증 (예약 생성 전)
     *
     * @throws personal.dine.seating.customer.domain.exception.CustomerNotFoundException 고객을 찾을 수 없을 때
     */
    void validateCustomerExists(Long customerId);
}
