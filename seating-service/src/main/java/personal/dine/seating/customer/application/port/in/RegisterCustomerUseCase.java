package personal.dine.seating.customer.application.port.in;

import personal.dine.seating.customer.domain.model.Customer;

/**
 * Register Customer UseCase (Input Port)
 */
public interface RegisterCustomerUseCase {

    Customer register(RegisterCustomerCommand command);
}
