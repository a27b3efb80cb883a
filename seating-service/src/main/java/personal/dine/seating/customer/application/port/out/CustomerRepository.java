package personal.dine.seating.customer.application.port.out;

import personal.dine.seating.customer.domain.model.Customer;

import java.util.Optional;

/**
 * Customer Repository (Output Port)
 */
public interface CustomerRepository {

    Customer save(Customer customer);

    Optional<Customer> findById(Long customerId);

    boolean existsById(Long customerId);
}
