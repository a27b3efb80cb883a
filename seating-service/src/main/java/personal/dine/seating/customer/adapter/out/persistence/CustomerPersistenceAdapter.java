package personal.dine.seating.customer.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.dine.seating.customer.application.port.out.CustomerRepository;
import personal.dine.seating.customer.domain.model.Customer;

import java.util.Optional;

/**
 * Customer Persistence Adapter
 */
@Component
@RequiredArgsConstructor
public class CustomerPersistenceAdapter implements CustomerRepository {

    private final JpaCustomerRepository jpaCustomerRepository;

    @Override
    public Customer save(Customer customer) {
        return jpaCustomerRepository.save(CustomerEntity.fromDomain(customer)).toDomain();
    }

    @Override
    public Optional<Customer> findById(Long customerId) {
        return jpaCustomerRepository.findById(customerId)
                .map(CustomerEntity::toDomain);
    }

    @Override
    public boolean existsById(Long customerId) {
        return jpaCustomerRepository.existsById(customerId);
    }
}
