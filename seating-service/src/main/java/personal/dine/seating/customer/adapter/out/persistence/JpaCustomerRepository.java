package personal.dine.seating.customer.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Spring Data JPA Repository for Customer
 */
public interface JpaCustomerRepository extends JpaRepository<CustomerEntity, Long> {
}
