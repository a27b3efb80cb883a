package personal.dine.seating.customer.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.dine.seating.customer.application.port.in.GetCustomerUseCase;
import personal.dine.seating.customer.application.port.in.RegisterCustomerCommand;
import personal.dine.seating.customer.application.port.in.RegisterCustomerUseCase;
import personal.dine.seating.customer.application.port.out.CustomerRepository;
import personal.dine.seating.customer.domain.exception.CustomerNotFoundException;
import personal.dine.seating.customer.domain.model.Customer;

/**
 * Customer Service
 * 고객 등록/조회
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CustomerService implements RegisterCustomerUseCase, GetCustomerUseCase {

    private final CustomerRepository customerRepository;

    @Override
    @Transactional
    public Customer register(RegisterCustomerCommand command) {
        Customer customer = Customer.register(command.name(), command.email(), command.phone(), command.notes());
        Customer saved = customerRepository.save(customer);
        log.info("Customer registered: customerId={}", saved.id());
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public Customer getCustomer(Long customerId) {
        return customerRepository.findById(customerId)
                .orElseThrow(() -> new CustomerNotFoundException(customerId));
    }

    @Override
    @Transactional(readOnly = true)
    public void validateCustomerExists(Long customerId) {
        if (!customerRepository.existsById(customerId)) {
            log.warn("Customer not found: customerId={}", customerId);
            throw new CustomerNotFoundException(customerId);
        }
    }
}
