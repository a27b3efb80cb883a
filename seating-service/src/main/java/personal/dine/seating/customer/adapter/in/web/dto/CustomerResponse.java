package personal.dine.seating.customer.adapter.in.web.dto;

import personal.dine.seating.customer.domain.model.Customer;

/**
 * 고객 응답 DTO
 */
public record CustomerResponse(
        Long customerId,
        String name,
        String email,
        String phone,
        String notes
) {
    public static CustomerResponse from(Customer customer) {
        return new CustomerResponse(
                customer.id(),
                customer.name(),
                customer.email(),
                customer.phone(),
                customer.notes()
        );
    }
}
