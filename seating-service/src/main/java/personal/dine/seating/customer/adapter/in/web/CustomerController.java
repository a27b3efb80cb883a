package personal.dine.seating.customer.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.dine.seating.customer.adapter.in.web.dto.CustomerResponse;
import personal.dine.seating.customer.adapter.in.web.dto.RegisterCustomerRequest;
import personal.dine.seating.customer.application.port.in.GetCustomerUseCase;
import personal.dine.seating.customer.application.port.in.RegisterCustomerUseCase;

/**
 * Customer API Controller
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/customers")
@RequiredArgsConstructor
public class CustomerController {

    private final RegisterCustomerUseCase registerCustomerUseCase;
    private final GetCustomerUseCase getCustomerUseCase;

    @PostMapping
    public ResponseEntity<CustomerResponse> registerCustomer(@Valid @RequestBody RegisterCustomerRequest request) {
        log.info("Register customer: name={}", request.name());

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(CustomerResponse.from(registerCustomerUseCase.register(request.toCommand())));
    }

    @GetMapping("/{customerId}")
    public ResponseEntity<CustomerResponse> getCustomer(@PathVariable Long customerId) {
        log.info("Get customer: customerId={}", customerId);

        return ResponseEntity.ok(CustomerResponse.from(getCustomerUseCase.getCustomer(customerId)));
    }
}
