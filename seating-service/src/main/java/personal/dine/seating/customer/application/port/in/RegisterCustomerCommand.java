package personal.dine.seating.customer.application.port.in;

/**
 * Register Customer Command
 * 필드 검증은 Customer 도메인 모델이 수행
 */
public record RegisterCustomerCommand(
        String name,
        String email,
        String phone,
        String notes
) {
}
