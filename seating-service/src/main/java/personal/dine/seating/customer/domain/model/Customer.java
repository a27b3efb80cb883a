package personal.dine.seating.customer.domain.model;

import personal.dine.common.exception.BusinessException;
import personal.dine.common.exception.ErrorCode;

/**
 * Customer Domain Model
 * 고객 도메인 모델 (불변) - 이메일 또는 전화번호 중 하나는 필수
 */
public record Customer(
        Long id,
        String name,
        String email,
        String phone,
        String notes
) {
    public Customer {
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Customer name cannot be null or blank");
        }
        if (isBlank(email) && isBlank(phone)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Either email or phone is required");
        }
    }

    public static Customer register(String name, String email, String phone, String notes) {
        return new Customer(null, name, email, phone, notes);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
