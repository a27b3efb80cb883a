package personal.dine.seating.customer.adapter.in.web.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import personal.dine.seating.customer.application.port.in.RegisterCustomerCommand;

/**
 * 고객 등록 요청 DTO (이메일/전화번호 중 하나 필수는 도메인에서 검증)
 */
public record RegisterCustomerRequest(
        @NotBlank(message = "이름은 필수입니다.")
        @Size(max = 100, message = "이름은 100자 이하여야 합니다.")
        String name,

        @Email(message = "이메일 형식이 올바르지 않습니다.")
        @Size(max = 100, message = "이메일은 100자 이하여야 합니다.")
        String email,

        @Size(max = 20, message = "전화번호는 20자 이하여야 합니다.")
        String phone,

        String notes
) {
    public RegisterCustomerCommand toCommand() {
        return new RegisterCustomerCommand(name, email, phone, notes);
    }
}
