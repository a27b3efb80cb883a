package personal.dine.seating.customer.adapter.in.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import personal.dine.seating.customer.application.port.in.GetCustomerUseCase;
import personal.dine.seating.customer.application.port.in.RegisterCustomerCommand;
import personal.dine.seating.customer.application.port.in.RegisterCustomerUseCase;
import personal.dine.seating.customer.domain.exception.CustomerNotFoundException;
import personal.dine.seating.customer.domain.model.Customer;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CustomerController.class)
@DisplayName("Customer API 단위 테스트")
class CustomerControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RegisterCustomerUseCase registerCustomerUseCase;
    @MockBean
    private GetCustomerUseCase getCustomerUseCase;

    @Test
    @DisplayName("고객 등록 성공 시 201")
    void registerCustomer() throws Exception {
        // given
        given(registerCustomerUseCase.register(any(RegisterCustomerCommand.class)))
                .willReturn(new Customer(1L, "김민수", "minsu@example.com", null, null));

        // when & then
        mockMvc.perform(post("/api/v1/customers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "김민수", "email": "minsu@example.com"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.customerId").value(1))
                .andExpect(jsonPath("$.email").value("minsu@example.com"));
    }

    @Test
    @DisplayName("이메일 형식 오류는 400")
    void registerCustomer_InvalidEmail() throws Exception {
        mockMvc.perform(post("/api/v1/customers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "김민수", "email": "not-an-email"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("이메일 형식이 올바르지 않습니다."));
    }

    @Test
    @DisplayName("존재하지 않는 고객은 404 (U001)")
    void getCustomer_NotFound() throws Exception {
        // given
        given(getCustomerUseCase.getCustomer(42L)).willThrow(new CustomerNotFoundException(42L));

        // when & then
        mockMvc.perform(get("/api/v1/customers/42"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("U001"));
    }
}
