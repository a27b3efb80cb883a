package personal.dine.seating.booking.adapter.in.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;
import personal.dine.seating.booking.application.port.in.AvailableTables;
import personal.dine.seating.booking.application.port.in.CheckAvailabilityQuery;
import personal.dine.seating.booking.application.port.in.CheckAvailabilityUseCase;
import personal.dine.seating.booking.application.port.in.FindAvailableTablesQuery;
import personal.dine.seating.booking.application.port.in.FindAvailableTablesUseCase;
import personal.dine.seating.booking.domain.model.DiningTable;
import personal.dine.seating.booking.domain.model.TableCombination;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AvailabilityController.class)
@DisplayName("Availability API 단위 테스트")
class AvailabilityControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CheckAvailabilityUseCase checkAvailabilityUseCase;
    @MockBean
    private FindAvailableTablesUseCase findAvailableTablesUseCase;

    @Test
    @DisplayName("가능 시각은 HH:mm 문자열 목록")
    void getAvailableSlots() throws Exception {
        // given
        given(checkAvailabilityUseCase.checkAvailability(new CheckAvailabilityQuery(LocalDate.of(2025, 6, 14), 4, null, null)))
                .willReturn(List.of(LocalTime.of(17, 0), LocalTime.of(20, 30)));

        // when & then
        mockMvc.perform(get("/api/v1/availability/slots")
                        .param("date", "2025-06-14")
                        .param("partySize", "4"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.date").value("2025-06-14"))
                .andExpect(jsonPath("$.availableSlots[0]").value("17:00"))
                .andExpect(jsonPath("$.availableSlots[1]").value("20:30"));
    }

    @Test
    @DisplayName("인원수 0이면 400")
    void getAvailableSlots_InvalidPartySize() throws Exception {
        mockMvc.perform(get("/api/v1/availability/slots")
                        .param("date", "2025-06-14")
                        .param("partySize", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C001"));
    }

    @Test
    @DisplayName("날짜 누락 시 400")
    void getAvailableSlots_MissingDate() throws Exception {
        mockMvc.perform(get("/api/v1/availability/slots").param("partySize", "2"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C001"));
    }

    @Test
    @DisplayName("정확한 시각 후보 조회 - 조합 후보 포함")
    void getAvailableTables() throws Exception {
        // given
        TableCombination combined = new TableCombination(List.of(
                new DiningTable(7L, "7", 1, 4, true, "terrace"),
                new DiningTable(8L, "8", 1, 4, true, "terrace")));
        given(findAvailableTablesUseCase.findAvailableTables(any(FindAvailableTablesQuery.class)))
                .willReturn(new AvailableTables(true, List.of(combined)));

        // when & then
        mockMvc.perform(get("/api/v1/availability/tables")
                        .param("date", "2025-06-14")
                        .param("startTime", "19:00")
                        .param("partySize", "6"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.validTime").value(true))
                .andExpect(jsonPath("$.candidates[0].combined").value(true))
                .andExpect(jsonPath("$.candidates[0].totalMaxCapacity").value(8))
                .andExpect(jsonPath("$.candidates[0].tables.length()").value(2));
    }
}
