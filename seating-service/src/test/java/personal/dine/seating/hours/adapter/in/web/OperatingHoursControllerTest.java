package personal.dine.seating.hours.adapter.in.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import personal.dine.seating.hours.application.port.in.GetOperatingHoursUseCase;
import personal.dine.seating.hours.application.port.in.ManageOperatingHoursUseCase;
import personal.dine.seating.hours.application.port.in.SetWeeklyHoursCommand;
import personal.dine.seating.hours.domain.exception.SpecialHoursNotFoundException;
import personal.dine.seating.hours.domain.model.OperatingWindow;
import personal.dine.seating.hours.domain.model.WeeklyHours;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(OperatingHoursController.class)
@DisplayName("Operating Hours API 단위 테스트")
class OperatingHoursControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private GetOperatingHoursUseCase getOperatingHoursUseCase;
    @MockBean
    private ManageOperatingHoursUseCase manageOperatingHoursUseCase;

    @Test
    @DisplayName("요일 영업 시간 목록 - 요일 이름 포함")
    void getWeeklyHours() throws Exception {
        // given
        given(getOperatingHoursUseCase.getWeeklyHours()).willReturn(List.of(
                new WeeklyHours(1L, 0, LocalTime.of(17, 0), LocalTime.of(22, 0), LocalTime.of(21, 0))));

        // when & then
        mockMvc.perform(get("/api/v1/hours/weekly"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].dayOfWeek").value(0))
                .andExpect(jsonPath("$[0].dayName").value("MONDAY"));
    }

    @Test
    @DisplayName("요일 범위를 벗어나면 400")
    void setWeeklyHours_InvalidDay() throws Exception {
        mockMvc.perform(put("/api/v1/hours/weekly")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"dayOfWeek": 7, "openTime": "17:00", "closeTime": "22:00", "lastReservationTime": "21:00"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C001"));
        verify(manageOperatingHoursUseCase, never()).setWeeklyHours(any());
    }

    @Test
    @DisplayName("요일 영업 시간 저장")
    void setWeeklyHours() throws Exception {
        // given
        given(manageOperatingHoursUseCase.setWeeklyHours(any(SetWeeklyHoursCommand.class))).willReturn(
                new WeeklyHours(3L, 6, LocalTime.of(12, 0), LocalTime.of(21, 0), LocalTime.of(20, 0)));

        // when & then
        mockMvc.perform(put("/api/v1/hours/weekly")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"dayOfWeek": 6, "openTime": "12:00", "closeTime": "21:00", "lastReservationTime": "20:00"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dayName").value("SUNDAY"));
    }

    @Test
    @DisplayName("실제 영업 시간 - 휴무일")
    void getEffectiveHours_Closed() throws Exception {
        // given
        LocalDate date = LocalDate.of(2025, 12, 25);
        given(getOperatingHoursUseCase.getEffectiveHours(date))
                .willReturn(OperatingWindow.closed(OperatingWindow.Source.SPECIAL));

        // when & then
        mockMvc.perform(get("/api/v1/hours/effective/2025-12-25"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.closed").value(true))
                .andExpect(jsonPath("$.source").value("SPECIAL"));
    }

    @Test
    @DisplayName("존재하지 않는 특별일 삭제는 404 (H001)")
    void deleteSpecialHours_NotFound() throws Exception {
        // given
        willThrow(new SpecialHoursNotFoundException(5L)).given(manageOperatingHoursUseCase).deleteSpecialHours(5L);

        // when & then
        mockMvc.perform(delete("/api/v1/hours/special/5"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("H001"));
    }
}
