package personal.dine.seating.booking.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import personal.dine.seating.booking.adapter.in.web.dto.AvailabilitySlotsResponse;
import personal.dine.seating.booking.adapter.in.web.dto.AvailableTablesResponse;
import personal.dine.seating.booking.application.port.in.CheckAvailabilityQuery;
import personal.dine.seating.booking.application.port.in.CheckAvailabilityUseCase;
import personal.dine.seating.booking.application.port.in.FindAvailableTablesQuery;
import personal.dine.seating.booking.application.port.in.FindAvailableTablesUseCase;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Availability API Controller
 * 예약 가능 시각 및 테이블 조회 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/availability")
@RequiredArgsConstructor
public class AvailabilityController {

    private final CheckAvailabilityUseCase checkAvailabilityUseCase;
    private final FindAvailableTablesUseCase findAvailableTablesUseCase;

    /**
     * 예약 가능 시작 시각 목록
     * GET /api/v1/availability/slots?date=2025-06-01&partySize=4
     */
    @GetMapping("/slots")
    public ResponseEntity<AvailabilitySlotsResponse> getAvailableSlots(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam int partySize,
            @RequestParam(required = false) Integer durationMinutes,
            @RequestParam(required = false) Integer granularityMinutes
    ) {
        log.info("Check availability: date={}, partySize={}", date, partySize);

        List<LocalTime> slots = checkAvailabilityUseCase.checkAvailability(
                new CheckAvailabilityQuery(date, partySize, durationMinutes, granularityMinutes));

        return ResponseEntity.ok(AvailabilitySlotsResponse.of(date, partySize, slots));
    }

    /**
     * 정확한 시각 기준 배정 가능 테이블(조합)
     * GET /api/v1/availability/tables?date=2025-06-01&startTime=19:00&partySize=4
     */
    @GetMapping("/tables")
    public ResponseEntity<AvailableTablesResponse> getAvailableTables(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.TIME) LocalTime startTime,
            @RequestParam int partySize,
            @RequestParam(required = false) Integer durationMinutes
    ) {
        log.info("Find available tables: date={}, startTime={}, partySize={}", date, startTime, partySize);

        var result = findAvailableTablesUseCase.findAvailableTables(
                new FindAvailableTablesQuery(date, startTime, partySize, durationMinutes));

        return ResponseEntity.ok(AvailableTablesResponse.from(result));
    }
}
