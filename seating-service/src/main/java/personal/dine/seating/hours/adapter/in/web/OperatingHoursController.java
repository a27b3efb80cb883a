package personal.dine.seating.hours.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.dine.seating.hours.adapter.in.web.dto.EffectiveHoursResponse;
import personal.dine.seating.hours.adapter.in.web.dto.SpecialHoursRequest;
import personal.dine.seating.hours.adapter.in.web.dto.SpecialHoursResponse;
import personal.dine.seating.hours.adapter.in.web.dto.WeeklyHoursRequest;
import personal.dine.seating.hours.adapter.in.web.dto.WeeklyHoursResponse;
import personal.dine.seating.hours.application.port.in.GetOperatingHoursUseCase;
import personal.dine.seating.hours.application.port.in.ManageOperatingHoursUseCase;

import java.time.LocalDate;
import java.util.List;

/**
 * Operating Hours API Controller
 * 요일/특별 영업 시간 조회 및 관리 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/hours")
@RequiredArgsConstructor
public class OperatingHoursController {

    private final GetOperatingHoursUseCase getOperatingHoursUseCase;
    private final ManageOperatingHoursUseCase manageOperatingHoursUseCase;

    @GetMapping("/weekly")
    public ResponseEntity<List<WeeklyHoursResponse>> getWeeklyHours() {
        List<WeeklyHoursResponse> response = getOperatingHoursUseCase.getWeeklyHours().stream()
                .map(WeeklyHoursResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }

    @PutMapping("/weekly")
    public ResponseEntity<WeeklyHoursResponse> setWeeklyHours(@Valid @RequestBody WeeklyHoursRequest request) {
        log.info("Set weekly hours: dayOfWeek={}, open={}, close={}",
                request.dayOfWeek(), request.openTime(), request.closeTime());

        return ResponseEntity.ok(WeeklyHoursResponse.from(manageOperatingHoursUseCase.setWeeklyHours(request.toCommand())));
    }

    /**
     * GET /api/v1/hours/special?from=2025-12-01&to=2025-12-31
     */
    @GetMapping("/special")
    public ResponseEntity<List<SpecialHoursResponse>> getSpecialHours(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        List<SpecialHoursResponse> response = getOperatingHoursUseCase.getSpecialHours(from, to).stream()
                .map(SpecialHoursResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }

    @GetMapping("/special/{date}")
    public ResponseEntity<SpecialHoursResponse> getSpecialHoursByDate(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return ResponseEntity.ok(SpecialHoursResponse.from(getOperatingHoursUseCase.getSpecialHours(date)));
    }

    @PutMapping("/special")
    public ResponseEntity<SpecialHoursResponse> setSpecialHours(@Valid @RequestBody SpecialHoursRequest request) {
        log.info("Set special hours: date={}, name={}, closed={}", request.date(), request.name(), request.closed());

        return ResponseEntity.ok(SpecialHoursResponse.from(manageOperatingHoursUseCase.setSpecialHours(request.toCommand())));
    }

    @DeleteMapping("/special/{specialHoursId}")
    public ResponseEntity<Void> deleteSpecialHours(@PathVariable Long specialHoursId) {
        log.info("Delete special hours: specialHoursId={}", specialHoursId);

        manageOperatingHoursUseCase.deleteSpecialHours(specialHoursId);
        return ResponseEntity.noContent().build();
    }

    /**
     * 특정 날짜의 실제 영업 시간 (특별 영업 시간 우선)
     * GET /api/v1/hours/effective/2025-12-25
     */
    @GetMapping("/effective/{date}")
    public ResponseEntity<EffectiveHoursResponse> getEffectiveHours(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return ResponseEntity.ok(EffectiveHoursResponse.of(date, getOperatingHoursUseCase.getEffectiveHours(date)));
    }
}
