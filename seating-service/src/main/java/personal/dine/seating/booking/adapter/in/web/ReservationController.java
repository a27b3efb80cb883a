package personal.dine.seating.booking.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.dine.seating.booking.adapter.in.web.dto.CreateReservationRequest;
import personal.dine.seating.booking.adapter.in.web.dto.RescheduleReservationRequest;
import personal.dine.seating.booking.adapter.in.web.dto.ReservationResponse;
import personal.dine.seating.booking.adapter.in.web.dto.ReservationStatusResponse;
import personal.dine.seating.booking.application.port.in.CancelReservationUseCase;
import personal.dine.seating.booking.application.port.in.ChangeReservationStatusUseCase;
import personal.dine.seating.booking.application.port.in.CreateReservationUseCase;
import personal.dine.seating.booking.application.port.in.DeleteReservationUseCase;
import personal.dine.seating.booking.application.port.in.GetReservationUseCase;
import personal.dine.seating.booking.application.port.in.RescheduleReservationUseCase;
import personal.dine.seating.booking.application.port.in.ReservationSearchCondition;
import personal.dine.seating.booking.domain.model.Reservation;
import personal.dine.seating.booking.domain.model.ReservationStatus;
import personal.dine.seating.booking.domain.model.ReservationWithTables;

import java.time.LocalDate;
import java.util.List;

/**
 * Reservation API Controller
 * 예약 생성(테이블 자동 배정), 조회, 상태 변경, 일정 변경, 삭제 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/reservations")
@RequiredArgsConstructor
public class ReservationController {

    private final CreateReservationUseCase createReservationUseCase;
    private final RescheduleReservationUseCase rescheduleReservationUseCase;
    private final GetReservationUseCase getReservationUseCase;
    private final ChangeReservationStatusUseCase changeReservationStatusUseCase;
    private final CancelReservationUseCase cancelReservationUseCase;
    private final DeleteReservationUseCase deleteReservationUseCase;

    /**
     * 예약 생성 + 테이블 배정
     * POST /api/v1/reservations
     */
    @PostMapping
    public ResponseEntity<ReservationResponse> createReservation(
            @Valid @RequestBody CreateReservationRequest request
    ) {
        log.info("Create reservation: customerId={}, partySize={}, date={}, startTime={}",
                request.customerId(), request.partySize(), request.reservationDate(), request.startTime());

        ReservationWithTables result = createReservationUseCase.createAndAssign(request.toCommand());

        return ResponseEntity.status(HttpStatus.CREATED).body(ReservationResponse.from(result));
    }

    /**
     * 예약 조회
     * GET /api/v1/reservations/{reservationId}
     */
    @GetMapping("/{reservationId}")
    public ResponseEntity<ReservationResponse> getReservation(@PathVariable Long reservationId) {
        log.info("Get reservation: reservationId={}", reservationId);

        return ResponseEntity.ok(ReservationResponse.from(getReservationUseCase.getReservation(reservationId)));
    }

    /**
     * 예약 목록 검색
     * GET /api/v1/reservations?dateFrom=2025-06-01&dateTo=2025-06-07&tableId=3&customerId=10&status=confirmed&limit=100&offset=0
     * date 는 dateFrom = dateTo 인 하루 조회의 축약
     */
    @GetMapping
    public ResponseEntity<List<ReservationResponse>> listReservations(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo,
            @RequestParam(required = false) Long tableId,
            @RequestParam(required = false) Long customerId,
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(defaultValue = "0") int offset
    ) {
        log.info("List reservations: date={}, dateFrom={}, dateTo={}, tableId={}, customerId={}, status={}, limit={}, offset={}",
                date, dateFrom, dateTo, tableId, customerId, status, limit, offset);

        ReservationStatus filter = status == null ? null : ReservationStatus.from(status);
        ReservationSearchCondition condition = new ReservationSearchCondition(
                date != null ? date : dateFrom,
                date != null ? date : dateTo,
                tableId, customerId, filter, limit, offset);

        List<ReservationResponse> response = getReservationUseCase.listReservations(condition).stream()
                .map(ReservationResponse::from)
                .toList();

        return ResponseEntity.ok(response);
    }

    /**
     * 예약 상태 변경
     * PATCH /api/v1/reservations/{reservationId}/status?status=confirmed
     */
    @PatchMapping("/{reservationId}/status")
    public ResponseEntity<ReservationStatusResponse> changeStatus(
            @PathVariable Long reservationId,
            @RequestParam String status
    ) {
        log.info("Change reservation status: reservationId={}, status={}", reservationId, status);

        Reservation reservation = changeReservationStatusUseCase.changeStatus(reservationId, ReservationStatus.from(status));

        return ResponseEntity.ok(ReservationStatusResponse.from(reservation));
    }

    /**
     * 예약 취소
     * POST /api/v1/reservations/{reservationId}/cancel
     */
    @PostMapping("/{reservationId}/cancel")
    public ResponseEntity<ReservationStatusResponse> cancelReservation(@PathVariable Long reservationId) {
        log.info("Cancel reservation: reservationId={}", reservationId);

        return ResponseEntity.ok(ReservationStatusResponse.from(cancelReservationUseCase.cancel(reservationId)));
    }

    /**
     * 예약 일정 변경 (테이블 재배정)
     * PUT /api/v1/reservations/{reservationId}/schedule
     */
    @PutMapping("/{reservationId}/schedule")
    public ResponseEntity<ReservationResponse> rescheduleReservation(
            @PathVariable Long reservationId,
            @Valid @RequestBody RescheduleReservationRequest request
    ) {
        log.info("Reschedule reservation: reservationId={}, date={}, startTime={}, partySize={}",
                reservationId, request.reservationDate(), request.startTime(), request.partySize());

        ReservationWithTables result = rescheduleReservationUseCase.reschedule(request.toCommand(reservationId));

        return ResponseEntity.ok(ReservationResponse.from(result));
    }

    /**
     * 예약 삭제 (배정 포함)
     * DELETE /api/v1/reservations/{reservationId}
     */
    @DeleteMapping("/{reservationId}")
    public ResponseEntity<Void> deleteReservation(@PathVariable Long reservationId) {
        log.info("Delete reservation: reservationId={}", reservationId);

        deleteReservationUseCase.deleteReservation(reservationId);

        return ResponseEntity.noContent().build();
    }
}
