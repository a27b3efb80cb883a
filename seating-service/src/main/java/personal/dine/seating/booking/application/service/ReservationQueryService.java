package personal.dine.seating.booking.application.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.dine.common.exception.BusinessException;
import personal.dine.common.exception.ErrorCode;
import personal.dine.seating.booking.application.port.in.GetReservationUseCase;
import personal.dine.seating.booking.application.port.in.ReservationSearchCondition;
import personal.dine.seating.booking.application.port.out.ReservationRepository;
import personal.dine.seating.booking.application.port.out.TableAssignmentRepository;
import personal.dine.seating.booking.application.port.out.TableRepository;
import personal.dine.seating.booking.domain.exception.ReservationNotFoundException;
import personal.dine.seating.booking.domain.model.Reservation;
import personal.dine.seating.booking.domain.model.ReservationWithTables;
import personal.dine.seating.booking.domain.model.TableAssignment;

import java.util.List;

/**
 * Reservation Query Service
 * 예약 조회 (배정된 테이블 포함)
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ReservationQueryService implements GetReservationUseCase {

    private final ReservationRepository reservationRepository;
    private final TableAssignmentRepository tableAssignmentRepository;
    private final TableRepository tableRepository;

    @Override
    public ReservationWithTables getReservation(Long reservationId) {
        Reservation reservation = reservationRepository.findById(reservationId)
                .orElseThrow(() -> new ReservationNotFoundException(reservationId));
        return withTables(reservation);
    }

    @Override
    public List<ReservationWithTables> listReservations(ReservationSearchCondition condition) {
        if (condition == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Search condition cannot be null");
        }
        return reservationRepository.search(condition).stream()
                .map(this::withTables)
                .toList();
    }

    /**
     * 해제된 배정도 이력으로 함께 표시
     */
    private ReservationWithTables withTables(Reservation reservation) {
        List<Long> tableIds = tableAssignmentRepository.findByReservationId(reservation.id()).stream()
                .map(TableAssignment::tableId)
                .toList();
        return new ReservationWithTables(reservation, tableIds.isEmpty() ? List.of() : tableRepository.findAllById(tableIds));
    }
}
