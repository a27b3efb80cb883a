package personal.dine.seating.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.dine.common.exception.BusinessException;
import personal.dine.common.exception.ErrorCode;
import personal.dine.seating.booking.application.port.in.CancelReservationUseCase;
import personal.dine.seating.booking.application.port.in.ChangeReservationStatusUseCase;
import personal.dine.seating.booking.application.port.in.DeleteReservationUseCase;
import personal.dine.seating.booking.application.port.out.ReservationRepository;
import personal.dine.seating.booking.application.port.out.TableAssignmentRepository;
import personal.dine.seating.booking.domain.exception.ReservationNotFoundException;
import personal.dine.seating.booking.domain.model.Reservation;
import personal.dine.seating.booking.domain.model.ReservationStatus;
import personal.dine.seating.booking.domain.service.ReservationStateMachine;

/**
 * Reservation Lifecycle Service
 * 예약 상태 변경, 취소, 삭제
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationLifecycleService
        implements ChangeReservationStatusUseCase, CancelReservationUseCase, DeleteReservationUseCase {

    private final ReservationStateMachine reservationStateMachine;
    private final ReservationRepository reservationRepository;
    private final TableAssignmentRepository tableAssignmentRepository;

    @Override
    public Reservation changeStatus(Long reservationId, ReservationStatus newStatus) {
        if (newStatus == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Status cannot be null");
        }
        return reservationStateMachine.transition(reservationId, newStatus);
    }

    @Override
    public Reservation cancel(Long reservationId) {
        return reservationStateMachine.transition(reservationId, ReservationStatus.CANCELLED);
    }

    /**
     * 배정 → 예약 순서로 같은 트랜잭션에서 삭제
     */
    @Override
    @Transactional
    public void deleteReservation(Long reservationId) {
        if (reservationRepository.findById(reservationId).isEmpty()) {
            throw new ReservationNotFoundException(reservationId);
        }
        tableAssignmentRepository.deleteByReservationId(reservationId);
        reservationRepository.deleteById(reservationId);
        log.info("Reservation deleted: reservationId={}", reservationId);
    }
}
