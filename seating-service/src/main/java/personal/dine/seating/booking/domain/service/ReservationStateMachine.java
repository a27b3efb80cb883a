package personal.dine.seating.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.dine.seating.booking.application.port.out.ReservationRepository;
import personal.dine.seating.booking.application.port.out.TableAssignmentRepository;
import personal.dine.seating.booking.domain.exception.ReservationNotFoundException;
import personal.dine.seating.booking.domain.model.Reservation;
import personal.dine.seating.booking.domain.model.ReservationStatus;

import java.time.LocalDateTime;

/**
 * Reservation State Machine (Domain Service)
 * 예약 상태 전이와 점유 해제 부수 효과를 하나의 트랜잭션으로 처리
 *
 * - 전이 가능 여부는 ReservationStatus 전이 테이블이 결정
 * - CANCELLED/NO_SHOW 진입 시 배정을 해제(released) 표시
 * - COMPLETED는 배정 이력을 유지하며 상태로 인해 점유하지 않음
 * - 동시 전이는 낙관적 락(version)으로 직렬화
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReservationStateMachine {

    private final ReservationRepository reservationRepository;
    private final TableAssignmentRepository tableAssignmentRepository;

    @Transactional
    public Reservation transition(Long reservationId, ReservationStatus target) {
        Reservation reservation = reservationRepository.findById(reservationId)
                .orElseThrow(() -> new ReservationNotFoundException(reservationId));

        // 허용되지 않는 전이면 아무것도 변경하지 않고 예외
        Reservation transitioned = reservation.transitionTo(target);
        Reservation saved = reservationRepository.save(transitioned);

        if (target.releasesTables()) {
            int released = tableAssignmentRepository.releaseByReservationId(reservationId, LocalDateTime.now());
            log.info("Table assignments released: reservationId={}, count={}", reservationId, released);
        }

        log.info("Reservation status changed: reservationId={}, from={}, to={}",
                reservationId, reservation.status(), target);
        return saved;
    }
}
