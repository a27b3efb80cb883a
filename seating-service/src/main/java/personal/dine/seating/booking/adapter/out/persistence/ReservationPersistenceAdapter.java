package personal.dine.seating.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.dine.seating.booking.application.port.in.ReservationSearchCondition;
import personal.dine.seating.booking.application.port.out.ReservationRepository;
import personal.dine.seating.booking.domain.exception.ReservationNotFoundException;
import personal.dine.seating.booking.domain.model.Reservation;

import java.util.List;
import java.util.Optional;

/**
 * Reservation Persistence Adapter
 * JPA를 사용한 예약 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReservationPersistenceAdapter implements ReservationRepository {

    private final JpaReservationRepository jpaReservationRepository;

    /**
     * 신규 예약은 INSERT, 기존 예약은 영속 엔티티에 변경 반영 후 flush
     * flush 시점에 version이 증가하므로 반환 값에 새 version이 담긴다
     */
    @Override
    public Reservation save(Reservation reservation) {
        log.debug("Saving reservation: reservationId={}, status={}", reservation.id(), reservation.status());

        if (reservation.id() == null) {
            return jpaReservationRepository.saveAndFlush(ReservationEntity.fromDomain(reservation)).toDomain();
        }

        ReservationEntity entity = jpaReservationRepository.findById(reservation.id())
                .orElseThrow(() -> new ReservationNotFoundException(reservation.id()));
        entity.verifyVersion(reservation.version());
        entity.apply(reservation);
        return jpaReservationRepository.saveAndFlush(entity).toDomain();
    }

    @Override
    public Optional<Reservation> findById(Long reservationId) {
        log.debug("Finding reservation: reservationId={}", reservationId);
        return jpaReservationRepository.findById(reservationId)
                .map(ReservationEntity::toDomain);
    }

    @Override
    public List<Reservation> search(ReservationSearchCondition condition) {
        log.debug("Searching reservations: condition={}", condition);
        return jpaReservationRepository.search(condition).stream()
                .map(ReservationEntity::toDomain)
                .toList();
    }

    @Override
    public void deleteById(Long reservationId) {
        jpaReservationRepository.deleteById(reservationId);
    }
}
