package personal.dine.seating.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Spring Data JPA Repository for Reservation
 */
public interface JpaReservationRepository extends JpaRepository<ReservationEntity, Long>,
        JpaReservationRepositoryCustom {
}
