package personal.dine.seating.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Spring Data JPA Repository for DiningTable
 */
public interface JpaDiningTableRepository extends JpaRepository<DiningTableEntity, Long> {
}
