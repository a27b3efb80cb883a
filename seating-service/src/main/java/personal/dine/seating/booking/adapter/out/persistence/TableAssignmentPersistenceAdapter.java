package personal.dine.seating.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.dine.seating.booking.application.port.out.TableAssignmentRepository;
import personal.dine.seating.booking.domain.model.Occupancy;
import personal.dine.seating.booking.domain.model.ReservationStatus;
import personal.dine.seating.booking.domain.model.TableAssignment;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Table Assignment Persistence Adapter
 * JPA를 사용한 배정 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TableAssignmentPersistenceAdapter implements TableAssignmentRepository {

    private final JpaTableAssignmentRepository jpaTableAssignmentRepository;

    @Override
    public List<TableAssignment> saveAll(List<TableAssignment> assignments) {
        List<TableAssignmentEntity> entities = assignments.stream()
                .map(TableAssignmentEntity::fromDomain)
                .toList();
        return jpaTableAssignmentRepository.saveAll(entities).stream()
                .map(TableAssignmentEntity::toDomain)
                .toList();
    }

    @Override
    public List<TableAssignment> findByReservationId(Long reservationId) {
        return jpaTableAssignmentRepository.findByReservationId(reservationId).stream()
                .map(TableAssignmentEntity::toDomain)
                .toList();
    }

    @Override
    public List<Occupancy> findActiveOccupancies(Long tableId, LocalDate date) {
        return jpaTableAssignmentRepository.findOccupancies(tableId, date, ReservationStatus.OCCUPYING).stream()
                .map(OccupancyRow::toDomain)
                .toList();
    }

    @Override
    public List<Occupancy> findActiveOccupancies(LocalDate date) {
        return jpaTableAssignmentRepository.findOccupancies(date, ReservationStatus.OCCUPYING).stream()
                .map(OccupancyRow::toDomain)
                .toList();
    }

    @Override
    public int releaseByReservationId(Long reservationId, LocalDateTime releasedAt) {
        return jpaTableAssignmentRepository.releaseByReservationId(reservationId, releasedAt);
    }

    @Override
    public void deleteByReservationId(Long reservationId) {
        int deleted = jpaTableAssignmentRepository.deleteByReservationId(reservationId);
        log.debug("Table assignments deleted: reservationId={}, count={}", reservationId, deleted);
    }
}
