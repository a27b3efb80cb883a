package personal.dine.seating.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.dine.seating.booking.domain.model.ReservationStatus;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Spring Data JPA Repository for TableAssignment
 */
public interface JpaTableAssignmentRepository extends JpaRepository<TableAssignmentEntity, Long> {

    List<TableAssignmentEntity> findByReservationId(Long reservationId);

    /**
     * 특정 테이블의 활성 점유 조회
     * 점유 상태 예약의 해제되지 않은 배정만 포함
     */
    @Query("""
            SELECT new personal.dine.seating.booking.adapter.out.persistence.OccupancyRow(
                r.id, a.tableId, r.startTime, r.durationMinutes)
            FROM TableAssignmentEntity a, ReservationEntity r
            WHERE a.reservationId = r.id
              AND a.tableId = :tableId
              AND r.reservationDate = :date
              AND r.status IN :statuses
              AND a.releasedAt IS NULL
            """)
    List<OccupancyRow> findOccupancies(@Param("tableId") Long tableId,
                                       @Param("date") LocalDate date,
                                       @Param("statuses") Collection<ReservationStatus> statuses);

    /**
     * 특정 날짜 전체 테이블의 활성 점유 조회
     */
    @Query("""
            SELECT new personal.dine.seating.booking.adapter.out.persistence.OccupancyRow(
                r.id, a.tableId, r.startTime, r.durationMinutes)
            FROM TableAssignmentEntity a, ReservationEntity r
            WHERE a.reservationId = r.id
              AND r.reservationDate = :date
              AND r.status IN :statuses
              AND a.releasedAt IS NULL
            """)
    List<OccupancyRow> findOccupancies(@Param("date") LocalDate date,
                                       @Param("statuses") Collection<ReservationStatus> statuses);

    @Modifying(flushAutomatically = true)
    @Query("""
            UPDATE TableAssignmentEntity a
            SET a.releasedAt = :releasedAt, a.updatedAt = :releasedAt
            WHERE a.reservationId = :reservationId AND a.releasedAt IS NULL
            """)
    int releaseByReservationId(@Param("reservationId") Long reservationId,
                               @Param("releasedAt") LocalDateTime releasedAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM TableAssignmentEntity a WHERE a.reservationId = :reservationId")
    int deleteByReservationId(@Param("reservationId") Long reservationId);
}
