package personal.dine.seating.booking.application.port.out;

import personal.dine.seating.booking.domain.model.Occupancy;
import personal.dine.seating.booking.domain.model.TableAssignment;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Table Assignment Repository (Output Port)
 * 예약-테이블 배정 저장소 인터페이스
 */
public interface TableAssignmentRepository {

    List<TableAssignment> saveAll(List<TableAssignment> assignments);

    List<TableAssignment> findByReservationId(Long reservationId);

    /**
     * 특정 테이블의 활성 점유 목록
     * 예약 상태가 PENDING/CONFIRMED/SEATED 이고 해제되지 않은 배정만 포함
     */
    List<Occupancy> findActiveOccupancies(Long tableId, LocalDate date);

    /**
     * 특정 날짜 전체 테이블의 활성 점유 목록
     */
    List<Occupancy> findActiveOccupancies(LocalDate date);

    /**
     * 배정 해제 표시 (이력은 유지)
     *
     * @return 해제된 배정 수
     */
    int releaseByReservationId(Long reservationId, LocalDateTime releasedAt);

    void deleteByReservationId(Long reservationId);
}
