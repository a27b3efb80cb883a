package personal.dine.seating.booking.application.port.out;

import personal.dine.seating.booking.domain.model.DiningTable;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Table Repository (Output Port)
 * 테이블(플로어 플랜) 조회 인터페이스 - 엔진은 테이블을 읽기만 한다
 */
public interface TableRepository {

    List<DiningTable> findAll();

    Optional<DiningTable> findById(Long tableId);

    List<DiningTable> findAllById(Collection<Long> tableIds);

    /**
     * 테이블별 배치된(assigned) 의자 수
     *
     * @return tableId → 의자 수 (의자가 없는 테이블은 포함되지 않음)
     */
    Map<Long, Long> countAssignedChairsByTable();
}
