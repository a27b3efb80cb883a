package personal.dine.seating.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.dine.seating.booking.application.port.out.TableRepository;
import personal.dine.seating.booking.domain.model.DiningTable;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Table Persistence Adapter
 * JPA를 사용한 테이블 조회 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TablePersistenceAdapter implements TableRepository {

    private final JpaDiningTableRepository jpaDiningTableRepository;
    private final JpaChairRepository jpaChairRepository;

    @Override
    public List<DiningTable> findAll() {
        return jpaDiningTableRepository.findAll().stream()
                .map(DiningTableEntity::toDomain)
                .toList();
    }

    @Override
    public Optional<DiningTable> findById(Long tableId) {
        log.debug("Finding table: tableId={}", tableId);
        return jpaDiningTableRepository.findById(tableId)
                .map(DiningTableEntity::toDomain);
    }

    @Override
    public List<DiningTable> findAllById(Collection<Long> tableIds) {
        return jpaDiningTableRepository.findAllById(tableIds).stream()
                .map(DiningTableEntity::toDomain)
                .toList();
    }

    @Override
    public Map<Long, Long> countAssignedChairsByTable() {
        Map<Long, Long> counts = new HashMap<>();
        for (Object[] row : jpaChairRepository.countAssignedGroupByTable()) {
            counts.put((Long) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }
}
