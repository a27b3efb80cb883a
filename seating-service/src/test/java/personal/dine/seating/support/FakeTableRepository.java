package personal.dine.seating.support;

import personal.dine.seating.booking.application.port.out.TableRepository;
import personal.dine.seating.booking.domain.model.DiningTable;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 테스트용 인메모리 테이블 저장소
 */
public class FakeTableRepository implements TableRepository {

    private final Map<Long, DiningTable> tables = new ConcurrentHashMap<>();
    private final Map<Long, Long> assignedChairs = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public DiningTable add(String tableNumber, int min, int max, boolean shared) {
        long id = sequence.incrementAndGet();
        DiningTable table = new DiningTable(id, tableNumber, min, max, shared, null);
        tables.put(id, table);
        return table;
    }

    public void setAssignedChairs(Long tableId, long count) {
        assignedChairs.put(tableId, count);
    }

    @Override
    public List<DiningTable> findAll() {
        return List.copyOf(tables.values());
    }

    @Override
    public Optional<DiningTable> findById(Long tableId) {
        return Optional.ofNullable(tables.get(tableId));
    }

    @Override
    public List<DiningTable> findAllById(Collection<Long> tableIds) {
        return tableIds.stream().map(tables::get).filter(table -> table != null).toList();
    }

    @Override
    public Map<Long, Long> countAssignedChairsByTable() {
        return new HashMap<>(assignedChairs);
    }
}
