package personal.dine.seating.booking.application.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.dine.seating.booking.application.port.in.GetTablesUseCase;
import personal.dine.seating.booking.application.port.in.TableSearchCondition;
import personal.dine.seating.booking.application.port.out.TableRepository;
import personal.dine.seating.booking.domain.exception.TableNotFoundException;
import personal.dine.seating.booking.domain.model.DiningTable;

import java.util.List;

/**
 * Table Query Service
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class TableQueryService implements GetTablesUseCase {

    private final TableRepository tableRepository;

    @Override
    public List<DiningTable> getTables(TableSearchCondition condition) {
        TableSearchCondition filter = condition != null ? condition : TableSearchCondition.none();
        return tableRepository.findAll().stream()
                .filter(filter::matches)
                .sorted(DiningTable.DISPLAY_ORDER)
                .toList();
    }

    @Override
    public DiningTable getTable(Long tableId) {
        return tableRepository.findById(tableId)
                .orElseThrow(() -> new TableNotFoundException(tableId));
    }
}
