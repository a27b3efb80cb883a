package personal.dine.seating.booking.application.port.in;

import personal.dine.seating.booking.domain.model.DiningTable;

import java.util.List;

/**
 * Get Tables UseCase (Input Port)
 */
public interface GetTablesUseCase {

    List<DiningTable> getTables(TableSearchCondition condition);

    /**
     * @throws personal.dine.seating.booking.domain.exception.TableNotFoundException 테이블을 찾을 수 없을 때
     */
    DiningTable getTable(Long tableId);
}
