package personal.dine.seating.booking.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import personal.dine.seating.booking.adapter.in.web.dto.TableResponse;
import personal.dine.seating.booking.application.port.in.GetTablesUseCase;
import personal.dine.seating.booking.application.port.in.TableSearchCondition;

import java.util.List;

/**
 * Table API Controller
 * 테이블(플로어 플랜) 조회 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/tables")
@RequiredArgsConstructor
public class TableController {

    private final GetTablesUseCase getTablesUseCase;

    @GetMapping
    public ResponseEntity<List<TableResponse>> getTables(
            @RequestParam(required = false) Boolean shared,
            @RequestParam(required = false) String location,
            @RequestParam(required = false) Integer minSeats
    ) {
        log.info("Get tables: shared={}, location={}, minSeats={}", shared, location, minSeats);

        List<TableResponse> response = getTablesUseCase.getTables(new TableSearchCondition(shared, location, minSeats))
                .stream()
                .map(TableResponse::from)
                .toList();

        return ResponseEntity.ok(response);
    }

    @GetMapping("/{tableId}")
    public ResponseEntity<TableResponse> getTable(@PathVariable Long tableId) {
        log.info("Get table: tableId={}", tableId);

        return ResponseEntity.ok(TableResponse.from(getTablesUseCase.getTable(tableId)));
    }
}
