package personal.dine.seating.booking.adapter.in.web.dto;

import personal.dine.seating.booking.application.port.in.AvailableTables;
import personal.dine.seating.booking.domain.model.TableCombination;

import java.util.List;

/**
 * 정확한 시각 기준 배정 가능 후보 응답 DTO
 */
public record AvailableTablesResponse(
        boolean validTime,
        List<Candidate> candidates
) {
    public record Candidate(
            boolean combined,
            int totalMinCapacity,
            int totalMaxCapacity,
            List<TableResponse> tables
    ) {
        static Candidate from(TableCombination combination) {
            return new Candidate(
                    combination.isCombined(),
                    combination.totalMinCapacity(),
                    combination.totalMaxCapacity(),
                    combination.tables().stream().map(TableResponse::from).toList()
            );
        }
    }

    public static AvailableTablesResponse from(AvailableTables result) {
        return new AvailableTablesResponse(
                result.validTime(),
                result.candidates().stream().map(Candidate::from).toList()
        );
    }
}
