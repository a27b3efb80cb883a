package personal.dine.seating.booking.application.port.in;

/**
 * Find Available Tables UseCase (Input Port)
 */
public interface FindAvailableTablesUseCase {

    AvailableTables findAvailableTables(FindAvailableTablesQuery query);
}
