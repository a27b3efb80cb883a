package personal.dine.seating.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.dine.seating.booking.application.config.SeatingProperties;
import personal.dine.seating.booking.application.port.in.AvailableTables;
import personal.dine.seating.booking.application.port.in.CheckAvailabilityQuery;
import personal.dine.seating.booking.application.port.in.CheckAvailabilityUseCase;
import personal.dine.seating.booking.application.port.in.FindAvailableTablesQuery;
import personal.dine.seating.booking.application.port.in.FindAvailableTablesUseCase;
import personal.dine.seating.booking.domain.model.TableCombination;
import personal.dine.seating.booking.domain.model.TimeSlot;
import personal.dine.seating.booking.domain.service.AvailabilitySlotGenerator;
import personal.dine.seating.hours.domain.model.OperatingWindow;
import personal.dine.seating.hours.domain.service.HoursResolver;

import java.time.LocalTime;
import java.util.List;

/**
 * Availability Query Service
 * 예약 가능 시각/테이블 조회 (조회 전용, 락 없음)
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AvailabilityQueryService implements CheckAvailabilityUseCase, FindAvailableTablesUseCase {

    private final AvailabilitySlotGenerator availabilitySlotGenerator;
    private final HoursResolver hoursResolver;
    private final SeatingProperties seatingProperties;

    @Override
    public List<LocalTime> checkAvailability(CheckAvailabilityQuery query) {
        int duration = orDefault(query.durationMinutes(), seatingProperties.reservation().defaultDurationMinutes());
        int granularity = orDefault(query.granularityMinutes(), seatingProperties.availability().granularityMinutes());

        List<LocalTime> slots = availabilitySlotGenerator
                .slots(query.date(), query.partySize(), granularity, duration)
                .toList();

        log.debug("Availability checked: date={}, partySize={}, slots={}", query.date(), query.partySize(), slots.size());
        return slots;
    }

    @Override
    public AvailableTables findAvailableTables(FindAvailableTablesQuery query) {
        int duration = orDefault(query.durationMinutes(), seatingProperties.reservation().defaultDurationMinutes());
        TimeSlot slot = new TimeSlot(query.startTime(), duration);

        OperatingWindow window = hoursResolver.resolve(query.date());
        if (!window.admits(slot)) {
            log.debug("Requested time outside hours: date={}, slot={}", query.date(), slot);
            return AvailableTables.invalidTime();
        }

        List<TableCombination> candidates =
                availabilitySlotGenerator.freeCandidates(query.date(), slot, query.partySize());
        return new AvailableTables(true, candidates);
    }

    private static int orDefault(Integer value, int defaultValue) {
        return value != null ? value : defaultValue;
    }
}
