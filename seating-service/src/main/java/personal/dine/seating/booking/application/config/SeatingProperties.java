package personal.dine.seating.booking.application.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import personal.dine.seating.booking.domain.model.CapacitySource;

/**
 * Seating 설정 Properties
 * application.yml의 seating.* 설정을 바인딩 (seating.lock.* 은 TableLockProperties)
 */
@ConfigurationProperties(prefix = "seating")
public record SeatingProperties(
        @DefaultValue ReservationDefaults reservation,
        @DefaultValue Matching matching,
        @DefaultValue Availability availability
) {
    public record ReservationDefaults(
            @DefaultValue("90") int defaultDurationMinutes
    ) {}

    public record Matching(
            @DefaultValue("3") int maxCombinationSize,
            @DefaultValue("4") int maxExcessCapacity,  // 음수면 제한 없음
            @DefaultValue("STATIC") CapacitySource capacitySource
    ) {}

    public record Availability(
            @DefaultValue("15") int granularityMinutes
    ) {}

    public static SeatingProperties defaults() {
        return new SeatingProperties(
                new ReservationDefaults(90),
                new Matching(3, 4, CapacitySource.STATIC),
                new Availability(15));
    }
}
