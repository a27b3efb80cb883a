package personal.dine.seating.hours.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.dine.common.jpa.AbstractTimestampedEntity;
import personal.dine.seating.hours.domain.model.WeeklyHours;

import java.time.LocalTime;

/**
 * Weekly Hours JPA Entity
 * 요일별 영업 시간 매핑 (day_of_week: 0 = 월요일)
 */
@Entity
@Table(name = "restaurant_hours",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_day_of_week",
                columnNames = {"day_of_week"}
        ))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class WeeklyHoursEntity extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "day_of_week", nullable = false)
    private int dayOfWeek;

    @Column(name = "open_time", nullable = false)
    private LocalTime openTime;

    @Column(name = "close_time", nullable = false)
    private LocalTime closeTime;

    @Column(name = "last_reservation_time", nullable = false)
    private LocalTime lastReservationTime;

    public static WeeklyHoursEntity fromDomain(WeeklyHours hours) {
        WeeklyHoursEntity entity = new WeeklyHoursEntity();
        entity.dayOfWeek = hours.dayOfWeek();
        entity.apply(hours);
        return entity;
    }

    public WeeklyHours toDomain() {
        return new WeeklyHours(id, dayOfWeek, openTime, closeTime, lastReservationTime);
    }

    public void apply(WeeklyHours hours) {
        this.openTime = hours.openTime();
        this.closeTime = hours.closeTime();
        this.lastReservationTime = hours.lastReservationTime();
    }
}
