package personal.dine.seating.hours.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.dine.common.jpa.AbstractTimestampedEntity;
import personal.dine.seating.hours.domain.model.SpecialHours;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Special Hours JPA Entity
 * 특정 날짜 영업 시간 매핑
 */
@Entity
@Table(name = "special_hours",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_special_date",
                columnNames = {"special_date"}
        ))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SpecialHoursEntity extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "special_date", nullable = false)
    private LocalDate date;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "is_closed", nullable = false)
    private boolean closed;

    @Column(name = "open_time")
    private LocalTime openTime;

    @Column(name = "close_time")
    private LocalTime closeTime;

    @Column(name = "last_reservation_time")
    private LocalTime lastReservationTime;

    public static SpecialHoursEntity fromDomain(SpecialHours hours) {
        SpecialHoursEntity entity = new SpecialHoursEntity();
        entity.date = hours.date();
        entity.apply(hours);
        return entity;
    }

    public SpecialHours toDomain() {
        return new SpecialHours(id, date, name, description, closed, openTime, closeTime, lastReservationTime);
    }

    public void apply(SpecialHours hours) {
        this.name = hours.name();
        this.description = hours.description();
        this.closed = hours.closed();
        this.openTime = hours.openTime();
        this.closeTime = hours.closeTime();
        this.lastReservationTime = hours.lastReservationTime();
    }
}
