package personal.dine.seating.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import personal.dine.common.jpa.AbstractTimestampedEntity;
import personal.dine.seating.booking.domain.model.Reservation;
import personal.dine.seating.booking.domain.model.ReservationStatus;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Objects;

/**
 * Reservation JPA Entity
 * 예약 테이블 매핑 (낙관적 락 version)
 */
@Entity
@Table(name = "reservations",
        indexes = {
                @Index(name = "idx_reservation_date_status", columnList = "reservation_date, status"),
                @Index(name = "idx_reservation_customer", columnList = "customer_id")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ReservationEntity extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "customer_id", nullable = false)
    private Long customerId;

    @Column(name = "party_size", nullable = false)
    private int partySize;

    @Column(name = "reservation_date", nullable = false)
    private LocalDate reservationDate;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "duration_minutes", nullable = false)
    private int durationMinutes;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ReservationStatus status;

    @Version
    private Long version;

    /**
     * 신규 예약 엔티티 생성
     */
    public static ReservationEntity fromDomain(Reservation reservation) {
        ReservationEntity entity = new ReservationEntity();
        entity.customerId = reservation.customerId();
        entity.apply(reservation);
        return entity;
    }

    public Reservation toDomain() {
        return new Reservation(id, customerId, partySize, reservationDate, startTime, durationMinutes,
                notes, status, version, getCreatedAt());
    }

    /**
     * 변경 가능한 필드 반영 (영속성 컨텍스트 내에서 사용)
     */
    public void apply(Reservation reservation) {
        this.partySize = reservation.partySize();
        this.reservationDate = reservation.reservationDate();
        this.startTime = reservation.startTime();
        this.durationMinutes = reservation.durationMinutes();
        this.notes = reservation.notes();
        this.status = reservation.status();
    }

    /**
     * 도메인 모델이 읽은 시점 이후 다른 트랜잭션이 변경했으면 예외
     */
    public void verifyVersion(Long expectedVersion) {
        if (expectedVersion != null && !Objects.equals(version, expectedVersion)) {
            throw new ObjectOptimisticLockingFailureException(ReservationEntity.class, id);
        }
    }
}
