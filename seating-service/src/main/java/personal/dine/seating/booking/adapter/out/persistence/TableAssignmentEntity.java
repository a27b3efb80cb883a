package personal.dine.seating.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.dine.common.jpa.AbstractTimestampedEntity;
import personal.dine.seating.booking.domain.model.TableAssignment;

import java.time.LocalDateTime;

/**
 * Table Assignment JPA Entity
 * 예약-테이블 연결 매핑
 */
@Entity
@Table(name = "table_assignments",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_reservation_table",
                columnNames = {"reservation_id", "table_id"}
        ),
        indexes = @Index(name = "idx_assignment_table", columnList = "table_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TableAssignmentEntity extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "reservation_id", nullable = false)
    private Long reservationId;

    @Column(name = "table_id", nullable = false)
    private Long tableId;

    @Column(name = "released_at")
    private LocalDateTime releasedAt;

    public static TableAssignmentEntity fromDomain(TableAssignment assignment) {
        TableAssignmentEntity entity = new TableAssignmentEntity();
        entity.id = assignment.id();
        entity.reservationId = assignment.reservationId();
        entity.tableId = assignment.tableId();
        entity.releasedAt = assignment.releasedAt();
        return entity;
    }

    public TableAssignment toDomain() {
        return new TableAssignment(id, reservationId, tableId, releasedAt);
    }
}
