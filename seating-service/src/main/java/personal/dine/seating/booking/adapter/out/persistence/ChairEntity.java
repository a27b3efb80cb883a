package personal.dine.seating.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.dine.common.jpa.AbstractTimestampedEntity;

/**
 * Chair JPA Entity
 * 테이블에 배치된 의자 (capacity-source=CHAIRS 일 때만 사용)
 */
@Entity
@Table(name = "chairs", indexes = @Index(name = "idx_chair_table", columnList = "table_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ChairEntity extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "table_id", nullable = false)
    private Long tableId;

    @Column(name = "is_assigned", nullable = false)
    private boolean assigned;

    public static ChairEntity of(Long tableId, boolean assigned) {
        ChairEntity entity = new ChairEntity();
        entity.tableId = tableId;
        entity.assigned = assigned;
        return entity;
    }
}
