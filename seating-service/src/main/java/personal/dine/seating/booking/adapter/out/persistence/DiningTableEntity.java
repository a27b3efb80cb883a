package personal.dine.seating.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.dine.common.jpa.AbstractTimestampedEntity;
import personal.dine.seating.booking.domain.model.DiningTable;

/**
 * Dining Table JPA Entity
 * 테이블(플로어 플랜) 매핑 - 엔진에서는 조회만 한다
 */
@Entity
@Table(name = "dining_tables",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_table_number",
                columnNames = {"table_number"}
        ))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DiningTableEntity extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "table_number", nullable = false, length = 10)
    private String tableNumber;

    @Column(name = "min_capacity", nullable = false)
    private int minCapacity;

    @Column(name = "max_capacity", nullable = false)
    private int maxCapacity;

    @Column(name = "is_shared", nullable = false)
    private boolean shared;

    @Column(length = 50)
    private String location;

    public static DiningTableEntity fromDomain(DiningTable table) {
        DiningTableEntity entity = new DiningTableEntity();
        entity.id = table.id();
        entity.tableNumber = table.tableNumber();
        entity.minCapacity = table.minCapacity();
        entity.maxCapacity = table.maxCapacity();
        entity.shared = table.shared();
        entity.location = table.location();
        return entity;
    }

    public DiningTable toDomain() {
        return new DiningTable(id, tableNumber, minCapacity, maxCapacity, shared, location);
    }
}
