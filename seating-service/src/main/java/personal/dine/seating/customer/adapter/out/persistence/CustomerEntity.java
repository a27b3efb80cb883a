package personal.dine.seating.customer.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.dine.common.jpa.AbstractTimestampedEntity;
import personal.dine.seating.customer.domain.model.Customer;

/**
 * Customer JPA Entity
 */
@Entity
@Table(name = "customers")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CustomerEntity extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 100)
    private String email;

    @Column(length = 20)
    private String phone;

    @Column(columnDefinition = "TEXT")
    private String notes;

    public static CustomerEntity fromDomain(Customer customer) {
        CustomerEntity entity = new CustomerEntity();
        entity.id = customer.id();
        entity.name = customer.name();
        entity.email = customer.email();
        entity.phone = customer.phone();
        entity.notes = customer.notes();
        return entity;
    }

    public Customer toDomain() {
        return new Customer(id, name, email, phone, notes);
    }
}
