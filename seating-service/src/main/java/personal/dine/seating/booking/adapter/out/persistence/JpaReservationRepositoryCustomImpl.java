package personal.dine.seating.booking.adapter.out.persistence;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;
import org.springframework.stereotype.Repository;
import personal.dine.seating.booking.application.port.in.ReservationSearchCondition;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reservation Search (JPQL)
 * 지정된 조건만 WHERE 절에 추가하고 offset/limit 으로 페이지를 자른다
 */
@Repository
public class JpaReservationRepositoryCustomImpl implements JpaReservationRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<ReservationEntity> search(ReservationSearchCondition condition) {
        Objects.requireNonNull(condition, "condition must not be null");

        List<String> whereClauses = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();

        if (condition.dateFrom() != null) {
            whereClauses.add("r.reservationDate >= :dateFrom");
            params.put("dateFrom", condition.dateFrom());
        }
        if (condition.dateTo() != null) {
            whereClauses.add("r.reservationDate <= :dateTo");
            params.put("dateTo", condition.dateTo());
        }
        if (condition.customerId() != null) {
            whereClauses.add("r.customerId = :customerId");
            params.put("customerId", condition.customerId());
        }
        if (condition.status() != null) {
            whereClauses.add("r.status = :status");
            params.put("status", condition.status());
        }
        if (condition.tableId() != null) {
            whereClauses.add("""
                    EXISTS (SELECT a.id FROM TableAssignmentEntity a
                            WHERE a.reservationId = r.id AND a.tableId = :tableId)""");
            params.put("tableId", condition.tableId());
        }

        String whereJpql = whereClauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", whereClauses);
        String jpql = "SELECT r FROM ReservationEntity r" + whereJpql
                + " ORDER BY r.reservationDate ASC, r.startTime ASC, r.id ASC";

        TypedQuery<ReservationEntity> query = entityManager.createQuery(jpql, ReservationEntity.class);
        params.forEach(query::setParameter);
        return query
                .setFirstResult(condition.offset())
                .setMaxResults(condition.limit())
                .getResultList();
    }
}
