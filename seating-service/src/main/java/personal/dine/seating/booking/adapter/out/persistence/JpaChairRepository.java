package personal.dine.seating.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

/**
 * Spring Data JPA Repository for Chair
 */
public interface JpaChairRepository extends JpaRepository<ChairEntity, Long> {

    /**
     * 테이블별 배치된 의자 수 [tableId, count]
     */
    @Query("SELECT c.tableId, COUNT(c) FROM ChairEntity c WHERE c.assigned = true GROUP BY c.tableId")
    List<Object[]> countAssignedGroupByTable();
}
