package personal.dine.seating.admin.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

/**
 * Demo Data Initialization Service
 *
 * 로컬 개발/데모용 플로어 플랜과 영업 시간 생성
 *
 * WARNING: 기존 예약/테이블/영업 시간 데이터를 모두 삭제한다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DemoDataInitService {

    /**
     * {tableNumber, min, max, shared, location}
     */
    private static final List<Object[]> DEMO_TABLES = List.of(
            new Object[]{"1", 1, 2, false, "window"},
            new Object[]{"2", 1, 2, false, "window"},
            new Object[]{"3", 2, 4, false, "main"},
            new Object[]{"4", 2, 4, false, "main"},
            new Object[]{"5", 4, 6, false, "main"},
            new Object[]{"6", 6, 8, false, "private"},
            new Object[]{"7", 2, 4, true, "terrace"},
            new Object[]{"8", 2, 4, true, "terrace"},
            new Object[]{"9", 2, 4, true, "terrace"}
    );

    private final JdbcTemplate jdbcTemplate;

    @Transactional
    public Map<String, Long> initializeDemoData() {
        log.info("Starting demo data initialization...");

        cleanupExistingData();
        long tables = createTables();
        long chairs = createChairs();
        long weeklyHours = createWeeklyHours();

        log.info("Demo data initialization completed - Tables: {}, Chairs: {}, WeeklyHours: {}",
                tables, chairs, weeklyHours);

        return Map.of(
                "tables", tables,
                "chairs", chairs,
                "weeklyHours", weeklyHours
        );
    }

    /**
     * 참조 관계 역순으로 삭제
     */
    private void cleanupExistingData() {
        log.debug("Cleaning up existing data...");

        jdbcTemplate.update("DELETE FROM table_assignments");
        jdbcTemplate.update("DELETE FROM reservations");
        jdbcTemplate.update("DELETE FROM chairs");
        jdbcTemplate.update("DELETE FROM dining_tables");
        jdbcTemplate.update("DELETE FROM special_hours");
        jdbcTemplate.update("DELETE FROM restaurant_hours");

        log.debug("Existing data cleaned up");
    }

    private long createTables() {
        String sql = "INSERT INTO dining_tables (table_number, min_capacity, max_capacity, is_shared, location, created_at, updated_at) "
                + "VALUES (?, ?, ?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)";
        jdbcTemplate.batchUpdate(sql, DEMO_TABLES);
        return DEMO_TABLES.size();
    }

    /**
     * 테이블마다 최대 인원만큼 의자 배치
     */
    private long createChairs() {
        return jdbcTemplate.update(
                "INSERT INTO chairs (table_id, is_assigned, created_at, updated_at) "
                        + "SELECT t.id, TRUE, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP "
                        + "FROM dining_tables t "
                        + "JOIN (SELECT 1 AS n UNION ALL SELECT 2 UNION ALL SELECT 3 UNION ALL SELECT 4 "
                        + "      UNION ALL SELECT 5 UNION ALL SELECT 6 UNION ALL SELECT 7 UNION ALL SELECT 8) seq "
                        + "ON seq.n <= t.max_capacity");
    }

    /**
     * 화~일 17:00-22:00 (마지막 예약 20:30), 월요일 휴무
     */
    private long createWeeklyHours() {
        String sql = "INSERT INTO restaurant_hours (day_of_week, open_time, close_time, last_reservation_time, created_at, updated_at) "
                + "VALUES (?, '17:00:00', '22:00:00', '20:30:00', CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)";
        long count = 0;
        for (int day = 1; day <= 6; day++) {
            jdbcTemplate.update(sql, day);
            count++;
        }
        return count;
    }
}
