package personal.dine.seating.admin.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.dine.seating.admin.application.service.DemoDataInitService;

import java.util.Map;

/**
 * Admin Demo Data Controller
 *
 * WARNING: 데모/로컬 개발 전용 API입니다.
 * 프로덕션 환경에서는 자동 비활성화됩니다. (@Profile("!prod"))
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/admin/demo-data")
@Profile("!prod")
@RequiredArgsConstructor
public class AdminDemoDataController {

    private final DemoDataInitService demoDataInitService;

    /**
     * 데모 데이터 초기화
     *
     * - 기존 예약, 배정, 테이블, 의자, 영업 시간 삭제
     * - 테이블 9개 (합석 가능 3개 포함)와 최대 인원만큼의 의자 생성
     * - 화~일 17:00-22:00 영업 (월요일 휴무)
     */
    @PostMapping("/init")
    public ResponseEntity<Map<String, Object>> initializeDemoData() {
        log.info("Initializing demo data via API...");

        long startTime = System.currentTimeMillis();
        Map<String, Long> counts = demoDataInitService.initializeDemoData();
        long duration = System.currentTimeMillis() - startTime;

        log.info("Demo data initialized successfully in {}ms - Tables: {}, WeeklyHours: {}",
                duration, counts.get("tables"), counts.get("weeklyHours"));

        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "Demo data initialized successfully",
                "duration_ms", duration,
                "data", counts));
    }
}
