package personal.dine.seating.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.dine.common.dto.ApiResponse;
import personal.dine.common.dto.HealthCheckResponse;
import personal.dine.common.health.HealthCheckService;

import javax.sql.DataSource;

/**
 * Health Check API Controller
 * 데이터베이스와 Redis 연결 상태를 확인하는 엔드포인트
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class HealthCheckController {

    private final DataSource dataSource;
    private final HealthCheckService healthCheckService;

    @GetMapping("/health")
    public ResponseEntity<ApiResponse<HealthCheckResponse>> healthCheck() {
        log.debug("Health check requested");

        HealthCheckResponse data = new HealthCheckResponse(
                healthCheckService.checkDatabase(dataSource),
                healthCheckService.checkRedis()
        );

        if (data.allHealthy()) {
            return ResponseEntity.ok(ApiResponse.success("Application is healthy", data));
        }
        return ResponseEntity.ok(ApiResponse.error("Some components are unhealthy", data));
    }
}
