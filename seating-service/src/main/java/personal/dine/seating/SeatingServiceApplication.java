package personal.dine.seating;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import personal.dine.seating.booking.application.config.SeatingProperties;

/**
 * Seating Service Application
 * 영업 시간, 테이블 배정, 예약 상태 관리를 담당하는 좌석 배정 서비스
 */
@EnableConfigurationProperties(SeatingProperties.class)
@SpringBootApplication(
    scanBasePackages = {
        "personal.dine.seating",
        "personal.dine.common"  // common 모듈의 GlobalExceptionHandler 등을 스캔
    }
)
public class SeatingServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(SeatingServiceApplication.class, args);
    }
}
