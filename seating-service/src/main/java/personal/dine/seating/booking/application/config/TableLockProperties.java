package personal.dine.seating.booking.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Table Lock 설정 Properties
 *
 * 설정 예시:
 * seating:
 *   lock:
 *     strategy: redis     # local | redis
 *     wait-millis: 3000   # 테이블 락 최대 대기 시간
 *     ttl-seconds: 10     # Redis 락 TTL
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "seating.lock")
public class TableLockProperties {

    /**
     * 락 전략
     * - local: JVM 내 테이블별 ReentrantLock (단일 인스턴스)
     * - redis: Redis SET NX 분산 락 (다중 인스턴스)
     */
    private String strategy = "local";

    /**
     * 락 최대 대기 시간 (밀리초) - 초과 시 해당 후보는 건너뛴다
     */
    private long waitMillis = 3000;

    /**
     * Redis 락 TTL (초)
     * 트랜잭션 최대 실행 시간보다 길어야 한다
     */
    private int ttlSeconds = 10;

    /**
     * Redis 락 재시도 간격 (밀리초)
     */
    private long retryIntervalMillis = 50;
}
