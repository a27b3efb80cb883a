package personal.dine.seating.booking.adapter.out.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import personal.dine.seating.booking.application.config.TableLockProperties;
import personal.dine.seating.booking.application.port.out.TableLockRepository;

import java.time.Duration;

/**
 * Table Lock Adapter Factory
 * 설정에 따라 적절한 TableLockRepository 구현체를 생성
 *
 * 설정:
 * - seating.lock.strategy=local → LocalTableLockAdapter (기본값)
 * - seating.lock.strategy=redis → RedisTableLockAdapter
 */
@Slf4j
@Configuration
public class TableLockAdapterFactory {

    private static final String RELEASE_LOCK_SCRIPT = "scripts/release_lock.lua";

    @Bean
    @ConditionalOnProperty(name = "seating.lock.strategy", havingValue = "local", matchIfMissing = true)
    public TableLockRepository localTableLockAdapter() {
        log.info("Creating LocalTableLockAdapter - in-process table locks");
        return new LocalTableLockAdapter();
    }

    @Bean
    @ConditionalOnProperty(name = "seating.lock.strategy", havingValue = "redis")
    public TableLockRepository redisTableLockAdapter(
            StringRedisTemplate redisTemplate,
            TableLockProperties properties) {

        log.info("Creating RedisTableLockAdapter - TTL: {}s, retry interval: {}ms",
                properties.getTtlSeconds(), properties.getRetryIntervalMillis());
        return new RedisTableLockAdapter(
                redisTemplate,
                RedisScript.of(new ClassPathResource(RELEASE_LOCK_SCRIPT), Long.class),
                Duration.ofSeconds(properties.getTtlSeconds()),
                properties.getRetryIntervalMillis());
    }
}
