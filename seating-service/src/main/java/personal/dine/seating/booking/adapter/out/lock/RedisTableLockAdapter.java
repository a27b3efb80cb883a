package personal.dine.seating.booking.adapter.out.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import personal.dine.seating.booking.application.port.out.TableLockRepository;

import java.time.Duration;
import java.util.List;

/**
 * Redis Table Lock Adapter
 * SET NX + TTL 분산 락, 대기 시간 동안 폴링 재시도
 *
 * 특징:
 * - 락 값에 소유자 식별자를 저장하고 Lua Script로 본인 소유인 경우만 삭제
 * - 프로세스가 죽어도 TTL에 의해 자동 해제
 *
 * 사용 환경:
 * - 운영 환경 (다중 인스턴스)
 */
@Slf4j
public class RedisTableLockAdapter implements TableLockRepository {

    private static final String LOCK_KEY_PREFIX = "seating:lock:table:";

    private final StringRedisTemplate redisTemplate;
    private final RedisScript<Long> releaseLockScript;
    private final Duration lockTtl;
    private final long retryIntervalMillis;

    public RedisTableLockAdapter(StringRedisTemplate redisTemplate,
                                 RedisScript<Long> releaseLockScript,
                                 Duration lockTtl,
                                 long retryIntervalMillis) {
        this.redisTemplate = redisTemplate;
        this.releaseLockScript = releaseLockScript;
        this.lockTtl = lockTtl;
        this.retryIntervalMillis = retryIntervalMillis;
    }

    @Override
    public boolean tryLock(Long tableId, String owner, Duration wait) {
        String lockKey = buildLockKey(tableId);
        long deadline = System.currentTimeMillis() + wait.toMillis();

        while (true) {
            Boolean acquired = redisTemplate.opsForValue().setIfAbsent(lockKey, owner, lockTtl);
            if (Boolean.TRUE.equals(acquired)) {
                log.debug("[RedisLock] Lock acquired: key={}, owner={}", lockKey, owner);
                return true;
            }
            if (System.currentTimeMillis() >= deadline) {
                log.debug("[RedisLock] Lock wait timed out: key={}, waitMillis={}", lockKey, wait.toMillis());
                return false;
            }
            sleep(tableId);
        }
    }

    @Override
    public void unlock(Long tableId, String owner) {
        String lockKey = buildLockKey(tableId);
        try {
            Long released = redisTemplate.execute(releaseLockScript, List.of(lockKey), owner);
            if (released != null && released > 0) {
                log.debug("[RedisLock] Lock released: key={}", lockKey);
            } else {
                log.warn("[RedisLock] Lock not released (not owner or expired): key={}", lockKey);
            }
        } catch (Exception e) {
            // 해제 실패 시 TTL에 의해 자동 해제되므로 예외를 전파하지 않음
            log.error("[RedisLock] Failed to release lock: key={}", lockKey, e);
        }
    }

    @Override
    public String getStrategyName() {
        return "redis";
    }

    private void sleep(Long tableId) {
        try {
            Thread.sleep(retryIntervalMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for table lock: tableId=" + tableId, e);
        }
    }

    private String buildLockKey(Long tableId) {
        return LOCK_KEY_PREFIX + tableId;
    }
}
