package personal.dine.seating.booking.adapter.out.lock;

import lombok.extern.slf4j.Slf4j;
import personal.dine.seating.booking.application.port.out.TableLockRepository;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Local Table Lock Adapter
 * JVM 내부 테이블별 공정(fair) ReentrantLock
 *
 * 사용 환경:
 * - 로컬 개발, 단일 인스턴스 운영
 * - 단위/동시성 테스트
 *
 * 주의: 락은 스레드 소유이므로 획득한 스레드에서 해제해야 한다
 */
@Slf4j
public class LocalTableLockAdapter implements TableLockRepository {

    private final Map<Long, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Map<Long, String> owners = new ConcurrentHashMap<>();

    @Override
    public boolean tryLock(Long tableId, String owner, Duration wait) {
        ReentrantLock lock = locks.computeIfAbsent(tableId, id -> new ReentrantLock(true));
        try {
            boolean acquired = lock.tryLock(wait.toMillis(), TimeUnit.MILLISECONDS);
            if (acquired) {
                owners.put(tableId, owner);
                log.debug("[LocalLock] Lock acquired: tableId={}, owner={}", tableId, owner);
            } else {
                log.debug("[LocalLock] Lock wait timed out: tableId={}, waitMillis={}", tableId, wait.toMillis());
            }
            return acquired;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for table lock: tableId=" + tableId, e);
        }
    }

    @Override
    public void unlock(Long tableId, String owner) {
        ReentrantLock lock = locks.get(tableId);
        if (lock == null || !lock.isHeldByCurrentThread() || !owner.equals(owners.get(tableId))) {
            log.warn("[LocalLock] Lock not released (not owner): tableId={}, owner={}", tableId, owner);
            return;
        }
        // 재진입 마지막 해제 시에만 소유자 정보 삭제
        if (lock.getHoldCount() == 1) {
            owners.remove(tableId);
        }
        lock.unlock();
        log.debug("[LocalLock] Lock released: tableId={}", tableId);
    }

    @Override
    public String getStrategyName() {
        return "local";
    }
}
