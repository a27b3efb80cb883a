package personal.dine.seating.booking.application.port.out;

import java.time.Duration;

/**
 * Table Lock Repository (Output Port)
 * 테이블 단위 배타 락 - 충돌 재확인과 배정 저장을 원자적으로 묶기 위해 사용
 */
public interface TableLockRepository {

    /**
     * 테이블 락 획득 시도
     * 최대 wait 만큼 대기하고, 실패 시 false 반환
     *
     * @param tableId 테이블 ID
     * @param owner   락 소유자 식별자 (해제 시 검증)
     * @param wait    최대 대기 시간
     * @return true: 획득 성공, false: 대기 시간 초과
     */
    boolean tryLock(Long tableId, String owner, Duration wait);

    /**
     * 테이블 락 해제 (소유자 일치 시에만)
     */
    void unlock(Long tableId, String owner);

    /**
     * 락 전략 이름 (local, redis)
     */
    String getStrategyName();
}
