package personal.dine.seating.booking.application.port.in;

import java.time.LocalTime;
import java.util.List;

/**
 * Check Availability UseCase (Input Port)
 * 예약 가능한 시작 시각 조회 유스케이스
 */
public interface CheckAvailabilityUseCase {

    /**
     * @return 예약 가능한 시작 시각 (오름차순, 휴무일이면 빈 목록)
     */
    List<LocalTime> checkAvailability(CheckAvailabilityQuery query);
}
