package personal.dine.seating.booking.application.port.in;

import personal.dine.seating.booking.domain.model.ReservationWithTables;

/**
 * Create Reservation UseCase (Input Port)
 * 예약 생성 및 테이블 자동 배정 유스케이스
 */
public interface CreateReservationUseCase {

    /**
     * 예약 생성 + 테이블 배정
     * 후보 테이블(조합)을 순위대로 시도하여 처음 성공한 조합에 PENDING 상태로 저장
     *
     * @param command 예약 커맨드
     * @return 저장된 예약과 배정된 테이블
     * @throws personal.dine.seating.customer.domain.exception.CustomerNotFoundException 고객을 찾을 수 없을 때
     * @throws personal.dine.seating.booking.domain.exception.RestaurantClosedException 휴무일 또는 영업 시간 밖일 때
     * @throws personal.dine.seating.booking.domain.exception.NoTableAvailableException 배정 가능한 후보가 없을 때
     */
    ReservationWithTables createAndAssign(CreateReservationCommand command);
}
