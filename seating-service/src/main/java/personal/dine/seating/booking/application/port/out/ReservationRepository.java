package personal.dine.seating.booking.application.port.out;

import personal.dine.seating.booking.application.port.in.ReservationSearchCondition;
import personal.dine.seating.booking.domain.model.Reservation;

import java.util.List;
import java.util.Optional;

/**
 * Reservation Repository (Output Port)
 * 예약 저장소 인터페이스
 */
public interface ReservationRepository {

    /**
     * 예약 저장
     * 기존 예약은 version이 일치할 때만 갱신된다 (불일치 시 낙관적 락 예외)
     *
     * @param reservation 예약 정보
     * @return 저장된 예약 정보 (ID, version 포함)
     */
    Reservation save(Reservation reservation);

    Optional<Reservation> findById(Long reservationId);

    /**
     * 조건 검색 (날짜, 시작 시각, ID 순으로 offset부터 limit건)
     */
    List<Reservation> search(ReservationSearchCondition condition);

    void deleteById(Long reservationId);
}
