package personal.dine.seating.booking.adapter.out.persistence;

import personal.dine.seating.booking.application.port.in.ReservationSearchCondition;

import java.util.List;

/**
 * 조건 조합이 가변적인 예약 검색 (동적 JPQL)
 */
public interface JpaReservationRepositoryCustom {

    List<ReservationEntity> search(ReservationSearchCondition condition);
}
