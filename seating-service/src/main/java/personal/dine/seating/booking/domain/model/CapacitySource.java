package personal.dine.seating.booking.domain.model;

/**
 * 테이블 최대 수용 인원 산정 기준
 */
public enum CapacitySource {
    /** 테이블에 정의된 max_capacity 사용 */
    STATIC,
    /** 배치된(assigned) 의자 수를 최대 인원으로 사용 */
    CHAIRS
}
