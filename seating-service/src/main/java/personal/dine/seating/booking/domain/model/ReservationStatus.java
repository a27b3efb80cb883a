package personal.dine.seating.booking.domain.model;

import personal.dine.common.exception.BusinessException;
import personal.dine.common.exception.ErrorCode;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reservation Status
 * 예약 상태와 허용되는 전이 테이블
 *
 * PENDING → CONFIRMED | CANCELLED
 * CONFIRMED → SEATED | CANCELLED | NO_SHOW
 * SEATED → COMPLETED | NO_SHOW
 * COMPLETED, CANCELLED, NO_SHOW: 종료 상태
 */
public enum ReservationStatus {
    PENDING,
    CONFIRMED,
    SEATED,
    COMPLETED,
    CANCELLED,
    NO_SHOW;

    private static final Map<ReservationStatus, Set<ReservationStatus>> TRANSITIONS = Map.of(
            PENDING, EnumSet.of(CONFIRMED, CANCELLED),
            CONFIRMED, EnumSet.of(SEATED, CANCELLED, NO_SHOW),
            SEATED, EnumSet.of(COMPLETED, NO_SHOW),
            COMPLETED, EnumSet.noneOf(ReservationStatus.class),
            CANCELLED, EnumSet.noneOf(ReservationStatus.class),
            NO_SHOW, EnumSet.noneOf(ReservationStatus.class)
    );

    /**
     * 테이블을 점유하는 상태
     */
    public static final Set<ReservationStatus> OCCUPYING = EnumSet.of(PENDING, CONFIRMED, SEATED);

    public boolean canTransitionTo(ReservationStatus target) {
        return target != null && TRANSITIONS.get(this).contains(target);
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    public boolean occupiesTables() {
        return OCCUPYING.contains(this);
    }

    /**
     * 진입 시 테이블 배정을 해제(released)하는 상태
     */
    public boolean releasesTables() {
        return this == CANCELLED || this == NO_SHOW;
    }

    public boolean isReschedulable() {
        return this == PENDING || this == CONFIRMED;
    }

    /**
     * API 입력 파싱 ("confirmed", "no_show", "no-show" 허용)
     */
    public static ReservationStatus from(String value) {
        if (value == null || value.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Status cannot be null or blank");
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (ReservationStatus status : values()) {
            if (status.name().equals(normalized)) {
                return status;
            }
        }
        throw new BusinessException(ErrorCode.INVALID_INPUT, "Unknown reservation status: " + value);
    }
}
