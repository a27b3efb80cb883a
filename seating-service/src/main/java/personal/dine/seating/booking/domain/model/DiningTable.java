package personal.dine.seating.booking.domain.model;

import personal.dine.common.exception.BusinessException;
import personal.dine.common.exception.ErrorCode;

import java.util.Comparator;

/**
 * Dining Table Domain Model
 * 테이블 도메인 모델 (불변) - 수용 인원 범위와 합석(결합) 가능 여부를 가진다
 */
public record DiningTable(
        Long id,
        String tableNumber,
        int minCapacity,
        int maxCapacity,
        boolean shared,
        String location
) {
    /**
     * 테이블 번호 정렬: 둘 다 숫자면 숫자 비교, 아니면 문자열 비교
     */
    public static final Comparator<String> TABLE_NUMBER_ORDER = (a, b) -> {
        if (isNumeric(a) && isNumeric(b)) {
            int byValue = Long.compare(Long.parseLong(a), Long.parseLong(b));
            if (byValue != 0) {
                return byValue;
            }
        }
        return a.compareTo(b);
    };

    public static final Comparator<DiningTable> DISPLAY_ORDER =
            Comparator.comparing(DiningTable::tableNumber, TABLE_NUMBER_ORDER)
                    .thenComparing(DiningTable::id, Comparator.nullsLast(Comparator.naturalOrder()));

    public DiningTable {
        if (tableNumber == null || tableNumber.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Table number cannot be null or blank");
        }
        if (tableNumber.length() > 10) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Table number too long: tableNumber=%s", tableNumber));
        }
        if (minCapacity <= 0 || maxCapacity <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Table capacity must be positive: min=%d, max=%d", minCapacity, maxCapacity));
        }
        if (minCapacity > maxCapacity) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Min capacity exceeds max capacity: min=%d, max=%d", minCapacity, maxCapacity));
        }
    }

    /**
     * 단독 배정 가능 여부 (min <= party <= max)
     */
    public boolean seats(int partySize) {
        return minCapacity <= partySize && partySize <= maxCapacity;
    }

    /**
     * 실제 배치된 의자 수를 최대 수용 인원으로 사용한 테이블
     * 의자 수가 최소 인원보다 적으면 배정 대상에서 제외되므로 null 반환
     */
    public DiningTable withSeatsLimitedTo(long assignedChairs) {
        if (assignedChairs < minCapacity) {
            return null;
        }
        int effectiveMax = (int) Math.min(maxCapacity, assignedChairs);
        return new DiningTable(id, tableNumber, minCapacity, effectiveMax, shared, location);
    }

    private static boolean isNumeric(String value) {
        if (value.isEmpty() || value.length() > 18) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
