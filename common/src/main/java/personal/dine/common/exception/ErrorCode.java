package personal.dine.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code와 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (1xxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "잘못된 입력값입니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C004", "요청한 리소스를 찾을 수 없습니다."),
    CONFLICT(HttpStatus.CONFLICT, "C005", "리소스 충돌이 발생했습니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C006", "서버 내부 오류가 발생했습니다."),
    CONCURRENT_MODIFICATION(HttpStatus.CONFLICT, "C007", "다른 요청에 의해 이미 변경되었습니다. 다시 시도해 주세요."),

    // Customer Domain (2xxx)
    CUSTOMER_NOT_FOUND(HttpStatus.NOT_FOUND, "U001", "고객을 찾을 수 없습니다."),

    // Seating Domain (3xxx)
    RESTAURANT_CLOSED(HttpStatus.UNPROCESSABLE_ENTITY, "S001", "영업 시간이 아닙니다."),
    NO_TABLE_AVAILABLE(HttpStatus.CONFLICT, "S002", "예약 가능한 테이블이 없습니다."),
    INVALID_STATUS_TRANSITION(HttpStatus.CONFLICT, "S003", "허용되지 않는 예약 상태 변경입니다."),
    RESERVATION_NOT_FOUND(HttpStatus.NOT_FOUND, "S004", "예약을 찾을 수 없습니다."),
    TABLE_NOT_FOUND(HttpStatus.NOT_FOUND, "S005", "테이블을 찾을 수 없습니다."),
    RESERVATION_NOT_MODIFIABLE(HttpStatus.CONFLICT, "S006", "현재 상태에서는 예약을 변경할 수 없습니다."),

    // Hours Domain (4xxx)
    SPECIAL_HOURS_NOT_FOUND(HttpStatus.NOT_FOUND, "H001", "특별 영업시간을 찾을 수 없습니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
