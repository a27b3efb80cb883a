package personal.dine.common.exception;

import java.time.LocalDateTime;

/**
 * 에러 응답 포맷
 *
 * @param code      에러 코드 (예: "S002")
 * @param message   사용자에게 노출할 메시지
 * @param timestamp 발생 시각
 */
public record ErrorResponse(
        String code,
        String message,
        LocalDateTime timestamp
) {
    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return new ErrorResponse(errorCode.getCode(), message, LocalDateTime.now());
    }
}
