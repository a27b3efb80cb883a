package personal.dine.common.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * 전역 예외 처리 핸들러
 * BusinessException은 ErrorCode의 HTTP 상태로, 그 외 예외는 500으로 변환한다.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

        @ExceptionHandler(BusinessException.class)
        public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException e) {
                ErrorCode errorCode = e.getErrorCode();
                log.warn("Business exception occurred: code={}, message={}, detail={}",
                                errorCode.getCode(), errorCode.getMessage(), e.getMessage());

                ErrorResponse response = ErrorResponse.of(errorCode, errorCode.getMessage() + " " + e.getMessage());
                return ResponseEntity
                                .status(errorCode.getHttpStatus())
                                .body(response);
        }

        @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
        public ResponseEntity<ErrorResponse> handleOptimisticLockingFailure(ObjectOptimisticLockingFailureException e) {
                log.warn("Concurrent modification detected: entity={}, id={}",
                                e.getPersistentClassName(), e.getIdentifier());

                ErrorResponse response = ErrorResponse.of(
                                ErrorCode.CONCURRENT_MODIFICATION,
                                ErrorCode.CONCURRENT_MODIFICATION.getMessage());
                return ResponseEntity
                                .status(ErrorCode.CONCURRENT_MODIFICATION.getHttpStatus())
                                .body(response);
        }

        @ExceptionHandler(NoResourceFoundException.class)
        public ResponseEntity<ErrorResponse> handleNoResourceFoundException(NoResourceFoundException e) {
                log.warn("Resource not found: {}", e.getResourcePath());

                ErrorResponse response = ErrorResponse.of(
                                ErrorCode.NOT_FOUND,
                                "요청한 URL을 찾을 수 없습니다: " + e.getResourcePath());
                return ResponseEntity
                                .status(ErrorCode.NOT_FOUND.getHttpStatus())
                                .body(response);
        }

        @ExceptionHandler(MethodArgumentNotValidException.class)
        public ResponseEntity<ErrorResponse> handleMethodArgumentNotValidException(MethodArgumentNotValidException e) {
                log.warn("Validation failed: {}", e.getMessage());
                String message = "입력값이 유효하지 않습니다.";
                if (!e.getBindingResult().getAllErrors().isEmpty()) {
                        message = e.getBindingResult().getAllErrors().get(0).getDefaultMessage();
                }
                ErrorResponse response = ErrorResponse.of(ErrorCode.INVALID_INPUT, message);
                return ResponseEntity.status(ErrorCode.INVALID_INPUT.getHttpStatus()).body(response);
        }

        @ExceptionHandler(HttpMessageNotReadableException.class)
        public ResponseEntity<ErrorResponse> handleHttpMessageNotReadableException(HttpMessageNotReadableException e) {
                log.warn("Malformed request body: {}", e.getMessage());
                ErrorResponse response = ErrorResponse.of(ErrorCode.INVALID_INPUT, "요청 본문을 해석할 수 없습니다.");
                return ResponseEntity.status(ErrorCode.INVALID_INPUT.getHttpStatus()).body(response);
        }

        @ExceptionHandler(MethodArgumentTypeMismatchException.class)
        public ResponseEntity<ErrorResponse> handleMethodArgumentTypeMismatchException(
                        MethodArgumentTypeMismatchException e) {
                log.warn("Type mismatch: parameter={}, value={}", e.getName(), e.getValue());
                ErrorResponse response = ErrorResponse.of(ErrorCode.INVALID_INPUT,
                                "파라미터 형식이 올바르지 않습니다: " + e.getName());
                return ResponseEntity.status(ErrorCode.INVALID_INPUT.getHttpStatus()).body(response);
        }

        @ExceptionHandler(jakarta.validation.ConstraintViolationException.class)
        public ResponseEntity<ErrorResponse> handleConstraintViolationException(
                        jakarta.validation.ConstraintViolationException e) {
                log.warn("Constraint violation: {}", e.getMessage());
                ErrorResponse response = ErrorResponse.of(ErrorCode.INVALID_INPUT, e.getMessage());
                return ResponseEntity.status(ErrorCode.INVALID_INPUT.getHttpStatus()).body(response);
        }

        @ExceptionHandler(MissingServletRequestParameterException.class)
        public ResponseEntity<ErrorResponse> handleMissingServletRequestParameterException(
                        MissingServletRequestParameterException e) {
                log.warn("Missing parameter: {}", e.getParameterName());
                ErrorResponse response = ErrorResponse.of(ErrorCode.INVALID_INPUT,
                                "필수 파라미터가 누락되었습니다: " + e.getParameterName());
                return ResponseEntity.status(ErrorCode.INVALID_INPUT.getHttpStatus()).body(response);
        }

        @ExceptionHandler(Exception.class)
        public ResponseEntity<ErrorResponse> handleException(Exception e) {
                log.error("Unexpected exception occurred", e);

                ErrorResponse response = ErrorResponse.of(
                                ErrorCode.INTERNAL_SERVER_ERROR,
                                ErrorCode.INTERNAL_SERVER_ERROR.getMessage());
                return ResponseEntity
                                .status(ErrorCode.INTERNAL_SERVER_ERROR.getHttpStatus())
                                .body(response);
        }
}
