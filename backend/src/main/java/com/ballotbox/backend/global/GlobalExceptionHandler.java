package com.ballotbox.backend.global;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;

/**
 * 전역 예외 처리기
 * - 컨트롤러/서비스에서 발생한 예외를 가로채어 공통 응답(ApiError)으로 변환한다.
 * - HTTP 상태코드도 ErrorCode/ApiException에서만 결정되게 한다.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * ApiException 전용 핸들러
     *
     * - 비즈니스 로직이 의도적으로 던진 예외를 처리한다.
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiError> handleApiException(ApiException e) {
        return ResponseEntity.status(e.getStatus()).body(ApiError.from(e));
    }

    /**
     * @RequestBody + @Valid 검증 실패
     *
     * - 응답은 VALIDATION_ERROR로 통일하고, 필드 단위 상세는 details로 내려준다.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleMethodArgumentNotValid(MethodArgumentNotValidException e) {

        List<FieldViolation> violations = e.getBindingResult().getFieldErrors().stream()
                .map(fe -> new FieldViolation(fe.getField(), fe.getDefaultMessage()))
                .toList();

        violations.forEach(v -> log.warn("요청 검증 실패: field={}, message={}", v.field(), v.message()));

        return ResponseEntity
                .status(ErrorCode.VALIDATION_ERROR.status())
                .body(ApiError.of(ErrorCode.VALIDATION_ERROR, violations));
    }

    /**
     * @RequestParam / @PathVariable / @Validated 검증 실패(제약 위반)
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(ConstraintViolationException e) {

        List<FieldViolation> violations = e.getConstraintViolations().stream()
                .map(v -> new FieldViolation(String.valueOf(v.getPropertyPath()), v.getMessage()))
                .toList();

        violations.forEach(v -> log.warn("요청 검증 실패: path={}, message={}", v.field(), v.message()));

        return ResponseEntity
                .status(ErrorCode.VALIDATION_ERROR.status())
                .body(ApiError.of(ErrorCode.VALIDATION_ERROR, violations));
    }

    // JSON 파싱 불가 (깨진 바디, enum에 없는 값 등)
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleNotReadable(HttpMessageNotReadableException e) {
        log.warn("요청 바디 파싱 실패: {}", e.getMostSpecificCause().getMessage());
        return ResponseEntity
                .status(ErrorCode.VALIDATION_ERROR.status())
                .body(ApiError.of(ErrorCode.VALIDATION_ERROR));
    }

    /**
     * 처리되지 않은 예외(버그/장애) - 내부 정보는 응답에 절대 싣지 않는다.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnhandled(Exception e) {
        log.error("처리되지 않은 예외", e);
        return ResponseEntity
                .status(ErrorCode.INTERNAL_ERROR.status())
                .body(ApiError.of(ErrorCode.INTERNAL_ERROR));
    }

    public record FieldViolation(String field, String message) {}

}
