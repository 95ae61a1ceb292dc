package com.ballotbox.backend.global;

import org.springframework.http.HttpStatus;

import lombok.Getter;

/**
 * 비즈니스 로직에서 사용하는 커스텀 예외 (중앙화된 ErrorCode 기반)
 *
 * - 서비스/도메인 정책 위반을 ErrorCode로 표현한다.
 *   => throw new ApiException(ErrorCode.REFRESH_REUSED);
 * - 전역 핸들러(GlobalExceptionHandler) / refresh 전용 핸들러(RefreshCookieExceptionHandler)가
 *   이 예외를 ApiError로 직렬화해 응답 포맷을 고정한다.
 * - errorCode는 내부 사유(로그/감사용), code는 외부 노출용이다.
 */
@Getter
public class ApiException extends RuntimeException {

    private final ErrorCode errorCode; // ex: ErrorCode.REFRESH_REUSED (내부 사유)
    private final HttpStatus status;   // ex: HttpStatus.UNAUTHORIZED
    private final String code;         // ex: "REFRESH_INVALID" (외부 노출)

    public ApiException(ErrorCode errorCode) {
        // super(...)는 첫 줄이어야 해서 errorCode null 검사보다 앞에 둘 수밖에 없음.
        super(errorCode == null ? null : errorCode.defaultMessage());

        if (errorCode == null)
            throw new IllegalArgumentException("ErrorCode must not be null");

        this.errorCode = errorCode;
        this.status = errorCode.status();
        this.code = errorCode.code();
    }
}
