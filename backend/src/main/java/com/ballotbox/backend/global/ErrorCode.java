package com.ballotbox.backend.global;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드(클라이언트 분기용) + HTTP 상태 + 기본 메시지의 단일 소스.
 *
 * 원칙:
 * - enum name()은 내부 식별자(로그/감사용)
 * - code()는 클라이언트에 노출되는 코드 (변경 시 API 계약 깨짐)
 * - refresh 실패 사유(UNKNOWN/EXPIRED/REVOKED/REUSED/OWNER_DISABLED)는 외부에 전부 REFRESH_INVALID로 뭉갠다.
 *   어떤 사유로 막혔는지는 로그에만 남긴다.
 */
public enum ErrorCode {

    // Registration
    USER_ALREADY_EXISTS(HttpStatus.BAD_REQUEST,
            "이미 가입된 이메일입니다."),
    ROLE_NOT_ALLOWED(HttpStatus.BAD_REQUEST,
            "선택할 수 없는 역할입니다."),

    // Login
    INVALID_CREDENTIALS(HttpStatus.BAD_REQUEST,
            "이메일 또는 비밀번호가 올바르지 않습니다."),
    ACCOUNT_DISABLED(HttpStatus.FORBIDDEN,
            "사용할 수 없는 계정 상태입니다."),

    // Auth / Security
    AUTH_REQUIRED(HttpStatus.UNAUTHORIZED,
            "인증이 필요합니다."),
    ACCESS_INVALID(HttpStatus.UNAUTHORIZED,
            "엑세스 토큰이 유효하지 않습니다."),

    // Refresh token
    REFRESH_INVALID(HttpStatus.UNAUTHORIZED,
            "리프레시 토큰이 유효하지 않습니다."),
    REFRESH_UNKNOWN(HttpStatus.UNAUTHORIZED, "REFRESH_INVALID",
            "리프레시 토큰이 유효하지 않습니다."),
    REFRESH_EXPIRED(HttpStatus.UNAUTHORIZED, "REFRESH_INVALID",
            "리프레시 토큰이 유효하지 않습니다."),
    REFRESH_REVOKED(HttpStatus.UNAUTHORIZED, "REFRESH_INVALID",
            "리프레시 토큰이 유효하지 않습니다."),
    REFRESH_REUSED(HttpStatus.UNAUTHORIZED, "REFRESH_INVALID",
            "리프레시 토큰이 유효하지 않습니다."), // 탈취 의심. 외부에는 동일하게 보인다.
    REFRESH_OWNER_DISABLED(HttpStatus.UNAUTHORIZED, "REFRESH_INVALID",
            "리프레시 토큰이 유효하지 않습니다."), // 토큰은 멀쩡하지만 소유자 계정이 ACTIVE가 아님

    // User / Data consistency
    USER_NOT_FOUND(HttpStatus.UNAUTHORIZED,
            "사용자를 찾을 수 없습니다."),

    // Validation / Common
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST,
            "요청 값이 올바르지 않습니다."),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR,
            "서버 오류가 발생했습니다.");

    private final HttpStatus status;
    private final String code;
    private final String defaultMessage;

    ErrorCode(HttpStatus status, String defaultMessage) {
        this(status, null, defaultMessage);
    }

    ErrorCode(HttpStatus status, String code, String defaultMessage) {
        this.status = status;
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus status() {
        return status;
    }

    /** 클라이언트에 내려가는 코드. 따로 지정하지 않았으면 name() */
    public String code() {
        return code != null ? code : name();
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
