package com.ballotbox.backend.global;

import com.fasterxml.jackson.annotation.JsonInclude;


/**
 * 공통 API 에러 응답 DTO
 *
 * 원칙:
 * - 모든 레이어(ControllerAdvice / EntryPoint / Filter)에서 에러 응답에 대하여
 *   항상 동일한 JSON 스키마 포맷을 유지한다.
 *
 * 필드:
 * - code: 클라이언트 분기용 안정 식별자 (ErrorCode.code())
 * - message: 사용자 메시지
 * - details: 필드 단위 검증 오류 등 추가 정보(필요 시만)
 *
 * @JsonInclude(NON_NULL): null인 필드는 JSON에서 제외
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
        String code,    // ex: "INVALID_CREDENTIALS"
        String message, // ex: "이메일 또는 비밀번호가 올바르지 않습니다."
        Object details
) {
    public static ApiError of(ErrorCode errorCode) {
        return new ApiError(errorCode.code(), errorCode.defaultMessage(), null);
    }

    public static ApiError of(ErrorCode errorCode, String messageOverride) {
        return new ApiError(errorCode.code(), messageOverride, null);
    }

    public static ApiError of(ErrorCode errorCode, Object details) {
        return new ApiError(errorCode.code(), errorCode.defaultMessage(), details);
    }

    public static ApiError from(ApiException e) {
        return new ApiError(e.getCode(), e.getMessage(), null);
    }

}
