package com.ballotbox.backend.auth.token.web;

import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.ballotbox.backend.auth.token.support.AuthCookieUtils;
import com.ballotbox.backend.global.ApiError;
import com.ballotbox.backend.global.ApiException;
import com.ballotbox.backend.global.ErrorCode;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * /auth/refresh, /auth/logout 전용 예외 처리
 *
 * - 실패하면 클라이언트의 refresh 쿠키를 항상 지운다. (Max-Age=0)
 * - 외부 응답 코드는 ErrorCode.code() (= REFRESH_INVALID)로 뭉개고,
 *   실제 사유(UNKNOWN/EXPIRED/REVOKED/REUSED)는 로그에만 남긴다.
 * - GlobalExceptionHandler보다 먼저 선택되도록 최우선 순서를 준다.
 */
@Slf4j
@RestControllerAdvice(assignableTypes = {AuthTokenController.class, AuthLogoutController.class})
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class RefreshCookieExceptionHandler {

    private final AuthCookieUtils cookieUtils;

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiError> handle(ApiException e, HttpServletRequest request) {
        if (e.getErrorCode() == ErrorCode.REFRESH_REUSED) {
            log.warn("refresh 거부(재사용): uri={}, ip={}", request.getRequestURI(), request.getRemoteAddr());
        } else {
            log.info("refresh 거부: uri={}, reason={}", request.getRequestURI(), e.getErrorCode());
        }

        return ResponseEntity.status(e.getStatus())
                .header(HttpHeaders.SET_COOKIE, cookieUtils.clearedRefreshCookie().toString())
                .header(HttpHeaders.CACHE_CONTROL, "no-store")
                .body(ApiError.from(e));
    }
}
