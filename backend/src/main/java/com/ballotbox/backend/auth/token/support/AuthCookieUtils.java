package com.ballotbox.backend.auth.token.support;

import java.time.Duration;
import java.util.Arrays;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

import com.ballotbox.backend.auth.config.AuthProperties;
import com.ballotbox.backend.auth.config.AuthProperties.Refresh;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * Refresh Token 쿠키 유틸
 *
 * - HttpOnly 쿠키로만 주고받는다. (JS 접근 차단)
 * - cookie 옵션(path/samesite/secure/maxAge)을 한 곳에서 통일한다.
 * - Max-Age는 서버 측 만료(app.auth.refresh.ttl-seconds)와 같다.
 */
@Component
@RequiredArgsConstructor
public class AuthCookieUtils {

    private final AuthProperties props;

    /** Refresh 쿠키 읽기 (없으면 null) */
    public String readRefreshCookie(HttpServletRequest request) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null || cookies.length == 0) return null;

        String cookieName = props.refresh().cookieName();

        return Arrays.stream(cookies)
                .filter(c -> cookieName.equals(c.getName()))
                .map(Cookie::getValue)
                .map(v -> v == null ? null : v.trim())
                .filter(v -> v != null && !v.isBlank())
                .findFirst()
                .orElse(null);
    }

    public void setRefreshCookie(HttpServletResponse response, String refreshRaw) {
        if (refreshRaw == null || refreshRaw.isBlank()) return;
        response.addHeader(HttpHeaders.SET_COOKIE, refreshCookie(refreshRaw).toString());
    }

    public void clearRefreshCookie(HttpServletResponse response) {
        response.addHeader(HttpHeaders.SET_COOKIE, clearedRefreshCookie().toString());
    }

    public ResponseCookie refreshCookie(String refreshRaw) {
        return baseRefreshCookie(refreshRaw)
                .maxAge(Duration.ofSeconds(props.refresh().ttlSeconds()))
                .build();
    }

    /** 삭제용 쿠키. 속성(path/sameSite/secure)이 발급 때와 같아야 브라우저가 지운다. */
    public ResponseCookie clearedRefreshCookie() {
        return baseRefreshCookie("deleted")
                .maxAge(Duration.ZERO)
                .build();
    }

    private ResponseCookie.ResponseCookieBuilder baseRefreshCookie(String value) {
        Refresh r = props.refresh();
        return ResponseCookie.from(r.cookieName(), value)
                .httpOnly(true)
                .secure(r.cookieSecure())
                .path(r.cookiePath())
                .sameSite(r.cookieSameSite().name());
    }
}
