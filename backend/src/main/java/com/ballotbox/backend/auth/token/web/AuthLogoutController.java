package com.ballotbox.backend.auth.token.web;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.ballotbox.backend.auth.token.service.LogoutService;
import com.ballotbox.backend.auth.token.support.AuthCookieUtils;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * POST /auth/logout
 *
 * - 쿠키의 refresh 토큰이 속한 lineage를 폐기하고 204 + 쿠키 삭제
 * - 실패(없음/미발급/이미 폐기/재사용)도 쿠키는 지운다. (RefreshCookieExceptionHandler)
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthLogoutController {

    private final LogoutService logoutService;
    private final AuthCookieUtils cookieUtils;

    @PostMapping("/logout")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void logout(HttpServletRequest request, HttpServletResponse response) {
        logoutService.logout(cookieUtils.readRefreshCookie(request));
        cookieUtils.clearRefreshCookie(response);
    }
}
