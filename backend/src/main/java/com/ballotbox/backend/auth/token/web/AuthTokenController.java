package com.ballotbox.backend.auth.token.web;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.ballotbox.backend.auth.token.dto.RefreshResponse;
import com.ballotbox.backend.auth.token.service.RefreshRotationService;
import com.ballotbox.backend.auth.token.service.RefreshRotationService.RotationResult;
import com.ballotbox.backend.auth.token.support.AuthCookieUtils;
import com.ballotbox.backend.auth.token.support.ClientInfo;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * POST /auth/refresh
 *
 * - refresh 원문은 HttpOnly 쿠키에서만 읽는다. (바디/헤더로 받지 않음)
 * - 성공: 새 refresh 쿠키로 교체 + 새 access token(바디)
 * - 실패: RefreshCookieExceptionHandler가 401 + 쿠키 삭제로 응답
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthTokenController {

    private final RefreshRotationService rotationService;
    private final AuthCookieUtils cookieUtils;

    @PostMapping("/refresh")
    public RefreshResponse refresh(HttpServletRequest request, HttpServletResponse response) {
        String refreshRaw = cookieUtils.readRefreshCookie(request);

        RotationResult result = rotationService.rotate(refreshRaw, ClientInfo.from(request));

        cookieUtils.setRefreshCookie(response, result.refreshRaw());
        return new RefreshResponse(result.accessToken());
    }
}
