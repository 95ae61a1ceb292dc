package com.ballotbox.backend.auth.identity.login.web;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.ballotbox.backend.auth.identity.login.dto.LoginRequest;
import com.ballotbox.backend.auth.identity.login.dto.LoginResponse;
import com.ballotbox.backend.auth.identity.login.service.LoginService;
import com.ballotbox.backend.auth.identity.login.service.LoginService.LoginResult;
import com.ballotbox.backend.auth.token.support.AuthCookieUtils;
import com.ballotbox.backend.auth.token.support.ClientInfo;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 로그인 API
 * - accessToken: 바디
 * - refreshToken: HttpOnly 쿠키
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthLoginController {

    private final LoginService loginService;
    private final AuthCookieUtils cookieUtils;

    @PostMapping("/login")
    public LoginResponse login(@Valid @RequestBody LoginRequest req,
                               HttpServletRequest request,
                               HttpServletResponse response) {

        LoginResult result = loginService.login(req.email(), req.password(), ClientInfo.from(request));

        cookieUtils.setRefreshCookie(response, result.refreshRaw());
        return new LoginResponse(result.accessToken());
    }
}
