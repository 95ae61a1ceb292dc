package com.ballotbox.backend.auth.identity.me.web;

import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import com.ballotbox.backend.auth.identity.me.dto.MeResponse;
import com.ballotbox.backend.auth.identity.me.service.MeService;
import com.ballotbox.backend.global.ApiException;
import com.ballotbox.backend.global.ErrorCode;
import com.ballotbox.backend.security.AuthPrincipal;

import lombok.RequiredArgsConstructor;

@RestController
@RequiredArgsConstructor
public class AuthMeController {

    private final MeService meService;

    // 인증 없는 요청은 보통 RestAuthEntryPoint에서 먼저 401로 끝난다.
    @GetMapping("/auth/me")
    public MeResponse me(@AuthenticationPrincipal AuthPrincipal principal) {
        if (principal == null) {
            throw new ApiException(ErrorCode.AUTH_REQUIRED);
        }
        return meService.describe(principal.userId());
    }
}
