package com.ballotbox.backend.auth.token.service;

import org.springframework.stereotype.Component;

import com.ballotbox.backend.auth.token.domain.RefreshToken;
import com.ballotbox.backend.auth.token.store.RefreshTokenStore;
import com.ballotbox.backend.auth.token.support.TokenGenerator;
import com.ballotbox.backend.auth.token.support.TokenHashUtils;
import com.ballotbox.backend.global.ApiException;
import com.ballotbox.backend.global.ErrorCode;

import lombok.RequiredArgsConstructor;

/**
 * 제출된 refresh 원문 → 레코드 (회전/로그아웃 공통 1단계)
 * - 없음/공백/모양이 다름 → REFRESH_INVALID (DB 조회 안 함)
 * - 발급된 적 없음 → REFRESH_UNKNOWN
 * 상태(ROTATED/REVOKED/만료) 판단은 호출자 몫이다.
 */
@Component
@RequiredArgsConstructor
public class RefreshTokenLookup {

    private final RefreshTokenStore store;

    public RefreshToken require(String presentedRaw) {
        if (presentedRaw == null || presentedRaw.isBlank() || !TokenGenerator.isWellFormed(presentedRaw)) {
            throw new ApiException(ErrorCode.REFRESH_INVALID);
        }

        return store.findByTokenHash(TokenHashUtils.sha256Hex(presentedRaw))
                .orElseThrow(() -> new ApiException(ErrorCode.REFRESH_UNKNOWN));
    }
}
