package com.ballotbox.backend.auth.token.support;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

/**
 * Refresh Token 원문 생성기
 *
 * - SecureRandom 48바이트(384bit) → Base64 URL-safe, padding 제거 → 항상 64자
 * - 원문은 클라이언트 쿠키로만 나가고 서버에는 sha256만 남는다.
 */
@Component
@RequiredArgsConstructor
public class TokenGenerator {

    private static final int TOKEN_BYTES = 48;
    public static final int TOKEN_LENGTH = 64;

    private static final Pattern TOKEN_PATTERN = Pattern.compile("^[A-Za-z0-9_-]{" + TOKEN_LENGTH + "}$");

    private final SecureRandom secureRandom;

    /** Refresh Token raw 생성 */
    public String generateRefreshToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * 우리가 발급한 토큰과 같은 모양인지 (DB 조회 전에 거르는 용도)
     * - 모양이 맞아도 발급된 토큰이라는 뜻은 아니다.
     */
    public static boolean isWellFormed(String raw) {
        return raw != null && TOKEN_PATTERN.matcher(raw).matches();
    }
}
