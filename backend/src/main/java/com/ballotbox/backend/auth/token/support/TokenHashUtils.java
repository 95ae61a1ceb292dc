package com.ballotbox.backend.auth.token.support;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * refresh 토큰 해시 유틸
 *
 * - DB 조회 키는 sha256(raw)의 소문자 hex(64자)다.
 * - 원문은 384bit 난수라서 salt 없는 단일 sha256으로 충분하다. (비밀번호와 다름)
 */
public final class TokenHashUtils {
    private TokenHashUtils() {}

    /**
     * raw 문자열을 SHA-256 해시 후 hex(64 chars) 문자열로 반환
     */
    public static String sha256Hex(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("raw token must not be null/blank");
        }

        byte[] digest = sha256(raw.getBytes(StandardCharsets.UTF_8));
        return toHex(digest);
    }

    private static byte[] sha256(byte[] input) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return md.digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // 소문자 hex (RefreshToken.HEX64_REGEX와 맞춘다)
    private static String toHex(byte[] bytes) {
        char[] hex = new char[bytes.length * 2];
        final char[] digits = "0123456789abcdef".toCharArray();

        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            hex[i * 2] = digits[v >>> 4];
            hex[i * 2 + 1] = digits[v & 0x0F];
        }
        return new String(hex);
    }
}