package com.ballotbox.backend.auth.token.support;

import jakarta.servlet.http.HttpServletRequest;

/**
 * refresh 토큰 레코드에 남기는 클라이언트 정보 (운영/감사용)
 * - 값은 그대로 신뢰하지 않는다. 길이 제한/trim은 RefreshToken이 한다.
 */
public record ClientInfo(String userAgent, String ipAddress) {

    public static final ClientInfo UNKNOWN = new ClientInfo(null, null);

    public static ClientInfo from(HttpServletRequest request) {
        if (request == null) {
            return UNKNOWN;
        }
        return new ClientInfo(request.getHeader("User-Agent"), request.getRemoteAddr());
    }
}
