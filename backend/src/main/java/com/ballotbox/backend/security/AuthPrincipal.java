package com.ballotbox.backend.security;

import com.ballotbox.backend.auth.domain.UserRole;

/**
 * SecurityContext에 저장되는 "인증된 사용자"의 최소 정보(Principal).
 *
 * - JwtAuthenticationFilter가 Access Token 검증 성공 시 만들어 Authentication에 넣는다.
 * - 값은 전부 토큰 클레임에서 온다. (DB 조회 없음)
 */
public record AuthPrincipal(Long userId, String email, UserRole role) {

    public AuthPrincipal {
        if (userId == null) throw new IllegalArgumentException("userId must not be null");
        if (email == null || email.isBlank()) throw new IllegalArgumentException("email must not be blank");
        if (role == null) throw new IllegalArgumentException("role must not be null");
    }

    /** Spring Security 권한 문자열 규칙(ROLE_*) */
    public String authority() {
        return "ROLE_" + role.name();
    }
}
