package com.ballotbox.backend.auth.token.domain;

/**
 * refresh 토큰 레코드 상태 (앞으로만 움직인다)
 *
 *   ACTIVE ──rotate──▶ ROTATED ──revokeLineage──▶ REVOKED
 *   ACTIVE ──────────revokeLineage──────────────▶ REVOKED
 *
 * - ACTIVE: lineage당 최대 1개. 지금 클라이언트가 들고 있어야 하는 토큰.
 * - ROTATED: 정상 회전으로 후속 토큰이 발급된 토큰. 다시 제출되면 재사용(탈취 의심).
 * - REVOKED: 종단 상태. 어떤 경로로도 되돌아가지 않는다.
 */
public enum RefreshTokenStatus {
    ACTIVE,
    ROTATED,
    REVOKED
}
