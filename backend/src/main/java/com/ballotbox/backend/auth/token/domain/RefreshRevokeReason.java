package com.ballotbox.backend.auth.token.domain;

/**
 * lineage 폐기(REVOKED) 사유
 *
 * LOGOUT: 사용자가 명시적으로 로그아웃
 * REUSE_DETECTED: 이미 회전된(ROTATED) 토큰이 다시 제출됨. 탈취 의심으로 lineage 전체를 끊는다.
 * EXPIRED: 만료된 ACTIVE 토큰이 제출됐거나 보관 정리 작업이 만료분을 정리함
 */
public enum RefreshRevokeReason { LOGOUT, REUSE_DETECTED, EXPIRED }
