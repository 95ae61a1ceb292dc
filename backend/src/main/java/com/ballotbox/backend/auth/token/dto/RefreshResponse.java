package com.ballotbox.backend.auth.token.dto;

/**
 * /auth/refresh 응답 바디
 * - access token만 바디로 준다. 새 refresh 토큰은 Set-Cookie로만 나간다.
 */
public record RefreshResponse(String accessToken) {}
