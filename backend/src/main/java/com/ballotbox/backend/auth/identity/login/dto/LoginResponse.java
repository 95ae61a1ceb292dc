package com.ballotbox.backend.auth.identity.login.dto;

/**
 * 로그인 응답 DTO
 *
 * - accessToken: 응답 바디(JSON). 이후 Authorization: Bearer {accessToken}
 * - refreshToken: 바디에 넣지 않고 HttpOnly 쿠키(Set-Cookie)로만 반환
 */
public record LoginResponse(String accessToken) {}
