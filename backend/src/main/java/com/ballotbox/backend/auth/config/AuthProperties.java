package com.ballotbox.backend.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;


/*
  @ConfigurationProperties(prefix = "app.auth"):
  application.yml (+ 프로필별 yml)의 app.auth.* 값을 타입 안정성 있게 바인딩해준다.

  app:
    auth:
      jwt:
        issuer: ballotbox-local
        access-ttl-seconds: 900
        secret: ${APP_AUTH_JWT_SECRET:?set APP_AUTH_JWT_SECRET}

      refresh:
        cookie-name: refreshToken
        cookie-path: /auth
        cookie-same-site: None
        cookie-secure: false  # 운영(prod)에서는 true
        ttl-seconds: 604800

      retention:
        enabled: true
        horizon-seconds: 2592000
        cron: "0 30 3 * * *"
 */
@Validated
@ConfigurationProperties(prefix = "app.auth")
public record AuthProperties(@Valid @NotNull Jwt jwt,
                             @Valid @NotNull Refresh refresh,
                             @Valid @NotNull Retention retention) {

    /**
     * Access Token(JWT) 관련 설정
     * - issuer: 토큰 발급자 식별자
     * - accessTtlSeconds: Access Token 수명
     * - secret: HS256 서명을 위한 비밀키 문자열
     */
    public record Jwt(
        @NotBlank String issuer,
        @Min(1) long accessTtlSeconds,
        @NotBlank @Size(min = 32) String secret
    ) {}


    /**
     * Refresh Token + 쿠키 관련 설정
     * - cookieName: Refresh 토큰을 담을 쿠키 이름
     * - cookiePath: 이 경로에 해당하는 요청에만 쿠키를 같이 전송 (/auth)
     * - cookieSameSite: SameSite 정책 (Lax / Strict / None)
     * - cookieSecure: https 에서만 전송 여부 (운영에선 true)
     * - ttlSeconds: refresh 토큰 수명. 서버 측 expires_at 과 쿠키 Max-Age 둘 다 이 값을 쓴다.
     */
    public record Refresh(
            @NotBlank String cookieName,

            // 최소 형식만 강제: "/"로 시작 (오타로 "auth" 같은 값 들어오는 것 방지)
            @NotBlank @Pattern(regexp = "^/.*", message = "cookiePath must start with '/'")
            String cookiePath,

            @NotNull SameSite cookieSameSite,

            boolean cookieSecure,

            @Min(1) long ttlSeconds
    ) {}

    /**
     * 폐기된 세션(lineage) 보관/정리 정책
     * - enabled: 스케줄 정리 작업 on/off
     * - horizonSeconds: 마지막 revoke 이후 이 시간이 지난 "완전 폐기" lineage만 삭제
     * - cron: 정리 작업 실행 주기
     *
     * 재사용 탐지는 ROTATED/REVOKED row가 남아 있어야 가능하므로 horizon은 refresh TTL보다 길게 잡는다.
     */
    public record Retention(
            boolean enabled,
            @Min(1) long horizonSeconds,
            @NotBlank String cron
    ) {}

    // SameSite는 오타가 치명적이라 enum으로 고정
    public enum SameSite {
        Lax, Strict, None
    }
}
