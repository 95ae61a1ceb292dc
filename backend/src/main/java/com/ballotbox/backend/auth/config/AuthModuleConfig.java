package com.ballotbox.backend.auth.config;

import java.security.SecureRandom;
import java.time.Clock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * 인증 모듈 공통 빈 설정
 *
 * @EnableConfigurationProperties
 *  - AuthProperties(app.auth.*)를 바인딩 + 검증(@Validated)한다. 규칙 위반이면 부팅 실패.
 *
 * @EnableScheduling
 *  - refresh 토큰 보관 정리(RefreshTokenRetentionJob)용. 잡 빈 자체는 app.auth.retention.enabled로 켜고 끈다.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties(AuthProperties.class)
public class AuthModuleConfig {

    /**
     * java.time.Clock:
     * - 모든 시각(issued_at/rotated_at/revoked_at, JWT iat/exp)은 이 Clock 하나로 찍는다.
     * - DB에는 LocalDateTime으로 들어가므로 서버 표준은 UTC로 고정한다.
     * - 테스트 환경에서는 TestClockConfig가 별도의 Clock을 제공한다.
     */
    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }

    // BCrypt matches()는 해시 비교를 상수 시간으로 수행한다.
    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }
}
