package com.ballotbox.backend.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import lombok.RequiredArgsConstructor;

/**
 * Spring Security 전역 보안 설정
 *
 * - Stateless: 서버 세션 없음. 인증 상태는 Access Token(JWT) + refresh 쿠키로만 유지한다.
 * - JWT 인증: JwtAuthenticationFilter (토큰이 있는데 invalid면 ACCESS_INVALID)
 * - 인증 필요 리소스에 인증 없이 접근: RestAuthEntryPoint (AUTH_REQUIRED)
 *
 * refresh/logout은 Access Token이 아니라 refresh 쿠키로 동작하므로 permitAll 이다.
 * (Access Token이 만료된 상태에서도 호출할 수 있어야 한다)
 */
@Configuration
@RequiredArgsConstructor
public class SecurityConfig {

    private final JwtService jwtService;
    private final SecurityErrorWriter securityErrorWriter;

    @Bean
    RestAuthEntryPoint restAuthEntryPoint() {
        return new RestAuthEntryPoint(securityErrorWriter);
    }

    @Bean
    JwtAuthenticationFilter jwtAuthenticationFilter() {
        return new JwtAuthenticationFilter(jwtService, securityErrorWriter);
    }

    @Bean
    SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        return http
                .csrf(csrf -> csrf.disable()) // refresh 쿠키는 Path=/auth 로 한정되고 보호 자원은 Bearer 헤더로만 인증한다.
                .httpBasic(b -> b.disable()) // HTTP Basic 인증 비활성화 - Authorization: Basic ... 방식 사용 안 함
                .formLogin(f -> f.disable()) // formLogin 비활성화 - 스프링 기본 로그인 페이지 사용 안 함

                // 세션 사용 안 함 - 로그인 상태를 서버 세션에 저장하지 않음
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                
                // 인증 실패(= 인증 없이 보호 리소스 접근) 응답 방식 커스터마이즈 - 401 Unauthorized
                .exceptionHandling(eh -> eh.authenticationEntryPoint(restAuthEntryPoint()))

                // JWT 필터 등록: UsernamePasswordAuthenticationFilter 전에 실행되도록 설정
                .addFilterBefore(
                        jwtAuthenticationFilter(),
                        UsernamePasswordAuthenticationFilter.class
                )

                // URL별 접근 정책(인가)
                .authorizeHttpRequests(auth -> auth
                        // 스프링 내부 에러 페이지 접근 허용
                        .requestMatchers("/error").permitAll()

                        // Liveness/Readiness Probe
                        .requestMatchers("/actuator/health", "/actuator/health/**").permitAll()

                        // 인증 필요 없는 Auth 엔드포인트
                        .requestMatchers("/auth/register").permitAll()
                        .requestMatchers("/auth/login").permitAll()
                        .requestMatchers("/auth/refresh").permitAll()
                        .requestMatchers("/auth/logout").permitAll()

                        // 그 외는 인증 필요 (/auth/me 포함)
                        .anyRequest().authenticated()
                )
                .build(); // SecurityFilterChain 생성
    }
}
