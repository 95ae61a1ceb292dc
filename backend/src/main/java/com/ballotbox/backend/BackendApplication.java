package com.ballotbox.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.context.annotation.Import;

import com.ballotbox.backend.auth.config.AuthModuleConfig;

/*
================================================================================
[curl 시나리오] 가입 → 로그인 → me → refresh → 재사용 → 로그아웃
================================================================================
# 가입 201
curl -i -X POST "http://localhost:8080/auth/register" \
  -H "Content-Type: application/json" \
  -d '{"firstName":"Alice","lastName":"Kim","email":"alice@example.com","role":"VOTER","password":"correct-horse"}'

# 로그인 200 (refresh 쿠키를 파일에 저장)
curl -i -X POST "http://localhost:8080/auth/login" \
  -H "Content-Type: application/json" \
  -c /tmp/bb_cookie.txt \
  -d '{"email":"alice@example.com","password":"correct-horse"}'

# /auth/me
curl -i "http://localhost:8080/auth/me" -H "Authorization: Bearer <accessToken>"

# refresh 200 (old 쿠키 전송, 새 쿠키는 다른 파일에)
curl -i -X POST "http://localhost:8080/auth/refresh" -b /tmp/bb_cookie.txt -c /tmp/bb_cookie_new.txt

# old 쿠키로 다시 refresh → 401 REFRESH_INVALID (재사용 탐지, lineage 전체 폐기)
curl -i -X POST "http://localhost:8080/auth/refresh" -b /tmp/bb_cookie.txt

# 새 쿠키도 이제 401 (같은 lineage라서)
curl -i -X POST "http://localhost:8080/auth/refresh" -b /tmp/bb_cookie_new.txt

# DB 확인
select id, lineage_id, parent_id, status, revoke_reason from refresh_tokens order by id;
*/

/**
 * - 설정 값 흐름: 환경변수 -> application.yml(${ENV:default}) -> @ConfigurationProperties(AuthProperties)
 * - @Validated 규칙 위반이면 부팅 실패(Fail-fast)
 * - UserDetailsServiceAutoConfiguration 제외: JWT 방식이라 기본 인메모리 유저가 필요 없다.
 */
@Import(AuthModuleConfig.class)
@SpringBootApplication(exclude = {UserDetailsServiceAutoConfiguration.class})
public class BackendApplication {
    public static void main(String[] args) {
        SpringApplication.run(BackendApplication.class, args);
    }
}
