package com.ballotbox.backend.auth.me;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ballotbox.backend.auth.AbstractAuthIntegrationTest;
import com.ballotbox.backend.auth.domain.UserRole;
import com.ballotbox.backend.auth.domain.UserStatus;
import com.ballotbox.backend.auth.support.AuthFlowSupport;
import com.ballotbox.backend.auth.support.AuthHttpSupport;
import com.ballotbox.backend.auth.support.AuthHttpSupport.LoginResult;
import com.ballotbox.backend.global.ErrorCode;
import com.ballotbox.backend.infra.TestClockConfig;

/**
 * /auth/me 통합 테스트 (SecurityFilterChain + Controller + Service까지 포함)
 *
 * [JwtAuthenticationFilter]
 * - Authorization 헤더 없음 / Bearer 아님 → 그냥 통과 → EntryPoint 401(AUTH_REQUIRED)
 * - Bearer 토큰 검증 실패(형식/서명/issuer/만료) → Filter에서 즉시 401(ACCESS_INVALID)
 *
 * [MeService]
 * - DB에 사용자 없음 → USER_NOT_FOUND, ACTIVE 아님 → ACCOUNT_DISABLED
 */
@DisplayName("[Auth][Me] 내 정보 조회(/auth/me) 통합 테스트")
class AuthMeFlowTest extends AbstractAuthIntegrationTest {

    @Autowired MockMvc mvc;
    @Autowired JdbcTemplate jdbc;

    @BeforeEach
    void seedUser() {
        createDefaultUser();
    }

    // ---- 인증 없음 (EntryPoint) ----

    @Test
    @DisplayName("me: Authorization 없음 → 401 AUTH_REQUIRED")
    void me_requires_auth_when_no_authorization_header() throws Exception {
        ResultActions actions = AuthHttpSupport.performMe(mvc, null);
        AuthHttpSupport.expectErrorWithCode(actions, ErrorCode.AUTH_REQUIRED);
    }

    @Test
    @DisplayName("me: Bearer가 아닌 Authorization → 401 AUTH_REQUIRED")
    void me_requires_auth_when_non_bearer_header() throws Exception {
        ResultActions actions = AuthHttpSupport.performMe(mvc, "Basic abcdefg");
        AuthHttpSupport.expectErrorWithCode(actions, ErrorCode.AUTH_REQUIRED);
    }

    // ---- 토큰 invalid (Filter) ----

    @Test
    @DisplayName("me: JWT 아님 → 401 ACCESS_INVALID")
    void me_rejects_garbage_token() throws Exception {
        ResultActions actions = AuthHttpSupport.performMe(mvc, "Bearer not-a-jwt");
        AuthHttpSupport.expectErrorWithCode(actions, ErrorCode.ACCESS_INVALID);
    }

    @Test
    @DisplayName("me: refresh 토큰 원문을 access처럼 사용 → 401 ACCESS_INVALID")
    void me_rejects_refresh_token_used_as_access_token() throws Exception {
        LoginResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);

        ResultActions actions = AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(login.refreshRaw()));
        AuthHttpSupport.expectErrorWithCode(actions, ErrorCode.ACCESS_INVALID);
    }

    @Test
    @DisplayName("me: access TTL(900초) 경과 → 401 ACCESS_INVALID")
    void me_rejects_expired_access_token() throws Exception {
        LoginResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);

        TestClockConfig.CLOCK.forward(Duration.ofSeconds(901));

        ResultActions actions = AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(login.accessToken()));
        AuthHttpSupport.expectErrorWithCode(actions, ErrorCode.ACCESS_INVALID);
    }

    // ---- 서비스 정책 ----

    @Test
    @DisplayName("me: 토큰은 유효하지만 DB에 유저 없음 → USER_NOT_FOUND")
    void me_returns_user_not_found_when_user_deleted_after_login() throws Exception {
        LoginResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);

        // refresh_tokens는 ON DELETE CASCADE로 같이 지워진다
        jdbc.update("delete from users where email = ?", EMAIL);

        ResultActions actions = AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(login.accessToken()));
        AuthHttpSupport.expectErrorWithCode(actions, ErrorCode.USER_NOT_FOUND);
    }

    @Test
    @DisplayName("me: 토큰은 유효하지만 비활성 계정 → 403 ACCOUNT_DISABLED")
    void me_blocks_when_user_not_active() throws Exception {
        LoginResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);
        jdbc.update("update users set status = ? where email = ?", UserStatus.DISABLED.name(), EMAIL);

        ResultActions actions = AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(login.accessToken()));
        AuthHttpSupport.expectErrorWithCode(actions, ErrorCode.ACCOUNT_DISABLED);
    }

    // ---- 성공 ----

    @Test
    @DisplayName("me: 유효한 access 토큰 + ACTIVE 사용자 → 200 + 표시 이름/권한/마지막 로그인 시각")
    void me_returns_user_view_when_access_token_valid() throws Exception {
        LoginResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);

        AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(login.accessToken()))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.userId").isNumber())
                .andExpect(jsonPath("$.email").value(EMAIL))
                .andExpect(jsonPath("$.displayName").value(FIRST_NAME + " " + LAST_NAME))
                .andExpect(jsonPath("$.role").value(UserRole.VOTER.name()))
                .andExpect(jsonPath("$.authority").value("ROLE_VOTER"))
                .andExpect(jsonPath("$.lastLoginAt").exists())
                .andExpect(jsonPath("$.status").doesNotExist())
                .andExpect(jsonPath("$.passwordHash").doesNotExist());
    }

    @Test
    @DisplayName("me: 로그인 이후 DB에서 바뀐 이름이 그대로 보인다 (토큰 클레임이 아니라 DB 기준)")
    void me_reads_current_name_from_db() throws Exception {
        LoginResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);
        jdbc.update("update users set last_name = ? where email = ?", "Park", EMAIL);

        AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(login.accessToken()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.displayName").value(FIRST_NAME + " Park"));
    }

    @Test
    @DisplayName("me: 로그아웃 후에도 이미 받은 access 토큰은 exp까지 유효 (stateless)")
    void access_token_survives_logout_until_expiry() throws Exception {
        LoginResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);
        AuthHttpSupport.performLogout(mvc, login.refreshRaw()).andExpect(status().isNoContent());

        AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(login.accessToken()))
                .andExpect(status().isOk());
    }
}
