package com.ballotbox.backend.auth.register;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.web.servlet.MockMvc;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ballotbox.backend.auth.AbstractAuthIntegrationTest;
import com.ballotbox.backend.auth.domain.User;
import com.ballotbox.backend.auth.domain.UserRole;
import com.ballotbox.backend.auth.domain.UserStatus;
import com.ballotbox.backend.auth.support.AuthFlowSupport;
import com.ballotbox.backend.auth.support.AuthHttpSupport;
import com.ballotbox.backend.global.ErrorCode;

@DisplayName("[Auth][Register] 회원가입 통합 테스트")
class AuthRegisterFlowTest extends AbstractAuthIntegrationTest {

    @Autowired MockMvc mvc;

    @Test
    @DisplayName("가입 성공 → 201 + message/data, 비밀번호는 해시로 저장")
    void register_success() throws Exception {
        AuthHttpSupport.performRegister(mvc, "Alice", "Kim", "  Alice@Example.com ", "CANDIDATE", PASSWORD)
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.message").value("Account Created Successfully!"))
                .andExpect(jsonPath("$.data.email").value(EMAIL))
                .andExpect(jsonPath("$.data.firstName").value("Alice"))
                .andExpect(jsonPath("$.data.role").value("CANDIDATE"))
                .andExpect(jsonPath("$.data.password").doesNotExist())
                .andExpect(jsonPath("$.data.passwordHash").doesNotExist());

        User saved = userRepository.findByEmail(EMAIL).orElseThrow();
        assertThat(saved.getRole()).isEqualTo(UserRole.CANDIDATE);
        assertThat(saved.getStatus()).isEqualTo(UserStatus.ACTIVE);
        assertThat(saved.getPasswordHash()).isNotEqualTo(PASSWORD);
        assertThat(passwordEncoder.matches(PASSWORD, saved.getPasswordHash())).isTrue();
    }

    @Test
    @DisplayName("role 생략 → VOTER")
    void role_defaults_to_voter() throws Exception {
        AuthHttpSupport.performRegister(mvc, "Bob", "Lee", "bob@example.com", null, PASSWORD)
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.role").value("VOTER"));
    }

    @Test
    @DisplayName("가입 후 같은 자격증명으로 로그인 가능")
    void registered_user_can_login() throws Exception {
        AuthHttpSupport.performRegister(mvc, "Alice", "Kim", EMAIL, "VOTER", PASSWORD)
                .andExpect(status().isCreated());

        assertThat(AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD).accessToken()).isNotBlank();
    }

    @Test
    @DisplayName("중복 이메일(대소문자만 다름 포함) → 400 USER_ALREADY_EXISTS")
    void duplicate_email_rejected() throws Exception {
        createDefaultUser();

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRegister(mvc, "Alice", "Kim", EMAIL.toUpperCase(), "VOTER", PASSWORD),
                ErrorCode.USER_ALREADY_EXISTS);

        assertThat(userRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("ADMIN 자가 선택 → 400 ROLE_NOT_ALLOWED")
    void admin_role_rejected() throws Exception {
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRegister(mvc, "Mallory", "Park", "mallory@example.com", "ADMIN", PASSWORD),
                ErrorCode.ROLE_NOT_ALLOWED);

        assertThat(userRepository.existsByEmail("mallory@example.com")).isFalse();
    }

    @Test
    @DisplayName("없는 role 값 → 400 VALIDATION_ERROR")
    void unknown_role_rejected() throws Exception {
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRegister(mvc, "Alice", "Kim", EMAIL, "SUPERUSER", PASSWORD),
                ErrorCode.VALIDATION_ERROR);
    }

    @Test
    @DisplayName("짧은 비밀번호 / 이메일 형식 / 빈 이름 → 400 VALIDATION_ERROR + details")
    void validation_errors() throws Exception {
        AuthHttpSupport.performRegister(mvc, "Alice", "Kim", EMAIL, "VOTER", "short")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.details[0].field").value("password"));

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRegister(mvc, "Alice", "Kim", "not-an-email", "VOTER", PASSWORD),
                ErrorCode.VALIDATION_ERROR);

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRegister(mvc, "   ", "Kim", EMAIL, "VOTER", PASSWORD),
                ErrorCode.VALIDATION_ERROR);

        assertThat(userRepository.count()).isZero();
    }
}
