package com.ballotbox.backend.auth.identity.register.dto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.ballotbox.backend.auth.domain.UserRole;
import com.ballotbox.backend.global.jackson.TrimStringDeserializer;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * 회원가입 요청
 * - role을 비우면 VOTER. ADMIN은 서비스에서 거부한다.
 * - 비밀번호 최대 72자는 BCrypt 입력 한계.
 */
public record RegisterRequest(

        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank(message = "이름은 필수입니다.")
        @Size(max = 50, message = "이름이 너무 깁니다.")
        String firstName,

        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank(message = "성은 필수입니다.")
        @Size(max = 50, message = "성이 너무 깁니다.")
        String lastName,

        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank(message = "이메일은 필수입니다.")
        @Email(message = "이메일 형식이 올바르지 않습니다.")
        @Size(max = 255, message = "이메일이 너무 깁니다.")
        String email,

        UserRole role,

        @NotBlank(message = "비밀번호는 필수입니다.")
        @Size(min = 8, max = 72, message = "비밀번호는 8~72자여야 합니다.")
        String password
) {
    public UserRole roleOrDefault() {
        return role == null ? UserRole.VOTER : role;
    }
}
