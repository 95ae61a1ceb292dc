package com.ballotbox.backend.auth.identity.register.dto;

import com.ballotbox.backend.auth.domain.User;

/**
 * 회원가입 응답: { message, data }
 * - 비밀번호 해시는 절대 싣지 않는다.
 */
public record RegisterResponse(String message, RegisteredUser data) {

    public static final String CREATED_MESSAGE = "Account Created Successfully!";

    public static RegisterResponse created(User user) {
        return new RegisterResponse(CREATED_MESSAGE, RegisteredUser.from(user));
    }

    public record RegisteredUser(Long userId, String email, String firstName, String lastName, String role) {

        static RegisteredUser from(User user) {
            return new RegisteredUser(
                    user.getId(),
                    user.getEmail(),
                    user.getFirstName(),
                    user.getLastName(),
                    user.getRole().name()
            );
        }
    }
}
