package com.ballotbox.backend.auth.identity.me.dto;

import java.time.LocalDateTime;

import com.ballotbox.backend.auth.domain.User;

/**
 * /auth/me 응답.
 * 이름은 "first last" 한 줄(displayName)로만 내려가고, status는 싣지 않는다. (ACTIVE가 아니면 여기까지 오지 못함)
 */
public record MeResponse(
    Long userId,
    String email,
    String displayName,
    String role,
    String authority,     // ex: "ROLE_VOTER" (SecurityContext에 실리는 권한 문자열과 같다)
    LocalDateTime lastLoginAt
) {

    public static MeResponse of(User user) {
        return new MeResponse(
                user.getId(),
                user.getEmail(),
                displayName(user.getFirstName(), user.getLastName()),
                user.getRole().name(),
                "ROLE_" + user.getRole().name(),
                user.getLastLoginAt()
        );
    }

    static String displayName(String firstName, String lastName) {
        String first = firstName == null ? "" : firstName.strip();
        String last = lastName == null ? "" : lastName.strip();
        return (first + " " + last).strip();
    }
}
