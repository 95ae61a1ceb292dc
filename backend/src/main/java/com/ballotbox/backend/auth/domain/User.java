package com.ballotbox.backend.auth.domain;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * users 테이블 = "회원 저장소"
 *
 * 가입 흐름:
 * - RegistrationService.register()에서 users에 insert (role은 VOTER/CANDIDATE만 자가 선택 가능)
 *
 * 로그인 흐름:
 * - LoginService.login()에서 users를 email로 조회
 * - password_hash 비교
 * - status가 ACTIVE일 때만 세션(lineage)을 연다
 *
 * refresh 흐름:
 * - 회전 직전에 사용자 존재/상태를 다시 확인한다. (DISABLED면 회전 거부)
 */
@Entity
@Table(name = "users", uniqueConstraints = {
        @UniqueConstraint(name = "uq_users_email", columnNames = "email")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id; // PK. JWT의 sub(subject)로 쓰임(userId)

    @Column(nullable = false, length = 255)
    private String email; // 로그인 ID (Unique)

    @Column(name = "password_hash", nullable = false, length = 100)
    private String passwordHash; // BCrypt 해시 (원문 저장 금지)

    @Column(name = "first_name", nullable = false, length = 50)
    private String firstName;

    @Column(name = "last_name", nullable = false, length = 50)
    private String lastName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UserRole role; // JWT에 실어서 인가(권한 체크)에 씀

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UserStatus status;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "last_login_at")
    private LocalDateTime lastLoginAt;

    public static User create(String email, String passwordHash, String firstName, String lastName,
                              UserRole role, LocalDateTime now) {
        if (role == null) throw new IllegalArgumentException("role must not be null");

        User u = new User();
        u.email = email;
        u.passwordHash = passwordHash;
        u.firstName = firstName;
        u.lastName = lastName;
        u.role = role;
        u.status = UserStatus.ACTIVE;
        u.createdAt = now;
        u.lastLoginAt = null;
        return u;
    }

    public boolean isActive() {
        return status == UserStatus.ACTIVE;
    }

    public void markLoggedIn(LocalDateTime now) {
        this.lastLoginAt = now;
    }
}
