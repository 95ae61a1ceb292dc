package com.ballotbox.backend.auth.identity.register.service;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.ballotbox.backend.auth.domain.User;
import com.ballotbox.backend.auth.domain.UserRole;
import com.ballotbox.backend.auth.identity.login.service.LoginService;
import com.ballotbox.backend.auth.repo.UserRepository;
import com.ballotbox.backend.global.ApiException;
import com.ballotbox.backend.global.ErrorCode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 회원가입 유스케이스
 *
 * - 이메일은 로그인과 같은 규칙(trim + 소문자)으로 정규화해서 저장한다.
 * - 중복 이메일 → USER_ALREADY_EXISTS (선검사 + DB unique 제약으로 최종 차단)
 * - ADMIN 자가 선택 → ROLE_NOT_ALLOWED
 * - 비밀번호는 BCrypt 해시만 저장
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegistrationService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    @Transactional
    public User register(String firstName, String lastName, String rawEmail, UserRole role, String rawPassword) {
        if (role == null || !role.isSelfAssignable()) {
            throw new ApiException(ErrorCode.ROLE_NOT_ALLOWED);
        }

        String email = LoginService.normalizeEmail(rawEmail);

        if (userRepository.existsByEmail(email)) {
            throw new ApiException(ErrorCode.USER_ALREADY_EXISTS);
        }

        User user = User.create(
                email,
                passwordEncoder.encode(rawPassword),
                firstName,
                lastName,
                role,
                LocalDateTime.now(clock)
        );

        try {
            User saved = userRepository.saveAndFlush(user);
            log.info("회원가입 완료: userId={}, role={}", saved.getId(), saved.getRole());
            return saved;
        } catch (DataIntegrityViolationException e) {
            // 동시 가입 레이스: uq_users_email 에 걸린 경우만 중복으로 본다.
            if (userRepository.existsByEmail(email)) {
                throw new ApiException(ErrorCode.USER_ALREADY_EXISTS);
            }
            throw e;
        }
    }
}
