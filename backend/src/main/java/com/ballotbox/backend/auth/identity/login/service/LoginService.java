package com.ballotbox.backend.auth.identity.login.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Optional;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.ballotbox.backend.auth.domain.User;
import com.ballotbox.backend.auth.repo.UserRepository;
import com.ballotbox.backend.auth.token.service.RefreshTokenIssuer;
import com.ballotbox.backend.auth.token.service.RefreshTokenIssuer.Issued;
import com.ballotbox.backend.auth.token.support.ClientInfo;
import com.ballotbox.backend.global.ApiException;
import com.ballotbox.backend.global.ErrorCode;
import com.ballotbox.backend.security.JwtService;

import lombok.extern.slf4j.Slf4j;

/**
 * 로그인 유스케이스 (= 새 세션 lineage 시작)
 *
 * 계약:
 * - 이메일은 trim + 소문자로 정규화 후 조회한다.
 * - "이메일 없음"과 "비밀번호 불일치"는 동일 에러(INVALID_CREDENTIALS)로 처리한다.
 *   이메일이 없을 때도 더미 해시로 BCrypt 비교를 한 번 해서 응답 시간 차이를 줄인다.
 * - ACTIVE 계정만 로그인 허용(그 외는 ACCOUNT_DISABLED).
 * - 성공 시 새 lineage를 열고 access token(바디) + refresh token(raw, 쿠키용)을 발급한다.
 *   같은 사용자의 기존 lineage(다른 기기)는 건드리지 않는다.
 */
@Slf4j
@Service
public class LoginService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwtService;
    private final RefreshTokenIssuer refreshTokenIssuer;
    private final Clock clock;

    // 존재하지 않는 이메일에도 matches()를 태우기 위한 해시
    private final String dummyPasswordHash;

    public LoginService(UserRepository userRepository,
                        PasswordEncoder passwordEncoder,
                        JwtService jwtService,
                        RefreshTokenIssuer refreshTokenIssuer,
                        Clock clock) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtService = jwtService;
        this.refreshTokenIssuer = refreshTokenIssuer;
        this.clock = clock;
        this.dummyPasswordHash = passwordEncoder.encode("ballotbox-login-dummy-password");
    }

    @Transactional
    public LoginResult login(String rawEmail, String rawPassword, ClientInfo client) {
        // 컨트롤러 @Valid가 있어도 서비스는 한 번 더 본다.
        if (isBlank(rawEmail) || isBlank(rawPassword)) {
            throw new ApiException(ErrorCode.INVALID_CREDENTIALS);
        }

        String email = normalizeEmail(rawEmail);
        Optional<User> found = userRepository.findByEmail(email);

        String hashToCheck = found.map(User::getPasswordHash).orElse(dummyPasswordHash);
        boolean matches = passwordEncoder.matches(rawPassword, hashToCheck);

        if (found.isEmpty() || !matches) {
            throw new ApiException(ErrorCode.INVALID_CREDENTIALS);
        }

        User user = found.get();
        if (!user.isActive()) {
            throw new ApiException(ErrorCode.ACCOUNT_DISABLED);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        user.markLoggedIn(now); // 더티체킹으로 커밋 시 반영

        Issued refresh = refreshTokenIssuer.openLineage(user.getId(), client, now);
        String accessToken = jwtService.issueAccessToken(user.getId(), user.getEmail(), user.getRole());

        log.info("로그인 성공: userId={}, lineageId={}", user.getId(), refresh.record().getLineageId());
        return new LoginResult(accessToken, refresh.raw());
    }

    public static String normalizeEmail(String rawEmail) {
        return rawEmail.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    // 컨트롤러가 HTTP 응답으로 변환하기 위한 서비스 내부 결과.
    public record LoginResult(String accessToken, String refreshRaw) {}
}
