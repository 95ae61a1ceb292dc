package com.ballotbox.backend.auth.token.service;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.ballotbox.backend.auth.domain.User;
import com.ballotbox.backend.auth.repo.UserRepository;
import com.ballotbox.backend.auth.token.domain.RefreshRevokeReason;
import com.ballotbox.backend.auth.token.domain.RefreshToken;
import com.ballotbox.backend.auth.token.service.RefreshTokenIssuer.Issued;
import com.ballotbox.backend.auth.token.store.RefreshTokenStore;
import com.ballotbox.backend.auth.token.support.ClientInfo;
import com.ballotbox.backend.global.ApiException;
import com.ballotbox.backend.global.ErrorCode;
import com.ballotbox.backend.security.JwtService;

import lombok.RequiredArgsConstructor;

/**
 * Refresh Token 회전 (1회용)
 *
 * 제출된 토큰 상태별 처리:
 * - REVOKED → REFRESH_REVOKED (상태 변화 없음)
 * - ROTATED → 재사용. lineage 전체 폐기 후 REFRESH_REUSED
 * - ACTIVE인데 만료 → lineage 폐기(EXPIRED) 후 REFRESH_EXPIRED
 * - ACTIVE → 조건부 UPDATE(ACTIVE→ROTATED) 후 같은 lineage에 후속 토큰 발급
 *
 * 동시성:
 * - 같은 ACTIVE 토큰으로 동시에 들어온 요청 중 markRotated에서 1 row를 얻은 한 건만 성공한다.
 * - 0 row를 받은 쪽은 "누군가 먼저 썼다" = 재사용으로 보고, 승자가 방금 만든 후속 토큰까지 폐기한다.
 *   재시도하지 않는다.
 *
 * noRollbackFor = ApiException:
 * - 폐기(REVOKED)는 요청이 실패로 끝나도 커밋되어야 한다.
 */
@Service
@RequiredArgsConstructor
public class RefreshRotationService {

    private final RefreshTokenLookup lookup;
    private final RefreshTokenStore store;
    private final RefreshTokenIssuer issuer;
    private final LineageRevocationService revocationService;
    private final UserRepository userRepository;
    private final JwtService jwtService;
    private final Clock clock;

    @Transactional(noRollbackFor = ApiException.class)
    public RotationResult rotate(String presentedRaw, ClientInfo client) {
        RefreshToken presented = lookup.require(presentedRaw);
        LocalDateTime now = LocalDateTime.now(clock);

        if (presented.isRevoked()) {
            throw new ApiException(ErrorCode.REFRESH_REVOKED);
        }

        if (presented.isRotated()) {
            revocationService.reuseDetected(presented);
            throw new ApiException(ErrorCode.REFRESH_REUSED);
        }

        if (presented.isExpired(now)) {
            revocationService.revokeLineage(presented.getLineageId(), RefreshRevokeReason.EXPIRED);
            throw new ApiException(ErrorCode.REFRESH_EXPIRED);
        }

        // 전이 전에 확인해야 반쯤 회전된(ROTATED인데 후속 없음) lineage가 안 생긴다.
        User user = userRepository.findById(presented.getUserId())
                .orElseThrow(() -> new ApiException(ErrorCode.REFRESH_INVALID));
        if (!user.isActive()) {
            throw new ApiException(ErrorCode.REFRESH_OWNER_DISABLED);
        }

        if (!store.markRotated(presented.getId(), now)) {
            revocationService.reuseDetected(presented);
            throw new ApiException(ErrorCode.REFRESH_REUSED);
        }

        Issued next = issuer.issueSuccessor(presented, client, now);
        String accessToken = jwtService.issueAccessToken(user.getId(), user.getEmail(), user.getRole());

        return new RotationResult(accessToken, next.raw(), next.expiresAt());
    }

    public record RotationResult(String accessToken, String refreshRaw, LocalDateTime refreshExpiresAt) {}
}
