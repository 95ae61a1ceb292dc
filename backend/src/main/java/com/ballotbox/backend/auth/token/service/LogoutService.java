package com.ballotbox.backend.auth.token.service;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.ballotbox.backend.auth.token.domain.RefreshRevokeReason;
import com.ballotbox.backend.auth.token.domain.RefreshToken;
import com.ballotbox.backend.global.ApiException;
import com.ballotbox.backend.global.ErrorCode;

import lombok.RequiredArgsConstructor;

/**
 * 로그아웃 = 제출된 refresh 토큰이 속한 lineage 종료
 *
 * - ACTIVE(만료 여부 무관) → lineage 폐기(LOGOUT). 같은 사용자의 다른 lineage는 건드리지 않는다.
 * - ROTATED → 재사용으로 처리 (lineage 폐기 + REFRESH_REUSED)
 * - REVOKED → REFRESH_REVOKED (상태 변화 없음)
 * - 동시에 다른 요청이 먼저 폐기했으면 revokeLineage가 0 row로 끝나고 로그아웃은 성공이다.
 */
@Service
@RequiredArgsConstructor
public class LogoutService {

    private final RefreshTokenLookup lookup;
    private final LineageRevocationService revocationService;

    @Transactional(noRollbackFor = ApiException.class)
    public void logout(String presentedRaw) {
        RefreshToken presented = lookup.require(presentedRaw);

        if (presented.isRevoked()) {
            throw new ApiException(ErrorCode.REFRESH_REVOKED);
        }

        if (presented.isRotated()) {
            revocationService.reuseDetected(presented);
            throw new ApiException(ErrorCode.REFRESH_REUSED);
        }

        revocationService.revokeLineage(presented.getLineageId(), RefreshRevokeReason.LOGOUT);
    }
}
