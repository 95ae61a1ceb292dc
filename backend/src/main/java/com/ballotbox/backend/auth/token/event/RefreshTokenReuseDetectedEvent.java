package com.ballotbox.backend.auth.token.event;

import java.time.LocalDateTime;

/**
 * 이미 회전된 refresh 토큰이 다시 제출되어 lineage를 폐기했을 때 발행하는 이벤트
 * - 폐기 트랜잭션이 커밋된 뒤에만 리스너가 받는다.
 * - 토큰 원문/해시는 싣지 않는다.
 */
public record RefreshTokenReuseDetectedEvent(
        Long userId,
        String lineageId,
        Long presentedTokenId,
        int revokedCount,
        LocalDateTime detectedAt
) {}
