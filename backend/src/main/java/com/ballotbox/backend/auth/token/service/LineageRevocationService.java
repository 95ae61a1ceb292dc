package com.ballotbox.backend.auth.token.service;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.ballotbox.backend.auth.token.domain.RefreshRevokeReason;
import com.ballotbox.backend.auth.token.domain.RefreshToken;
import com.ballotbox.backend.auth.token.event.RefreshTokenReuseDetectedEvent;
import com.ballotbox.backend.auth.token.store.RefreshTokenStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * lineage 단위 폐기 (재사용 탐지 / 로그아웃 / 만료 공통)
 *
 * - 폐기는 항상 lineage 전체다. 토큰 하나만 끊는 경로는 없다.
 * - store.revokeLineage 한 문장으로 처리하므로 멱등이고, 동시에 여러 번 불려도 안전하다.
 *   (늦게 온 호출은 0 row)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LineageRevocationService {

    private final RefreshTokenStore store;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public int revokeLineage(String lineageId, RefreshRevokeReason reason) {
        if (lineageId == null || lineageId.isBlank()) throw new IllegalArgumentException("lineageId must not be blank");
        if (reason == null) throw new IllegalArgumentException("reason must not be null");

        int revoked = store.revokeLineage(lineageId, reason, LocalDateTime.now(clock));
        log.debug("lineage 폐기: lineageId={}, reason={}, revoked={}", lineageId, reason, revoked);
        return revoked;
    }

    /**
     * 이미 회전된 토큰이 다시 제출됨 → lineage 전체 폐기 + 감사 이벤트
     * 이벤트는 이번 호출이 실제로 레코드를 폐기했을 때만 발행되고, 커밋 후(RefreshTokenAuditListener)에만 처리된다.
     */
    @Transactional
    public int reuseDetected(RefreshToken presented) {
        int revoked = revokeLineage(presented.getLineageId(), RefreshRevokeReason.REUSE_DETECTED);
        if (revoked == 0) {
            // 로그아웃/다른 요청의 재사용 탐지가 먼저 끊었다. 새로 폐기한 게 없으니 감사 대상도 아니다.
            log.info("재사용 제출이지만 lineage는 이미 폐기됨: lineageId={}, tokenId={}",
                    presented.getLineageId(), presented.getId());
            return 0;
        }

        eventPublisher.publishEvent(new RefreshTokenReuseDetectedEvent(
                presented.getUserId(),
                presented.getLineageId(),
                presented.getId(),
                revoked,
                LocalDateTime.now(clock)
        ));
        return revoked;
    }
}
