package com.ballotbox.backend.auth.token.event;

import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
public class RefreshTokenAuditListener {

    // 폐기가 DB에 확정된 뒤에만 남긴다. (롤백되면 호출되지 않음)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void on(RefreshTokenReuseDetectedEvent event) {
        log.warn("[SECURITY] refresh 토큰 재사용 탐지 → lineage 폐기. userId={}, lineageId={}, presentedTokenId={}, revokedCount={}, at={}",
                event.userId(),
                event.lineageId(),
                event.presentedTokenId(),
                event.revokedCount(),
                event.detectedAt());
    }
}
