package com.ballotbox.backend.auth.token.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.ballotbox.backend.auth.config.AuthProperties;
import com.ballotbox.backend.auth.token.domain.RefreshRevokeReason;
import com.ballotbox.backend.auth.token.store.RefreshTokenStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * refresh_tokens 보관 정리
 *
 * 1) 만료된 ACTIVE 토큰이 있는 lineage → 전체 폐기(EXPIRED)
 * 2) 전부 REVOKED이고 마지막 폐기가 horizon보다 오래된 lineage → 삭제
 *
 * 살아 있는(REVOKED 아닌 row가 남은) lineage는 절대 지우지 않는다.
 * ROTATED row가 남아 있어야 재사용 탐지가 가능하기 때문이다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RefreshTokenRetentionService {

    private final RefreshTokenStore store;
    private final LineageRevocationService revocationService;
    private final AuthProperties props;
    private final Clock clock;

    @Transactional
    public SweepResult sweep() {
        LocalDateTime now = LocalDateTime.now(clock);

        List<String> expiredLineages = store.findLineagesWithExpiredActive(now);
        int revokedRecords = 0;
        for (String lineageId : expiredLineages) {
            revokedRecords += revocationService.revokeLineage(lineageId, RefreshRevokeReason.EXPIRED);
        }

        LocalDateTime cutoff = now.minusSeconds(props.retention().horizonSeconds());
        List<String> purgeable = store.findFullyRevokedLineagesBefore(cutoff);
        int deletedRecords = store.deleteLineages(purgeable);

        SweepResult result = new SweepResult(expiredLineages.size(), revokedRecords, purgeable.size(), deletedRecords);
        log.info("refresh 토큰 정리 완료: expiredLineages={}, revokedRecords={}, purgedLineages={}, deletedRecords={}",
                result.expiredLineages(), result.revokedRecords(), result.purgedLineages(), result.deletedRecords());
        return result;
    }

    public record SweepResult(int expiredLineages, int revokedRecords, int purgedLineages, int deletedRecords) {}
}
