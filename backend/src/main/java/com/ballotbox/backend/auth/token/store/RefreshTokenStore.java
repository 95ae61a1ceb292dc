package com.ballotbox.backend.auth.token.store;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import com.ballotbox.backend.auth.token.domain.RefreshRevokeReason;
import com.ballotbox.backend.auth.token.domain.RefreshToken;

/**
 * refresh 토큰 레코드 저장소 계약
 *
 * - 조회는 Optional로, 상태 전이는 "몇 row가 바뀌었는지"로 답한다. (예외는 인프라 장애용)
 * - 상태 전이 메서드는 모두 조건부(atomic)여야 한다. 같은 row에 대한 동시 호출 중 하나만 이긴다.
 * - 호출하는 쪽 트랜잭션에 참여한다.
 */
public interface RefreshTokenStore {

    Optional<RefreshToken> findByTokenHash(String tokenHash);

    /** 새 레코드(ACTIVE) 저장. id가 채워진 엔티티를 돌려준다. */
    RefreshToken insert(RefreshToken token);

    /**
     * ACTIVE → ROTATED 조건부 전이
     * @return 이 호출이 전이를 일으켰으면 true, 이미 ACTIVE가 아니었으면 false
     */
    boolean markRotated(Long tokenId, LocalDateTime now);

    /**
     * lineage의 REVOKED가 아닌 모든 레코드를 REVOKED로. 멱등.
     * @return 이번 호출로 바뀐 레코드 수 (이미 전부 폐기됐으면 0)
     */
    int revokeLineage(String lineageId, RefreshRevokeReason reason, LocalDateTime now);

    List<String> findLineagesWithExpiredActive(LocalDateTime now);

    List<String> findFullyRevokedLineagesBefore(LocalDateTime cutoff);

    int deleteLineages(Collection<String> lineageIds);
}
