package com.ballotbox.backend.auth.token.repo;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.ballotbox.backend.auth.token.domain.RefreshRevokeReason;
import com.ballotbox.backend.auth.token.domain.RefreshToken;
import com.ballotbox.backend.auth.token.domain.RefreshTokenStatus;

/**
 * refresh_tokens 접근.
 *
 * 상태 전이는 전부 "조건부 UPDATE" 한 문장으로 한다. (읽고-판단하고-쓰기 금지)
 * - 같은 row를 두 트랜잭션이 동시에 UPDATE 하면 DB가 row lock으로 줄 세운다.
 * - 뒤에 온 쪽은 lock이 풀린 뒤 WHERE 조건을 다시 평가하므로 status가 이미 바뀌었으면 0 row가 된다.
 *
 * @Modifying(clearAutomatically = true)
 * - bulk UPDATE는 영속성 컨텍스트를 거치지 않으므로, 실행 후 1차 캐시를 비워 stale 엔티티를 읽지 않게 한다.
 */
@Repository
public interface RefreshTokenRepository extends JpaRepository<RefreshToken, Long> {

    Optional<RefreshToken> findByTokenHash(String tokenHash);

    List<RefreshToken> findAllByLineageIdOrderByIdAsc(String lineageId);

    /** ACTIVE → ROTATED. 성공하면 1, 이미 ACTIVE가 아니면 0 */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update RefreshToken r
               set r.status = :rotated,
                   r.rotatedAt = :now,
                   r.lastUsedAt = :now
             where r.id = :id
               and r.status = :active
            """)
    int markRotated(@Param("id") Long id,
                    @Param("now") LocalDateTime now,
                    @Param("active") RefreshTokenStatus active,
                    @Param("rotated") RefreshTokenStatus rotated);

    /** lineage 안의 REVOKED가 아닌 모든 row → REVOKED. 갱신된 row 수 반환 */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update RefreshToken r
               set r.status = :revoked,
                   r.revokedAt = :now,
                   r.revokeReason = :reason
             where r.lineageId = :lineageId
               and r.status <> :revoked
            """)
    int revokeLineage(@Param("lineageId") String lineageId,
                      @Param("now") LocalDateTime now,
                      @Param("reason") RefreshRevokeReason reason,
                      @Param("revoked") RefreshTokenStatus revoked);

    /** 만료 시각이 지난 ACTIVE 토큰을 가진 lineage 목록 (보관 정리용) */
    @Query("""
            select distinct r.lineageId
              from RefreshToken r
             where r.status = :active
               and r.expiresAt <= :now
            """)
    List<String> findLineageIdsWithExpiredActive(@Param("now") LocalDateTime now,
                                                 @Param("active") RefreshTokenStatus active);

    /** 모든 row가 REVOKED이고 마지막 revoke가 cutoff 이전인 lineage 목록 */
    @Query("""
            select r.lineageId
              from RefreshToken r
             group by r.lineageId
            having sum(case when r.status <> :revoked then 1 else 0 end) = 0
               and max(r.revokedAt) < :cutoff
            """)
    List<String> findFullyRevokedLineageIdsBefore(@Param("cutoff") LocalDateTime cutoff,
                                                  @Param("revoked") RefreshTokenStatus revoked);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from RefreshToken r where r.lineageId in :lineageIds")
    int deleteAllByLineageIdIn(@Param("lineageIds") Collection<String> lineageIds);
}
